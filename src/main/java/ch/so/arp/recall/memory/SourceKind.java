package ch.so.arp.recall.memory;

/**
 * Origin of the entries kept in a collection. The kind decides the collection
 * name prefix and the schema that is used when the collection is created.
 */
public enum SourceKind {

    HISTORY("History_"),
    DISCORD("Discord_");

    private final String prefix;

    SourceKind(String prefix) {
        this.prefix = prefix;
    }

    public String prefix() {
        return prefix;
    }
}
