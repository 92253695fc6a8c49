package ch.so.arp.recall.memory;

import java.util.Arrays;
import java.util.Optional;

/**
 * Decides who composes the final reply: the client through a separate
 * completion call ({@link #SEMANTIC}) or the vector store through its
 * generative module ({@link #GENERATIVE}).
 */
public enum ResponseMode {

    GENERATIVE("generative"),
    SEMANTIC("semantic");

    private final String wireName;

    ResponseMode(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static Optional<ResponseMode> fromWireName(String name) {
        return Arrays.stream(values()).filter(mode -> mode.wireName.equals(name)).findFirst();
    }
}
