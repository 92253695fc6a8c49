package ch.so.arp.recall.memory;

import java.util.Arrays;
import java.util.Optional;

/**
 * Retrieval method used against the collection.
 */
public enum RetrievalMode {

    /** Keyword and vector similarity blended by {@code alpha}. */
    HYBRID("hybrid"),

    /** Pure vector similarity bounded by a certainty threshold. */
    NEAR_TEXT("nearText");

    private final String wireName;

    RetrievalMode(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static Optional<RetrievalMode> fromWireName(String name) {
        return Arrays.stream(values()).filter(mode -> mode.wireName.equals(name)).findFirst();
    }
}
