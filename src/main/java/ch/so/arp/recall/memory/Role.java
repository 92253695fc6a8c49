package ch.so.arp.recall.memory;

/**
 * Sender of a stored conversation turn.
 */
public enum Role {

    USER("user"),
    ASSISTANT("assistant");

    private final String value;

    Role(String value) {
        this.value = value;
    }

    /**
     * @return the value written to the {@code role} property of stored entries
     */
    public String value() {
        return value;
    }
}
