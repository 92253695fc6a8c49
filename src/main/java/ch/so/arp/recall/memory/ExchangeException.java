package ch.so.arp.recall.memory;

import java.util.Objects;

/**
 * Structured failure raised inside the exchange components. It is only turned
 * into display text by {@link ExchangeOrchestrator}.
 */
public class ExchangeException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final ErrorKind kind;

    public ExchangeException(ErrorKind kind, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public ExchangeException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public ErrorKind getKind() {
        return kind;
    }
}
