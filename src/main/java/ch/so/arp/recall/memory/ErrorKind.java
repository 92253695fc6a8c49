package ch.so.arp.recall.memory;

/**
 * Failure categories surfaced by the exchange components.
 */
public enum ErrorKind {

    /** Vector store unreachable or not ready in time. */
    CONNECTION,

    /** Existence check or creation of the collection failed. */
    COLLECTION,

    /** Unrecognized strategy pair. */
    DISPATCH,

    /** A single-object insert failed or the collection is not open. */
    PERSISTENCE,

    /** The completion call or the store side generation produced no usable text. */
    GENERATION
}
