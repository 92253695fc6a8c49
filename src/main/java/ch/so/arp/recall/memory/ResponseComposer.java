package ch.so.arp.recall.memory;

/**
 * Composes the reply of an exchange from a collection and records the exchange
 * in memory. One implementation exists per {@link ResponseMode}.
 */
interface ResponseComposer {

    ResponseMode mode();

    /**
     * @param collection opened collection to retrieve from and write to
     * @param query      the live user message
     * @param options    retrieval parameters of the selected routine
     * @param prompt     caller supplied task prompt, may be {@code null}
     * @return the reply text
     */
    String compose(CollectionHandle collection, String query, SearchOptions options, String prompt);
}
