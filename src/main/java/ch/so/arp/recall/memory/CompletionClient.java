package ch.so.arp.recall.memory;

/**
 * Abstraction over the chat completion API of the model provider.
 * Implementations either call the provider or return predictable replies for
 * testing.
 */
public interface CompletionClient {

    /**
     * Compose a reply for the query from the retrieved context.
     *
     * @param request query, retrieved context and optional grounding prompt
     * @return the reply text
     * @throws ExchangeException of kind {@link ErrorKind#GENERATION} when the
     *                           provider returns no usable text
     */
    String complete(CompletionRequest request);
}
