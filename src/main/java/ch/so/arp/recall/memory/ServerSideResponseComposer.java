package ch.so.arp.recall.memory;

import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Delegates composition to the generative module of the vector store. Only a
 * reply the store actually generated is stored, as a single assistant turn.
 */
class ServerSideResponseComposer implements ResponseComposer {

    private static final Logger LOGGER = LoggerFactory.getLogger(ServerSideResponseComposer.class);

    static final String DEFAULT_TASK = "Answer the following message using the retrieved conversation history: ";

    private final MemoryStore memoryStore;

    ServerSideResponseComposer(MemoryStore memoryStore) {
        this.memoryStore = Objects.requireNonNull(memoryStore, "memoryStore");
    }

    @Override
    public ResponseMode mode() {
        return ResponseMode.GENERATIVE;
    }

    @Override
    public String compose(CollectionHandle collection, String query, SearchOptions options, String prompt) {
        String task = prompt == null || prompt.isBlank() ? DEFAULT_TASK + query : prompt;
        String generated = collection.generate(query, options, task)
                .filter(text -> !text.isBlank())
                .orElseThrow(() -> new ExchangeException(ErrorKind.GENERATION,
                        "No text generated for query '" + query + "' (" + options.mode().wireName() + ")"));
        String id = memoryStore.appendTurn(Role.ASSISTANT, generated);
        LOGGER.debug("Stored generated reply {} in {}", id, collection.name());
        return generated;
    }
}
