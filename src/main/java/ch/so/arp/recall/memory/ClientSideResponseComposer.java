package ch.so.arp.recall.memory;

import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Retrieves candidate entries and lets a separate completion call compose the
 * reply. The query and the reply are stored as a pair, even when the reply is
 * the text of a failed completion. A failed write does not replace the reply.
 */
class ClientSideResponseComposer implements ResponseComposer {

    private static final Logger LOGGER = LoggerFactory.getLogger(ClientSideResponseComposer.class);

    static final String COMPLETION_FAILURE_PREFIX = "An error occurred while generating response: ";

    private final CompletionClient completionClient;
    private final MemoryStore memoryStore;

    ClientSideResponseComposer(CompletionClient completionClient, MemoryStore memoryStore) {
        this.completionClient = Objects.requireNonNull(completionClient, "completionClient");
        this.memoryStore = Objects.requireNonNull(memoryStore, "memoryStore");
    }

    @Override
    public ResponseMode mode() {
        return ResponseMode.SEMANTIC;
    }

    @Override
    public String compose(CollectionHandle collection, String query, SearchOptions options, String prompt) {
        List<StoredObject> retrieved = collection.query(query, options);
        LOGGER.debug("Retrieved {} entries from {} ({})", retrieved.size(), collection.name(), options.mode());
        String reply = complete(completionClient, new CompletionRequest(query, retrieved, null));
        try {
            memoryStore.appendPair(query, reply);
        } catch (ExchangeException ex) {
            LOGGER.warn("Storing message pair in {} failed: {}", collection.name(), ex.getMessage());
        }
        return reply;
    }

    /**
     * Run the completion and turn any failure into the reply text.
     */
    static String complete(CompletionClient completionClient, CompletionRequest request) {
        try {
            String reply = completionClient.complete(request);
            if (reply == null) {
                throw new ExchangeException(ErrorKind.GENERATION, "Completion returned no text");
            }
            return reply;
        } catch (RuntimeException ex) {
            LOGGER.warn("Completion failed for query '{}': {}", request.query(), ex.getMessage());
            return COMPLETION_FAILURE_PREFIX + ex.getMessage();
        }
    }
}
