package ch.so.arp.recall.memory;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for one request/response cycle against a single collection. The
 * collection is opened on first use. Failures are logged and returned as
 * display text; callers never receive an exception.
 */
public class ExchangeOrchestrator {

    private static final Logger LOGGER = LoggerFactory.getLogger(ExchangeOrchestrator.class);

    static final String DISPATCH_ERROR = "Error exchanging messages";
    static final String GENERATION_ERROR = "Error generating response";
    static final String PERSISTENCE_ERROR = "Error adding ai response to history";
    static final String COLLECTION_ERROR = "Error getting collection";

    private final CollectionManager collectionManager;
    private final RetrievalDispatcher dispatcher;
    private final TransportExchange transportExchange;

    ExchangeOrchestrator(CollectionManager collectionManager, RetrievalDispatcher dispatcher,
            TransportExchange transportExchange) {
        this.collectionManager = Objects.requireNonNull(collectionManager, "collectionManager");
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
        this.transportExchange = Objects.requireNonNull(transportExchange, "transportExchange");
    }

    /**
     * Wire the components for one collection.
     */
    public static ExchangeOrchestrator create(StoreConnector connector, CompletionClient completionClient,
            TransportClient transportClient, ProviderCredentials credentials, SourceKind sourceKind,
            String logicalName) {
        CollectionManager collectionManager = new CollectionManager(connector, credentials, sourceKind, logicalName);
        MemoryStore memoryStore = new MemoryStore(collectionManager);
        RetrievalDispatcher dispatcher = new RetrievalDispatcher(List.of(
                new ClientSideResponseComposer(completionClient, memoryStore),
                new ServerSideResponseComposer(memoryStore)));
        return new ExchangeOrchestrator(collectionManager, dispatcher,
                new TransportExchange(completionClient, transportClient, memoryStore));
    }

    /**
     * Exchange with the strategy given by its wire names, for example
     * {@code exchange("semantic", "nearText", "hello", null)}.
     */
    public String exchange(String responseMode, String retrievalMode, String query, String prompt) {
        Optional<StrategySelector> selector = StrategySelector.parse(responseMode, retrievalMode);
        if (selector.isEmpty()) {
            LOGGER.warn("Unknown exchange strategy {}/{}", responseMode, retrievalMode);
            return DISPATCH_ERROR;
        }
        return exchange(selector.get(), query, prompt);
    }

    public String exchange(StrategySelector selector, String query, String prompt) {
        try {
            CollectionHandle collection = collectionManager.ensureOpen();
            return dispatcher.run(collection, selector, query, prompt);
        } catch (ExchangeException ex) {
            LOGGER.error("Exchange {} on {} failed ({}): {}", selector, collectionManager.collectionName(),
                    ex.getKind(), ex.getMessage(), ex);
            return render(ex);
        } catch (RuntimeException ex) {
            LOGGER.error("Exchange {} on {} failed: {}", selector, collectionManager.collectionName(),
                    ex.getMessage(), ex);
            return DISPATCH_ERROR + ": " + ex.getMessage();
        }
    }

    /**
     * Answer an inbound transport message and reply over the transport.
     */
    public String transportExchange(Map<String, Object> inbound, String prompt) {
        try {
            CollectionHandle collection = collectionManager.ensureOpen();
            return transportExchange.run(collection, inbound, prompt);
        } catch (ExchangeException ex) {
            LOGGER.error("Transport exchange on {} failed ({}): {}", collectionManager.collectionName(),
                    ex.getKind(), ex.getMessage(), ex);
            return render(ex);
        } catch (RuntimeException ex) {
            LOGGER.error("Transport exchange on {} failed: {}", collectionManager.collectionName(),
                    ex.getMessage(), ex);
            return DISPATCH_ERROR + ": " + ex.getMessage();
        }
    }

    static String render(ExchangeException ex) {
        return switch (ex.getKind()) {
            case DISPATCH -> DISPATCH_ERROR;
            case GENERATION -> GENERATION_ERROR;
            case PERSISTENCE -> PERSISTENCE_ERROR;
            case CONNECTION, COLLECTION -> COLLECTION_ERROR + ": " + ex.getMessage();
        };
    }

    public String collectionName() {
        return collectionManager.collectionName();
    }

    CollectionManager collectionManager() {
        return collectionManager;
    }
}
