package ch.so.arp.recall.memory;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Keeps exactly one {@link ExchangeOrchestrator} per collection. Orchestrators
 * are created on first request and bound to the configured provider.
 */
public class OrchestratorRegistry {

    private final StoreConnector connector;
    private final CompletionClient completionClient;
    private final TransportClient transportClient;
    private final ProviderCredentials credentials;
    private final Map<String, ExchangeOrchestrator> orchestrators = new ConcurrentHashMap<>();

    public OrchestratorRegistry(StoreConnector connector, CompletionClient completionClient,
            TransportClient transportClient, ProviderCredentials credentials) {
        this.connector = Objects.requireNonNull(connector, "connector");
        this.completionClient = Objects.requireNonNull(completionClient, "completionClient");
        this.transportClient = Objects.requireNonNull(transportClient, "transportClient");
        this.credentials = Objects.requireNonNull(credentials, "credentials");
    }

    public ExchangeOrchestrator forCollection(SourceKind sourceKind, String logicalName) {
        String collectionName = CollectionManager.collectionName(sourceKind, logicalName);
        return orchestrators.computeIfAbsent(collectionName, name -> ExchangeOrchestrator.create(connector,
                completionClient, transportClient, credentials, sourceKind, logicalName));
    }
}
