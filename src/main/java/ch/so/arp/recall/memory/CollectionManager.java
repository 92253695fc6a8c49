package ch.so.arp.recall.memory;

import java.util.Objects;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns the lifecycle of one named collection. The collection is opened lazily:
 * the first {@link #ensureOpen()} connects, checks whether the collection
 * exists and creates it when absent. Later calls reuse the opened handle.
 */
public class CollectionManager {

    private static final Logger LOGGER = LoggerFactory.getLogger(CollectionManager.class);

    private final StoreConnector connector;
    private final ProviderCredentials credentials;
    private final SourceKind sourceKind;
    private final String collectionName;

    private State state = State.UNOPENED;
    private VectorStoreSession session;
    private CollectionHandle collection;

    public CollectionManager(StoreConnector connector, ProviderCredentials credentials, SourceKind sourceKind,
            String logicalName) {
        this.connector = Objects.requireNonNull(connector, "connector");
        this.credentials = Objects.requireNonNull(credentials, "credentials");
        this.sourceKind = Objects.requireNonNull(sourceKind, "sourceKind");
        this.collectionName = collectionName(sourceKind, logicalName);
    }

    /**
     * Derive the collection name from the source kind and the logical name. All
     * whitespace is removed, so different logical names may map to the same
     * collection.
     */
    public static String collectionName(SourceKind sourceKind, String logicalName) {
        Objects.requireNonNull(sourceKind, "sourceKind");
        Objects.requireNonNull(logicalName, "logicalName");
        return (sourceKind.prefix() + logicalName).replaceAll("\\s+", "");
    }

    /**
     * Open the collection if that has not happened yet.
     *
     * @return the handle of the opened collection
     * @throws ExchangeException when connecting, the existence check or the creation fails
     */
    public synchronized CollectionHandle ensureOpen() {
        if (state == State.OPEN) {
            return collection;
        }
        try {
            session = connector.connect(credentials);
            collection = createCollection();
            state = State.OPEN;
            LOGGER.debug("Collection {} is open", collectionName);
            return collection;
        } catch (ExchangeException ex) {
            markFailed(ex);
            throw ex;
        } catch (RuntimeException ex) {
            markFailed(ex);
            throw new ExchangeException(ErrorKind.COLLECTION, "Unable to open collection " + collectionName, ex);
        }
    }

    /**
     * Create the collection unless the store already has it. The existence check
     * and the creation are two separate remote calls; concurrent creators of
     * the same name are resolved by the store.
     */
    synchronized CollectionHandle createCollection() {
        if (session == null) {
            throw new ExchangeException(ErrorKind.CONNECTION, "Client not initialized");
        }
        CollectionSchema schema = CollectionSchemas.forKind(sourceKind, collectionName, credentials.modelProvider());
        boolean exists;
        try {
            exists = session.exists(collectionName);
        } catch (RuntimeException ex) {
            throw new ExchangeException(ErrorKind.COLLECTION,
                    "Existence check for collection " + collectionName + " failed: " + ex.getMessage(), ex);
        }
        if (exists) {
            return session.collection(schema);
        }
        try {
            CollectionHandle created = session.create(schema);
            LOGGER.info("Created collection {} for provider {}", collectionName, credentials.modelProvider());
            return created;
        } catch (RuntimeException ex) {
            throw new ExchangeException(ErrorKind.COLLECTION,
                    "Creating collection " + collectionName + " failed: " + ex.getMessage(), ex);
        }
    }

    private void markFailed(RuntimeException ex) {
        state = State.FAILED;
        collection = null;
        LOGGER.warn("Opening collection {} failed: {}", collectionName, ex.getMessage());
    }

    public synchronized Optional<CollectionHandle> currentCollection() {
        return state == State.OPEN ? Optional.of(collection) : Optional.empty();
    }

    public synchronized State state() {
        return state;
    }

    public String collectionName() {
        return collectionName;
    }

    public enum State {
        UNOPENED,
        OPEN,
        FAILED
    }
}
