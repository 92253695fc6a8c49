package ch.so.arp.recall.memory;

/**
 * Session with the remote vector store. Sessions are obtained through
 * {@link StoreConnector} and are only used while a collection is opened.
 */
public interface VectorStoreSession {

    /**
     * @return {@code true} once the store reports itself ready to serve requests
     */
    boolean isReady();

    boolean exists(String collectionName);

    /**
     * Create the collection described by the schema.
     *
     * @return handle to the new collection
     */
    CollectionHandle create(CollectionSchema schema);

    /**
     * Handle to an existing collection, without any remote call.
     */
    CollectionHandle collection(CollectionSchema schema);
}
