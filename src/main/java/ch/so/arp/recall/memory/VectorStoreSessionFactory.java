package ch.so.arp.recall.memory;

/**
 * Opens transport sessions with the vector store for a set of provider
 * credentials.
 */
@FunctionalInterface
public interface VectorStoreSessionFactory {

    VectorStoreSession open(ProviderCredentials credentials);
}
