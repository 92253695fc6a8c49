package ch.so.arp.recall.memory;

import java.util.Objects;

/**
 * Credentials of the model provider the vector store calls on behalf of the
 * caller for vectorization and generation.
 */
public record ProviderCredentials(ModelProvider modelProvider, String apiKey) {

    public ProviderCredentials {
        Objects.requireNonNull(modelProvider, "modelProvider");
        Objects.requireNonNull(apiKey, "apiKey");
    }

    @Override
    public String toString() {
        return "ProviderCredentials[modelProvider=" + modelProvider + ", apiKey=***]";
    }
}
