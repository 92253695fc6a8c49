package ch.so.arp.recall.memory;

import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;

import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * {@link VectorStoreSession} backed by the Weaviate REST API.
 */
class WeaviateSession implements VectorStoreSession {

    private final RestClient restClient;
    private final ObjectMapper objectMapper;

    WeaviateSession(RestClient restClient, ObjectMapper objectMapper) {
        this.restClient = restClient;
        this.objectMapper = objectMapper;
    }

    @Override
    public boolean isReady() {
        return restClient.get()
                .uri("/v1/.well-known/ready")
                .exchange((request, response) -> response.getStatusCode().is2xxSuccessful());
    }

    @Override
    public boolean exists(String collectionName) {
        return restClient.get()
                .uri("/v1/schema/{className}", collectionName)
                .exchange((request, response) -> {
                    if (response.getStatusCode().value() == 404) {
                        return false;
                    }
                    if (response.getStatusCode().is2xxSuccessful()) {
                        return true;
                    }
                    throw new IllegalStateException(
                            "Schema lookup for " + collectionName + " returned HTTP " + response.getStatusCode().value());
                });
    }

    @Override
    public CollectionHandle create(CollectionSchema schema) {
        restClient.post()
                .uri("/v1/schema")
                .contentType(MediaType.APPLICATION_JSON)
                .body(schema.toClassDefinition())
                .retrieve()
                .toBodilessEntity();
        return collection(schema);
    }

    @Override
    public CollectionHandle collection(CollectionSchema schema) {
        return new WeaviateCollectionHandle(restClient, objectMapper, schema);
    }
}
