package ch.so.arp.recall.memory;

import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClient;

import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Opens sessions with a Weaviate cluster over its REST and GraphQL API. The
 * admin key authenticates the client; the provider key travels in the
 * provider specific header so the cluster can vectorize and generate on the
 * caller's behalf.
 */
class WeaviateSessionFactory implements VectorStoreSessionFactory {

    private static final Logger LOGGER = LoggerFactory.getLogger(WeaviateSessionFactory.class);

    private final StoreProperties properties;
    private final RestClient.Builder restClientBuilder;
    private final ObjectMapper objectMapper;

    WeaviateSessionFactory(StoreProperties properties, RestClient.Builder restClientBuilder,
            ObjectMapper objectMapper) {
        this.properties = Objects.requireNonNull(properties, "properties");
        this.restClientBuilder = Objects.requireNonNull(restClientBuilder, "restClientBuilder");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
    }

    @Override
    public VectorStoreSession open(ProviderCredentials credentials) {
        RestClient.Builder builder = restClientBuilder.clone()
                .baseUrl(properties.getUrl())
                .defaultHeader(credentials.modelProvider().headerName(), credentials.apiKey());
        if (StringUtils.hasText(properties.getAdminApiKey())) {
            builder.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + properties.getAdminApiKey());
        }
        RestClient restClient = builder.build();
        restClient.get().uri("/v1/meta").retrieve().toBodilessEntity();
        LOGGER.debug("Opened Weaviate session with {}", properties.getUrl());
        return new WeaviateSession(restClient, objectMapper);
    }
}
