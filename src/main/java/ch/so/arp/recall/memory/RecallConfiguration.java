package ch.so.arp.recall.memory;

import java.time.Duration;

import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Central configuration wiring the exchange components together. It exposes
 * toggles that decide whether mocked or real infrastructure components should
 * be used for the vector store, the completion API and the chat transport.
 */
@Configuration
@EnableConfigurationProperties({ StoreProperties.class, CompletionProperties.class, TransportProperties.class })
public class RecallConfiguration {

    @Bean
    @ConditionalOnProperty(name = "recall.mock-vector-store", havingValue = "true", matchIfMissing = true)
    public VectorStoreSessionFactory inMemoryVectorStore() {
        return new InMemoryVectorStore();
    }

    @Bean
    @ConditionalOnProperty(name = "recall.mock-vector-store", havingValue = "false")
    public VectorStoreSessionFactory weaviateSessionFactory(StoreProperties properties,
            RestClient.Builder restClientBuilder, ObjectMapper objectMapper) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(properties.getInitTimeout());
        requestFactory.setReadTimeout(longest(properties.getQueryTimeout(), properties.getInsertTimeout()));
        return new WeaviateSessionFactory(properties, restClientBuilder.clone().requestFactory(requestFactory),
                objectMapper);
    }

    @Bean
    @ConditionalOnProperty(name = "recall.mock-completion", havingValue = "true", matchIfMissing = true)
    public CompletionClient mockCompletionClient() {
        return new MockCompletionClient();
    }

    @Bean
    @ConditionalOnProperty(name = "recall.mock-completion", havingValue = "false")
    public CompletionClient chatCompletionClient(CompletionProperties properties,
            RestClient.Builder restClientBuilder, ObjectMapper objectMapper) {
        return new ChatCompletionClient(properties, restClientBuilder.clone(), objectMapper);
    }

    @Bean
    @ConditionalOnProperty(name = "recall.mock-transport", havingValue = "true", matchIfMissing = true)
    public TransportClient mockTransportClient() {
        return new MockTransportClient();
    }

    @Bean
    @ConditionalOnProperty(name = "recall.mock-transport", havingValue = "false")
    public TransportClient discordTransportClient(TransportProperties properties,
            RestClient.Builder restClientBuilder) {
        return new DiscordTransportClient(properties, restClientBuilder.clone());
    }

    @Bean
    @ConditionalOnMissingBean
    public StoreConnector storeConnector(VectorStoreSessionFactory sessionFactory, StoreProperties properties) {
        return new StoreConnector(sessionFactory, properties.getPollInterval(), properties.getReadyTimeout());
    }

    @Bean
    @ConditionalOnMissingBean
    public OrchestratorRegistry orchestratorRegistry(StoreConnector storeConnector, CompletionClient completionClient,
            TransportClient transportClient, CompletionProperties completionProperties) {
        return new OrchestratorRegistry(storeConnector, completionClient, transportClient,
                completionProperties.toCredentials());
    }

    private static Duration longest(Duration first, Duration second) {
        return first.compareTo(second) >= 0 ? first : second;
    }
}
