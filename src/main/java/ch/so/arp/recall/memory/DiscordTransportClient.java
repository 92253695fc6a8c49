package ch.so.arp.recall.memory;

import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClient;

/**
 * {@link TransportClient} for the Discord REST API.
 */
class DiscordTransportClient implements TransportClient {

    private static final Logger LOGGER = LoggerFactory.getLogger(DiscordTransportClient.class);

    private static final ParameterizedTypeReference<Map<String, Object>> MESSAGE_TYPE =
            new ParameterizedTypeReference<>() {
            };

    private final RestClient restClient;

    DiscordTransportClient(TransportProperties properties, RestClient.Builder restClientBuilder) {
        if (!StringUtils.hasText(properties.getBotToken())) {
            throw new IllegalArgumentException(
                    "Property 'recall.transport.bot-token' must be provided when mocks are disabled");
        }
        this.restClient = restClientBuilder
                .baseUrl(properties.getBaseUrl())
                .defaultHeader(HttpHeaders.AUTHORIZATION, "Bot " + properties.getBotToken())
                .build();
    }

    @Override
    public void sendTypingIndicator(String channelId) {
        restClient.post()
                .uri("/channels/{channelId}/typing", channelId)
                .retrieve()
                .toBodilessEntity();
    }

    @Override
    public Map<String, Object> sendMessage(String channelId, String content) {
        LOGGER.debug("Sending message to channel {}", channelId);
        return restClient.post()
                .uri("/channels/{channelId}/messages", channelId)
                .contentType(MediaType.APPLICATION_JSON)
                .body(Map.of("content", content))
                .retrieve()
                .body(MESSAGE_TYPE);
    }
}
