package ch.so.arp.recall.memory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.StringJoiner;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * {@link CompletionClient} calling the OpenAI compatible {@code /chat/completions}
 * endpoint that both Mistral and OpenAI expose. Retrieved entries are passed
 * as conversation history in the system message, the query as user message.
 */
class ChatCompletionClient implements CompletionClient {

    private static final Logger LOGGER = LoggerFactory.getLogger(ChatCompletionClient.class);

    private static final String COMPLETIONS_PATH = "/chat/completions";
    private static final int MAX_ERROR_SNIPPET = 512;

    private final CompletionProperties properties;
    private final RestClient restClient;
    private final ObjectMapper objectMapper;

    ChatCompletionClient(CompletionProperties properties, RestClient.Builder restClientBuilder,
            ObjectMapper objectMapper) {
        if (!StringUtils.hasText(properties.getApiKey())) {
            throw new IllegalArgumentException(
                    "Property 'recall.completion.api-key' must be provided when mocks are disabled");
        }
        this.properties = properties;
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
        this.restClient = restClientBuilder
                .baseUrl(properties.getBaseUrl())
                .defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + properties.getApiKey())
                .build();
    }

    @Override
    public String complete(CompletionRequest request) {
        LOGGER.debug("Requesting completion with model {} and {} context entries", properties.getModel(),
                request.context().size());
        JsonNode response;
        try {
            response = restClient.post()
                    .uri(COMPLETIONS_PATH)
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(requestBody(request))
                    .retrieve()
                    .body(JsonNode.class);
        } catch (RestClientResponseException ex) {
            throw new ExchangeException(ErrorKind.GENERATION, describeFailure(ex), ex);
        } catch (RestClientException ex) {
            throw new ExchangeException(ErrorKind.GENERATION, "Completion request failed: " + ex.getMessage(), ex);
        }
        return extractContent(response);
    }

    Map<String, Object> requestBody(CompletionRequest request) {
        List<Map<String, String>> messages = new ArrayList<>();
        messages.add(Map.of("role", "system", "content", systemMessage(request)));
        messages.add(Map.of("role", "user", "content", request.query()));

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", properties.getModel());
        body.put("messages", messages);
        body.put("max_tokens", properties.getMaxTokens());
        body.put("temperature", properties.getTemperature());
        return body;
    }

    private String systemMessage(CompletionRequest request) {
        StringJoiner joiner = new StringJoiner("\n");
        if (request.hasGroundingPrompt()) {
            joiner.add(request.groundingPrompt());
            joiner.add("");
        }
        if (request.context().isEmpty()) {
            joiner.add("No relevant conversation history is available.");
        } else {
            joiner.add("Relevant conversation history:");
            request.context().forEach(entry -> joiner.add(entry.formatForPrompt()));
        }
        return joiner.toString();
    }

    private String extractContent(JsonNode response) {
        JsonNode content = response == null ? null : response.path("choices").path(0).path("message").path("content");
        if (content == null || !content.isTextual()) {
            throw new ExchangeException(ErrorKind.GENERATION, "Completion response contained no message content");
        }
        return content.asText();
    }

    private String describeFailure(RestClientResponseException ex) {
        String body = ex.getResponseBodyAsString();
        String prefix = "Completion API returned HTTP " + ex.getStatusCode().value();
        if (!StringUtils.hasText(body)) {
            return prefix;
        }
        try {
            JsonNode error = objectMapper.readTree(body);
            JsonNode detail = error.path("detail");
            if (detail.isArray()) {
                List<String> issues = new ArrayList<>();
                detail.forEach(issue -> issues.add(issue.toString()));
                return prefix + ": " + String.join("; ", issues);
            }
            if (detail.isTextual()) {
                return prefix + ": " + detail.asText();
            }
            if (error.path("message").isTextual()) {
                return prefix + ": " + error.path("message").asText();
            }
            if (error.path("error").path("message").isTextual()) {
                return prefix + ": " + error.path("error").path("message").asText();
            }
        } catch (JsonProcessingException parseFailure) {
            LOGGER.debug("Completion error body is not JSON: {}", parseFailure.getMessage());
        }
        return prefix + ": " + snippet(body);
    }

    private static String snippet(String body) {
        String sanitized = body.replace("\r", " ").replace("\n", " ").trim();
        return sanitized.length() > MAX_ERROR_SNIPPET ? sanitized.substring(0, MAX_ERROR_SNIPPET) + "..." : sanitized;
    }
}
