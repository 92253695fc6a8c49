package ch.so.arp.recall.memory;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * {@link CollectionHandle} for one Weaviate class. Searches and store side
 * generation go through GraphQL {@code Get} queries, writes through the
 * objects and batch endpoints.
 */
class WeaviateCollectionHandle implements CollectionHandle {

    private static final Logger LOGGER = LoggerFactory.getLogger(WeaviateCollectionHandle.class);

    private final RestClient restClient;
    private final ObjectMapper objectMapper;
    private final CollectionSchema schema;

    WeaviateCollectionHandle(RestClient restClient, ObjectMapper objectMapper, CollectionSchema schema) {
        this.restClient = restClient;
        this.objectMapper = objectMapper;
        this.schema = schema;
    }

    @Override
    public String name() {
        return schema.name();
    }

    @Override
    public List<StoredObject> query(String query, SearchOptions options) {
        JsonNode objects = getObjects(getQuery(query, options, null));
        List<StoredObject> results = new ArrayList<>();
        objects.forEach(object -> results.add(toStoredObject(object)));
        LOGGER.debug("{} query on {} returned {} objects", options.mode().wireName(), name(), results.size());
        return results;
    }

    @Override
    public Optional<String> generate(String query, SearchOptions options, String groupedTask) {
        JsonNode objects = getObjects(getQuery(query, options, groupedTask));
        if (objects.isEmpty()) {
            return Optional.empty();
        }
        JsonNode generate = objects.path(0).path("_additional").path("generate");
        if (generate.path("error").isTextual()) {
            LOGGER.warn("Generation on {} reported: {}", name(), generate.path("error").asText());
        }
        JsonNode groupedResult = generate.path("groupedResult");
        return groupedResult.isTextual() ? Optional.of(groupedResult.asText()) : Optional.empty();
    }

    @Override
    public String insert(StoredObject object) {
        JsonNode response = restClient.post()
                .uri("/v1/objects")
                .contentType(MediaType.APPLICATION_JSON)
                .body(toObjectBody(object))
                .retrieve()
                .body(JsonNode.class);
        return response != null && response.path("id").isTextual() ? response.path("id").asText() : object.id();
    }

    @Override
    public BatchInsertResult insertMany(List<StoredObject> objects) {
        List<Map<String, Object>> bodies = objects.stream().map(this::toObjectBody).toList();
        JsonNode response = restClient.post()
                .uri("/v1/batch/objects")
                .contentType(MediaType.APPLICATION_JSON)
                .body(Map.of("objects", bodies))
                .retrieve()
                .body(JsonNode.class);
        if (response == null || !response.isArray()) {
            throw new IllegalStateException("Batch response for " + name() + " is not an array");
        }
        boolean hasErrors = false;
        List<String> inserted = new ArrayList<>();
        for (JsonNode element : response) {
            JsonNode errors = element.path("result").path("errors");
            if (errors.isMissingNode() || errors.isNull()) {
                inserted.add(element.path("id").asText());
            } else {
                hasErrors = true;
                LOGGER.debug("Batch object {} rejected: {}", element.path("id").asText(), errors);
            }
        }
        return new BatchInsertResult(hasErrors, inserted);
    }

    @Override
    public long count() {
        String aggregate = "{ Aggregate { " + name() + " { meta { count } } } }";
        JsonNode data = graphQl(aggregate);
        return data.path("Aggregate").path(name()).path(0).path("meta").path("count").asLong();
    }

    String getQuery(String query, SearchOptions options, String groupedTask) {
        List<String> arguments = new ArrayList<>();
        if (!options.unlimited()) {
            arguments.add("limit: " + options.limit());
        }
        arguments.add(options.mode() == RetrievalMode.HYBRID ? hybridArgument(query, options)
                : nearTextArgument(query, options));

        StringBuilder additional = new StringBuilder("_additional { id");
        if (groupedTask != null) {
            additional.append(" generate(groupedResult: {task: ").append(literal(groupedTask))
                    .append("}) { groupedResult error }");
        }
        additional.append(" }");

        return "{ Get { " + name() + "(" + String.join(", ", arguments) + ") { "
                + String.join(" ", schema.propertyNames()) + " " + additional + " } } }";
    }

    private String hybridArgument(String query, SearchOptions options) {
        StringBuilder argument = new StringBuilder("hybrid: {query: ").append(literal(query));
        argument.append(", alpha: ").append(options.alpha());
        if (!options.queryProperties().isEmpty()) {
            argument.append(", properties: [")
                    .append(options.queryProperties().stream().map(this::literal).collect(Collectors.joining(", ")))
                    .append("]");
        }
        if (options.fusionType() != null) {
            argument.append(", fusionType: ").append(options.fusionType().queryValue());
        }
        return argument.append("}").toString();
    }

    private String nearTextArgument(String query, SearchOptions options) {
        return "nearText: {concepts: [" + literal(query) + "], certainty: " + options.certainty() + "}";
    }

    private JsonNode getObjects(String query) {
        return graphQl(query).path("Get").path(name());
    }

    private JsonNode graphQl(String query) {
        JsonNode response = restClient.post()
                .uri("/v1/graphql")
                .contentType(MediaType.APPLICATION_JSON)
                .body(Map.of("query", query))
                .retrieve()
                .body(JsonNode.class);
        if (response == null) {
            throw new IllegalStateException("Empty GraphQL response from " + name());
        }
        JsonNode errors = response.path("errors");
        if (errors.isArray() && !errors.isEmpty()) {
            List<String> messages = new ArrayList<>();
            errors.forEach(error -> messages.add(error.path("message").asText()));
            throw new IllegalStateException("GraphQL query on " + name() + " failed: " + String.join("; ", messages));
        }
        return response.path("data");
    }

    private StoredObject toStoredObject(JsonNode object) {
        Map<String, Object> properties = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = object.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (!field.getKey().equals("_additional") && !field.getValue().isNull()) {
                properties.put(field.getKey(), objectMapper.convertValue(field.getValue(), Object.class));
            }
        }
        String id = object.path("_additional").path("id").asText(null);
        return new StoredObject(id, MemoryStore.withoutNulls(properties));
    }

    private Map<String, Object> toObjectBody(StoredObject object) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("class", name());
        body.put("id", object.id());
        body.put("properties", object.properties());
        return body;
    }

    private String literal(String value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException ex) {
            throw new IllegalArgumentException("Unable to encode GraphQL literal", ex);
        }
    }
}
