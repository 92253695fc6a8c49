package ch.so.arp.recall.memory;

import java.util.Map;
import java.util.Objects;
import java.util.StringJoiner;

/**
 * Object kept in a collection: a dialogue entry or an arbitrary transport
 * payload. Retrieval results are ordered lists of these, ranked by the store.
 */
public record StoredObject(String id, Map<String, Object> properties) {

    public StoredObject {
        Objects.requireNonNull(properties, "properties");
        properties = Map.copyOf(properties);
    }

    public Object property(String name) {
        return properties.get(name);
    }

    /**
     * Formats the object as one line of prompt context. Dialogue entries render
     * as {@code [timestamp] role: content}; other payloads fall back to their
     * property map.
     */
    public String formatForPrompt() {
        Object content = properties.get("content");
        if (content == null) {
            return properties.toString();
        }
        StringJoiner joiner = new StringJoiner(" ");
        Object timestamp = properties.get("timestamp");
        if (timestamp != null && !timestamp.toString().isBlank()) {
            joiner.add("[" + timestamp + "]");
        }
        Object role = properties.get("role");
        joiner.add((role != null ? role : "unknown") + ":");
        joiner.add(content.toString());
        return joiner.toString();
    }
}
