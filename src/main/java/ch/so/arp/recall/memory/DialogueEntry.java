package ch.so.arp.recall.memory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One turn of a conversation as stored in a history collection.
 */
public record DialogueEntry(String timestamp, Role role, String content) {

    public DialogueEntry {
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(role, "role");
        Objects.requireNonNull(content, "content");
    }

    Map<String, Object> toProperties() {
        Map<String, Object> properties = new LinkedHashMap<>();
        properties.put("timestamp", timestamp);
        properties.put("role", role.value());
        properties.put("content", content);
        return properties;
    }
}
