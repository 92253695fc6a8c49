package ch.so.arp.recall.memory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Definition of a collection as sent to the store on creation. The set of
 * properties is fixed once the collection exists.
 */
public record CollectionSchema(String name, String description, List<PropertyDefinition> properties,
        ModelProvider modelProvider) {

    public CollectionSchema {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(modelProvider, "modelProvider");
        properties = List.copyOf(properties);
    }

    public List<String> propertyNames() {
        return properties.stream().map(PropertyDefinition::name).toList();
    }

    /**
     * Renders the schema as the class definition accepted by the store's schema
     * endpoint.
     */
    public Map<String, Object> toClassDefinition() {
        Map<String, Object> definition = new LinkedHashMap<>();
        definition.put("class", name);
        definition.put("description", description);
        definition.put("properties", properties.stream().map(PropertyDefinition::toDefinition).toList());
        definition.put("vectorizer", modelProvider.vectorizerModule());
        definition.put("moduleConfig", modelProvider.moduleConfig());
        return definition;
    }

    /**
     * A single retrievable field of a collection.
     */
    public record PropertyDefinition(String name, String dataType, String description) {

        public static PropertyDefinition text(String name, String description) {
            return new PropertyDefinition(name, "text", description);
        }

        public static PropertyDefinition integer(String name, String description) {
            return new PropertyDefinition(name, "int", description);
        }

        Map<String, Object> toDefinition() {
            Map<String, Object> definition = new LinkedHashMap<>();
            definition.put("name", name);
            definition.put("dataType", List.of(dataType));
            definition.put("description", description);
            return definition;
        }
    }
}
