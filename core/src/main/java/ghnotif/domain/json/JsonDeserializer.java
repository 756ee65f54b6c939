package ghnotif.domain.json;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Map;

public interface JsonDeserializer {
    String serialize(Object object);

    <T> T deserialize(String json, Class<T> clazz);

    <U, V> Map<U, V> deserializeMap(String json, Class<U> key, Class<V> value);

    /**
     * Converts an arbitrary object into a JSON tree, so it can be embedded in another document.
     */
    JsonNode toTree(Object object);

    /**
     * Converts a JSON tree produced by {@link #toTree(Object)} back into the requested type.
     */
    <T> T fromTree(JsonNode node, Class<T> clazz);
}
