package ghnotif.domain.json;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.fasterxml.jackson.module.blackbird.BlackbirdModule;
import ghnotif.domain.exceptions.DeserializationFailed;
import ghnotif.domain.exceptions.SerializationFailed;
import io.vavr.control.Try;
import jakarta.enterprise.context.ApplicationScoped;

import java.util.Map;
import java.util.logging.Logger;

/**
 * A service for serializing and deserializing JSON. The caches also use it to wrap values in their storage envelope.
 */
@ApplicationScoped
public class JsonDeserializerJackson implements JsonDeserializer {
    private static final Logger logger = Logger.getLogger(JsonDeserializerJackson.class.getName());

    private final ObjectMapper objectMapper = createObjectMapper();

    @Override
    public String serialize(final Object object) {
        return Try.of(() -> objectMapper.writeValueAsString(object))
                .onFailure(ex -> logger.warning("Failed to serialize object of type " + object.getClass().getSimpleName() + ": " + ex.getMessage()))
                .getOrElseThrow(ex -> new SerializationFailed(ex));
    }

    @Override
    public <T> T deserialize(final String json, final Class<T> clazz) {
        return Try.of(() -> objectMapper.readValue(json, clazz))
                .getOrElseThrow(ex -> new DeserializationFailed(ex));
    }

    @Override
    public <U, V> Map<U, V> deserializeMap(final String json, final Class<U> key, final Class<V> value) {
        return Try.of(() -> objectMapper.<Map<U, V>>readValue(
                        json,
                        objectMapper.getTypeFactory().constructMapType(Map.class, key, value)))
                .onFailure(ex -> logger.warning("Failed to deserialize map of type " + value.getSimpleName() + ": " + ex.getMessage()))
                .getOrElseThrow(ex -> new DeserializationFailed(ex));
    }

    @Override
    public JsonNode toTree(final Object object) {
        return Try.of(() -> objectMapper.<JsonNode>valueToTree(object))
                .getOrElseThrow(ex -> new SerializationFailed(ex));
    }

    @Override
    public <T> T fromTree(final JsonNode node, final Class<T> clazz) {
        return Try.of(() -> objectMapper.treeToValue(node, clazz))
                .getOrElseThrow(ex -> new DeserializationFailed(ex));
    }

    private static ObjectMapper createObjectMapper() {
        final ObjectMapper objectMapper = new ObjectMapper();
        objectMapper.registerModule(new JavaTimeModule());
        objectMapper.registerModule(new BlackbirdModule());
        objectMapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);
        objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        objectMapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return objectMapper;
    }
}
