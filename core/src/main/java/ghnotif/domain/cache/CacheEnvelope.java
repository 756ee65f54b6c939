package ghnotif.domain.cache;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * The serialized form of an entry in the persistent caches.
 *
 * @param value     The cached value as a JSON tree
 * @param expiresAt The expiry in epoch milliseconds, or 0 if the entry never expires
 */
public record CacheEnvelope(@JsonProperty("v") JsonNode value, @JsonProperty("e") long expiresAt) {
}
