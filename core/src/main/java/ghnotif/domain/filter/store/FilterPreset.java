package ghnotif.domain.filter.store;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.jspecify.annotations.Nullable;

import java.time.Instant;
import java.util.List;

/**
 * A saved filter expression.
 *
 * @param name        The name used in {@code @name} references
 * @param description An optional description
 * @param expression  The filter expression
 * @param created     When the preset was first saved
 * @param lastUsed    When the preset was last resolved, if ever
 * @param useCount    How many times the preset has been resolved
 * @param parent      The preset this one was derived from, if any
 * @param tags        Free-form tags
 */
public record FilterPreset(
        String name,
        @Nullable String description,
        String expression,
        @Nullable Instant created,
        @JsonProperty("last_used") @Nullable Instant lastUsed,
        @JsonProperty("use_count") int useCount,
        @Nullable String parent,
        @Nullable List<String> tags) {

    public static FilterPreset of(final String name, final String expression) {
        return new FilterPreset(name, null, expression, null, null, 0, null, null);
    }

    public FilterPreset withCreated(final Instant created) {
        return new FilterPreset(name, description, expression, created, lastUsed, useCount, parent, tags);
    }

    public FilterPreset used(final Instant now) {
        return new FilterPreset(name, description, expression, created, now, useCount + 1, parent, tags);
    }
}
