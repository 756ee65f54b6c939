package ghnotif.domain.cache;

import org.jspecify.annotations.Nullable;

import java.util.Optional;

/**
 * Represents the result of a cache lookup.
 *
 * @param result    The cached value, or null on a miss
 * @param fromCache True if the value was found in the cache and has not expired
 * @param <T>       The result type
 */
public record CacheResult<T>(@Nullable T result, boolean fromCache) {
    public static <T> CacheResult<T> hit(final T result) {
        return new CacheResult<>(result, true);
    }

    public static <T> CacheResult<T> miss() {
        return new CacheResult<>(null, false);
    }

    public Optional<T> toOptional() {
        return fromCache ? Optional.ofNullable(result) : Optional.empty();
    }
}
