package ghnotif.domain.cache;

import org.jspecify.annotations.Nullable;

import java.time.Duration;

/**
 * A cache that stores nothing. Used to disable caching without changing the callers.
 */
public class NullCache implements Cache {
    @Override
    public <T> CacheResult<T> get(final String key, final Class<T> type) {
        return CacheResult.miss();
    }

    @Override
    public void set(final String key, final Object value, @Nullable final Duration ttl) {
    }

    @Override
    public void delete(final String key) {
    }

    @Override
    public void clear() {
    }

    @Override
    public void prefetch(final String key) {
    }

    @Override
    public CacheMetrics metrics() {
        return CacheMetrics.empty();
    }

    @Override
    public void close() {
    }
}
