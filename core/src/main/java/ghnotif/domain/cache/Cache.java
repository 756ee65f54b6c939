package ghnotif.domain.cache;

import org.jspecify.annotations.Nullable;

import java.time.Duration;

/**
 * A key/value store with per-entry expiry. Caching is best effort: apart from construction, no operation
 * throws because of a storage failure. Failures are counted in {@link #metrics()} and logged instead.
 */
public interface Cache extends AutoCloseable {
    /**
     * Returns the value stored under the key, converted to the requested type. Expired entries are
     * evicted and reported as a miss.
     */
    <T> CacheResult<T> get(String key, Class<T> type);

    default CacheResult<Object> get(final String key) {
        return get(key, Object.class);
    }

    /**
     * Stores a value. A null, zero or negative TTL means the entry never expires.
     */
    void set(String key, Object value, @Nullable Duration ttl);

    void delete(String key);

    /**
     * Removes every entry in this cache's bucket.
     */
    void clear();

    /**
     * Queues a best-effort background fetch of the key. The request is dropped if the queue is full.
     * Computing the value is the caller's responsibility; see {@link CacheManager}.
     */
    void prefetch(String key);

    CacheMetrics metrics();

    @Override
    void close();
}
