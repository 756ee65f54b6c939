package ghnotif.domain.cache;

import java.util.concurrent.Callable;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A request to compute a value in the background and store it under a key.
 *
 * @param key      The cache key to populate
 * @param priority Requests with a higher priority are served first
 * @param callback Computes the value. A null result or an exception leaves the cache untouched.
 */
public record PrefetchRequest(String key, int priority, Callable<?> callback) {
    public PrefetchRequest {
        checkNotNull(key, "key must not be null");
        checkNotNull(callback, "callback must not be null");
    }
}
