package ghnotif.domain.cache;

import ghnotif.domain.exceptionhandling.ExceptionHandler;
import ghnotif.domain.exceptionhandling.LoggingExceptionHandler;
import ghnotif.domain.json.JsonDeserializer;
import io.vavr.control.Try;
import org.jspecify.annotations.Nullable;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.logging.Logger;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * The shared half of the on-disk caches. Values are wrapped in a {@link CacheEnvelope} and stored as JSON.
 * Storage failures after construction are counted and logged, never thrown.
 * Subclasses only move strings in and out of their storage engine.
 */
public abstract class PersistentCache implements Cache {
    private static final Logger logger = Logger.getLogger(PersistentCache.class.getName());

    private final String name;
    private final JsonDeserializer jsonDeserializer;
    private final ExceptionHandler exceptionHandler = new LoggingExceptionHandler();
    private final Clock clock;
    private final CacheStatistics statistics = new CacheStatistics();
    private final PrefetchQueue prefetchQueue;

    protected PersistentCache(final String name, final JsonDeserializer jsonDeserializer, final Clock clock, final int prefetchQueueSize) {
        this.name = checkNotNull(name, "name must not be null");
        this.jsonDeserializer = checkNotNull(jsonDeserializer, "jsonDeserializer must not be null");
        this.clock = checkNotNull(clock, "clock must not be null");
        this.prefetchQueue = new PrefetchQueue(name, prefetchQueueSize, key -> statistics.prefetchesProcessed.incrementAndGet());
    }

    protected abstract Optional<String> read(String key) throws Exception;

    protected abstract void write(String key, String value) throws Exception;

    protected abstract void remove(String key) throws Exception;

    /**
     * Drops and recreates the bucket.
     */
    protected abstract void recreateBucket() throws Exception;

    protected abstract long count() throws Exception;

    protected abstract void closeStorage() throws Exception;

    /**
     * Stops the prefetch thread of a cache whose storage could not be opened.
     */
    protected void abandon() {
        prefetchQueue.close();
    }

    @Override
    public <T> CacheResult<T> get(final String key, final Class<T> type) {
        final CacheResult<T> result = Try.of(() -> read(key))
                .map(raw -> raw.map(value -> jsonDeserializer.deserialize(value, CacheEnvelope.class)))
                .map(envelope -> toResult(key, envelope, type))
                .onFailure(ex -> recordError("read " + key, ex))
                .getOrElse(CacheResult::miss);

        if (result.fromCache()) {
            statistics.hit();
        } else {
            statistics.miss();
        }

        return result;
    }

    private <T> CacheResult<T> toResult(final String key, final Optional<CacheEnvelope> envelope, final Class<T> type) {
        if (envelope.isEmpty()) {
            return CacheResult.miss();
        }

        if (Expiry.isExpired(clock, envelope.get().expiresAt())) {
            Try.run(() -> remove(key))
                    .onFailure(ex -> recordError("evict " + key, ex));
            return CacheResult.miss();
        }

        return CacheResult.hit(jsonDeserializer.fromTree(envelope.get().value(), type));
    }

    @Override
    public void set(final String key, final Object value, @Nullable final Duration ttl) {
        checkNotNull(key, "key must not be null");
        checkNotNull(value, "value must not be null");

        statistics.sets.incrementAndGet();
        Try.of(() -> new CacheEnvelope(jsonDeserializer.toTree(value), Expiry.expiresAt(clock, ttl)))
                .map(jsonDeserializer::serialize)
                .andThenTry(json -> write(key, json))
                .onFailure(ex -> recordError("write " + key, ex));
    }

    @Override
    public void delete(final String key) {
        statistics.deletes.incrementAndGet();
        Try.run(() -> remove(key))
                .onFailure(ex -> recordError("delete " + key, ex));
    }

    @Override
    public void clear() {
        statistics.clears.incrementAndGet();
        Try.run(this::recreateBucket)
                .onFailure(ex -> recordError("clear", ex));
    }

    @Override
    public void prefetch(final String key) {
        statistics.prefetches.incrementAndGet();
        if (!prefetchQueue.offer(key)) {
            logger.fine("Prefetch queue of the " + name + " cache is full, dropped " + key);
        }
    }

    @Override
    public CacheMetrics metrics() {
        final long size = Try.of(this::count)
                .onFailure(ex -> recordError("count", ex))
                .getOrElse(0L);
        return statistics.snapshot(size);
    }

    @Override
    public void close() {
        prefetchQueue.close();
        final CacheMetrics metrics = metrics();
        logger.info("Closing the " + name + " cache after " + metrics.gets() + " reads with a hit ratio of "
                + Math.round(metrics.hitRatio() * 100) + "%");
        Try.run(this::closeStorage)
                .onFailure(ex -> logger.warning("Failed to close the " + name + " cache: " + exceptionHandler.getExceptionMessage(ex)));
    }

    private void recordError(final String operation, final Throwable ex) {
        statistics.errors.incrementAndGet();
        logger.warning("The " + name + " cache failed to " + operation + ": " + exceptionHandler.getExceptionMessage(ex));
    }
}
