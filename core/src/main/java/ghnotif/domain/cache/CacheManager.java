package ghnotif.domain.cache;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import io.vavr.control.Try;
import org.jspecify.annotations.Nullable;

import java.time.Duration;
import java.util.Comparator;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.PriorityBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Logger;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Adds a default TTL and computed prefetching on top of a {@link Cache}. A miss in {@link #get(String, Class)}
 * queues a prefetch on the underlying cache, and {@link #prefetch(PrefetchRequest)} runs the caller's callback on
 * a small worker pool and stores the result. The manager owns the cache and closes it.
 */
public class CacheManager implements AutoCloseable {
    public static final int DEFAULT_PREFETCH_CONCURRENCY = 2;

    private static final Logger logger = Logger.getLogger(CacheManager.class.getName());
    private static final Comparator<QueuedRequest> PRIORITY_ORDER = Comparator
            .comparingInt((QueuedRequest queued) -> queued.request().priority()).reversed()
            .thenComparingLong(QueuedRequest::sequence);

    private final Cache cache;
    private final Duration defaultTtl;
    private final int queueCapacity;
    private final PriorityBlockingQueue<QueuedRequest> queue;
    private final AtomicLong sequence = new AtomicLong();
    private final ExecutorService workers;

    public CacheManager(final Cache cache, final Duration defaultTtl, final int prefetchConcurrency, final int queueCapacity) {
        checkNotNull(cache, "cache must not be null");
        checkNotNull(defaultTtl, "defaultTtl must not be null");
        checkArgument(prefetchConcurrency > 0, "prefetchConcurrency must be positive");
        checkArgument(queueCapacity > 0, "queueCapacity must be positive");

        this.cache = cache;
        this.defaultTtl = defaultTtl;
        this.queueCapacity = queueCapacity;
        this.queue = new PriorityBlockingQueue<>(queueCapacity, PRIORITY_ORDER);
        this.workers = Executors.newFixedThreadPool(
                prefetchConcurrency,
                new ThreadFactoryBuilder().setNameFormat("cache-manager-%d").setDaemon(true).build());

        for (int i = 0; i < prefetchConcurrency; i++) {
            workers.execute(this::runWorker);
        }
    }

    public Cache getCache() {
        return cache;
    }

    public <T> CacheResult<T> get(final String key, final Class<T> type) {
        final CacheResult<T> result = cache.get(key, type);
        if (!result.fromCache()) {
            cache.prefetch(key);
        }
        return result;
    }

    /**
     * Stores a value. A null, zero or negative TTL is replaced by the default TTL.
     */
    public void set(final String key, final Object value, @Nullable final Duration ttl) {
        cache.set(key, value, ttl == null || ttl.isZero() || ttl.isNegative() ? defaultTtl : ttl);
    }

    public void delete(final String key) {
        cache.delete(key);
    }

    /**
     * Queues a request without blocking.
     *
     * @return false if the queue was full or the manager is closed, in which case the request is dropped
     */
    public boolean prefetch(final PrefetchRequest request) {
        checkNotNull(request, "request must not be null");

        if (workers.isShutdown() || queue.size() >= queueCapacity) {
            logger.fine("Dropped the prefetch request for " + request.key());
            return false;
        }

        return queue.offer(new QueuedRequest(request, sequence.getAndIncrement()));
    }

    public CacheMetrics metrics() {
        return cache.metrics();
    }

    private void runWorker() {
        try {
            while (!Thread.currentThread().isInterrupted()) {
                populate(queue.take().request());
            }
        } catch (final InterruptedException ex) {
            Thread.currentThread().interrupt();
        }
    }

    private void populate(final PrefetchRequest request) {
        if (cache.get(request.key(), Object.class).fromCache()) {
            return;
        }

        Try.<Object>of(() -> request.callback().call())
                .onFailure(ex -> logger.warning("Prefetch callback for " + request.key() + " failed: " + ex.getMessage()))
                .filter(value -> value != null)
                .onSuccess(value -> cache.set(request.key(), value, defaultTtl));
    }

    @Override
    public void close() {
        workers.shutdownNow();
        Try.of(() -> workers.awaitTermination(5, TimeUnit.SECONDS))
                .onFailure(ex -> logger.warning("Interrupted while stopping the prefetch workers"));
        cache.close();
    }

    private record QueuedRequest(PrefetchRequest request, long sequence) {
    }
}
