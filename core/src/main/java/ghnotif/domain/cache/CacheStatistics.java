package ghnotif.domain.cache;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Thread safe counters behind {@link CacheMetrics}.
 */
class CacheStatistics {
    final AtomicLong gets = new AtomicLong();
    final AtomicLong sets = new AtomicLong();
    final AtomicLong hits = new AtomicLong();
    final AtomicLong misses = new AtomicLong();
    final AtomicLong deletes = new AtomicLong();
    final AtomicLong clears = new AtomicLong();
    final AtomicLong errors = new AtomicLong();
    final AtomicLong prefetches = new AtomicLong();
    final AtomicLong prefetchesProcessed = new AtomicLong();

    void hit() {
        gets.incrementAndGet();
        hits.incrementAndGet();
    }

    void miss() {
        gets.incrementAndGet();
        misses.incrementAndGet();
    }

    CacheMetrics snapshot(final long size) {
        return new CacheMetrics(
                gets.get(),
                sets.get(),
                hits.get(),
                misses.get(),
                deletes.get(),
                clears.get(),
                errors.get(),
                prefetches.get(),
                prefetchesProcessed.get(),
                size);
    }
}
