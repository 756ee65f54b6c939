package ghnotif.domain.cache;

import org.jspecify.annotations.Nullable;

import java.time.Clock;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.logging.Logger;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A volatile cache guarded by a read/write lock. Values are held by reference, so a hit returns
 * the same instance that was stored. Expired entries are evicted when they are read.
 */
public class MemoryCache implements Cache {
    private static final Logger logger = Logger.getLogger(MemoryCache.class.getName());

    private final Map<String, Entry> entries = new HashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final CacheStatistics statistics = new CacheStatistics();
    private final Clock clock;

    public MemoryCache() {
        this(Clock.systemUTC());
    }

    public MemoryCache(final Clock clock) {
        this.clock = checkNotNull(clock, "clock must not be null");
    }

    @Override
    public <T> CacheResult<T> get(final String key, final Class<T> type) {
        final Entry entry;
        lock.readLock().lock();
        try {
            entry = entries.get(key);
        } finally {
            lock.readLock().unlock();
        }

        if (entry == null) {
            statistics.miss();
            return CacheResult.miss();
        }

        if (Expiry.isExpired(clock, entry.expiresAt())) {
            evict(key, entry);
            statistics.miss();
            return CacheResult.miss();
        }

        if (!type.isInstance(entry.value())) {
            logger.warning("Cached value for " + key + " is a " + entry.value().getClass().getSimpleName()
                    + ", not a " + type.getSimpleName());
            statistics.errors.incrementAndGet();
            statistics.miss();
            return CacheResult.miss();
        }

        statistics.hit();
        return CacheResult.hit(type.cast(entry.value()));
    }

    /**
     * Removes the entry only if it has not been replaced since it was read.
     */
    private void evict(final String key, final Entry expired) {
        lock.writeLock().lock();
        try {
            entries.remove(key, expired);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public void set(final String key, final Object value, @Nullable final Duration ttl) {
        checkNotNull(key, "key must not be null");
        checkNotNull(value, "value must not be null");

        lock.writeLock().lock();
        try {
            entries.put(key, new Entry(value, Expiry.expiresAt(clock, ttl)));
        } finally {
            lock.writeLock().unlock();
        }
        statistics.sets.incrementAndGet();
    }

    @Override
    public void delete(final String key) {
        lock.writeLock().lock();
        try {
            entries.remove(key);
        } finally {
            lock.writeLock().unlock();
        }
        statistics.deletes.incrementAndGet();
    }

    @Override
    public void clear() {
        lock.writeLock().lock();
        try {
            entries.clear();
        } finally {
            lock.writeLock().unlock();
        }
        statistics.clears.incrementAndGet();
    }

    /**
     * The values already live in memory, so there is nothing to warm.
     */
    @Override
    public void prefetch(final String key) {
        statistics.prefetches.incrementAndGet();
    }

    @Override
    public CacheMetrics metrics() {
        lock.readLock().lock();
        try {
            return statistics.snapshot(entries.size());
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public void close() {
        lock.writeLock().lock();
        try {
            entries.clear();
        } finally {
            lock.writeLock().unlock();
        }
    }

    private record Entry(Object value, long expiresAt) {
    }
}
