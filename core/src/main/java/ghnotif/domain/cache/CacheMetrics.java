package ghnotif.domain.cache;

/**
 * A snapshot of the counters of one cache instance.
 */
public record CacheMetrics(
        long gets,
        long sets,
        long hits,
        long misses,
        long deletes,
        long clears,
        long errors,
        long prefetches,
        long prefetchesProcessed,
        long size) {

    public static CacheMetrics empty() {
        return new CacheMetrics(0, 0, 0, 0, 0, 0, 0, 0, 0, 0);
    }

    /**
     * The share of lookups that hit, between 0 and 1. Zero when there were no lookups.
     */
    public double hitRatio() {
        return gets == 0 ? 0 : (double) hits / gets;
    }
}
