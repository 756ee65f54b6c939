package ghnotif.domain.config;

import java.time.Duration;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Settings for the filter engine.
 *
 * @param concurrency The number of workers used for large collections
 * @param batchSize   Collections smaller than this are filtered sequentially
 * @param timeout     The deadline for filtering one collection
 * @param indexing    Whether indexed filters may narrow the collection before evaluation
 */
public record FilterEngineSettings(int concurrency, int batchSize, Duration timeout, boolean indexing) {
    public static final int DEFAULT_BATCH_SIZE = 100;
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(5);

    public FilterEngineSettings {
        checkNotNull(timeout, "timeout must not be null");
        SettingsValidation.positive("concurrency", concurrency);
        SettingsValidation.positive("batch size", batchSize);
        SettingsValidation.positive("timeout", timeout);
    }

    public static FilterEngineSettings defaults() {
        return new FilterEngineSettings(
                Runtime.getRuntime().availableProcessors(),
                DEFAULT_BATCH_SIZE,
                DEFAULT_TIMEOUT,
                true);
    }

    public FilterEngineSettings withTimeout(final Duration timeout) {
        return new FilterEngineSettings(concurrency, batchSize, timeout, indexing);
    }

    public FilterEngineSettings withBatchSize(final int batchSize) {
        return new FilterEngineSettings(concurrency, batchSize, timeout, indexing);
    }

    public FilterEngineSettings withIndexing(final boolean indexing) {
        return new FilterEngineSettings(concurrency, batchSize, timeout, indexing);
    }
}
