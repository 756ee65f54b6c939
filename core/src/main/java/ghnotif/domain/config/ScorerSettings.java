package ghnotif.domain.config;

import org.jspecify.annotations.Nullable;

import java.time.Duration;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Settings for the scorer.
 *
 * @param concurrency The number of workers used for large collections
 * @param batchSize   Collections smaller than this are scored sequentially
 * @param timeout     The deadline for scoring one collection
 * @param username    The current user, reserved for involvement scoring
 * @param cacheTtl    How long computed scores are cached
 */
public record ScorerSettings(int concurrency, int batchSize, Duration timeout, @Nullable String username, Duration cacheTtl) {
    public static final int DEFAULT_BATCH_SIZE = 100;
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(5);
    public static final Duration DEFAULT_CACHE_TTL = Duration.ofMinutes(5);

    public ScorerSettings {
        checkNotNull(timeout, "timeout must not be null");
        checkNotNull(cacheTtl, "cacheTtl must not be null");
        SettingsValidation.positive("concurrency", concurrency);
        SettingsValidation.positive("batch size", batchSize);
        SettingsValidation.positive("timeout", timeout);
    }

    public static ScorerSettings defaults() {
        return new ScorerSettings(
                Runtime.getRuntime().availableProcessors(),
                DEFAULT_BATCH_SIZE,
                DEFAULT_TIMEOUT,
                null,
                DEFAULT_CACHE_TTL);
    }

    public ScorerSettings withBatchSize(final int batchSize) {
        return new ScorerSettings(concurrency, batchSize, timeout, username, cacheTtl);
    }

    public ScorerSettings withTimeout(final Duration timeout) {
        return new ScorerSettings(concurrency, batchSize, timeout, username, cacheTtl);
    }
}
