package ghnotif.domain.config;

import ghnotif.domain.cache.CacheType;
import ghnotif.domain.exceptions.ConfigurationFailure;
import org.apache.commons.lang3.StringUtils;

import java.nio.file.Path;
import java.time.Duration;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Settings for the cache.
 *
 * @param type              The backend
 * @param directory         Where the persistent backends keep their files
 * @param bucket            The namespace used by this cache instance
 * @param prefetchQueueSize The capacity of the prefetch queue
 * @param defaultTtl        The TTL the cache manager applies when the caller does not give one
 */
public record CacheSettings(CacheType type, Path directory, String bucket, int prefetchQueueSize, Duration defaultTtl) {
    public static final String DEFAULT_BUCKET = "cache";
    public static final int DEFAULT_PREFETCH_QUEUE_SIZE = 100;
    public static final Duration DEFAULT_TTL = Duration.ofHours(1);

    public CacheSettings {
        checkNotNull(type, "type must not be null");
        checkNotNull(directory, "directory must not be null");
        checkNotNull(defaultTtl, "defaultTtl must not be null");
        if (StringUtils.isBlank(bucket)) {
            throw new ConfigurationFailure("The cache bucket must not be blank");
        }
        if (!bucket.matches("[A-Za-z0-9_]+")) {
            throw new ConfigurationFailure("The cache bucket may only contain letters, digits and underscores, but was " + bucket);
        }
        SettingsValidation.positive("prefetch queue size", prefetchQueueSize);
    }

    public static CacheSettings defaults() {
        return new CacheSettings(
                CacheType.MEMORY,
                Path.of(System.getProperty("user.home"), ".ghnotif-cache"),
                DEFAULT_BUCKET,
                DEFAULT_PREFETCH_QUEUE_SIZE,
                DEFAULT_TTL);
    }

    public CacheSettings withType(final CacheType type) {
        return new CacheSettings(type, directory, bucket, prefetchQueueSize, defaultTtl);
    }

    public CacheSettings withDirectory(final Path directory) {
        return new CacheSettings(type, directory, bucket, prefetchQueueSize, defaultTtl);
    }
}
