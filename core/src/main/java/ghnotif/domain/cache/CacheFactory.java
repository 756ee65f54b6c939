package ghnotif.domain.cache;

import ghnotif.domain.config.CacheSettings;
import ghnotif.domain.json.JsonDeserializer;

import java.util.logging.Logger;

/**
 * Opens the cache backend named by the settings.
 */
public final class CacheFactory {
    private static final Logger logger = Logger.getLogger(CacheFactory.class.getName());

    private CacheFactory() {
    }

    /**
     * @throws ghnotif.domain.exceptions.LocalStorageFailure if a persistent backend cannot open its storage
     */
    public static Cache open(final CacheSettings settings, final JsonDeserializer jsonDeserializer) {
        logger.fine("Opening a " + settings.type() + " cache");

        return switch (settings.type()) {
            case NULL -> new NullCache();
            case MEMORY -> new MemoryCache();
            case H2 -> new H2Cache(
                    settings.directory().resolve("h2"),
                    settings.bucket(),
                    jsonDeserializer,
                    settings.prefetchQueueSize());
            case ROCKSDB -> new RocksDbCache(
                    settings.directory().resolve("rocksdb"),
                    settings.bucket(),
                    jsonDeserializer,
                    settings.prefetchQueueSize());
        };
    }
}
