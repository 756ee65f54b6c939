package ghnotif.domain.config;

import ghnotif.domain.cache.Cache;
import ghnotif.domain.cache.CacheFactory;
import ghnotif.domain.json.JsonDeserializer;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;

import java.util.logging.Logger;

/**
 * Produces the cache selected by {@code ghnotif.cache.type}, and closes it when the container shuts down.
 */
@ApplicationScoped
public class CacheProducer {
    @Inject
    private Logger logger;

    @Produces
    @ApplicationScoped
    public Cache produceCache(final CacheSettings cacheSettings, final JsonDeserializer jsonDeserializer) {
        logger.info("Using the " + cacheSettings.type() + " cache");
        return CacheFactory.open(cacheSettings, jsonDeserializer);
    }

    public void closeCache(@Disposes final Cache cache) {
        cache.close();
    }
}
