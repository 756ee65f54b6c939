package ghnotif.domain.cache;

import ghnotif.domain.exceptions.ConfigurationFailure;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

public class NullCacheTest {
    @Test
    public void testEverythingMisses() {
        try (final NullCache cache = new NullCache()) {
            cache.set("key", "value", null);
            cache.prefetch("key");

            Assertions.assertFalse(cache.get("key").fromCache());
            Assertions.assertEquals(CacheMetrics.empty(), cache.metrics());
        }
    }

    @Test
    public void testTypeNames() {
        Assertions.assertEquals(CacheType.NULL, CacheType.fromName("none"));
        Assertions.assertEquals(CacheType.MEMORY, CacheType.fromName(" Memory "));
        Assertions.assertEquals(CacheType.H2, CacheType.fromName("bolt"));
        Assertions.assertEquals(CacheType.ROCKSDB, CacheType.fromName("badger"));
        Assertions.assertThrows(ConfigurationFailure.class, () -> CacheType.fromName("redis"));
    }
}
