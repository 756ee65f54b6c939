package ghnotif.domain.cache;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

public class CacheManagerTest {
    @Test
    public void testMissTriggersAPrefetch() {
        try (final CacheManager manager = new CacheManager(new MemoryCache(), Duration.ofMinutes(1), 1, 10)) {
            Assertions.assertFalse(manager.get("key", String.class).fromCache());
            Assertions.assertEquals(1, manager.metrics().prefetches());

            manager.set("key", "value", null);
            Assertions.assertTrue(manager.get("key", String.class).fromCache());
            Assertions.assertEquals(1, manager.metrics().prefetches());
        }
    }

    @Test
    public void testPrefetchStoresTheComputedValue() throws InterruptedException {
        try (final CacheManager manager = new CacheManager(new MemoryCache(), Duration.ofMinutes(1), 2, 10)) {
            Assertions.assertTrue(manager.prefetch(new PrefetchRequest("key", 0, () -> "computed")));

            Assertions.assertEquals("computed", await(manager, "key"));
        }
    }

    @Test
    public void testFailedOrEmptyCallbacksLeaveTheCacheAlone() throws InterruptedException {
        try (final CacheManager manager = new CacheManager(new MemoryCache(), Duration.ofMinutes(1), 1, 10)) {
            manager.prefetch(new PrefetchRequest("failing", 0, () -> {
                throw new IllegalStateException("boom");
            }));
            manager.prefetch(new PrefetchRequest("empty", 0, () -> null));
            manager.prefetch(new PrefetchRequest("marker", 0, () -> "done"));

            // a single worker serves requests of equal priority in order
            Assertions.assertEquals("done", await(manager, "marker"));
            Assertions.assertFalse(manager.getCache().get("failing").fromCache());
            Assertions.assertFalse(manager.getCache().get("empty").fromCache());
        }
    }

    @Test
    public void testCachedKeysAreNotRecomputed() throws InterruptedException {
        try (final CacheManager manager = new CacheManager(new MemoryCache(), Duration.ofMinutes(1), 1, 10)) {
            manager.set("key", "original", Duration.ofMinutes(1));
            manager.prefetch(new PrefetchRequest("key", 0, () -> "replacement"));
            manager.prefetch(new PrefetchRequest("marker", 0, () -> "done"));

            await(manager, "marker");
            Assertions.assertEquals("original", manager.getCache().get("key", String.class).result());
        }
    }

    @Test
    public void testHigherPriorityRunsFirst() throws InterruptedException {
        final CountDownLatch blocker = new CountDownLatch(1);
        final List<String> order = new CopyOnWriteArrayList<>();

        try (final CacheManager manager = new CacheManager(new MemoryCache(), Duration.ofMinutes(1), 1, 10)) {
            manager.prefetch(new PrefetchRequest("blocker", 100, () -> {
                blocker.await(5, TimeUnit.SECONDS);
                return "blocker";
            }));
            // give the worker time to pick up the blocking request
            Thread.sleep(100);

            manager.prefetch(new PrefetchRequest("low", 1, () -> {
                order.add("low");
                return "low";
            }));
            manager.prefetch(new PrefetchRequest("high", 9, () -> {
                order.add("high");
                return "high";
            }));
            blocker.countDown();

            await(manager, "low");
            Assertions.assertEquals(List.of("high", "low"), order);
        }
    }

    @Test
    public void testFullQueueDropsRequests() {
        final CountDownLatch blocker = new CountDownLatch(1);

        try (final CacheManager manager = new CacheManager(new MemoryCache(), Duration.ofMinutes(1), 1, 1)) {
            manager.prefetch(new PrefetchRequest("blocker", 0, () -> {
                blocker.await(5, TimeUnit.SECONDS);
                return "blocker";
            }));

            // one request is held by the worker and one fits in the queue
            int dropped = 0;
            for (int i = 0; i < 3; i++) {
                if (!manager.prefetch(new PrefetchRequest("key" + i, 0, () -> "value"))) {
                    dropped++;
                }
            }

            Assertions.assertTrue(dropped >= 2);
            blocker.countDown();
        }
    }

    @Test
    public void testClosedManagerRejectsRequests() {
        final CacheManager manager = new CacheManager(new MemoryCache(), Duration.ofMinutes(1), 1, 10);
        manager.close();

        Assertions.assertFalse(manager.prefetch(new PrefetchRequest("key", 0, () -> "value")));
    }

    private static String await(final CacheManager manager, final String key) throws InterruptedException {
        final long deadline = System.nanoTime() + Duration.ofSeconds(5).toNanos();
        while (System.nanoTime() < deadline) {
            final CacheResult<String> result = manager.getCache().get(key, String.class);
            if (result.fromCache()) {
                return result.result();
            }
            Thread.sleep(10);
        }
        return Assertions.fail("Timed out waiting for " + key);
    }
}
