package ghnotif.domain.cache;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import io.vavr.control.Try;

import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.Consumer;
import java.util.logging.Logger;

/**
 * A bounded queue of keys drained by a single daemon thread for the lifetime of the owner.
 * Offers never block: when the queue is full the key is dropped.
 */
class PrefetchQueue implements AutoCloseable {
    private static final Logger logger = Logger.getLogger(PrefetchQueue.class.getName());

    private final BlockingQueue<String> queue;
    private final Consumer<String> handler;
    private final ExecutorService executor;

    PrefetchQueue(final String name, final int capacity, final Consumer<String> handler) {
        this.queue = new ArrayBlockingQueue<>(capacity);
        this.handler = handler;
        this.executor = Executors.newSingleThreadExecutor(
                new ThreadFactoryBuilder().setNameFormat(name + "-prefetch-%d").setDaemon(true).build());
        this.executor.execute(this::drain);
    }

    boolean offer(final String key) {
        if (executor.isShutdown()) {
            return false;
        }

        return queue.offer(key);
    }

    int pending() {
        return queue.size();
    }

    private void drain() {
        try {
            while (!Thread.currentThread().isInterrupted()) {
                final String key = queue.take();
                Try.run(() -> handler.accept(key))
                        .onFailure(ex -> logger.warning("Prefetch of " + key + " failed: " + ex.getMessage()));
            }
        } catch (final InterruptedException ex) {
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }
}
