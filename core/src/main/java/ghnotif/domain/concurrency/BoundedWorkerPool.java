package ghnotif.domain.concurrency;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import ghnotif.domain.exceptions.DeadlineExceeded;
import org.jspecify.annotations.Nullable;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;
import java.util.logging.Level;
import java.util.logging.Logger;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Fans a list of inputs out to a fixed number of workers and collects their outputs on the calling thread.
 * <p>
 * A feeder thread pushes inputs onto a bounded queue, each worker applies the work function and forwards any
 * output to a single output queue, and a supervisor marks the output as finished once every worker has exited.
 * Every queue operation is bounded by the shared deadline and a cancellation flag, so no thread blocks past
 * the deadline. Output order is the order in which workers finish, not the input order.
 */
public class BoundedWorkerPool {
    private static final Logger logger = Logger.getLogger(BoundedWorkerPool.class.getName());
    private static final long POLL_SLICE_NANOS = TimeUnit.MILLISECONDS.toNanos(50);
    private static final Slot<?> END = new Slot<>(null);

    private final String name;
    private final int concurrency;
    private final int queueCapacity;

    public BoundedWorkerPool(final String name, final int concurrency, final int queueCapacity) {
        checkNotNull(name, "name must not be null");
        checkArgument(concurrency > 0, "concurrency must be positive");
        checkArgument(queueCapacity > 0, "queueCapacity must be positive");

        this.name = name;
        this.concurrency = concurrency;
        this.queueCapacity = queueCapacity;
    }

    /**
     * Applies the work function to every input. Inputs whose work function returns an empty optional produce
     * no output.
     *
     * @param inputs  The inputs to process
     * @param work    The function applied by the workers
     * @param timeout The overall deadline, measured from this call
     * @return The collected outputs, plus a deadline failure if the timeout elapsed first
     */
    public <I, O> PartialResult<List<O>> process(final List<I> inputs, final Function<I, Optional<O>> work, final Duration timeout) {
        checkNotNull(inputs, "inputs must not be null");
        checkNotNull(work, "work must not be null");
        checkNotNull(timeout, "timeout must not be null");

        final long deadline = System.nanoTime() + timeout.toNanos();
        final AtomicBoolean cancelled = new AtomicBoolean(false);
        final AtomicInteger processed = new AtomicInteger();
        final BlockingQueue<Slot<I>> input = new ArrayBlockingQueue<>(queueCapacity);
        final BlockingQueue<Slot<O>> output = new ArrayBlockingQueue<>(queueCapacity);
        final CountDownLatch workersDone = new CountDownLatch(concurrency);

        final ExecutorService executor = Executors.newFixedThreadPool(
                concurrency + 2,
                new ThreadFactoryBuilder().setNameFormat(name + "-worker-%d").setDaemon(true).build());

        try {
            for (int i = 0; i < concurrency; i++) {
                executor.execute(() -> runWorker(input, output, work, processed, workersDone, deadline, cancelled));
            }

            executor.execute(() -> feed(inputs, input, deadline, cancelled));

            executor.execute(() -> {
                if (await(workersDone, deadline)) {
                    offer(output, end(), deadline, cancelled);
                }
            });

            final List<O> results = new ArrayList<>();
            while (true) {
                final Slot<O> slot = poll(output, deadline, cancelled);
                if (slot == null) {
                    logger.warning(name + " deadline of " + timeout.toMillis() + " ms elapsed after "
                            + processed.get() + " of " + inputs.size() + " records");
                    return new PartialResult<>(
                            results,
                            processed.get(),
                            inputs.size(),
                            new DeadlineExceeded(name, processed.get(), inputs.size(), timeout));
                }

                if (slot == END) {
                    return new PartialResult<>(results, processed.get(), inputs.size(), null);
                }

                results.add(slot.item());
            }
        } finally {
            cancelled.set(true);
            executor.shutdownNow();
        }
    }

    private <I, O> void runWorker(
            final BlockingQueue<Slot<I>> input,
            final BlockingQueue<Slot<O>> output,
            final Function<I, Optional<O>> work,
            final AtomicInteger processed,
            final CountDownLatch workersDone,
            final long deadline,
            final AtomicBoolean cancelled) {
        try {
            while (true) {
                final Slot<I> slot = poll(input, deadline, cancelled);
                if (slot == null || slot == END) {
                    return;
                }

                final Optional<O> result = apply(work, slot.item());
                processed.incrementAndGet();

                if (result.isPresent() && !offer(output, new Slot<>(result.get()), deadline, cancelled)) {
                    return;
                }
            }
        } finally {
            workersDone.countDown();
        }
    }

    private <I, O> Optional<O> apply(final Function<I, Optional<O>> work, final I item) {
        try {
            return work.apply(item);
        } catch (final RuntimeException ex) {
            logger.log(Level.FINE, name + " work function failed, treating the record as producing no output", ex);
            return Optional.empty();
        }
    }

    private <I> void feed(final List<I> inputs, final BlockingQueue<Slot<I>> input, final long deadline, final AtomicBoolean cancelled) {
        for (final I item : inputs) {
            if (!offer(input, new Slot<>(item), deadline, cancelled)) {
                return;
            }
        }

        // one end marker per worker
        for (int i = 0; i < concurrency; i++) {
            if (!offer(input, end(), deadline, cancelled)) {
                return;
            }
        }
    }

    private static <T> boolean offer(final BlockingQueue<T> queue, final T item, final long deadline, final AtomicBoolean cancelled) {
        try {
            while (!cancelled.get()) {
                final long remaining = deadline - System.nanoTime();
                if (remaining <= 0) {
                    return false;
                }
                if (queue.offer(item, Math.min(remaining, POLL_SLICE_NANOS), TimeUnit.NANOSECONDS)) {
                    return true;
                }
            }
            return false;
        } catch (final InterruptedException ex) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    @Nullable
    private static <T> T poll(final BlockingQueue<T> queue, final long deadline, final AtomicBoolean cancelled) {
        try {
            while (!cancelled.get()) {
                final long remaining = deadline - System.nanoTime();
                if (remaining <= 0) {
                    return null;
                }
                final T item = queue.poll(Math.min(remaining, POLL_SLICE_NANOS), TimeUnit.NANOSECONDS);
                if (item != null) {
                    return item;
                }
            }
            return null;
        } catch (final InterruptedException ex) {
            Thread.currentThread().interrupt();
            return null;
        }
    }

    private static boolean await(final CountDownLatch latch, final long deadline) {
        try {
            return latch.await(Math.max(0, deadline - System.nanoTime()), TimeUnit.NANOSECONDS);
        } catch (final InterruptedException ex) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    @SuppressWarnings("unchecked")
    private static <T> Slot<T> end() {
        return (Slot<T>) END;
    }

    private record Slot<T>(@Nullable T item) {
    }
}
