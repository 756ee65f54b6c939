package ghnotif.domain.concurrency;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

public class BoundedWorkerPoolTest {
    @Test
    public void testProcessesEveryInput() {
        final List<Integer> inputs = IntStream.range(0, 500).boxed().toList();

        final PartialResult<List<Integer>> result = new BoundedWorkerPool("test", 4, 16)
                .process(inputs, i -> Optional.of(i * 2), Duration.ofSeconds(10));

        Assertions.assertTrue(result.isComplete());
        Assertions.assertEquals(500, result.processed());
        Assertions.assertEquals(
                inputs.stream().map(i -> i * 2).collect(Collectors.toSet()),
                Set.copyOf(result.value()));
    }

    @Test
    public void testEmptyOutputsAreDropped() {
        final List<Integer> inputs = IntStream.range(0, 100).boxed().toList();

        final PartialResult<List<Integer>> result = new BoundedWorkerPool("test", 2, 8)
                .process(inputs, i -> i % 2 == 0 ? Optional.of(i) : Optional.empty(), Duration.ofSeconds(10));

        Assertions.assertTrue(result.isComplete());
        Assertions.assertEquals(50, result.value().size());
    }

    @Test
    public void testFailingWorkProducesNoOutput() {
        final List<Integer> inputs = IntStream.range(0, 20).boxed().toList();

        final PartialResult<List<Integer>> result = new BoundedWorkerPool("test", 2, 4)
                .process(inputs, i -> {
                    if (i == 7) {
                        throw new IllegalStateException("boom");
                    }
                    return Optional.of(i);
                }, Duration.ofSeconds(10));

        Assertions.assertTrue(result.isComplete());
        Assertions.assertEquals(19, result.value().size());
        Assertions.assertFalse(result.value().contains(7));
    }

    @Test
    public void testDeadlineReturnsPartialOutput() {
        final List<Integer> inputs = IntStream.range(0, 200).boxed().toList();

        final long start = System.nanoTime();
        final PartialResult<List<Integer>> result = new BoundedWorkerPool("slow", 2, 4)
                .process(inputs, i -> {
                    try {
                        Thread.sleep(5);
                    } catch (final InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                    return Optional.of(i);
                }, Duration.ofMillis(50));
        final long elapsedMillis = Duration.ofNanos(System.nanoTime() - start).toMillis();

        Assertions.assertFalse(result.isComplete());
        Assertions.assertEquals("slow", result.getFailure().orElseThrow().getOperation());
        Assertions.assertTrue(result.value().size() < inputs.size());
        Assertions.assertTrue(elapsedMillis < 5000, "the pool returned promptly after the deadline");
    }

    @Test
    public void testInvalidConfiguration() {
        Assertions.assertThrows(IllegalArgumentException.class, () -> new BoundedWorkerPool("test", 0, 1));
        Assertions.assertThrows(IllegalArgumentException.class, () -> new BoundedWorkerPool("test", 1, 0));
    }
}
