package ghnotif.domain.concurrency;

import ghnotif.domain.exceptions.DeadlineExceeded;
import org.jspecify.annotations.Nullable;

import java.util.Optional;
import java.util.function.Function;

/**
 * The result of a collection-wide operation that may have been cut short by its deadline.
 * A partial value is not an error in itself; only the deadline failure is.
 *
 * @param value     The value collected before the operation finished or timed out
 * @param processed The number of input records that were processed
 * @param total     The number of input records
 * @param failure   The deadline failure, or null if the operation completed
 * @param <T>       The value type
 */
public record PartialResult<T>(T value, int processed, int total, @Nullable DeadlineExceeded failure) {

    public static <T> PartialResult<T> complete(final T value, final int total) {
        return new PartialResult<>(value, total, total, null);
    }

    public boolean isComplete() {
        return failure == null;
    }

    public Optional<DeadlineExceeded> getFailure() {
        return Optional.ofNullable(failure);
    }

    /**
     * Returns the value if the operation completed, or throws the deadline failure.
     */
    public T getOrThrow() {
        if (failure != null) {
            throw failure;
        }
        return value;
    }

    public <U> PartialResult<U> map(final Function<T, U> mapper) {
        return new PartialResult<>(mapper.apply(value), processed, total, failure);
    }
}
