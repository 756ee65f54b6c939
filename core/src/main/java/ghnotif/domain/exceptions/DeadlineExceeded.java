package ghnotif.domain.exceptions;

import java.time.Duration;

/**
 * Represents a collection-wide operation that did not finish before its deadline.
 * This is returned alongside the partial result rather than thrown, so the caller can decide
 * whether the degraded output is usable.
 */
public class DeadlineExceeded extends RuntimeException implements ExternalException {
    private final String operation;
    private final int processed;
    private final int total;
    private final Duration timeout;

    public DeadlineExceeded(final String operation, final int processed, final int total, final Duration timeout) {
        super(operation + " exceeded the " + timeout.toMillis() + " ms deadline after processing "
                + processed + " of " + total + " records");
        this.operation = operation;
        this.processed = processed;
        this.total = total;
        this.timeout = timeout;
    }

    public String getOperation() {
        return operation;
    }

    public int getProcessed() {
        return processed;
    }

    public int getTotal() {
        return total;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
