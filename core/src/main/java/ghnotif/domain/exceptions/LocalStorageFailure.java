package ghnotif.domain.exceptions;

/**
 * Represents a failure that occurred with a cache backend. Thrown when the backing storage can not be opened,
 * and used internally to tag failed reads and writes before they are absorbed into the cache metrics.
 */
public class LocalStorageFailure extends RuntimeException implements InternalException {
    public LocalStorageFailure() {
        super();
    }

    public LocalStorageFailure(final String message) {
        super(message);
    }

    public LocalStorageFailure(final String message, final Throwable cause) {
        super(message, cause);
    }

    public LocalStorageFailure(final Throwable cause) {
        super(cause);
    }
}
