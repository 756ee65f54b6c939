package ghnotif.domain.exceptions;

/**
 * Represents a failure to convert JSON back into an object.
 */
public class DeserializationFailed extends RuntimeException implements InternalException {
    public DeserializationFailed() {
        super();
    }

    public DeserializationFailed(final String message) {
        super(message);
    }

    public DeserializationFailed(final String message, final Throwable cause) {
        super(message, cause);
    }

    public DeserializationFailed(final Throwable cause) {
        super(cause);
    }
}
