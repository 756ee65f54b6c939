package ghnotif.domain.exceptions;

/**
 * Represents an invalid setting, such as a non-numeric weight or a non-positive concurrency.
 * Raised when the settings are read, never when they are first used.
 */
public class ConfigurationFailure extends RuntimeException implements InternalException {
    public ConfigurationFailure() {
        super();
    }

    public ConfigurationFailure(final String message) {
        super(message);
    }

    public ConfigurationFailure(final String message, final Throwable cause) {
        super(message, cause);
    }

    public ConfigurationFailure(final Throwable cause) {
        super(cause);
    }
}
