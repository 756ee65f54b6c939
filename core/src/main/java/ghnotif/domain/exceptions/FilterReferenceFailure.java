package ghnotif.domain.exceptions;

/**
 * Represents a named filter that could not be resolved, either because it does not exist or because
 * resolving it leads back to itself.
 */
public class FilterReferenceFailure extends RuntimeException implements InternalException {
    private final String name;

    public FilterReferenceFailure(final String name, final String message) {
        super(message);
        this.name = name;
    }

    public FilterReferenceFailure(final String name, final String message, final Throwable cause) {
        super(message, cause);
        this.name = name;
    }

    public String getName() {
        return name;
    }
}
