package ghnotif.domain.exceptions;

/**
 * Marker interface for external exceptions. These exceptions might be transient and may be resolved by retrying,
 * for example with a longer deadline or on a less loaded machine.
 */
public interface ExternalException {
}
