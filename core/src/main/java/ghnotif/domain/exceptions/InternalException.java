package ghnotif.domain.exceptions;

/**
 * Marker interface for internal exceptions. Usually this means a malformed query, a bad setting or an invalid input.
 * These exceptions can not be resolved by retrying.
 */
public interface InternalException {
}
