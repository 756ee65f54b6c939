package ghnotif.domain.exceptionhandling;

/**
 * Renders exceptions for log messages.
 */
public interface ExceptionHandler {
    String getExceptionMessage(Throwable e);
}
