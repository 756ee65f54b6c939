package ghnotif.domain.exceptionhandling;

import ghnotif.domain.exceptions.ExternalException;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.exception.ExceptionUtils;
import org.eclipse.microprofile.config.inject.ConfigProperty;

/**
 * Returns the message of an exception, or the full stack trace for external (possibly transient) failures.
 * Can be constructed directly by classes that are not managed by CDI, in which case stack traces are
 * only printed for external failures.
 */
@ApplicationScoped
public class LoggingExceptionHandler implements ExceptionHandler {

    @Inject
    @ConfigProperty(name = "ghnotif.exceptions.printstacktrace", defaultValue = "false")
    private String printStackTrace;

    @Override
    public String getExceptionMessage(final Throwable e) {
        if (e == null) {
            return "Exception was null";
        }

        if (Boolean.parseBoolean(printStackTrace) || e instanceof ExternalException) {
            return ExceptionUtils.getStackTrace(e);
        }

        if (StringUtils.isBlank(e.getMessage())) {
            return e.toString();
        }

        return e.getMessage();
    }
}
