package ghnotif.domain.exceptions;

import org.jspecify.annotations.Nullable;

/**
 * Represents a malformed filter expression. The fragment is the token or pattern that could not be parsed.
 */
public class FilterParseFailure extends RuntimeException implements InternalException {
    @Nullable
    private final String fragment;

    public FilterParseFailure(final String message) {
        super(message);
        this.fragment = null;
    }

    public FilterParseFailure(final String message, @Nullable final String fragment) {
        super(fragment == null ? message : message + ": " + fragment);
        this.fragment = fragment;
    }

    public FilterParseFailure(final String message, @Nullable final String fragment, final Throwable cause) {
        super(fragment == null ? message : message + ": " + fragment, cause);
        this.fragment = fragment;
    }

    @Nullable
    public String getFragment() {
        return fragment;
    }
}
