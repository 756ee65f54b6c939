package ghnotif.domain.filter;

import ghnotif.domain.model.Notification;

/**
 * A predicate over a notification. Implementations are total: a missing field makes the predicate
 * return false, it never throws.
 */
public interface Filter {
    boolean apply(Notification notification);

    /**
     * A human-readable rendering of the filter, used in logs and error messages.
     */
    String describe();
}
