package ghnotif.domain.sort;

import ghnotif.domain.model.Notification;

import java.time.Instant;
import java.util.Comparator;

/**
 * The fields notifications can be ordered by, each with its ascending order.
 */
public enum SortField {
    REPOSITORY(Comparator.comparing(Notification::getRepository)),
    TYPE(Comparator.comparing(Notification::getType)),
    TITLE(Comparator.comparing(Notification::getTitle)),
    /**
     * Oldest first. Notifications without a timestamp come before all others.
     */
    TIME(Comparator.comparing(Notification::updatedAt, Comparator.<Instant>nullsFirst(Comparator.naturalOrder()))),
    /**
     * Read notifications first, then unread ones.
     */
    STATUS(Comparator.comparing(Notification::unread)),
    REASON(Comparator.comparing(Notification::getReasonName));

    private final Comparator<Notification> ascending;

    SortField(final Comparator<Notification> ascending) {
        this.ascending = ascending;
    }

    public Comparator<Notification> comparator(final SortDirection direction) {
        return direction == SortDirection.DESCENDING ? ascending.reversed() : ascending;
    }
}
