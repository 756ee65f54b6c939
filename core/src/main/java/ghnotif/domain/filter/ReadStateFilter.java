package ghnotif.domain.filter;

import ghnotif.domain.model.Notification;

import java.util.BitSet;

/**
 * Matches unread notifications when {@code unread} is true, and read notifications otherwise.
 */
public record ReadStateFilter(boolean unread) implements IndexedFilter {
    @Override
    public boolean apply(final Notification notification) {
        return notification.unread() == unread;
    }

    @Override
    public BitSet candidates(final NotificationIndex index) {
        return index.byReadState(unread);
    }

    @Override
    public String describe() {
        return unread ? "is:unread" : "is:read";
    }
}
