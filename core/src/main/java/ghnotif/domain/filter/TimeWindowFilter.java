package ghnotif.domain.filter;

import ghnotif.domain.model.Notification;
import org.jspecify.annotations.Nullable;

import java.time.Instant;

/**
 * Matches notifications updated in the half-open window [since, before). A null bound is open.
 * Notifications without a timestamp never match.
 */
public record TimeWindowFilter(@Nullable Instant since, @Nullable Instant before) implements Filter {
    @Override
    public boolean apply(final Notification notification) {
        final Instant updatedAt = notification.updatedAt();
        if (updatedAt == null) {
            return false;
        }

        if (since != null && updatedAt.isBefore(since)) {
            return false;
        }

        return before == null || updatedAt.isBefore(before);
    }

    @Override
    public String describe() {
        return "updated:[" + (since == null ? "" : since) + ", " + (before == null ? "" : before) + ")";
    }
}
