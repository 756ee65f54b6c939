package ghnotif.domain.testing;

import ghnotif.domain.model.Notification;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Builds notifications for tests.
 */
public final class NotificationFixtures {
    public static final Instant NOW = Instant.parse("2024-06-01T12:00:00Z");

    private static final String[] REPOSITORIES = {"octo/alpha", "octo/beta", "acme/widgets", "acme/gadgets", "solo"};
    private static final String[] TYPES = {"PullRequest", "Issue", "Discussion", "Release", "Commit"};
    private static final String[] REASONS = {"assign", "author", "comment", "mention", "review_requested", "subscribed"};

    private NotificationFixtures() {
    }

    public static Notification notification(final String id, final String repository, final String type, final boolean unread) {
        return new Notification(id, repository, ownerOf(repository), type, "Title " + id, "subscribed", unread, NOW);
    }

    public static Notification notification(
            final String id,
            final String repository,
            final String type,
            final String title,
            final String reason,
            final boolean unread,
            final Instant updatedAt) {
        return new Notification(id, repository, ownerOf(repository), type, title, reason, unread, updatedAt);
    }

    /**
     * A deterministic mix of repositories, types, reasons, read states and ages, with many ties.
     */
    public static List<Notification> mixed(final int count) {
        final List<Notification> notifications = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            notifications.add(new Notification(
                    "n" + i,
                    REPOSITORIES[i % REPOSITORIES.length],
                    ownerOf(REPOSITORIES[i % REPOSITORIES.length]),
                    TYPES[(i / 3) % TYPES.length],
                    "Title " + (i % 17),
                    REASONS[(i / 7) % REASONS.length],
                    i % 4 != 0,
                    i % 11 == 0 ? null : NOW.minus(Duration.ofHours(i % 50))));
        }
        return notifications;
    }

    private static String ownerOf(final String repository) {
        final int slash = repository.indexOf('/');
        return slash < 0 ? "" : repository.substring(0, slash);
    }
}
