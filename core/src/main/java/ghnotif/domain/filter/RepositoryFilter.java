package ghnotif.domain.filter;

import ghnotif.domain.model.Notification;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Matches notifications whose "owner/name" repository matches a glob pattern.
 */
public record RepositoryFilter(GlobPattern pattern) implements Filter {
    public RepositoryFilter {
        checkNotNull(pattern, "pattern must not be null");
    }

    @Override
    public boolean apply(final Notification notification) {
        return pattern.matches(notification.getRepository());
    }

    @Override
    public String describe() {
        return "repo:" + pattern.glob();
    }
}
