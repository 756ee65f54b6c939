package ghnotif.domain.filter;

import ghnotif.domain.model.Notification;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Matches notifications whose organization, the part of the repository name before the slash,
 * matches a glob pattern. Repositories without an owner part never match.
 */
public record OrganizationFilter(GlobPattern pattern) implements Filter {
    public OrganizationFilter {
        checkNotNull(pattern, "pattern must not be null");
    }

    @Override
    public boolean apply(final Notification notification) {
        if (!notification.getRepository().contains("/")) {
            return false;
        }

        return pattern.matches(notification.getOrganization());
    }

    @Override
    public String describe() {
        return "org:" + pattern.glob();
    }
}
