package ghnotif.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import org.apache.commons.lang3.StringUtils;
import org.jspecify.annotations.Nullable;

import java.time.Instant;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A notification fetched from the issue tracker. The id is stable for the lifetime of the record and is used
 * as the cache and score key. Every other field may be missing, in which case the string accessors used by
 * filters and sorters return an empty string.
 *
 * @param id                 The unique notification id
 * @param repositoryFullName The repository in "owner/name" form
 * @param ownerLogin         The login of the repository owner
 * @param subjectType        The raw subject type, e.g. "PullRequest"
 * @param subjectTitle       The subject title
 * @param reason             The raw reason, e.g. "review_requested"
 * @param unread             true if the notification has not been read
 * @param updatedAt          When the notification was last updated
 */
public record Notification(
        String id,
        @Nullable String repositoryFullName,
        @Nullable String ownerLogin,
        @Nullable String subjectType,
        @Nullable String subjectTitle,
        @Nullable String reason,
        boolean unread,
        @Nullable Instant updatedAt) {

    public Notification {
        checkNotNull(id, "id must not be null");
    }

    @JsonIgnore
    public String getRepository() {
        return StringUtils.defaultString(repositoryFullName);
    }

    /**
     * The organization is the part of the repository name before the slash, or empty if the name has no slash.
     */
    @JsonIgnore
    public String getOrganization() {
        final String repository = getRepository();
        final int slash = repository.indexOf('/');
        return slash < 0 ? "" : repository.substring(0, slash);
    }

    @JsonIgnore
    public String getType() {
        return StringUtils.defaultString(subjectType);
    }

    @JsonIgnore
    public String getTitle() {
        return StringUtils.defaultString(subjectTitle);
    }

    @JsonIgnore
    public String getReasonName() {
        return StringUtils.defaultString(reason);
    }

    @JsonIgnore
    public SubjectType getSubjectTypeKind() {
        return SubjectType.fromApiName(subjectType);
    }

    @JsonIgnore
    public NotificationReason getReasonKind() {
        return NotificationReason.fromApiName(reason);
    }
}
