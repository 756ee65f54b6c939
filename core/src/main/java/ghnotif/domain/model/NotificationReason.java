package ghnotif.domain.model;

import org.jspecify.annotations.Nullable;

import java.util.Arrays;

/**
 * Why the user received a notification.
 */
public enum NotificationReason {
    ASSIGN("assign"),
    AUTHOR("author"),
    COMMENT("comment"),
    MENTION("mention"),
    REVIEW_REQUESTED("review_requested"),
    STATE_CHANGE("state_change"),
    SUBSCRIBED("subscribed"),
    TEAM_MENTION("team_mention"),
    OTHER("");

    private final String apiName;

    NotificationReason(final String apiName) {
        this.apiName = apiName;
    }

    public String getApiName() {
        return apiName;
    }

    public static NotificationReason fromApiName(@Nullable final String apiName) {
        return Arrays.stream(values())
                .filter(reason -> reason != OTHER)
                .filter(reason -> reason.apiName.equals(apiName))
                .findFirst()
                .orElse(OTHER);
    }
}
