package ghnotif.domain.scoring;

import java.util.Arrays;
import java.util.Optional;

/**
 * Every configurable weight of the scorer, with its configuration key and default value.
 */
public enum ScoreFactor {
    AGE_WEIGHT("age_weight", 0.3),
    AGE_DECAY("age_decay", 0.1),
    MAX_AGE("max_age", 168),

    ACTIVITY_WEIGHT("activity_weight", 0.2),
    COMMENT_WEIGHT("comment_weight", 0.6),
    REACTION_WEIGHT("reaction_weight", 0.4),

    INVOLVEMENT_WEIGHT("involvement_weight", 0.3),
    AUTHOR_WEIGHT("author_weight", 0.8),
    ASSIGNEE_WEIGHT("assignee_weight", 0.9),
    MENTION_WEIGHT("mention_weight", 0.7),
    REVIEW_WEIGHT("review_weight", 0.6),

    TYPE_WEIGHT("type_weight", 0.1),
    PR_WEIGHT("pr_weight", 0.8),
    ISSUE_WEIGHT("issue_weight", 0.7),
    DISCUSSION_WEIGHT("discussion_weight", 0.6),
    RELEASE_WEIGHT("release_weight", 0.5),
    COMMIT_WEIGHT("commit_weight", 0.4),

    REASON_WEIGHT("reason_weight", 0.1),
    ASSIGN_REASON_WEIGHT("assign_reason_weight", 0.9),
    AUTHOR_REASON_WEIGHT("author_reason_weight", 0.8),
    COMMENT_REASON_WEIGHT("comment_reason_weight", 0.7),
    MENTION_REASON_WEIGHT("mention_reason_weight", 0.8),
    REVIEW_REASON_WEIGHT("review_reason_weight", 0.8),
    STATE_CHANGE_REASON_WEIGHT("state_change_reason_weight", 0.6),
    SUBSCRIBED_REASON_WEIGHT("subscribed_reason_weight", 0.5),
    TEAM_MENTION_REASON_WEIGHT("team_mention_reason_weight", 0.7),

    REPO_WEIGHT("repo_weight", 0.1);

    private final String key;
    private final double defaultValue;

    ScoreFactor(final String key, final double defaultValue) {
        this.key = key;
        this.defaultValue = defaultValue;
    }

    public String getKey() {
        return key;
    }

    public double getDefaultValue() {
        return defaultValue;
    }

    public static Optional<ScoreFactor> fromKey(final String key) {
        return Arrays.stream(values())
                .filter(factor -> factor.key.equalsIgnoreCase(key))
                .findFirst();
    }
}
