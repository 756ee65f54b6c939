package ghnotif.domain.scoring;

import ghnotif.domain.model.Notification;

public class ReasonComponent implements ScoreComponent {
    @Override
    public String name() {
        return "reason";
    }

    @Override
    public double score(final Notification notification, final ScoreFactors factors) {
        final double reasonScore = switch (notification.getReasonKind()) {
            case ASSIGN -> factors.weight(ScoreFactor.ASSIGN_REASON_WEIGHT);
            case AUTHOR -> factors.weight(ScoreFactor.AUTHOR_REASON_WEIGHT);
            case COMMENT -> factors.weight(ScoreFactor.COMMENT_REASON_WEIGHT);
            case MENTION -> factors.weight(ScoreFactor.MENTION_REASON_WEIGHT);
            case REVIEW_REQUESTED -> factors.weight(ScoreFactor.REVIEW_REASON_WEIGHT);
            case STATE_CHANGE -> factors.weight(ScoreFactor.STATE_CHANGE_REASON_WEIGHT);
            case SUBSCRIBED -> factors.weight(ScoreFactor.SUBSCRIBED_REASON_WEIGHT);
            case TEAM_MENTION -> factors.weight(ScoreFactor.TEAM_MENTION_REASON_WEIGHT);
            case OTHER -> NEUTRAL;
        };

        return reasonScore * factors.weight(ScoreFactor.REASON_WEIGHT);
    }
}
