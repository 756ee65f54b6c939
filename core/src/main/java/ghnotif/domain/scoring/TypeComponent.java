package ghnotif.domain.scoring;

import ghnotif.domain.model.Notification;

public class TypeComponent implements ScoreComponent {
    @Override
    public String name() {
        return "type";
    }

    @Override
    public double score(final Notification notification, final ScoreFactors factors) {
        final double typeScore = switch (notification.getSubjectTypeKind()) {
            case PULL_REQUEST -> factors.weight(ScoreFactor.PR_WEIGHT);
            case ISSUE -> factors.weight(ScoreFactor.ISSUE_WEIGHT);
            case DISCUSSION -> factors.weight(ScoreFactor.DISCUSSION_WEIGHT);
            case RELEASE -> factors.weight(ScoreFactor.RELEASE_WEIGHT);
            case COMMIT -> factors.weight(ScoreFactor.COMMIT_WEIGHT);
            case OTHER -> NEUTRAL;
        };

        return typeScore * factors.weight(ScoreFactor.TYPE_WEIGHT);
    }
}
