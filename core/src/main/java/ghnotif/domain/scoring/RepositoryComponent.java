package ghnotif.domain.scoring;

import ghnotif.domain.model.Notification;

/**
 * Uses the custom weight configured for the repository, or the neutral sub-score.
 */
public class RepositoryComponent implements ScoreComponent {
    @Override
    public String name() {
        return "repository";
    }

    @Override
    public double score(final Notification notification, final ScoreFactors factors) {
        return factors.repositoryWeight(notification.getRepository()).orElse(NEUTRAL)
                * factors.weight(ScoreFactor.REPO_WEIGHT);
    }
}
