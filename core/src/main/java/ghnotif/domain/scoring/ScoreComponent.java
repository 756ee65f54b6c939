package ghnotif.domain.scoring;

import ghnotif.domain.model.Notification;

/**
 * One term of the score. Implementations return the weighted contribution, a sub-score in [0, 1]
 * multiplied by its configured weight.
 */
public interface ScoreComponent {
    /**
     * Sub-score used for unknown types and reasons, and by the components that have no data source yet.
     */
    double NEUTRAL = 0.5;

    String name();

    double score(Notification notification, ScoreFactors factors);
}
