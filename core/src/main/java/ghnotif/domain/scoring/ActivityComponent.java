package ghnotif.domain.scoring;

import ghnotif.domain.model.Notification;

/**
 * Comment and reaction counts are not part of the notification record yet, so every notification gets the
 * neutral sub-score. The comment and reaction weights are reserved for when they are.
 */
public class ActivityComponent implements ScoreComponent {
    @Override
    public String name() {
        return "activity";
    }

    @Override
    public double score(final Notification notification, final ScoreFactors factors) {
        return NEUTRAL * factors.weight(ScoreFactor.ACTIVITY_WEIGHT);
    }
}
