package ghnotif.domain.scoring;

import ghnotif.domain.model.Notification;
import org.jspecify.annotations.Nullable;

/**
 * Detecting whether the current user authored, was assigned to, was mentioned in or reviewed the subject
 * needs data the notification record does not carry, so every notification gets the neutral sub-score.
 */
public class InvolvementComponent implements ScoreComponent {
    @Nullable
    private final String username;

    public InvolvementComponent(@Nullable final String username) {
        this.username = username;
    }

    @Nullable
    public String getUsername() {
        return username;
    }

    @Override
    public String name() {
        return "involvement";
    }

    @Override
    public double score(final Notification notification, final ScoreFactors factors) {
        return NEUTRAL * factors.weight(ScoreFactor.INVOLVEMENT_WEIGHT);
    }
}
