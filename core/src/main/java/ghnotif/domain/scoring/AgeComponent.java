package ghnotif.domain.scoring;

import ghnotif.domain.model.Notification;

import java.time.Clock;
import java.time.Duration;

/**
 * Newer notifications score higher: exp(-decay * ageHours / 24), with the age capped at the maximum age.
 * Notifications without a timestamp are treated as being the maximum age.
 */
public class AgeComponent implements ScoreComponent {
    private static final double MILLIS_PER_HOUR = Duration.ofHours(1).toMillis();

    private final Clock clock;

    public AgeComponent(final Clock clock) {
        this.clock = clock;
    }

    @Override
    public String name() {
        return "age";
    }

    @Override
    public double score(final Notification notification, final ScoreFactors factors) {
        final double maxAge = factors.weight(ScoreFactor.MAX_AGE);
        final double ageHours = notification.updatedAt() == null
                ? maxAge
                : Math.max(0, Math.min(maxAge, Duration.between(notification.updatedAt(), clock.instant()).toMillis() / MILLIS_PER_HOUR));

        return Math.exp(-factors.weight(ScoreFactor.AGE_DECAY) * ageHours / 24) * factors.weight(ScoreFactor.AGE_WEIGHT);
    }
}
