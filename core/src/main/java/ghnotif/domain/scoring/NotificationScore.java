package ghnotif.domain.scoring;

import java.util.Map;

/**
 * The relevance of one notification. The total is a ranking signal between 0 and 100, not a probability.
 *
 * @param total      The clamped, truncated sum of the components times 100
 * @param components The weighted contribution of each component, keyed by component name
 * @param factors    The weights the score was computed with
 */
public record NotificationScore(int total, Map<String, Double> components, ScoreFactors factors) {
    public static final int MIN = 0;
    public static final int MAX = 100;

    public NotificationScore {
        components = Map.copyOf(components);
    }

    public static int toTotal(final double sum) {
        return (int) Math.min(MAX, Math.max(MIN, sum * 100));
    }
}
