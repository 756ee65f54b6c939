package ghnotif.domain.filter;

import ghnotif.domain.model.Notification;
import ghnotif.domain.scoring.NotificationScore;
import ghnotif.domain.scoring.Scorer;
import io.vavr.control.Try;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Logger;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Matches notifications whose score total lies in [min, max]. A bound of 0 leaves that side open.
 * Scores are computed on demand, unless they were handed over with {@link #setScores(Map)}.
 * A notification that cannot be scored does not match.
 */
public class ScoreRangeFilter implements Filter {
    private static final Logger logger = Logger.getLogger(ScoreRangeFilter.class.getName());

    private final int min;
    private final int max;
    private final Scorer scorer;
    private final Map<String, Integer> totals = new ConcurrentHashMap<>();

    public ScoreRangeFilter(final int min, final int max, final Scorer scorer) {
        this.min = min;
        this.max = max;
        this.scorer = checkNotNull(scorer, "scorer must not be null");
    }

    public int getMin() {
        return min;
    }

    public int getMax() {
        return max;
    }

    /**
     * Reuses scores that were already computed for the collection being filtered.
     */
    public void setScores(final Map<String, NotificationScore> scores) {
        scores.forEach((id, score) -> totals.put(id, score.total()));
    }

    @Override
    public boolean apply(final Notification notification) {
        return Try.of(() -> totals.computeIfAbsent(notification.id(), id -> scorer.scoreOne(notification).total()))
                .onFailure(ex -> logger.fine("Failed to score " + notification.id() + ": " + ex.getMessage()))
                .map(total -> (min == 0 || total >= min) && (max == 0 || total <= max))
                .getOrElse(false);
    }

    @Override
    public String describe() {
        if (min != 0 && min == max) {
            return "score:" + min;
        }

        return "score:[" + (min == 0 ? "" : min) + ".." + (max == 0 ? "" : max) + "]";
    }
}
