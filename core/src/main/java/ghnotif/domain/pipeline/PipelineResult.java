package ghnotif.domain.pipeline;

import ghnotif.domain.exceptions.DeadlineExceeded;
import ghnotif.domain.model.Notification;
import ghnotif.domain.scoring.NotificationScore;

import java.util.List;
import java.util.Map;

/**
 * The output of one pipeline run.
 *
 * @param notifications The matching notifications, in sorted order
 * @param scores        The score of every input notification that was scored before the deadline
 * @param failures      The stages that ran out of time. Empty when the result is complete.
 * @param cacheKey      The key the matching ids were written under
 */
public record PipelineResult(
        List<Notification> notifications,
        Map<String, NotificationScore> scores,
        List<DeadlineExceeded> failures,
        String cacheKey) {

    public PipelineResult {
        notifications = List.copyOf(notifications);
        scores = Map.copyOf(scores);
        failures = List.copyOf(failures);
    }

    public boolean isComplete() {
        return failures.isEmpty();
    }
}
