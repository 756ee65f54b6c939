package ghnotif.domain.scoring;

import ghnotif.domain.cache.Cache;
import ghnotif.domain.cache.CacheResult;
import ghnotif.domain.concurrency.BoundedWorkerPool;
import ghnotif.domain.concurrency.PartialResult;
import ghnotif.domain.config.ScorerSettings;
import ghnotif.domain.exceptions.DeadlineExceeded;
import ghnotif.domain.model.Notification;

import java.time.Clock;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Logger;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Computes a relevance score for each notification from weighted components.
 * <p>
 * Scores are cached under the notification id and a fingerprint of the weights, so a score is computed
 * once per notification and weight set until its cache entry expires. The age component depends on the
 * time the score was computed, so a cached score reflects the age at that moment.
 */
public class Scorer {
    private static final Logger logger = Logger.getLogger(Scorer.class.getName());
    private static final String CACHE_PREFIX = "score:";

    private final ScoreFactors factors;
    private final ScorerSettings settings;
    private final Cache cache;
    private final List<ScoreComponent> components;
    private final String fingerprint;

    public Scorer(final ScoreFactors factors, final ScorerSettings settings, final Cache cache) {
        this(factors, settings, cache, Clock.systemUTC());
    }

    public Scorer(final ScoreFactors factors, final ScorerSettings settings, final Cache cache, final Clock clock) {
        this.factors = checkNotNull(factors, "factors must not be null");
        this.settings = checkNotNull(settings, "settings must not be null");
        this.cache = checkNotNull(cache, "cache must not be null");
        this.components = List.of(
                new AgeComponent(clock),
                new ActivityComponent(),
                new InvolvementComponent(settings.username()),
                new TypeComponent(),
                new ReasonComponent(),
                new RepositoryComponent());
        this.fingerprint = factors.fingerprint();
    }

    public ScoreFactors getFactors() {
        return factors;
    }

    /**
     * Scores every notification. Small collections are scored on the calling thread, large ones on a worker
     * pool. The result is keyed by notification id.
     */
    public PartialResult<Map<String, NotificationScore>> score(final List<Notification> notifications) {
        checkNotNull(notifications, "notifications must not be null");

        if (notifications.isEmpty()) {
            return PartialResult.complete(Map.of(), 0);
        }

        if (notifications.size() < settings.batchSize()) {
            return scoreSequential(notifications);
        }

        return new BoundedWorkerPool("score", settings.concurrency(), settings.batchSize())
                .process(notifications, notification -> Optional.of(Map.entry(notification.id(), scoreOne(notification))), settings.timeout())
                .map(entries -> {
                    final Map<String, NotificationScore> scores = new HashMap<>();
                    entries.forEach(entry -> scores.put(entry.getKey(), entry.getValue()));
                    return scores;
                });
    }

    private PartialResult<Map<String, NotificationScore>> scoreSequential(final List<Notification> notifications) {
        final long deadline = System.nanoTime() + settings.timeout().toNanos();
        final Map<String, NotificationScore> scores = new LinkedHashMap<>();

        for (int i = 0; i < notifications.size(); i++) {
            if (System.nanoTime() - deadline > 0) {
                return new PartialResult<>(
                        scores,
                        i,
                        notifications.size(),
                        new DeadlineExceeded("score", i, notifications.size(), settings.timeout()));
            }

            final Notification notification = notifications.get(i);
            scores.put(notification.id(), scoreOne(notification));
        }

        return PartialResult.complete(scores, notifications.size());
    }

    /**
     * Scores one notification, using the cached score if there is one.
     */
    public NotificationScore scoreOne(final Notification notification) {
        final String key = CACHE_PREFIX + notification.id() + ":" + fingerprint;

        final CacheResult<NotificationScore> cached = cache.get(key, NotificationScore.class);
        if (cached.fromCache() && cached.result() != null) {
            return cached.result();
        }

        final NotificationScore score = compute(notification);
        cache.set(key, score, settings.cacheTtl());
        return score;
    }

    private NotificationScore compute(final Notification notification) {
        final Map<String, Double> contributions = new LinkedHashMap<>();
        double sum = 0;

        for (final ScoreComponent component : components) {
            final double contribution = component.score(notification, factors);
            contributions.put(component.name(), contribution);
            sum += contribution;
        }

        final NotificationScore score = new NotificationScore(NotificationScore.toTotal(sum), contributions, factors);
        logger.finest("Scored " + notification.id() + " at " + score.total());
        return score;
    }
}
