package ghnotif.domain.scoring;

import ghnotif.domain.cache.MemoryCache;
import ghnotif.domain.cache.NullCache;
import ghnotif.domain.concurrency.PartialResult;
import ghnotif.domain.config.ScorerSettings;
import ghnotif.domain.model.Notification;
import ghnotif.domain.testing.MutableClock;
import ghnotif.domain.testing.NotificationFixtures;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

public class ScorerTest {
    private static final double DELTA = 1e-9;

    private final MutableClock clock = new MutableClock(NotificationFixtures.NOW);

    @Test
    public void testDefaultWeights() {
        final Scorer scorer = new Scorer(ScoreFactors.defaults(), ScorerSettings.defaults(), new NullCache(), clock);
        final Notification notification = NotificationFixtures.notification(
                "1", "octo/alpha", "PullRequest", "Fix", "review_requested", true, NotificationFixtures.NOW);

        final NotificationScore score = scorer.scoreOne(notification);

        Assertions.assertEquals(0.3, score.components().get("age"), DELTA);
        Assertions.assertEquals(0.1, score.components().get("activity"), DELTA);
        Assertions.assertEquals(0.15, score.components().get("involvement"), DELTA);
        Assertions.assertEquals(0.08, score.components().get("type"), DELTA);
        Assertions.assertEquals(0.08, score.components().get("reason"), DELTA);
        Assertions.assertEquals(0.05, score.components().get("repository"), DELTA);
        // 0.76 in floating point may land either side of the integer
        Assertions.assertTrue(Math.abs(score.total() - 76) <= 1, "total was " + score.total());
    }

    @Test
    public void testAgeDecays() {
        final Scorer scorer = new Scorer(ScoreFactors.defaults(), ScorerSettings.defaults(), new NullCache(), clock);

        final double fresh = scorer.scoreOne(aged("1", Duration.ZERO)).components().get("age");
        final double dayOld = scorer.scoreOne(aged("2", Duration.ofHours(24))).components().get("age");
        final double ancient = scorer.scoreOne(aged("3", Duration.ofDays(365))).components().get("age");
        final double undated = scorer.scoreOne(new Notification("4", "octo/alpha", "octo", "Issue", "t", "mention", true, null))
                .components().get("age");

        Assertions.assertEquals(0.3 * Math.exp(-0.1), dayOld, DELTA);
        Assertions.assertTrue(fresh > dayOld);
        // the age is capped at max_age hours, and a missing timestamp counts as that age
        Assertions.assertEquals(0.3 * Math.exp(-0.1 * 168 / 24), ancient, DELTA);
        Assertions.assertEquals(ancient, undated, DELTA);
    }

    @Test
    public void testFutureTimestampsCountAsNew() {
        final Scorer scorer = new Scorer(ScoreFactors.defaults(), ScorerSettings.defaults(), new NullCache(), clock);
        final double future = scorer.scoreOne(aged("1", Duration.ofHours(-5))).components().get("age");
        Assertions.assertEquals(0.3, future, DELTA);
    }

    @Test
    public void testUnknownTypesAndReasonsAreNeutral() {
        final Scorer scorer = new Scorer(ScoreFactors.defaults(), ScorerSettings.defaults(), new NullCache(), clock);
        final NotificationScore score = scorer.scoreOne(NotificationFixtures.notification(
                "1", "octo/alpha", "CheckSuite", "t", "ci_activity", true, NotificationFixtures.NOW));

        Assertions.assertEquals(0.05, score.components().get("type"), DELTA);
        Assertions.assertEquals(0.05, score.components().get("reason"), DELTA);
    }

    @Test
    public void testCustomRepositoryWeight() {
        final ScoreFactors factors = ScoreFactors.defaults().withRepositoryWeight("octo/alpha", 1.0);
        final Scorer scorer = new Scorer(factors, ScorerSettings.defaults(), new NullCache(), clock);

        Assertions.assertEquals(0.1,
                scorer.scoreOne(NotificationFixtures.notification("1", "octo/alpha", "Issue", true)).components().get("repository"),
                DELTA);
        Assertions.assertEquals(0.05,
                scorer.scoreOne(NotificationFixtures.notification("2", "octo/beta", "Issue", true)).components().get("repository"),
                DELTA);
    }

    @Test
    public void testTotalsAreClamped() {
        final ScoreFactors huge = scaled(10);
        final ScoreFactors negative = scaled(-10);
        final Notification notification = NotificationFixtures.notification("1", "octo/alpha", "PullRequest", true);

        Assertions.assertEquals(NotificationScore.MAX,
                new Scorer(huge, ScorerSettings.defaults(), new NullCache(), clock).scoreOne(notification).total());
        Assertions.assertEquals(NotificationScore.MIN,
                new Scorer(negative, ScorerSettings.defaults(), new NullCache(), clock).scoreOne(notification).total());
    }

    @Test
    public void testTotalsStayInRange() {
        final Scorer scorer = new Scorer(ScoreFactors.defaults(), ScorerSettings.defaults(), new NullCache(), clock);
        scorer.score(NotificationFixtures.mixed(200)).getOrThrow().values().forEach(score -> {
            Assertions.assertTrue(score.total() >= NotificationScore.MIN);
            Assertions.assertTrue(score.total() <= NotificationScore.MAX);
        });
    }

    @Test
    public void testScoresAreCached() {
        final MemoryCache cache = new MemoryCache(clock);
        final Scorer scorer = new Scorer(ScoreFactors.defaults(), ScorerSettings.defaults(), cache, clock);
        final Notification notification = aged("1", Duration.ofHours(1));

        final NotificationScore first = scorer.scoreOne(notification);
        clock.advance(Duration.ofMinutes(1));
        final NotificationScore second = scorer.scoreOne(notification);

        Assertions.assertSame(first, second);
        Assertions.assertEquals(1, cache.metrics().hits());
        Assertions.assertEquals(1, cache.metrics().sets());
    }

    @Test
    public void testCachedScoresExpire() {
        final MemoryCache cache = new MemoryCache(clock);
        final Scorer scorer = new Scorer(ScoreFactors.defaults(), ScorerSettings.defaults(), cache, clock);
        final Notification notification = aged("1", Duration.ofHours(1));

        final NotificationScore first = scorer.scoreOne(notification);
        clock.advance(ScorerSettings.DEFAULT_CACHE_TTL.plusDays(2));
        final NotificationScore second = scorer.scoreOne(notification);

        Assertions.assertNotSame(first, second);
        Assertions.assertTrue(second.components().get("age") < first.components().get("age"));
    }

    @Test
    public void testChangingAWeightBypassesTheCache() {
        final MemoryCache cache = new MemoryCache(clock);
        final Notification notification = aged("1", Duration.ofHours(1));

        final NotificationScore before = new Scorer(ScoreFactors.defaults(), ScorerSettings.defaults(), cache, clock)
                .scoreOne(notification);
        final NotificationScore after = new Scorer(
                ScoreFactors.defaults().with(ScoreFactor.TYPE_WEIGHT, 0.5), ScorerSettings.defaults(), cache, clock)
                .scoreOne(notification);

        Assertions.assertNotEquals(before.components().get("type"), after.components().get("type"));
    }

    @Test
    public void testConcurrentScoringMatchesSequentialScoring() {
        final List<Notification> notifications = NotificationFixtures.mixed(500);

        final PartialResult<Map<String, NotificationScore>> sequential =
                new Scorer(ScoreFactors.defaults(), ScorerSettings.defaults().withBatchSize(1000), new NullCache(), clock)
                        .score(notifications);
        final PartialResult<Map<String, NotificationScore>> concurrent =
                new Scorer(ScoreFactors.defaults(), ScorerSettings.defaults().withBatchSize(10), new NullCache(), clock)
                        .score(notifications);

        Assertions.assertTrue(sequential.isComplete());
        Assertions.assertTrue(concurrent.isComplete());
        Assertions.assertEquals(500, concurrent.value().size());
        Assertions.assertEquals(sequential.value(), concurrent.value());
    }

    @Test
    public void testEmptyInput() {
        final Scorer scorer = new Scorer(ScoreFactors.defaults(), ScorerSettings.defaults(), new NullCache(), clock);
        final PartialResult<Map<String, NotificationScore>> result = scorer.score(List.of());

        Assertions.assertTrue(result.isComplete());
        Assertions.assertTrue(result.value().isEmpty());
    }

    private static Notification aged(final String id, final Duration age) {
        return NotificationFixtures.notification(
                id, "octo/alpha", "Issue", "t", "mention", true, NotificationFixtures.NOW.minus(age));
    }

    private static ScoreFactors scaled(final double value) {
        ScoreFactors factors = ScoreFactors.defaults();
        for (final ScoreFactor factor : Arrays.stream(ScoreFactor.values()).filter(f -> f != ScoreFactor.MAX_AGE).toList()) {
            factors = factors.with(factor, value);
        }
        return factors;
    }
}
