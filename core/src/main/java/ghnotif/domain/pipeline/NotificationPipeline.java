package ghnotif.domain.pipeline;

import ghnotif.domain.cache.Cache;
import ghnotif.domain.concurrency.PartialResult;
import ghnotif.domain.config.CacheSettings;
import ghnotif.domain.config.FilterEngineSettings;
import ghnotif.domain.config.ScorerSettings;
import ghnotif.domain.config.SorterSettings;
import ghnotif.domain.exceptionhandling.ExceptionHandler;
import ghnotif.domain.exceptions.DeadlineExceeded;
import ghnotif.domain.filter.AndFilter;
import ghnotif.domain.filter.Filter;
import ghnotif.domain.filter.FilterEngine;
import ghnotif.domain.filter.NotFilter;
import ghnotif.domain.filter.OrFilter;
import ghnotif.domain.filter.ScoreRangeFilter;
import ghnotif.domain.filter.parser.FilterParser;
import ghnotif.domain.filter.store.NamedFilterStore;
import ghnotif.domain.logger.TimedOperation;
import ghnotif.domain.model.Notification;
import ghnotif.domain.scoring.NotificationScore;
import ghnotif.domain.scoring.ScoreFactors;
import ghnotif.domain.scoring.Scorer;
import ghnotif.domain.sort.SortCriterion;
import ghnotif.domain.sort.Sorter;
import ghnotif.domain.source.NotificationSource;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.apache.commons.codec.digest.DigestUtils;
import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Logger;
import java.util.stream.Collectors;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Scores, filters and sorts a collection of notifications, then writes the ids of the result through the cache.
 * <p>
 * Scoring runs first so that score filters reuse the computed scores instead of scoring a second time.
 * A stage that runs out of time passes its partial output on to the next stage, and its deadline failure
 * is reported in the result.
 */
@ApplicationScoped
public class NotificationPipeline {
    private static final String RESULT_PREFIX = "result:";

    @Inject
    private FilterEngineSettings filterEngineSettings;

    @Inject
    private ScorerSettings scorerSettings;

    @Inject
    private ScoreFactors scoreFactors;

    @Inject
    private SorterSettings sorterSettings;

    @Inject
    private CacheSettings cacheSettings;

    @Inject
    private Cache cache;

    @Inject
    private NamedFilterStore filterStore;

    @Inject
    private ExceptionHandler exceptionHandler;

    @Inject
    private Logger logger;

    private Scorer scorer;

    @PostConstruct
    private void init() {
        scorer = new Scorer(scoreFactors, scorerSettings, cache);
    }

    public Scorer getScorer() {
        return scorer;
    }

    public PipelineResult process(final NotificationSource source, final String query, final List<SortCriterion> criteria) {
        checkNotNull(source, "source must not be null");

        final List<Notification> notifications;
        try (TimedOperation ignored = new TimedOperation("fetch notifications")) {
            notifications = source.fetch();
        }

        return process(notifications, query, criteria);
    }

    /**
     * @param notifications The notifications to process
     * @param query         The filter expression. Blank matches everything.
     * @param criteria      The sort criteria. Empty uses {@code ghnotif.sort.criteria}.
     * @throws ghnotif.domain.exceptions.FilterParseFailure     if the query is malformed
     * @throws ghnotif.domain.exceptions.FilterReferenceFailure if the query references an unknown filter
     */
    public PipelineResult process(final List<Notification> notifications, final String query, final List<SortCriterion> criteria) {
        checkNotNull(notifications, "notifications must not be null");
        checkNotNull(criteria, "criteria must not be null");

        final List<DeadlineExceeded> failures = new ArrayList<>();
        final List<SortCriterion> sortCriteria = criteria.isEmpty() ? sorterSettings.criteria() : criteria;

        final Filter filter = new FilterParser(filterStore, scorer).parse(query);
        logger.fine("Processing " + notifications.size() + " notifications with " + filter.describe());

        final PartialResult<Map<String, NotificationScore>> scores;
        try (TimedOperation ignored = new TimedOperation("score notifications")) {
            scores = scorer.score(notifications);
        }
        scores.getFailure().ifPresent(failures::add);
        primeScores(filter, scores.value());

        final PartialResult<List<Notification>> filtered;
        try (TimedOperation ignored = new TimedOperation("filter notifications")) {
            filtered = new FilterEngine(filterEngineSettings, filter).filter(notifications);
        }
        filtered.getFailure().ifPresent(failures::add);

        final List<Notification> sorted;
        try (TimedOperation ignored = new TimedOperation("sort notifications")) {
            sorted = new Sorter(sorterSettings, sortCriteria).sort(filtered.value());
        }

        failures.forEach(failure -> logger.warning(exceptionHandler.getExceptionMessage(failure)));

        final String cacheKey = getCacheKey(notifications, query, sortCriteria);
        if (failures.isEmpty()) {
            cache.set(cacheKey, sorted.stream().map(Notification::id).toArray(String[]::new), cacheSettings.defaultTtl());
        }

        return new PipelineResult(sorted, scores.value(), failures, cacheKey);
    }

    /**
     * Returns the ids of a previous complete run over the same notifications, query and criteria.
     */
    public Optional<List<String>> getCachedResult(final List<Notification> notifications, final String query, final List<SortCriterion> criteria) {
        final List<SortCriterion> sortCriteria = criteria.isEmpty() ? sorterSettings.criteria() : criteria;
        return cache.get(getCacheKey(notifications, query, sortCriteria), String[].class)
                .toOptional()
                .map(Arrays::asList);
    }

    private static String getCacheKey(final List<Notification> notifications, final String query, final List<SortCriterion> criteria) {
        final String ids = notifications.stream()
                .map(Notification::id)
                .collect(Collectors.joining(","));
        final String sort = criteria.stream()
                .map(SortCriterion::toString)
                .collect(Collectors.joining(","));
        return RESULT_PREFIX + DigestUtils.sha256Hex(StringUtils.trimToEmpty(query) + "\n" + sort + "\n" + ids);
    }

    private static void primeScores(final Filter filter, final Map<String, NotificationScore> scores) {
        if (filter instanceof ScoreRangeFilter scoreFilter) {
            scoreFilter.setScores(scores);
        } else if (filter instanceof AndFilter and) {
            and.filters().forEach(child -> primeScores(child, scores));
        } else if (filter instanceof OrFilter or) {
            or.filters().forEach(child -> primeScores(child, scores));
        } else if (filter instanceof NotFilter not) {
            primeScores(not.filter(), scores);
        }
    }
}
