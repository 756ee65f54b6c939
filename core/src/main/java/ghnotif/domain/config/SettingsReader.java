package ghnotif.domain.config;

import ghnotif.domain.cache.CacheType;
import ghnotif.domain.exceptions.ConfigurationFailure;
import ghnotif.domain.scoring.ScoreFactor;
import ghnotif.domain.scoring.ScoreFactors;
import ghnotif.domain.sort.SortCriterion;
import org.apache.commons.lang3.BooleanUtils;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.math.NumberUtils;
import org.eclipse.microprofile.config.Config;
import org.jspecify.annotations.Nullable;

import java.nio.file.Path;
import java.time.Duration;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.stream.StreamSupport;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Reads and validates the flat {@code ghnotif.*} settings. Every value is checked as it is read, so a bad
 * value fails when the settings are applied rather than when they are first used.
 */
public class SettingsReader {
    public static final String FILTER_CONCURRENCY = "ghnotif.filter.concurrency";
    public static final String FILTER_BATCH_SIZE = "ghnotif.filter.batchsize";
    public static final String FILTER_TIMEOUT = "ghnotif.filter.timeout";
    public static final String FILTER_INDEXING = "ghnotif.filter.indexing";

    public static final String SCORE_PREFIX = "ghnotif.score.";
    public static final String SCORE_REPO_PREFIX = SCORE_PREFIX + "repo.";
    public static final String SCORE_CONCURRENCY = SCORE_PREFIX + "concurrency";
    public static final String SCORE_BATCH_SIZE = SCORE_PREFIX + "batchsize";
    public static final String SCORE_TIMEOUT = SCORE_PREFIX + "timeout";
    public static final String SCORE_USERNAME = SCORE_PREFIX + "username";
    public static final String SCORE_CACHE_TTL = SCORE_PREFIX + "cachettl";

    public static final String SORT_PARALLEL = "ghnotif.sort.parallel";
    public static final String SORT_BATCH_SIZE = "ghnotif.sort.batchsize";
    public static final String SORT_CRITERIA = "ghnotif.sort.criteria";

    public static final String CACHE_TYPE = "ghnotif.cache.type";
    public static final String CACHE_DIRECTORY = "ghnotif.cache.directory";
    public static final String CACHE_BUCKET = "ghnotif.cache.bucket";
    public static final String CACHE_PREFETCH_QUEUE = "ghnotif.cache.prefetchqueue";
    public static final String CACHE_DEFAULT_TTL = "ghnotif.cache.defaultttl";

    public static final String FILTERS_FILE = "ghnotif.filters.file";

    private final Config config;

    public SettingsReader(final Config config) {
        this.config = checkNotNull(config, "config must not be null");
    }

    public FilterEngineSettings filterEngineSettings() {
        final FilterEngineSettings defaults = FilterEngineSettings.defaults();
        return new FilterEngineSettings(
                positiveInt(FILTER_CONCURRENCY, defaults.concurrency()),
                positiveInt(FILTER_BATCH_SIZE, defaults.batchSize()),
                positiveMillis(FILTER_TIMEOUT, defaults.timeout()),
                bool(FILTER_INDEXING, defaults.indexing()));
    }

    public ScorerSettings scorerSettings() {
        final ScorerSettings defaults = ScorerSettings.defaults();
        return new ScorerSettings(
                positiveInt(SCORE_CONCURRENCY, defaults.concurrency()),
                positiveInt(SCORE_BATCH_SIZE, defaults.batchSize()),
                positiveMillis(SCORE_TIMEOUT, defaults.timeout()),
                string(SCORE_USERNAME).orElse(null),
                millis(SCORE_CACHE_TTL, defaults.cacheTtl()));
    }

    /**
     * Reads {@code ghnotif.score.<factor key>} for every factor and {@code ghnotif.score.repo.<owner/name>}
     * for the custom repository weights.
     */
    public ScoreFactors scoreFactors() {
        final Map<ScoreFactor, Double> weights = new EnumMap<>(ScoreFactor.class);
        for (final ScoreFactor factor : ScoreFactor.values()) {
            weights.put(factor, number(SCORE_PREFIX + factor.getKey(), factor.getDefaultValue()));
        }

        final Map<String, Double> repositoryWeights = new HashMap<>();
        StreamSupport.stream(config.getPropertyNames().spliterator(), false)
                .filter(name -> name.startsWith(SCORE_REPO_PREFIX))
                .filter(name -> name.length() > SCORE_REPO_PREFIX.length())
                .forEach(name -> repositoryWeights.put(name.substring(SCORE_REPO_PREFIX.length()), number(name, 0)));

        return new ScoreFactors(weights, repositoryWeights);
    }

    public SorterSettings sorterSettings() {
        final SorterSettings defaults = SorterSettings.defaults();
        return new SorterSettings(
                bool(SORT_PARALLEL, defaults.parallel()),
                positiveInt(SORT_BATCH_SIZE, defaults.batchSize()),
                string(SORT_CRITERIA).map(SortCriterion::parseList).orElse(defaults.criteria()));
    }

    public CacheSettings cacheSettings() {
        final CacheSettings defaults = CacheSettings.defaults();
        return new CacheSettings(
                string(CACHE_TYPE).map(CacheType::fromName).orElse(defaults.type()),
                string(CACHE_DIRECTORY).map(Path::of).orElse(defaults.directory()),
                string(CACHE_BUCKET).orElse(defaults.bucket()),
                positiveInt(CACHE_PREFETCH_QUEUE, defaults.prefetchQueueSize()),
                millis(CACHE_DEFAULT_TTL, defaults.defaultTtl()));
    }

    public Path filterPresetsFile() {
        return string(FILTERS_FILE)
                .map(Path::of)
                .orElse(Path.of(System.getProperty("user.home"), ".ghnotif", "filter_presets.json"));
    }

    /**
     * Reads every setting once, so that any invalid value is reported immediately.
     */
    public void validate() {
        filterEngineSettings();
        scorerSettings();
        scoreFactors();
        sorterSettings();
        cacheSettings();
    }

    private Optional<String> string(final String key) {
        return config.getOptionalValue(key, String.class)
                .map(String::trim)
                .filter(StringUtils::isNotEmpty);
    }

    private int positiveInt(final String key, final int defaultValue) {
        final Optional<String> value = string(key);
        if (value.isEmpty()) {
            return defaultValue;
        }

        final int parsed = NumberUtils.isDigits(value.get()) ? NumberUtils.toInt(value.get(), -1) : -1;
        if (parsed <= 0) {
            throw invalid(key, value.get(), "a whole number greater than zero");
        }
        return parsed;
    }

    private double number(final String key, final double defaultValue) {
        final Optional<String> value = string(key);
        if (value.isEmpty()) {
            return defaultValue;
        }

        final double parsed = NumberUtils.toDouble(value.get(), Double.NaN);
        if (!Double.isFinite(parsed)) {
            throw invalid(key, value.get(), "a finite number");
        }
        return parsed;
    }

    private boolean bool(final String key, final boolean defaultValue) {
        final Optional<String> value = string(key);
        if (value.isEmpty()) {
            return defaultValue;
        }

        final Boolean parsed = BooleanUtils.toBooleanObject(value.get());
        if (parsed == null) {
            throw invalid(key, value.get(), "true or false");
        }
        return parsed;
    }

    private Duration millis(final String key, final Duration defaultValue) {
        final Optional<String> value = string(key);
        if (value.isEmpty()) {
            return defaultValue;
        }

        final long parsed = NumberUtils.isDigits(value.get()) ? NumberUtils.toLong(value.get(), -1) : -1;
        if (parsed < 0) {
            throw invalid(key, value.get(), "a number of milliseconds");
        }
        return Duration.ofMillis(parsed);
    }

    private Duration positiveMillis(final String key, final Duration defaultValue) {
        final Duration duration = millis(key, defaultValue);
        if (duration.isZero()) {
            throw invalid(key, string(key).orElse(null), "a number of milliseconds greater than zero");
        }
        return duration;
    }

    private static ConfigurationFailure invalid(final String key, @Nullable final String value, final String expected) {
        return new ConfigurationFailure("The setting " + key + " must be " + expected + ", but was " + value);
    }
}
