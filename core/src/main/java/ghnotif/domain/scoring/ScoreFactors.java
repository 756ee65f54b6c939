package ghnotif.domain.scoring;

import ghnotif.domain.exceptions.ConfigurationFailure;
import org.apache.commons.codec.digest.DigestUtils;

import java.util.Arrays;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.stream.Collectors;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * The weights used by the scorer. Factors missing from the map take their default value.
 * Weights are free-form, so totals can saturate at 0 or 100 under extreme settings.
 *
 * @param weights                 The weight of each factor
 * @param customRepositoryWeights Per-repository overrides of the repository sub-score, keyed by "owner/name"
 */
public record ScoreFactors(Map<ScoreFactor, Double> weights, Map<String, Double> customRepositoryWeights) {
    public ScoreFactors {
        checkNotNull(weights, "weights must not be null");
        checkNotNull(customRepositoryWeights, "customRepositoryWeights must not be null");

        final EnumMap<ScoreFactor, Double> complete = new EnumMap<>(ScoreFactor.class);
        Arrays.stream(ScoreFactor.values()).forEach(factor -> complete.put(factor, factor.getDefaultValue()));
        weights.forEach((factor, value) -> complete.put(factor, requireFinite(factor.getKey(), value)));
        customRepositoryWeights.forEach((repository, value) -> requireFinite("repository weight of " + repository, value));

        weights = Map.copyOf(complete);
        customRepositoryWeights = Map.copyOf(customRepositoryWeights);
    }

    public static ScoreFactors defaults() {
        return new ScoreFactors(Map.of(), Map.of());
    }

    public double weight(final ScoreFactor factor) {
        return weights.get(factor);
    }

    public Optional<Double> repositoryWeight(final String repository) {
        return Optional.ofNullable(customRepositoryWeights.get(repository));
    }

    public ScoreFactors with(final ScoreFactor factor, final double value) {
        final Map<ScoreFactor, Double> updated = new EnumMap<>(weights);
        updated.put(factor, value);
        return new ScoreFactors(updated, customRepositoryWeights);
    }

    public ScoreFactors withRepositoryWeight(final String repository, final double value) {
        final Map<String, Double> updated = new TreeMap<>(customRepositoryWeights);
        updated.put(repository, value);
        return new ScoreFactors(weights, updated);
    }

    /**
     * A short digest of every weight, used to key cached scores so that changing a weight
     * never returns a score computed with the old one.
     */
    public String fingerprint() {
        final String weightText = new TreeMap<>(weights).entrySet().stream()
                .map(entry -> entry.getKey().getKey() + "=" + entry.getValue())
                .collect(Collectors.joining(","));
        final String repositoryText = new TreeMap<>(customRepositoryWeights).entrySet().stream()
                .map(entry -> entry.getKey() + "=" + entry.getValue())
                .collect(Collectors.joining(","));
        return DigestUtils.sha256Hex(weightText + ";" + repositoryText).substring(0, 16);
    }

    private static double requireFinite(final String name, final Double value) {
        if (value == null || !Double.isFinite(value)) {
            throw new ConfigurationFailure("The score weight " + name + " must be a finite number, but was " + value);
        }
        return value;
    }
}
