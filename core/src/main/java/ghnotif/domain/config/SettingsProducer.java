package ghnotif.domain.config;

import ghnotif.domain.scoring.ScoreFactors;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.Config;

import java.nio.file.Path;

/**
 * Exposes the validated settings to CDI. The settings are read each time a bean that needs them is created.
 */
@ApplicationScoped
public class SettingsProducer {
    @Inject
    private Config config;

    public SettingsReader getReader() {
        return new SettingsReader(config);
    }

    @Produces
    public FilterEngineSettings produceFilterEngineSettings() {
        return getReader().filterEngineSettings();
    }

    @Produces
    public ScorerSettings produceScorerSettings() {
        return getReader().scorerSettings();
    }

    @Produces
    public ScoreFactors produceScoreFactors() {
        return getReader().scoreFactors();
    }

    @Produces
    public SorterSettings produceSorterSettings() {
        return getReader().sorterSettings();
    }

    @Produces
    public CacheSettings produceCacheSettings() {
        return getReader().cacheSettings();
    }

    @Produces
    @FilterPresetsFile
    public Path produceFilterPresetsFile() {
        return getReader().filterPresetsFile();
    }
}
