package ghnotif.domain.config;

import ghnotif.domain.sort.SortCriterion;

import java.util.List;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Settings for the sorter.
 *
 * @param parallel  Whether large collections are sorted in parallel batches
 * @param batchSize The batch size, and the size below which sorting is always sequential
 * @param criteria  The criteria used when the caller does not supply any
 */
public record SorterSettings(boolean parallel, int batchSize, List<SortCriterion> criteria) {
    public static final int DEFAULT_BATCH_SIZE = 1000;

    public SorterSettings {
        checkNotNull(criteria, "criteria must not be null");
        SettingsValidation.positive("batch size", batchSize);
        criteria = List.copyOf(criteria);
    }

    public static SorterSettings defaults() {
        return new SorterSettings(true, DEFAULT_BATCH_SIZE, List.of());
    }

    public SorterSettings withParallel(final boolean parallel) {
        return new SorterSettings(parallel, batchSize, criteria);
    }

    public SorterSettings withBatchSize(final int batchSize) {
        return new SorterSettings(parallel, batchSize, criteria);
    }
}
