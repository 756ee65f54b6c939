package ghnotif.domain.sort;

import com.google.common.collect.Lists;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import ghnotif.domain.config.SorterSettings;
import ghnotif.domain.model.Notification;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.logging.Logger;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Orders notifications by a chain of criteria. The first criterion decides unless it compares equal, then the
 * next one, and so on. Notifications that are equal on every criterion keep their input order, on both the
 * sequential and the parallel path, so the two paths return the same sequence.
 * <p>
 * The parallel path sorts fixed-size batches concurrently and merges them by repeatedly scanning the batch
 * heads for the smallest one. This costs O(batches) per element, which is fine while batches are few.
 */
public class Sorter {
    private static final Logger logger = Logger.getLogger(Sorter.class.getName());

    private final SorterSettings settings;
    private final List<SortCriterion> criteria;

    public Sorter(final SorterSettings settings, final List<SortCriterion> criteria) {
        this.settings = checkNotNull(settings, "settings must not be null");
        this.criteria = List.copyOf(checkNotNull(criteria, "criteria must not be null"));
    }

    /**
     * Sorts by a single field with the default settings.
     */
    public static List<Notification> byField(final List<Notification> notifications, final SortField field, final SortDirection direction) {
        return new Sorter(SorterSettings.defaults(), List.of(new SortCriterion(field, direction))).sort(notifications);
    }

    public List<SortCriterion> getCriteria() {
        return criteria;
    }

    /**
     * Returns a sorted copy. The input list is never modified.
     */
    public List<Notification> sort(final List<Notification> notifications) {
        checkNotNull(notifications, "notifications must not be null");

        if (notifications.size() <= 1 || criteria.isEmpty()) {
            return new ArrayList<>(notifications);
        }

        final Comparator<Notification> comparator = comparator();

        if (!settings.parallel() || notifications.size() < settings.batchSize()) {
            return sorted(notifications, comparator);
        }

        return sortParallel(notifications, comparator);
    }

    private Comparator<Notification> comparator() {
        return criteria.stream()
                .map(SortCriterion::comparator)
                .reduce(Comparator::thenComparing)
                .orElseThrow();
    }

    private static List<Notification> sorted(final List<Notification> notifications, final Comparator<Notification> comparator) {
        final List<Notification> copy = new ArrayList<>(notifications);
        copy.sort(comparator);
        return copy;
    }

    private List<Notification> sortParallel(final List<Notification> notifications, final Comparator<Notification> comparator) {
        final List<List<Notification>> batches = Lists.partition(notifications, settings.batchSize());
        logger.fine("Sorting " + notifications.size() + " notifications in " + batches.size() + " batches");

        final ExecutorService executor = Executors.newFixedThreadPool(
                Math.min(batches.size(), Runtime.getRuntime().availableProcessors()),
                new ThreadFactoryBuilder().setNameFormat("sort-worker-%d").setDaemon(true).build());

        try {
            final List<CompletableFuture<List<Notification>>> futures = batches.stream()
                    .map(batch -> CompletableFuture.supplyAsync(() -> sorted(batch, comparator), executor))
                    .toList();

            return merge(futures.stream().map(CompletableFuture::join).toList(), comparator, notifications.size());
        } finally {
            executor.shutdown();
        }
    }

    /**
     * Merges sorted batches. A head only replaces the current minimum when it is strictly smaller, so on ties
     * the earlier batch wins and input order is kept.
     */
    private static List<Notification> merge(final List<List<Notification>> batches, final Comparator<Notification> comparator, final int size) {
        final List<Notification> result = new ArrayList<>(size);
        final int[] positions = new int[batches.size()];

        for (int i = 0; i < size; i++) {
            int min = -1;
            for (int batch = 0; batch < batches.size(); batch++) {
                if (positions[batch] >= batches.get(batch).size()) {
                    continue;
                }

                if (min == -1 || comparator.compare(
                        batches.get(batch).get(positions[batch]),
                        batches.get(min).get(positions[min])) < 0) {
                    min = batch;
                }
            }

            result.add(batches.get(min).get(positions[min]++));
        }

        return result;
    }
}
