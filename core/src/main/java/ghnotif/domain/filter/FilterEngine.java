package ghnotif.domain.filter;

import ghnotif.domain.concurrency.BoundedWorkerPool;
import ghnotif.domain.concurrency.PartialResult;
import ghnotif.domain.config.FilterEngineSettings;
import ghnotif.domain.exceptions.DeadlineExceeded;
import ghnotif.domain.model.Notification;
import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;
import java.util.Optional;
import java.util.logging.Logger;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Applies a filter to a collection of notifications.
 * <p>
 * Collections smaller than the batch size are filtered on the calling thread and keep their order. Larger
 * collections are fanned out to a worker pool, and the matches come back in the order the workers finish.
 * Callers that need a strict order must sort the result.
 */
public class FilterEngine {
    private static final Logger logger = Logger.getLogger(FilterEngine.class.getName());

    private final FilterEngineSettings settings;
    @Nullable
    private final Filter filter;

    public FilterEngine(final FilterEngineSettings settings, @Nullable final Filter filter) {
        this.settings = checkNotNull(settings, "settings must not be null");
        this.filter = filter;
    }

    @Nullable
    public Filter getFilter() {
        return filter;
    }

    public PartialResult<List<Notification>> filter(final List<Notification> notifications) {
        checkNotNull(notifications, "notifications must not be null");

        if (notifications.isEmpty() || filter == null) {
            return PartialResult.complete(notifications, notifications.size());
        }

        final List<Notification> candidates = settings.indexing()
                ? narrow(notifications, filter)
                : notifications;

        logger.fine("Filtering " + candidates.size() + " of " + notifications.size()
                + " notifications with " + filter.describe());

        if (candidates.size() < settings.batchSize()) {
            return filterSequential(candidates, filter);
        }

        return new BoundedWorkerPool("filter", settings.concurrency(), settings.batchSize())
                .process(
                        candidates,
                        notification -> filter.apply(notification) ? Optional.of(notification) : Optional.empty(),
                        settings.timeout());
    }

    private PartialResult<List<Notification>> filterSequential(final List<Notification> notifications, final Filter filter) {
        final long deadline = System.nanoTime() + settings.timeout().toNanos();
        final List<Notification> results = new ArrayList<>();

        for (int i = 0; i < notifications.size(); i++) {
            if (System.nanoTime() - deadline > 0) {
                return new PartialResult<>(
                        results,
                        i,
                        notifications.size(),
                        new DeadlineExceeded("filter", i, notifications.size(), settings.timeout()));
            }

            final Notification notification = notifications.get(i);
            if (filter.apply(notification)) {
                results.add(notification);
            }
        }

        return PartialResult.complete(results, notifications.size());
    }

    /**
     * Drops the notifications that the index proves cannot match. Order is preserved.
     */
    private List<Notification> narrow(final List<Notification> notifications, final Filter filter) {
        final NotificationIndex index = NotificationIndex.build(notifications);
        return candidates(filter, index)
                .map(bits -> bits.stream().mapToObj(notifications::get).toList())
                .orElse(notifications);
    }

    private static Optional<BitSet> candidates(final Filter filter, final NotificationIndex index) {
        if (filter instanceof IndexedFilter indexed) {
            return Optional.of(indexed.candidates(index));
        }

        if (filter instanceof AndFilter and) {
            BitSet result = null;
            for (final Filter child : and.filters()) {
                final Optional<BitSet> childCandidates = candidates(child, index);
                if (childCandidates.isPresent()) {
                    if (result == null) {
                        result = childCandidates.get();
                    } else {
                        result.and(childCandidates.get());
                    }
                }
            }
            return Optional.ofNullable(result);
        }

        if (filter instanceof OrFilter or && !or.filters().isEmpty()) {
            final BitSet result = new BitSet(index.size());
            for (final Filter child : or.filters()) {
                final Optional<BitSet> childCandidates = candidates(child, index);
                if (childCandidates.isEmpty()) {
                    return Optional.empty();
                }
                result.or(childCandidates.get());
            }
            return Optional.of(result);
        }

        return Optional.empty();
    }
}
