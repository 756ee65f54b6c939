package ghnotif.domain.filter;

import java.util.BitSet;

/**
 * A filter that can narrow a collection through a {@link NotificationIndex} before it is applied.
 * The candidates must be a superset of the matching positions; the filter is still applied to each of them.
 */
public interface IndexedFilter extends Filter {
    BitSet candidates(NotificationIndex index);
}
