package ghnotif.domain.filter;

import ghnotif.domain.model.Notification;

import java.util.List;
import java.util.stream.Collectors;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Matches when every child matches. With no children it matches everything.
 */
public record AndFilter(List<Filter> filters) implements Filter {
    public AndFilter {
        checkNotNull(filters, "filters must not be null");
        filters = List.copyOf(filters);
    }

    public static AndFilter of(final Filter... filters) {
        return new AndFilter(List.of(filters));
    }

    @Override
    public boolean apply(final Notification notification) {
        return filters.stream().allMatch(filter -> filter.apply(notification));
    }

    @Override
    public String describe() {
        return filters.stream()
                .map(Filter::describe)
                .collect(Collectors.joining(" AND ", "(", ")"));
    }
}
