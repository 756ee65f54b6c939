package ghnotif.domain.filter;

import ghnotif.domain.model.Notification;

import java.util.List;
import java.util.stream.Collectors;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Matches when any child matches. With no children it matches nothing.
 */
public record OrFilter(List<Filter> filters) implements Filter {
    public OrFilter {
        checkNotNull(filters, "filters must not be null");
        filters = List.copyOf(filters);
    }

    public static OrFilter of(final Filter... filters) {
        return new OrFilter(List.of(filters));
    }

    @Override
    public boolean apply(final Notification notification) {
        return filters.stream().anyMatch(filter -> filter.apply(notification));
    }

    @Override
    public String describe() {
        return filters.stream()
                .map(Filter::describe)
                .collect(Collectors.joining(" OR ", "(", ")"));
    }
}
