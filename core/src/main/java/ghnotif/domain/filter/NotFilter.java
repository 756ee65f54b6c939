package ghnotif.domain.filter;

import ghnotif.domain.model.Notification;

import static com.google.common.base.Preconditions.checkNotNull;

public record NotFilter(Filter filter) implements Filter {
    public NotFilter {
        checkNotNull(filter, "filter must not be null");
    }

    @Override
    public boolean apply(final Notification notification) {
        return !filter.apply(notification);
    }

    @Override
    public String describe() {
        return "NOT (" + filter.describe() + ")";
    }
}
