package ghnotif.domain.filter;

import ghnotif.domain.model.Notification;

public record MatchAllFilter() implements Filter {
    @Override
    public boolean apply(final Notification notification) {
        return true;
    }

    @Override
    public String describe() {
        return "all";
    }
}
