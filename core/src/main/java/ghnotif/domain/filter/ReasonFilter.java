package ghnotif.domain.filter;

import ghnotif.domain.model.Notification;

import static com.google.common.base.Preconditions.checkNotNull;

public record ReasonFilter(String reason) implements Filter {
    public ReasonFilter {
        checkNotNull(reason, "reason must not be null");
    }

    @Override
    public boolean apply(final Notification notification) {
        return reason.equalsIgnoreCase(notification.getReasonName());
    }

    @Override
    public String describe() {
        return "reason:" + reason;
    }
}
