package ghnotif.domain.source;

import ghnotif.domain.model.Notification;

import java.util.List;

/**
 * Supplies notification records, typically by calling the issue tracker API. Retries and pagination are the
 * responsibility of the implementation.
 */
@FunctionalInterface
public interface NotificationSource {
    List<Notification> fetch();
}
