package ghnotif.domain.filter;

import ghnotif.domain.model.Notification;

import java.util.BitSet;
import java.util.List;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Matches notifications whose subject type is one of the listed types, ignoring case.
 */
public record TypeFilter(List<String> types) implements IndexedFilter {
    public TypeFilter {
        checkNotNull(types, "types must not be null");
        types = List.copyOf(types);
    }

    @Override
    public boolean apply(final Notification notification) {
        final String key = NotificationIndex.typeKey(notification.getType());
        return types.stream().anyMatch(type -> NotificationIndex.typeKey(type).equals(key));
    }

    @Override
    public BitSet candidates(final NotificationIndex index) {
        final BitSet candidates = new BitSet(index.size());
        types.forEach(type -> candidates.or(index.byType(type)));
        return candidates;
    }

    @Override
    public String describe() {
        return "type:" + String.join(",", types);
    }
}
