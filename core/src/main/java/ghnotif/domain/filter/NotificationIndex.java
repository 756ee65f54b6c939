package ghnotif.domain.filter;

import ghnotif.domain.model.Notification;

import java.util.BitSet;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Positions of notifications in one collection, keyed by repository, organization, type and read state.
 * An index is built for a single filter call and is never shared between calls.
 */
public final class NotificationIndex {
    private final int size;
    private final Map<String, BitSet> byRepository = new HashMap<>();
    private final Map<String, BitSet> byOrganization = new HashMap<>();
    private final Map<String, BitSet> byType = new HashMap<>();
    private final BitSet unread = new BitSet();
    private final BitSet read = new BitSet();

    private NotificationIndex(final int size) {
        this.size = size;
    }

    public static NotificationIndex build(final List<Notification> notifications) {
        final NotificationIndex index = new NotificationIndex(notifications.size());
        for (int i = 0; i < notifications.size(); i++) {
            final Notification notification = notifications.get(i);
            index.byRepository.computeIfAbsent(notification.getRepository(), key -> new BitSet()).set(i);
            index.byOrganization.computeIfAbsent(notification.getOrganization(), key -> new BitSet()).set(i);
            index.byType.computeIfAbsent(typeKey(notification.getType()), key -> new BitSet()).set(i);
            (notification.unread() ? index.unread : index.read).set(i);
        }
        return index;
    }

    public int size() {
        return size;
    }

    public BitSet byRepository(final String repository) {
        return copy(byRepository.get(repository));
    }

    public BitSet byOrganization(final String organization) {
        return copy(byOrganization.get(organization));
    }

    public BitSet byType(final String type) {
        return copy(byType.get(typeKey(type)));
    }

    public BitSet byReadState(final boolean unread) {
        return copy(unread ? this.unread : this.read);
    }

    /**
     * The case fold shared by the type index and {@link TypeFilter}, so both agree on which types match.
     */
    static String typeKey(final String type) {
        return type.toLowerCase(Locale.ROOT);
    }

    private static BitSet copy(final BitSet bits) {
        return bits == null ? new BitSet() : (BitSet) bits.clone();
    }
}
