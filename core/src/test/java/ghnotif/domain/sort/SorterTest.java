package ghnotif.domain.sort;

import ghnotif.domain.config.SorterSettings;
import ghnotif.domain.exceptions.ConfigurationFailure;
import ghnotif.domain.model.Notification;
import ghnotif.domain.testing.NotificationFixtures;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

public class SorterTest {
    private static final List<SortCriterion> BY_REPOSITORY_THEN_NEWEST = List.of(
            new SortCriterion(SortField.REPOSITORY, SortDirection.ASCENDING),
            new SortCriterion(SortField.TIME, SortDirection.DESCENDING));

    @Test
    public void testMultipleCriteria() {
        final Notification a1 = at("a1", "acme/widgets", Duration.ofHours(5));
        final Notification a2 = at("a2", "acme/widgets", Duration.ofHours(1));
        final Notification b1 = at("b1", "octo/alpha", Duration.ofHours(3));

        final List<Notification> sorted = new Sorter(SorterSettings.defaults(), BY_REPOSITORY_THEN_NEWEST)
                .sort(List.of(b1, a1, a2));

        Assertions.assertEquals(List.of(a2, a1, b1), sorted);
    }

    @Test
    public void testStatusPutsReadFirst() {
        final Notification read = NotificationFixtures.notification("1", "octo/alpha", "Issue", false);
        final Notification unread = NotificationFixtures.notification("2", "octo/alpha", "Issue", true);

        Assertions.assertEquals(List.of(read, unread),
                Sorter.byField(List.of(unread, read), SortField.STATUS, SortDirection.ASCENDING));
        Assertions.assertEquals(List.of(unread, read),
                Sorter.byField(List.of(read, unread), SortField.STATUS, SortDirection.DESCENDING));
    }

    @Test
    public void testMissingTimesSortFirst() {
        final Notification undated = new Notification("1", "octo/alpha", "octo", "Issue", "t", "mention", true, null);
        final Notification dated = at("2", "octo/alpha", Duration.ofDays(100));

        Assertions.assertEquals(List.of(undated, dated),
                Sorter.byField(List.of(dated, undated), SortField.TIME, SortDirection.ASCENDING));
    }

    @Test
    public void testTiesKeepInputOrder() {
        final List<Notification> notifications = NotificationFixtures.mixed(40);
        final List<Notification> sorted = Sorter.byField(notifications, SortField.TYPE, SortDirection.ASCENDING);

        for (int i = 1; i < sorted.size(); i++) {
            final Notification previous = sorted.get(i - 1);
            final Notification current = sorted.get(i);
            if (previous.getType().equals(current.getType())) {
                Assertions.assertTrue(notifications.indexOf(previous) < notifications.indexOf(current));
            }
        }
    }

    @Test
    public void testSortingIsIdempotent() {
        final Sorter sorter = new Sorter(SorterSettings.defaults(), BY_REPOSITORY_THEN_NEWEST);
        final List<Notification> once = sorter.sort(NotificationFixtures.mixed(200));

        Assertions.assertEquals(once, sorter.sort(once));
    }

    @Test
    public void testParallelMatchesSequential() {
        final List<Notification> notifications = NotificationFixtures.mixed(2500);
        final List<SortCriterion> criteria = List.of(
                new SortCriterion(SortField.REASON, SortDirection.DESCENDING),
                new SortCriterion(SortField.STATUS, SortDirection.ASCENDING));

        final List<Notification> sequential = new Sorter(SorterSettings.defaults().withParallel(false), criteria)
                .sort(notifications);
        final List<Notification> parallel = new Sorter(SorterSettings.defaults().withBatchSize(64), criteria)
                .sort(notifications);

        Assertions.assertEquals(sequential, parallel);
    }

    @Test
    public void testInputIsNotModified() {
        final List<Notification> notifications = new ArrayList<>(NotificationFixtures.mixed(50));
        final List<Notification> copy = List.copyOf(notifications);

        final List<Notification> sorted = new Sorter(SorterSettings.defaults().withBatchSize(8), BY_REPOSITORY_THEN_NEWEST)
                .sort(notifications);

        Assertions.assertEquals(copy, notifications);
        Assertions.assertNotSame(notifications, sorted);
        Assertions.assertEquals(notifications.size(), sorted.size());
    }

    @Test
    public void testNoCriteriaReturnsACopy() {
        final List<Notification> notifications = NotificationFixtures.mixed(5);
        final List<Notification> sorted = new Sorter(SorterSettings.defaults(), List.of()).sort(notifications);

        Assertions.assertEquals(notifications, sorted);
        Assertions.assertNotSame(notifications, sorted);
    }

    @Test
    public void testParseCriterion() {
        Assertions.assertEquals(new SortCriterion(SortField.TIME, SortDirection.DESCENDING), SortCriterion.parse("time:desc"));
        Assertions.assertEquals(new SortCriterion(SortField.TIME, SortDirection.DESCENDING), SortCriterion.parse(" Time : Descending "));
        Assertions.assertEquals(new SortCriterion(SortField.REPOSITORY, SortDirection.ASCENDING), SortCriterion.parse("repository"));
        Assertions.assertEquals("status:asc", SortCriterion.parse("status").toString());

        Assertions.assertThrows(ConfigurationFailure.class, () -> SortCriterion.parse("priority"));
        Assertions.assertThrows(ConfigurationFailure.class, () -> SortCriterion.parse("time:sideways"));
    }

    @Test
    public void testParseCriteriaList() {
        Assertions.assertEquals(BY_REPOSITORY_THEN_NEWEST, SortCriterion.parseList("repository:asc,time:desc"));
        Assertions.assertTrue(SortCriterion.parseList(" ").isEmpty());
    }

    private static Notification at(final String id, final String repository, final Duration age) {
        return NotificationFixtures.notification(
                id, repository, "Issue", "t", "mention", true, NotificationFixtures.NOW.minus(age));
    }
}
