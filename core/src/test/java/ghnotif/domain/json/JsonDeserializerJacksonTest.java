package ghnotif.domain.json;

import com.fasterxml.jackson.databind.JsonNode;
import ghnotif.domain.exceptions.DeserializationFailed;
import ghnotif.domain.model.Notification;
import ghnotif.domain.testing.NotificationFixtures;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.Map;

public class JsonDeserializerJacksonTest {
    private final JsonDeserializer jsonDeserializer = new JsonDeserializerJackson();

    @Test
    public void testNotificationsKeepTheirFields() {
        final Notification notification = NotificationFixtures.notification("1", "octo/alpha", "PullRequest", true);

        final String json = jsonDeserializer.serialize(notification);

        Assertions.assertTrue(json.contains("\"2024-06-01T12:00:00Z\""));
        Assertions.assertFalse(json.contains("\"organization\""), "derived accessors are not serialized");
        Assertions.assertEquals(notification, jsonDeserializer.deserialize(json, Notification.class));
    }

    @Test
    public void testUnknownPropertiesAreIgnored() {
        final Notification notification = jsonDeserializer.deserialize(
                "{\"id\":\"1\",\"unread\":true,\"somethingNew\":5}", Notification.class);

        Assertions.assertEquals("1", notification.id());
        Assertions.assertNull(notification.repositoryFullName());
    }

    @Test
    public void testMaps() {
        final Map<String, Integer> map = jsonDeserializer.deserializeMap("{\"a\":1,\"b\":2}", String.class, Integer.class);
        Assertions.assertEquals(Map.of("a", 1, "b", 2), map);
    }

    @Test
    public void testTrees() {
        final JsonNode tree = jsonDeserializer.toTree(Map.of("count", 3));
        Assertions.assertEquals(3, tree.get("count").asInt());
        Assertions.assertEquals(Map.of("count", 3), jsonDeserializer.fromTree(tree, Map.class));
    }

    @Test
    public void testInvalidJson() {
        Assertions.assertThrows(DeserializationFailed.class, () -> jsonDeserializer.deserialize("{", Notification.class));
    }
}
