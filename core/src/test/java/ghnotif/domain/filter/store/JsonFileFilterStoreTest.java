package ghnotif.domain.filter.store;

import ghnotif.domain.exceptions.FilterReferenceFailure;
import ghnotif.domain.exceptions.LocalStorageFailure;
import ghnotif.domain.json.JsonDeserializerJackson;
import ghnotif.domain.testing.MutableClock;
import ghnotif.domain.testing.NotificationFixtures;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

public class JsonFileFilterStoreTest {
    private final JsonDeserializerJackson jsonDeserializer = new JsonDeserializerJackson();
    private final MutableClock clock = new MutableClock(NotificationFixtures.NOW);

    @TempDir
    Path directory;

    @Test
    public void testMissingFileIsEmpty() {
        final JsonFileFilterStore store = new JsonFileFilterStore(directory.resolve("presets.json"), jsonDeserializer, clock);
        Assertions.assertTrue(store.list().isEmpty());
    }

    @Test
    public void testBlankFileIsEmpty() throws IOException {
        final Path file = directory.resolve("presets.json");
        Files.writeString(file, "  \n");

        Assertions.assertTrue(new JsonFileFilterStore(file, jsonDeserializer, clock).list().isEmpty());
    }

    @Test
    public void testCorruptFileFails() throws IOException {
        final Path file = directory.resolve("presets.json");
        Files.writeString(file, "{not json");

        Assertions.assertThrows(LocalStorageFailure.class, () -> new JsonFileFilterStore(file, jsonDeserializer, clock));
    }

    @Test
    public void testSaveAndReload() {
        final Path file = directory.resolve("nested").resolve("presets.json");
        final JsonFileFilterStore store = new JsonFileFilterStore(file, jsonDeserializer, clock);

        final FilterPreset saved = store.save(FilterPreset.of("mine", "is:unread AND type:PullRequest"));
        Assertions.assertEquals(NotificationFixtures.NOW, saved.created());
        Assertions.assertTrue(Files.exists(file));

        final JsonFileFilterStore reloaded = new JsonFileFilterStore(file, jsonDeserializer, clock);
        Assertions.assertEquals(saved, reloaded.get("mine").orElseThrow());
        Assertions.assertEquals("is:unread AND type:PullRequest", reloaded.lookup("mine"));
    }

    @Test
    public void testUsageIsPersistedInSnakeCase() throws IOException {
        final Path file = directory.resolve("presets.json");
        final JsonFileFilterStore store = new JsonFileFilterStore(file, jsonDeserializer, clock);
        store.save(FilterPreset.of("mine", "is:unread"));

        clock.advance(Duration.ofHours(1));
        store.markUsed("mine");
        store.markUsed("unknown");

        final FilterPreset preset = new JsonFileFilterStore(file, jsonDeserializer, clock).get("mine").orElseThrow();
        Assertions.assertEquals(1, preset.useCount());
        Assertions.assertEquals(NotificationFixtures.NOW.plus(Duration.ofHours(1)), preset.lastUsed());

        final String json = Files.readString(file);
        Assertions.assertTrue(json.contains("\"use_count\""));
        Assertions.assertTrue(json.contains("\"last_used\""));
    }

    @Test
    public void testReplacingKeepsTheCreationTime() {
        final JsonFileFilterStore store = new JsonFileFilterStore(directory.resolve("presets.json"), jsonDeserializer, clock);
        store.save(FilterPreset.of("mine", "is:unread"));

        clock.advance(Duration.ofDays(1));
        final FilterPreset replaced = store.save(FilterPreset.of("mine", "is:read"));

        Assertions.assertEquals(NotificationFixtures.NOW, replaced.created());
        Assertions.assertEquals("is:read", store.lookup("mine"));
    }

    @Test
    public void testInvalidPresets() {
        final JsonFileFilterStore store = new JsonFileFilterStore(directory.resolve("presets.json"), jsonDeserializer, clock);

        Assertions.assertThrows(IllegalArgumentException.class, () -> store.save(FilterPreset.of(" ", "is:unread")));
        Assertions.assertThrows(IllegalArgumentException.class, () -> store.save(FilterPreset.of("empty", "")));
    }

    @Test
    public void testDelete() {
        final JsonFileFilterStore store = new JsonFileFilterStore(directory.resolve("presets.json"), jsonDeserializer, clock);
        store.save(FilterPreset.of("mine", "is:unread"));

        store.delete("mine");

        Assertions.assertTrue(store.get("mine").isEmpty());
        Assertions.assertThrows(FilterReferenceFailure.class, () -> store.lookup("mine"));
        Assertions.assertThrows(FilterReferenceFailure.class, () -> store.delete("mine"));
    }

    @Test
    public void testListIsSortedByName() {
        final JsonFileFilterStore store = new JsonFileFilterStore(directory.resolve("presets.json"), jsonDeserializer, clock);
        store.save(FilterPreset.of("zeta", "is:unread"));
        store.save(FilterPreset.of("alpha", "is:read"));

        Assertions.assertEquals(List.of("alpha", "zeta"), store.list().stream().map(FilterPreset::name).toList());
    }

    @Test
    public void testShortcutsTakePrecedence() {
        final JsonFileFilterStore store = new JsonFileFilterStore(directory.resolve("presets.json"), jsonDeserializer, clock);
        store.save(FilterPreset.of("unread", "is:read"));

        Assertions.assertEquals("is:unread", store.lookup("unread"));
        Assertions.assertEquals("score:>50 score:<75", store.lookup("medium"));
        Assertions.assertEquals(12, store.shortcuts().size());
    }
}
