package ghnotif.domain.filter.store;

import ghnotif.domain.exceptions.FilterReferenceFailure;
import ghnotif.domain.exceptions.LocalStorageFailure;
import ghnotif.domain.json.JsonDeserializer;
import io.vavr.API;
import io.vavr.control.Try;
import org.apache.commons.io.output.LockableFileWriter;
import org.apache.commons.lang3.StringUtils;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.logging.Logger;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Keeps saved filters in a JSON file, a map from name to {@link FilterPreset}, rewritten on every change.
 * The built-in shortcuts take precedence over saved presets with the same name.
 */
public class JsonFileFilterStore implements NamedFilterStore {
    public static final Map<String, String> SHORTCUTS = Map.ofEntries(
            Map.entry("unread", "is:unread"),
            Map.entry("read", "is:read"),
            Map.entry("prs", "type:PullRequest"),
            Map.entry("issues", "type:Issue"),
            Map.entry("mentions", "reason:mention"),
            Map.entry("assigned", "reason:assign"),
            Map.entry("reviews", "reason:review_requested"),
            Map.entry("today", "updated:>24h"),
            Map.entry("week", "updated:>7d"),
            Map.entry("high", "score:>75"),
            Map.entry("medium", "score:>50 score:<75"),
            Map.entry("low", "score:<50"));

    private static final Logger logger = Logger.getLogger(JsonFileFilterStore.class.getName());

    private final Path file;
    private final JsonDeserializer jsonDeserializer;
    private final Clock clock;
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<String, FilterPreset> presets = new HashMap<>();

    public JsonFileFilterStore(final Path file, final JsonDeserializer jsonDeserializer) {
        this(file, jsonDeserializer, Clock.systemUTC());
    }

    /**
     * @throws LocalStorageFailure if the file exists but cannot be read or parsed
     */
    public JsonFileFilterStore(final Path file, final JsonDeserializer jsonDeserializer, final Clock clock) {
        this.file = checkNotNull(file, "file must not be null");
        this.jsonDeserializer = checkNotNull(jsonDeserializer, "jsonDeserializer must not be null");
        this.clock = checkNotNull(clock, "clock must not be null");
        load();
    }

    private void load() {
        if (!Files.exists(file)) {
            logger.fine("No filter presets at " + file);
            return;
        }

        presets.putAll(Try.of(() -> Files.readString(file))
                .filter(StringUtils::isNotBlank)
                .map(json -> jsonDeserializer.deserializeMap(json, String.class, FilterPreset.class))
                .recover(NoSuchElementException.class, ex -> Map.of())
                .mapFailure(API.Case(API.$(), ex -> new LocalStorageFailure("Failed to load the filter presets from " + file, ex)))
                .get());
    }

    @Override
    public String lookup(final String name) {
        final String shortcut = SHORTCUTS.get(name);
        if (shortcut != null) {
            return shortcut;
        }

        return get(name)
                .map(FilterPreset::expression)
                .orElseThrow(() -> new FilterReferenceFailure(name, "Filter preset not found: " + name));
    }

    public Optional<FilterPreset> get(final String name) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(presets.get(name));
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Adds or replaces a preset. The creation time of an existing preset is kept.
     */
    public FilterPreset save(final FilterPreset preset) {
        checkNotNull(preset, "preset must not be null");
        checkArgument(StringUtils.isNotBlank(preset.name()), "preset name cannot be empty");
        checkArgument(StringUtils.isNotBlank(preset.expression()), "preset expression cannot be empty");

        lock.writeLock().lock();
        try {
            final FilterPreset existing = presets.get(preset.name());
            final FilterPreset saved = existing != null && existing.created() != null
                    ? preset.withCreated(existing.created())
                    : preset.created() == null ? preset.withCreated(clock.instant()) : preset;

            presets.put(saved.name(), saved);
            write();
            return saved;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Records that a preset was resolved. Unknown names and shortcuts are ignored.
     */
    public void markUsed(final String name) {
        lock.writeLock().lock();
        try {
            final FilterPreset existing = presets.get(name);
            if (existing != null) {
                presets.put(name, existing.used(clock.instant()));
                write();
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void delete(final String name) {
        lock.writeLock().lock();
        try {
            if (presets.remove(name) == null) {
                throw new FilterReferenceFailure(name, "Filter preset not found: " + name);
            }
            write();
        } finally {
            lock.writeLock().unlock();
        }
    }

    public List<FilterPreset> list() {
        lock.readLock().lock();
        try {
            return presets.values().stream()
                    .sorted(Comparator.comparing(FilterPreset::name))
                    .toList();
        } finally {
            lock.readLock().unlock();
        }
    }

    public Map<String, String> shortcuts() {
        return SHORTCUTS;
    }

    private void write() {
        final String json = jsonDeserializer.serialize(presets);

        Try.of(() -> file.toAbsolutePath().getParent())
                .andThenTry(Files::createDirectories)
                // LockableFileWriter deals with several processes writing the same file
                .flatMap(dir -> Try.withResources(() -> new LockableFileWriter.Builder().setFile(file.toFile()).setAppend(false).get())
                        .of(writer -> {
                            writer.write(json);
                            return json;
                        }))
                .mapFailure(API.Case(API.$(), ex -> new LocalStorageFailure("Failed to save the filter presets to " + file, ex)))
                .get();
    }
}
