package ghnotif.domain.cache;

import ghnotif.domain.exceptions.LocalStorageFailure;
import ghnotif.domain.json.JsonDeserializer;
import io.vavr.API;
import io.vavr.control.Try;
import org.apache.commons.codec.digest.DigestUtils;

import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.Statement;
import java.time.Clock;
import java.util.Locale;
import java.util.Optional;
import java.util.logging.Logger;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * A cache backed by an embedded H2 database. H2 is a single writer store, so every statement runs while
 * holding this instance's monitor. Each bucket is a table holding the JSON envelope of each key, keyed by the
 * SHA-256 hash of the key so that keys of any length fit the primary key column.
 */
public class H2Cache extends PersistentCache {
    private static final Logger logger = Logger.getLogger(H2Cache.class.getName());
    private static final String DATABASE_NAME = "ghnotif";

    private final Connection connection;
    private final String table;

    public H2Cache(final Path directory, final String bucket, final JsonDeserializer jsonDeserializer, final int prefetchQueueSize) {
        this(directory, bucket, jsonDeserializer, prefetchQueueSize, Clock.systemUTC());
    }

    public H2Cache(final Path directory, final String bucket, final JsonDeserializer jsonDeserializer, final int prefetchQueueSize, final Clock clock) {
        super("h2", jsonDeserializer, clock, prefetchQueueSize);

        try {
            checkArgument(bucket.matches("[A-Za-z0-9_]+"), "bucket may only contain letters, digits and underscores");

            this.table = "BUCKET_" + bucket.toUpperCase(Locale.ROOT);
            this.connection = Try.of(() -> Files.createDirectories(directory))
                    .mapTry(dir -> DriverManager.getConnection(getConnectionString(dir)))
                    .andThenTry(this::createTable)
                    .mapFailure(API.Case(API.$(), ex -> new LocalStorageFailure("Failed to open the H2 cache in " + directory, ex)))
                    .get();
        } catch (final RuntimeException ex) {
            abandon();
            throw ex;
        }

        logger.info("Opened the H2 cache bucket " + bucket + " in " + directory);
    }

    private static String getConnectionString(final Path directory) {
        return "jdbc:h2:file:" + directory.resolve(DATABASE_NAME).toAbsolutePath();
    }

    private void createTable(final Connection connection) throws Exception {
        try (Statement statement = connection.createStatement()) {
            statement.execute("CREATE TABLE IF NOT EXISTS " + table + """
                     (key_hash CHAR(64) NOT NULL PRIMARY KEY,
                    payload CLOB NOT NULL)""".stripIndent().replaceAll("\n", ""));
        }
    }

    @Override
    protected synchronized Optional<String> read(final String key) throws Exception {
        try (PreparedStatement statement = connection.prepareStatement("SELECT payload FROM " + table + " WHERE key_hash = ?")) {
            statement.setString(1, DigestUtils.sha256Hex(key));
            try (ResultSet resultSet = statement.executeQuery()) {
                return resultSet.next()
                        ? Optional.of(resultSet.getString(1))
                        : Optional.empty();
            }
        }
    }

    @Override
    protected synchronized void write(final String key, final String value) throws Exception {
        try (PreparedStatement statement = connection.prepareStatement("MERGE INTO " + table + " (key_hash, payload) KEY (key_hash) VALUES (?, ?)")) {
            statement.setString(1, DigestUtils.sha256Hex(key));
            statement.setString(2, value);
            statement.executeUpdate();
        }
    }

    @Override
    protected synchronized void remove(final String key) throws Exception {
        try (PreparedStatement statement = connection.prepareStatement("DELETE FROM " + table + " WHERE key_hash = ?")) {
            statement.setString(1, DigestUtils.sha256Hex(key));
            statement.executeUpdate();
        }
    }

    @Override
    protected synchronized void recreateBucket() throws Exception {
        try (Statement statement = connection.createStatement()) {
            statement.execute("DROP TABLE IF EXISTS " + table);
        }
        createTable(connection);
    }

    @Override
    protected synchronized long count() throws Exception {
        try (Statement statement = connection.createStatement();
             ResultSet resultSet = statement.executeQuery("SELECT COUNT(*) FROM " + table)) {
            return resultSet.next() ? resultSet.getLong(1) : 0;
        }
    }

    @Override
    protected synchronized void closeStorage() throws Exception {
        connection.close();
    }
}
