package ghnotif.domain.cache;

import ghnotif.domain.exceptions.LocalStorageFailure;
import ghnotif.domain.json.JsonDeserializer;
import io.vavr.API;
import io.vavr.control.Try;
import org.rocksdb.ColumnFamilyDescriptor;
import org.rocksdb.ColumnFamilyHandle;
import org.rocksdb.ColumnFamilyOptions;
import org.rocksdb.DBOptions;
import org.rocksdb.Options;
import org.rocksdb.RocksDB;
import org.rocksdb.RocksIterator;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.logging.Logger;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * A cache backed by an embedded RocksDB store. Each bucket is a column family, so clearing the cache drops
 * and recreates the column family. RocksDB handles concurrent reads and writes itself; the lock only keeps
 * operations away from the column family handle while it is being replaced.
 */
public class RocksDbCache extends PersistentCache {
    private static final Logger logger = Logger.getLogger(RocksDbCache.class.getName());

    static {
        RocksDB.loadLibrary();
    }

    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final DBOptions options;
    private final ColumnFamilyOptions columnFamilyOptions;
    private final List<ColumnFamilyHandle> handles = new ArrayList<>();
    private final byte[] bucketName;
    private final RocksDB db;
    private ColumnFamilyHandle bucketHandle;

    public RocksDbCache(final Path directory, final String bucket, final JsonDeserializer jsonDeserializer, final int prefetchQueueSize) {
        this(directory, bucket, jsonDeserializer, prefetchQueueSize, Clock.systemUTC());
    }

    public RocksDbCache(final Path directory, final String bucket, final JsonDeserializer jsonDeserializer, final int prefetchQueueSize, final Clock clock) {
        super("rocksdb", jsonDeserializer, clock, prefetchQueueSize);

        try {
            checkArgument(bucket.matches("[A-Za-z0-9_]+"), "bucket may only contain letters, digits and underscores");

            this.bucketName = bucket.getBytes(StandardCharsets.UTF_8);
            this.options = new DBOptions().setCreateIfMissing(true).setCreateMissingColumnFamilies(true);
            this.columnFamilyOptions = new ColumnFamilyOptions();

            final List<ColumnFamilyDescriptor> descriptors = columnFamilies(directory).stream()
                    .map(name -> new ColumnFamilyDescriptor(name, columnFamilyOptions))
                    .toList();

            this.db = Try.of(() -> Files.createDirectories(directory))
                    .mapTry(dir -> RocksDB.open(options, dir.toAbsolutePath().toString(), descriptors, handles))
                    .onFailure(ex -> {
                        columnFamilyOptions.close();
                        options.close();
                    })
                    .mapFailure(API.Case(API.$(), ex -> new LocalStorageFailure("Failed to open the RocksDB cache in " + directory, ex)))
                    .get();

            this.bucketHandle = handles.stream()
                    .filter(handle -> Try.of(handle::getName).map(name -> Arrays.equals(name, bucketName)).getOrElse(false))
                    .findFirst()
                    .orElse(null);

            if (bucketHandle == null) {
                closeStorage();
                throw new LocalStorageFailure("RocksDB did not open the column family " + bucket);
            }
        } catch (final RuntimeException ex) {
            abandon();
            throw ex;
        }

        logger.info("Opened the RocksDB cache bucket " + bucket + " in " + directory);
    }

    /**
     * RocksDB must open every existing column family, plus the one for this bucket.
     */
    private List<byte[]> columnFamilies(final Path directory) {
        final List<byte[]> existing = Try.withResources(Options::new)
                .of(listOptions -> RocksDB.listColumnFamilies(listOptions, directory.toAbsolutePath().toString()))
                .getOrElse(List.of());

        final List<byte[]> names = new ArrayList<>(existing);
        if (names.stream().noneMatch(name -> Arrays.equals(name, RocksDB.DEFAULT_COLUMN_FAMILY))) {
            names.add(0, RocksDB.DEFAULT_COLUMN_FAMILY);
        }
        if (names.stream().noneMatch(name -> Arrays.equals(name, bucketName))) {
            names.add(bucketName);
        }
        return names;
    }

    @Override
    protected Optional<String> read(final String key) throws Exception {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(db.get(bucketHandle, bytes(key)))
                    .map(value -> new String(value, StandardCharsets.UTF_8));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    protected void write(final String key, final String value) throws Exception {
        lock.readLock().lock();
        try {
            db.put(bucketHandle, bytes(key), bytes(value));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    protected void remove(final String key) throws Exception {
        lock.readLock().lock();
        try {
            db.delete(bucketHandle, bytes(key));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    protected void recreateBucket() throws Exception {
        lock.writeLock().lock();
        try {
            db.dropColumnFamily(bucketHandle);
            handles.remove(bucketHandle);
            bucketHandle.close();
            bucketHandle = db.createColumnFamily(new ColumnFamilyDescriptor(bucketName, columnFamilyOptions));
            handles.add(bucketHandle);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Walks the bucket, since the key estimate RocksDB keeps is not exact after overwrites and deletes.
     */
    @Override
    protected long count() throws Exception {
        lock.readLock().lock();
        try {
            long count = 0;
            try (RocksIterator iterator = db.newIterator(bucketHandle)) {
                for (iterator.seekToFirst(); iterator.isValid(); iterator.next()) {
                    count++;
                }
            }
            return count;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    protected void closeStorage() {
        lock.writeLock().lock();
        try {
            handles.forEach(ColumnFamilyHandle::close);
            handles.clear();
            db.close();
            columnFamilyOptions.close();
            options.close();
        } finally {
            lock.writeLock().unlock();
        }
    }

    private static byte[] bytes(final String value) {
        return value.getBytes(StandardCharsets.UTF_8);
    }
}
