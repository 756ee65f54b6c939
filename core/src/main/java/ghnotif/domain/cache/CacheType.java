package ghnotif.domain.cache;

import ghnotif.domain.exceptions.ConfigurationFailure;
import org.apache.commons.lang3.StringUtils;

import java.util.Arrays;

public enum CacheType {
    /**
     * Every lookup misses and every write is discarded.
     */
    NULL("null", "none"),
    /**
     * A volatile map held in this process.
     */
    MEMORY("memory"),
    /**
     * An embedded H2 database, one table per bucket.
     */
    H2("h2", "bolt"),
    /**
     * An embedded RocksDB store, one column family per bucket.
     */
    ROCKSDB("rocksdb", "badger");

    private final String[] names;

    CacheType(final String... names) {
        this.names = names;
    }

    public static CacheType fromName(final String name) {
        final String trimmed = StringUtils.trimToEmpty(name);
        return Arrays.stream(values())
                .filter(type -> Arrays.stream(type.names).anyMatch(trimmed::equalsIgnoreCase))
                .findFirst()
                .orElseThrow(() -> new ConfigurationFailure("Unknown cache type " + name
                        + ", expected one of null, memory, h2 or rocksdb"));
    }
}
