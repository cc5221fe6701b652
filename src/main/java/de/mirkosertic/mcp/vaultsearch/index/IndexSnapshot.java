package de.mirkosertic.mcp.vaultsearch.index;

import org.jspecify.annotations.Nullable;

import java.util.Map;

/**
 * Immutable point-in-time mapping from secret path to its {@link SecretRecord}.
 * Iteration order is unspecified.
 */
public final class IndexSnapshot {

    public static final IndexSnapshot EMPTY = new IndexSnapshot(Map.of());

    // Rough JVM object sizes, compressed oops
    private static final long MAP_OVERHEAD = 48;
    private static final long ENTRY_OVERHEAD = 32;
    private static final long RECORD_OVERHEAD = 24;
    private static final long LIST_OVERHEAD = 24;
    private static final long REFERENCE_SIZE = 4;
    private static final long STRING_OVERHEAD = 40;

    private final Map<String, SecretRecord> records;
    private final long totalKeys;
    private volatile long estimatedSizeBytes = -1;

    private IndexSnapshot(final Map<String, SecretRecord> records) {
        this.records = records;
        long keys = 0;
        for (final SecretRecord record : records.values()) {
            keys += record.allKeys().size();
        }
        this.totalKeys = keys;
    }

    public static IndexSnapshot of(final Map<String, SecretRecord> records) {
        return records.isEmpty() ? EMPTY : new IndexSnapshot(Map.copyOf(records));
    }

    public Map<String, SecretRecord> records() {
        return records;
    }

    public @Nullable SecretRecord get(final String path) {
        return records.get(path);
    }

    public int size() {
        return records.size();
    }

    public boolean isEmpty() {
        return records.isEmpty();
    }

    public long totalKeys() {
        return totalKeys;
    }

    /**
     * Approximate heap footprint: fixed per-object overheads plus string lengths.
     * Computed once, snapshots never change.
     */
    public long estimatedSizeBytes() {
        long size = estimatedSizeBytes;
        if (size < 0) {
            size = MAP_OVERHEAD;
            for (final Map.Entry<String, SecretRecord> entry : records.entrySet()) {
                size += ENTRY_OVERHEAD + RECORD_OVERHEAD + stringSize(entry.getKey());
                final SecretRecord record = entry.getValue();
                size += LIST_OVERHEAD;
                for (final String key : record.allKeys()) {
                    size += REFERENCE_SIZE + stringSize(key);
                }
                size += stringSize(record.searchString());
            }
            estimatedSizeBytes = size;
        }
        return size;
    }

    private static long stringSize(final String value) {
        return STRING_OVERHEAD + value.length();
    }
}
