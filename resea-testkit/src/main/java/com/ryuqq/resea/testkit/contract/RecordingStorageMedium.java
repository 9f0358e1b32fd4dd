package com.ryuqq.resea.testkit.contract;

import com.ryuqq.resea.core.spi.StorageException;
import com.ryuqq.resea.core.spi.StorageMedium;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Test double {@link StorageMedium} that records every write and can simulate failures.
 *
 * <p><strong>Usage:</strong></p>
 * <pre>
 * RecordingStorageMedium medium = new RecordingStorageMedium();
 * medium.failWrites(true);   // subsequent set() calls throw StorageException
 * ...
 * assertEquals(2, medium.writes().size());
 * </pre>
 *
 * @author Resea Team
 * @since 1.0.0
 */
public class RecordingStorageMedium implements StorageMedium {

    private final Map<String, String> entries = new ConcurrentHashMap<>();
    private final List<Write> writes = Collections.synchronizedList(new ArrayList<>());
    private volatile boolean failReads;
    private volatile boolean failWrites;

    /**
     * A recorded {@code set} call.
     *
     * @param key the storage key
     * @param value the written value
     */
    public record Write(String key, String value) {
    }

    @Override
    public Optional<String> get(String key) {
        validateKey(key);
        if (failReads) {
            throw new StorageException("Simulated read failure for key: " + key);
        }
        return Optional.ofNullable(entries.get(key));
    }

    @Override
    public void set(String key, String value) {
        validateKey(key);
        if (value == null) {
            throw new IllegalArgumentException("value cannot be null");
        }
        if (failWrites) {
            throw new StorageException("Simulated write failure for key: " + key);
        }
        entries.put(key, value);
        writes.add(new Write(key, value));
    }

    @Override
    public void remove(String key) {
        validateKey(key);
        if (failWrites) {
            throw new StorageException("Simulated write failure for key: " + key);
        }
        entries.remove(key);
    }

    /**
     * Seeds a value without recording it as a write.
     *
     * @param key the storage key
     * @param value the value
     * @return this medium
     */
    public RecordingStorageMedium seed(String key, String value) {
        entries.put(key, value);
        return this;
    }

    public void failReads(boolean failReads) {
        this.failReads = failReads;
    }

    public void failWrites(boolean failWrites) {
        this.failWrites = failWrites;
    }

    /**
     * Returns the successful writes in call order.
     *
     * @return snapshot of recorded writes
     */
    public List<Write> writes() {
        synchronized (writes) {
            return List.copyOf(writes);
        }
    }

    /**
     * Returns the last value successfully written under the key.
     *
     * @param key the storage key
     * @return last written value, or empty if the key was never written
     */
    public Optional<String> lastWrite(String key) {
        List<Write> snapshot = writes();
        for (int i = snapshot.size() - 1; i >= 0; i--) {
            if (snapshot.get(i).key().equals(key)) {
                return Optional.of(snapshot.get(i).value());
            }
        }
        return Optional.empty();
    }

    public void clear() {
        entries.clear();
        writes.clear();
    }

    private static void validateKey(String key) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("key cannot be null or blank");
        }
    }
}
