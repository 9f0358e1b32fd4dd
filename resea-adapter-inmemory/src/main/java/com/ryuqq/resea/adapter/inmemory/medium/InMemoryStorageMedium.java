package com.ryuqq.resea.adapter.inmemory.medium;

import com.ryuqq.resea.core.spi.StorageMedium;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of {@link StorageMedium} SPI for testing and reference purposes.
 *
 * <p>This implementation provides thread-safe key/value operations using
 * {@link ConcurrentHashMap} for O(1) access.</p>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Data lost on process restart</li>
 *   <li>Two registries in the same process can share one instance to simulate a restart</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * StorageMedium medium = new InMemoryStorageMedium();
 * Registry registry = Registries.createRegistry()
 *     .use(new PersistencePlugin(medium));
 * </pre>
 *
 * @author Resea Team
 * @since 1.0.0
 */
public class InMemoryStorageMedium implements StorageMedium {

    private final ConcurrentHashMap<String, String> entries;

    /**
     * Creates an empty medium.
     */
    public InMemoryStorageMedium() {
        this.entries = new ConcurrentHashMap<>();
    }

    /**
     * Creates a medium pre-populated with the given entries.
     *
     * @param initial initial key/value entries
     * @throws IllegalArgumentException if initial is null
     */
    public InMemoryStorageMedium(Map<String, String> initial) {
        if (initial == null) {
            throw new IllegalArgumentException("initial cannot be null");
        }
        this.entries = new ConcurrentHashMap<>(initial);
    }

    @Override
    public Optional<String> get(String key) {
        validateKey(key);
        return Optional.ofNullable(entries.get(key));
    }

    @Override
    public void set(String key, String value) {
        validateKey(key);
        if (value == null) {
            throw new IllegalArgumentException("value cannot be null");
        }
        entries.put(key, value);
    }

    @Override
    public void remove(String key) {
        validateKey(key);
        entries.remove(key);
    }

    /**
     * Returns the number of stored keys.
     *
     * @return entry count
     */
    public int size() {
        return entries.size();
    }

    /**
     * Clears all stored entries.
     *
     * <p>This method is useful for test cleanup.</p>
     */
    public void clear() {
        entries.clear();
    }

    private static void validateKey(String key) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("key cannot be null or blank");
        }
    }
}
