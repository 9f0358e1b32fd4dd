package com.ryuqq.resea.core.spi;

import java.util.Optional;

/**
 * Durable key/value medium SPI for store persistence.
 *
 * <p>This interface is the only contract the persistence adapter relies on.
 * How and where values are kept is entirely up to the implementation.</p>
 *
 * <p><strong>Responsibilities:</strong></p>
 * <ul>
 *   <li>Reading a previously written value by key</li>
 *   <li>Writing (overwriting) a value by key</li>
 *   <li>Removing a value by key</li>
 * </ul>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Last write wins: {@code set} replaces any previous value for the key</li>
 *   <li>Idempotent removal: removing an absent key is not an error</li>
 *   <li>Failures are reported as {@link StorageException}, never as checked exceptions</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * StorageMedium medium = new InMemoryStorageMedium();
 * medium.set("resea_cart", "{\"items\":[]}");
 * Optional&lt;String&gt; saved = medium.get("resea_cart");
 * </pre>
 *
 * @author Resea Team
 * @since 1.0.0
 */
public interface StorageMedium {

    /**
     * Reads the value stored under the given key.
     *
     * @param key the storage key
     * @return the stored value, or empty if nothing is stored under the key
     * @throws IllegalArgumentException if key is null or blank
     * @throws StorageException if the medium cannot be read
     */
    Optional<String> get(String key);

    /**
     * Writes a value under the given key, replacing any previous value.
     *
     * @param key the storage key
     * @param value the value to store
     * @throws IllegalArgumentException if key is null or blank, or value is null
     * @throws StorageException if the medium cannot be written
     */
    void set(String key, String value);

    /**
     * Removes the value stored under the given key.
     *
     * @param key the storage key
     * @throws IllegalArgumentException if key is null or blank
     * @throws StorageException if the medium cannot be written
     */
    void remove(String key);
}
