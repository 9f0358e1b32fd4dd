/**
 * Service Provider Interface (SPI) package.
 *
 * <p>This package defines the interfaces that persistence adapters implement so that
 * store state can survive process restarts.</p>
 *
 * <h2>SPI Interfaces</h2>
 * <ul>
 *   <li>{@link com.ryuqq.resea.core.spi.StorageMedium} - Key/value medium holding serialized state</li>
 *   <li>{@link com.ryuqq.resea.core.spi.StateCodec} - State tree ↔ structured text conversion</li>
 *   <li>{@link com.ryuqq.resea.core.spi.PersistOptions} - Per-store persistence configuration</li>
 * </ul>
 *
 * <h2>Implementation Responsibility</h2>
 * <p>Adapter modules (resea-adapter-inmemory, resea-adapter-persistence) provide concrete
 * implementations. Implementations signal failures with
 * {@link com.ryuqq.resea.core.spi.StorageException} and
 * {@link com.ryuqq.resea.core.spi.StateCodecException}; the persistence layer treats both as recoverable.</p>
 *
 * @since 1.0.0
 * @author Resea Team
 */
package com.ryuqq.resea.core.spi;
