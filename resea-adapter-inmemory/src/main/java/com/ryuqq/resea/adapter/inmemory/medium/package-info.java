/**
 * In-memory storage medium adapter.
 *
 * <p>Provides {@link com.ryuqq.resea.adapter.inmemory.medium.InMemoryStorageMedium}, a
 * {@link com.ryuqq.resea.core.spi.StorageMedium} kept in process memory.</p>
 *
 * @since 1.0.0
 * @author Resea Team
 */
package com.ryuqq.resea.adapter.inmemory.medium;
