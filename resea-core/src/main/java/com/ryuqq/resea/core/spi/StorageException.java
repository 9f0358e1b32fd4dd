package com.ryuqq.resea.core.spi;

/**
 * Raised by {@link StorageMedium} implementations when the medium is unavailable.
 *
 * <p>Persistence is a best-effort side channel: the persistence adapter catches this
 * exception, logs it and keeps the store running in memory.</p>
 *
 * @author Resea Team
 * @since 1.0.0
 */
public class StorageException extends RuntimeException {

    public StorageException(String message) {
        super(message);
    }

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
