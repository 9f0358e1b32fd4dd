package com.ryuqq.resea.core.spi;

/**
 * Raised by {@link StateCodec} implementations for unserializable state or malformed stored data.
 *
 * @author Resea Team
 * @since 1.0.0
 */
public class StateCodecException extends RuntimeException {

    public StateCodecException(String message) {
        super(message);
    }

    public StateCodecException(String message, Throwable cause) {
        super(message, cause);
    }
}
