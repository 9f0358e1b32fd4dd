package com.ryuqq.resea.core.spi;

import java.util.Map;
import java.util.function.Function;

/**
 * Serialization SPI between store state trees and the text stored in a {@link StorageMedium}.
 *
 * <p>The default implementation is the Jackson based codec of the persistence adapter.
 * Stores may override both directions through {@link PersistOptions#withCodec(StateCodec)}.</p>
 *
 * @author Resea Team
 * @since 1.0.0
 */
public interface StateCodec {

    /**
     * Serializes a state tree.
     *
     * @param state the state (or persisted subset) to serialize
     * @return the serialized text
     * @throws StateCodecException if the state cannot be serialized
     */
    String serialize(Map<String, Object> state);

    /**
     * Deserializes text previously produced by {@link #serialize(Map)}.
     *
     * @param text the stored text
     * @return the decoded state tree
     * @throws StateCodecException if the text is malformed
     */
    Map<String, Object> deserialize(String text);

    /**
     * Adapts a pair of functions to a codec.
     *
     * @param serializer state to text
     * @param deserializer text to state
     * @return codec delegating to the given functions
     * @throws IllegalArgumentException if either function is null
     */
    static StateCodec of(Function<Map<String, Object>, String> serializer,
                         Function<String, Map<String, Object>> deserializer) {
        if (serializer == null) {
            throw new IllegalArgumentException("serializer cannot be null");
        }
        if (deserializer == null) {
            throw new IllegalArgumentException("deserializer cannot be null");
        }
        return new StateCodec() {
            @Override
            public String serialize(Map<String, Object> state) {
                return serializer.apply(state);
            }

            @Override
            public Map<String, Object> deserialize(String text) {
                return deserializer.apply(text);
            }
        };
    }
}
