package com.ryuqq.resea.adapter.persistence.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.ryuqq.resea.core.spi.StateCodec;
import com.ryuqq.resea.core.spi.StateCodecException;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * JSON {@link StateCodec} backed by Jackson.
 *
 * <p><b>Key settings</b></p>
 * <ul>
 *   <li>{@link JavaTimeModule}: {@code java.time.*} values in state are written as ISO-8601 strings.</li>
 *   <li>{@code WRITE_DATES_AS_TIMESTAMPS = false}: no numeric timestamps.</li>
 *   <li>The stored document must be a JSON object; arrays or scalars at the root are rejected.</li>
 * </ul>
 *
 * <p>Decoded numbers come back as {@code Integer}, {@code Long} or {@code Double} and objects
 * as insertion-ordered maps.</p>
 *
 * @author Resea Team
 * @since 1.0.0
 */
public class JacksonStateCodec implements StateCodec {

    private static final TypeReference<LinkedHashMap<String, Object>> STATE_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper mapper;

    /**
     * Creates a codec with the default mapper.
     */
    public JacksonStateCodec() {
        this(defaultMapper());
    }

    /**
     * Creates a codec around a caller-configured mapper.
     *
     * @param mapper the mapper to use
     * @throws IllegalArgumentException if mapper is null
     */
    public JacksonStateCodec(ObjectMapper mapper) {
        if (mapper == null) {
            throw new IllegalArgumentException("mapper cannot be null");
        }
        this.mapper = mapper;
    }

    /**
     * Builds the default mapper.
     *
     * @return a new mapper with java.time support and ISO-8601 dates
     */
    public static ObjectMapper defaultMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }

    @Override
    public String serialize(Map<String, Object> state) {
        if (state == null) {
            throw new IllegalArgumentException("state cannot be null");
        }
        try {
            return mapper.writeValueAsString(state);
        } catch (JsonProcessingException e) {
            throw new StateCodecException("Failed to serialize state: " + e.getOriginalMessage(), e);
        }
    }

    @Override
    public Map<String, Object> deserialize(String text) {
        if (text == null) {
            throw new IllegalArgumentException("text cannot be null");
        }
        JsonNode root;
        try {
            root = mapper.readTree(text);
        } catch (JsonProcessingException e) {
            throw new StateCodecException("Malformed stored state: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new StateCodecException(
                "Stored state must be a JSON object (found: " + (root == null ? "nothing" : root.getNodeType()) + ")"
            );
        }
        return mapper.convertValue(root, STATE_TYPE);
    }
}
