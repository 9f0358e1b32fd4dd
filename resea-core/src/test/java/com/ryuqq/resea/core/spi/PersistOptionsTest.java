package com.ryuqq.resea.core.spi;

import com.ryuqq.resea.core.model.StoreId;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * PersistOptions / StateCodec 테스트.
 *
 * @author Resea Team
 * @since 1.0.0
 */
class PersistOptionsTest {

    @Test
    void defaults_UsesPrefixedStoreKey() {
        // Given
        PersistOptions options = PersistOptions.defaults();

        // Then
        assertEquals("resea_cart", options.resolveKey(StoreId.of("cart")));
        assertTrue(options.paths().isEmpty());
        assertNull(options.codec());
        assertNull(options.medium());
        assertFalse(options.hydrateInitial());
    }

    @Test
    void withKey_ExplicitKey_OverridesPrefix() {
        PersistOptions options = PersistOptions.defaults().withKey("app-cart");

        assertEquals("app-cart", options.resolveKey(StoreId.of("cart")));
    }

    @Test
    void constructor_BlankKey_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> PersistOptions.defaults().withKey("  "));
    }

    @Test
    void withPaths_BracketPaths_AreNormalized() {
        PersistOptions options = PersistOptions.defaults().withPaths(List.of("items[0].id", "user.name"));

        assertEquals(List.of("items.0.id", "user.name"), options.paths());
    }

    @Test
    void withMethods_KeepOtherFields() {
        // Given
        StateCodec codec = StateCodec.of(state -> "", text -> Map.of());

        // When
        PersistOptions options = PersistOptions.defaults()
            .withKey("k")
            .withCodec(codec)
            .withHydrateInitial(true);

        // Then
        assertEquals("k", options.key());
        assertSame(codec, options.codec());
        assertTrue(options.hydrateInitial());
    }

    @Test
    void stateCodecOf_DelegatesToFunctions() {
        // Given
        StateCodec codec = StateCodec.of(state -> "count=" + state.get("count"), text -> Map.of("raw", text));

        // Then
        assertEquals("count=3", codec.serialize(Map.of("count", 3)));
        assertEquals(Map.of("raw", "x"), codec.deserialize("x"));
    }

    @Test
    void stateCodecOf_NullFunction_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> StateCodec.of(null, text -> Map.of()));
        assertThrows(IllegalArgumentException.class, () -> StateCodec.of(state -> "", null));
    }
}
