package com.ryuqq.resea.core.state;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * CopyOnWriteDraft 테스트.
 *
 * @author Resea Team
 * @since 1.0.0
 */
class CopyOnWriteDraftTest {

    private final Map<String, Object> base = Map.of(
        "user", Map.of("name", "kim", "age", 30),
        "todos", List.of("a", "b"),
        "count", 0
    );

    @Test
    void set_NestedPath_LeavesBaseUntouched() {
        // Given
        CopyOnWriteDraft draft = new CopyOnWriteDraft(base);

        // When
        draft.set("user.age", 31);

        // Then
        assertEquals(Integer.valueOf(31), draft.get("user.age"));
        assertEquals(31, ((Map<?, ?>) draft.snapshot().get("user")).get("age"));
        assertEquals(30, ((Map<?, ?>) base.get("user")).get("age"));
        assertEquals(Set.of("user"), draft.touchedKeys());
    }

    @Test
    void set_UntouchedKeys_AreShared() {
        // Given
        CopyOnWriteDraft draft = new CopyOnWriteDraft(base);

        // When
        draft.set("count", 1);

        // Then
        assertSame(base.get("user"), draft.snapshot().get("user"));
        assertSame(base.get("todos"), draft.snapshot().get("todos"));
    }

    @Test
    void append_ExistingAndMissingArray() {
        // Given
        CopyOnWriteDraft draft = new CopyOnWriteDraft(base);

        // When
        draft.append("todos", "c");
        draft.append("tags", "new");

        // Then
        assertEquals(List.of("a", "b", "c"), draft.snapshot().get("todos"));
        assertEquals(List.of("new"), draft.snapshot().get("tags"));
        assertEquals(List.of("a", "b"), base.get("todos"));
    }

    @Test
    void append_NonArrayValue_ThrowsException() {
        CopyOnWriteDraft draft = new CopyOnWriteDraft(base);

        assertThrows(IllegalStateException.class, () -> draft.append("count", 1));
    }

    @Test
    void remove_TopLevelAndNestedAndIndex() {
        // Given
        CopyOnWriteDraft draft = new CopyOnWriteDraft(base);

        // When
        draft.remove("count");
        draft.remove("user.age");
        draft.remove("todos[0]");

        // Then
        Map<String, Object> snapshot = draft.snapshot();
        assertFalse(snapshot.containsKey("count"));
        assertEquals(Map.of("name", "kim"), snapshot.get("user"));
        assertEquals(List.of("b"), snapshot.get("todos"));
        assertEquals(Set.of("count", "user", "todos"), draft.touchedKeys());
    }

    @Test
    void remove_MissingTopLevelKey_NotTouched() {
        // Given
        CopyOnWriteDraft draft = new CopyOnWriteDraft(base);

        // When
        draft.remove("missing");

        // Then
        assertTrue(draft.touchedKeys().isEmpty());
    }

    @Test
    void snapshot_IsImmutable() {
        CopyOnWriteDraft draft = new CopyOnWriteDraft(base);

        assertThrows(UnsupportedOperationException.class, () -> draft.snapshot().put("x", 1));
    }

    @Test
    void constructor_NullBase_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> new CopyOnWriteDraft(null));
    }
}
