package com.ryuqq.resea.core.model;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ActionEvent 테스트.
 *
 * @author Resea Team
 * @since 1.0.0
 */
class ActionEventTest {

    private static final StoreId STORE = StoreId.of("counter");

    @Test
    void succeeded_CapturesResultAndDuration() {
        // When
        ActionEvent event = ActionEvent.succeeded(STORE, "add", new Object[]{5}, 5, 100L, 350L);

        // Then
        assertTrue(event.isSuccess());
        assertEquals(5, event.result());
        assertNull(event.error());
        assertEquals(List.of(5), event.args());
        assertEquals(Duration.ofNanos(250L), event.duration());
    }

    @Test
    void failed_CapturesError() {
        // Given
        IOException error = new IOException("disk");

        // When
        ActionEvent event = ActionEvent.failed(STORE, "save", null, error, 0L, 1L);

        // Then
        assertFalse(event.isSuccess());
        assertSame(error, event.error());
        assertNull(event.result());
        assertTrue(event.args().isEmpty());
    }

    @Test
    void failed_NullError_ThrowsException() {
        assertThrows(
            IllegalArgumentException.class,
            () -> ActionEvent.failed(STORE, "save", null, null, 0L, 1L)
        );
    }

    @Test
    void constructor_EndBeforeStart_ThrowsException() {
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> ActionEvent.succeeded(STORE, "add", null, null, 10L, 5L)
        );
        assertTrue(exception.getMessage().contains("endTime"));
    }

    @Test
    void constructor_NanoTimeWrapsAround_AcceptsAndMeasuresElapsed() {
        // Given
        long startTime = Long.MAX_VALUE - 50L;
        long endTime = startTime + 200L;

        // When
        ActionEvent event = ActionEvent.succeeded(STORE, "add", null, null, startTime, endTime);

        // Then
        assertTrue(event.endTime() < event.startTime());
        assertEquals(Duration.ofNanos(200L), event.duration());
    }

    @Test
    void constructor_ResultWithError_ThrowsException() {
        assertThrows(
            IllegalArgumentException.class,
            () -> new ActionEvent(STORE, "add", List.of(), 1, new IllegalStateException(), 0L, 1L)
        );
    }

    @Test
    void args_AreDetachedFromCallerArray() {
        // Given
        Object[] args = {"a", "b"};

        // When
        ActionEvent event = ActionEvent.succeeded(STORE, "concat", args, "ab", 0L, 1L);
        args[0] = "changed";

        // Then
        assertEquals(List.of("a", "b"), event.args());
        assertThrows(UnsupportedOperationException.class, () -> event.args().add("c"));
    }
}
