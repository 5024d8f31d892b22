package io.github.cyfko.taskql.core.exception;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class FilterValidationExceptionTest {

    @Test
    @DisplayName("Should create FilterValidationException with message")
    void shouldCreateWithMessage() {
        // Given
        String message = "Group must have a valid conjunction (and/or)";

        // When
        FilterValidationException exception = new FilterValidationException(message);

        // Then
        assertEquals(message, exception.getMessage());
        assertNull(exception.getNodeId());
        assertNull(exception.getField());
        assertNull(exception.getCause());
    }

    @Test
    @DisplayName("Should carry the offending node id and field")
    void shouldCarryNodeIdAndField() {
        // When
        FilterValidationException exception =
                new FilterValidationException("Unknown property 'colour'", "filter_1", "colour");

        // Then
        assertEquals("Unknown property 'colour'", exception.getMessage());
        assertEquals("filter_1", exception.getNodeId());
        assertEquals("colour", exception.getField());
    }

    @Test
    @DisplayName("Should create FilterValidationException with message and cause")
    void shouldCreateWithMessageAndCause() {
        // Given
        Throwable cause = new IllegalArgumentException("Unknown sort key: size");

        // When
        FilterValidationException exception = new FilterValidationException("Invalid saved view", cause);

        // Then
        assertEquals("Invalid saved view", exception.getMessage());
        assertSame(cause, exception.getCause());
    }

    @Test
    @DisplayName("Should handle null message and cause")
    void shouldHandleNulls() {
        FilterValidationException exception = new FilterValidationException(null, null);

        assertNull(exception.getMessage());
        assertNull(exception.getCause());
    }

    @Test
    @DisplayName("Should be an unchecked exception")
    void shouldBeUnchecked() {
        assertInstanceOf(RuntimeException.class, new FilterValidationException("test"));
    }
}
