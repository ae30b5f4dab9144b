package com.ryuqq.conductor.core.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * WorkUnitId Value Object 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class WorkUnitIdTest {

    @Test
    void of_ValidValueWithColon_CreatesId() {
        // Given
        String value = "conv:42:wu_7-a";

        // When
        WorkUnitId id = WorkUnitId.of(value);

        // Then
        assertEquals(value, id.getValue());
        assertEquals(value, id.toString());
    }

    @Test
    void of_BlankValue_ThrowsException() {
        // When & Then
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> WorkUnitId.of("  ")
        );
        assertTrue(exception.getMessage().contains("cannot be null or blank"));
    }

    @Test
    void of_TooLongValue_ThrowsException() {
        // Given
        String value = "a".repeat(129);

        // When & Then
        assertThrows(IllegalArgumentException.class, () -> WorkUnitId.of(value));
    }

    @Test
    void of_InvalidCharacters_ThrowsException() {
        // When & Then
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> WorkUnitId.of("wu 1/2")
        );
        assertTrue(exception.getMessage().contains("invalid characters"));
    }

    @Test
    void generate_ProducesDistinctPrefixedIds() {
        // When
        WorkUnitId first = WorkUnitId.generate();
        WorkUnitId second = WorkUnitId.generate();

        // Then
        assertTrue(first.getValue().startsWith("wu-"));
        assertNotEquals(first, second);
    }

    @Test
    void equals_SameValue_AreEqual() {
        // When & Then
        assertEquals(WorkUnitId.of("wu-1"), WorkUnitId.of("wu-1"));
        assertEquals(WorkUnitId.of("wu-1").hashCode(), WorkUnitId.of("wu-1").hashCode());
    }
}
