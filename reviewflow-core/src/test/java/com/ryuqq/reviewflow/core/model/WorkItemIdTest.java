package com.ryuqq.reviewflow.core.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * WorkItemId Value Object 테스트.
 *
 * @author ReviewFlow Team
 * @since 1.0.0
 */
class WorkItemIdTest {

    @Test
    void of_ValidValue_CreatesWorkItemId() {
        // Given
        String value = "parser.tokenizer-01";

        // When
        WorkItemId id = WorkItemId.of(value);

        // Then
        assertEquals(value, id.getValue());
    }

    @Test
    void of_NullValue_ThrowsException() {
        // When & Then
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> WorkItemId.of(null)
        );
        assertTrue(exception.getMessage().contains("cannot be null"));
    }

    @Test
    void of_BlankValue_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> WorkItemId.of("   "));
    }

    @Test
    void of_TooLongValue_ThrowsException() {
        // Given
        String value = "a".repeat(129);

        // When & Then
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> WorkItemId.of(value)
        );
        assertTrue(exception.getMessage().contains("128"));
    }

    @Test
    void of_InvalidCharacters_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> WorkItemId.of("item/with/slash"));
    }

    @Test
    void equals_SameValue_ReturnsTrue() {
        // Given
        WorkItemId first = WorkItemId.of("item-1");
        WorkItemId second = WorkItemId.of("item-1");

        // When & Then
        assertEquals(first, second);
        assertEquals(first.hashCode(), second.hashCode());
    }

    @Test
    void toString_ContainsValue() {
        assertEquals("WorkItemId{item-1}", WorkItemId.of("item-1").toString());
    }
}
