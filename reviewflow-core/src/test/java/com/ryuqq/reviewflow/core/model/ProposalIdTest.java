package com.ryuqq.reviewflow.core.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ProposalId / EscalationId 생성 테스트.
 *
 * @author ReviewFlow Team
 * @since 1.0.0
 */
class ProposalIdTest {

    @Test
    void random_GeneratesPrefixedUniqueIds() {
        // When
        ProposalId first = ProposalId.random();
        ProposalId second = ProposalId.random();

        // Then
        assertTrue(first.getValue().startsWith("prop-"));
        assertNotEquals(first, second);
    }

    @Test
    void escalationRandom_GeneratesPrefixedId() {
        assertTrue(EscalationId.random().getValue().startsWith("esc-"));
    }

    @Test
    void entryId_InvalidCharacters_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> EntryId.of("RULE 004"));
    }
}
