package com.ryuqq.reviewflow.core.escalation;

import com.ryuqq.reviewflow.core.model.Payload;
import com.ryuqq.reviewflow.core.model.WorkItemId;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class EscalationTest {

    private final Instant now = Instant.parse("2026-01-01T00:00:00Z");

    @Test
    void raise_CreatesPendingEscalation() {
        // When
        Escalation escalation = Escalation.raise(SubjectKind.PROPOSAL, "prop-1", WorkItemId.of("item-1"),
            EscalationReason.VOTE_TIMEOUT, "missing ARCHITECT", List.of(), now);

        // Then
        assertTrue(escalation.isPending());
        assertTrue(escalation.outcome().isEmpty());
        assertEquals(WorkItemId.of("item-1"), escalation.dependentWorkItem().orElseThrow());
    }

    @Test
    void resolve_Twice_ThrowsException() {
        // Given
        Escalation resolved = Escalation.raise(SubjectKind.PROPOSAL, "prop-1", null,
            EscalationReason.CONSENSUS_DEADLOCK, "", List.of(), now)
            .resolve(EscalationDecision.approve("go"), now);

        // When & Then
        assertFalse(resolved.isPending());
        assertThrows(IllegalStateException.class,
            () -> resolved.resolve(EscalationDecision.reject("no"), now));
    }

    @Test
    void decision_RejectWithReplacement_ThrowsException() {
        assertThrows(IllegalArgumentException.class,
            () -> new EscalationDecision(EscalationVerdict.REJECT, "no", Payload.of("x")));
    }
}
