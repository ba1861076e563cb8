package com.ryuqq.reviewflow.core.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Phase 안전 우선순위 계산 테스트.
 *
 * @author ReviewFlow Team
 * @since 1.0.0
 */
class ConcernTest {

    @Test
    void priorityFor_ThreePhases_EarlyMidLate() {
        assertEquals(Concern.TESTABILITY, Concern.priorityFor(1, 3));
        assertEquals(Concern.FIDELITY, Concern.priorityFor(2, 3));
        assertEquals(Concern.QUALITY, Concern.priorityFor(3, 3));
    }

    @Test
    void priorityFor_SixPhases_TwoPhasesPerBand() {
        assertEquals(Concern.TESTABILITY, Concern.priorityFor(2, 6));
        assertEquals(Concern.FIDELITY, Concern.priorityFor(3, 6));
        assertEquals(Concern.FIDELITY, Concern.priorityFor(4, 6));
        assertEquals(Concern.QUALITY, Concern.priorityFor(6, 6));
    }

    @Test
    void priorityFor_SinglePhase_Testability() {
        assertEquals(Concern.TESTABILITY, Concern.priorityFor(1, 1));
    }
}
