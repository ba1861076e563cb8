package com.ryuqq.reviewflow.core.exception;

import com.ryuqq.reviewflow.core.model.CriterionDefinition;
import com.ryuqq.reviewflow.core.model.CriterionKind;
import com.ryuqq.reviewflow.core.model.EntryId;
import com.ryuqq.reviewflow.core.model.GateCriterion;
import com.ryuqq.reviewflow.core.model.WorkItemId;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 오류 코드와 메시지 테스트.
 *
 * @author ReviewFlow Team
 * @since 1.0.0
 */
class ReviewFlowExceptionTest {

    @Test
    void gateNotSatisfied_ListsUnmetCriteria() {
        // Given
        GateCriterion unmet = GateCriterion.unsatisfied(
            new CriterionDefinition("coverage", "Coverage attached", CriterionKind.MANUAL));

        // When
        GateNotSatisfiedException exception = new GateNotSatisfiedException(2, List.of(unmet));

        // Then
        assertEquals("GATE-001", exception.getErrorCode());
        assertEquals(2, exception.getPhase());
        assertEquals(List.of(unmet), exception.getUnmetCriteria());
        assertTrue(exception.getMessage().contains("[coverage]"));
    }

    @Test
    void errorCodes_AreStable() {
        assertEquals("ROUTE-001", new DuplicateSubmissionException(WorkItemId.of("i"), "x").getErrorCode());
        assertEquals("CAT-001", new CatalogueLockViolationException(EntryId.of("R"), 1, "x").getErrorCode());
        assertEquals("CHRON-001",
            new IncompleteReviewRecordException(com.ryuqq.reviewflow.core.model.ProposalId.of("p"), "x").getErrorCode());
        assertEquals("REVIEW-001",
            new ConsensusDeadlockException(com.ryuqq.reviewflow.core.model.ProposalId.of("p"), 2, "x").getErrorCode());
    }
}
