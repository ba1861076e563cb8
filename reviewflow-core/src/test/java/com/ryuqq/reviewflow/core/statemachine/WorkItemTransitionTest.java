package com.ryuqq.reviewflow.core.statemachine;

import org.junit.jupiter.api.Test;

import static com.ryuqq.reviewflow.core.statemachine.WorkItemStatus.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * WorkItemTransition 테스트.
 *
 * @author ReviewFlow Team
 * @since 1.0.0
 */
class WorkItemTransitionTest {

    @Test
    void validate_NormalFlow_Succeeds() {
        assertDoesNotThrow(() -> WorkItemTransition.validate(PENDING, IN_PROGRESS));
        assertDoesNotThrow(() -> WorkItemTransition.validate(IN_PROGRESS, UNDER_REVIEW));
        assertDoesNotThrow(() -> WorkItemTransition.validate(UNDER_REVIEW, DONE));
    }

    @Test
    void validate_RejectedReview_ReturnsToPending() {
        assertDoesNotThrow(() -> WorkItemTransition.validate(UNDER_REVIEW, PENDING));
    }

    @Test
    void validate_UnderReviewToInProgress_ThrowsException() {
        assertThrows(IllegalStateException.class, () -> WorkItemTransition.validate(UNDER_REVIEW, IN_PROGRESS));
    }

    @Test
    void validate_FromDone_ThrowsException() {
        // When & Then
        IllegalStateException exception = assertThrows(
            IllegalStateException.class,
            () -> WorkItemTransition.validate(DONE, PENDING)
        );
        assertTrue(exception.getMessage().contains("terminal"));
    }

    @Test
    void validate_FromBlocked_OnlyThroughUnblock() {
        assertThrows(IllegalStateException.class, () -> WorkItemTransition.validate(BLOCKED, IN_PROGRESS));
        assertDoesNotThrow(() -> WorkItemTransition.validateUnblock(BLOCKED, UNDER_REVIEW));
    }

    @Test
    void validateUnblock_NotBlocked_ThrowsException() {
        assertThrows(IllegalStateException.class, () -> WorkItemTransition.validateUnblock(PENDING, IN_PROGRESS));
    }

    @Test
    void validateUnblock_RestoreToDone_ThrowsException() {
        assertThrows(IllegalStateException.class, () -> WorkItemTransition.validateUnblock(BLOCKED, DONE));
    }
}
