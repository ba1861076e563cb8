package com.ryuqq.reviewflow.core.statemachine;

import org.junit.jupiter.api.Test;

import static com.ryuqq.reviewflow.core.statemachine.EntryStatus.*;
import static org.junit.jupiter.api.Assertions.*;

class EntryStatusTest {

    @Test
    void canTransitionTo_Lifecycle() {
        assertTrue(DRAFT.canTransitionTo(UNDER_REVIEW));
        assertTrue(UNDER_REVIEW.canTransitionTo(APPROVED));
        assertTrue(APPROVED.canTransitionTo(LOCKED));
        assertTrue(LOCKED.canTransitionTo(SUPERSEDED));
    }

    @Test
    void canTransitionTo_LockedCannotBeInvalidated() {
        assertFalse(LOCKED.canTransitionTo(INVALID));
        assertFalse(LOCKED.canTransitionTo(DRAFT));
    }

    @Test
    void canTransitionTo_SupersededIsFinal() {
        for (EntryStatus target : EntryStatus.values()) {
            assertFalse(SUPERSEDED.canTransitionTo(target));
        }
    }

    @Test
    void isUnsettled_OnlyDraftAndUnderReview() {
        assertTrue(DRAFT.isUnsettled());
        assertTrue(UNDER_REVIEW.isUnsettled());
        assertFalse(APPROVED.isUnsettled());
        assertFalse(LOCKED.isUnsettled());
    }

    @Test
    void validateTransition_Invalid_ThrowsException() {
        assertThrows(IllegalStateException.class, () -> DRAFT.validateTransition(LOCKED));
    }
}
