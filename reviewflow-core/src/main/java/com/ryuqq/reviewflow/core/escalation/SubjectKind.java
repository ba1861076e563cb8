package com.ryuqq.reviewflow.core.escalation;

/**
 * Escalation 대상의 종류.
 *
 * @author ReviewFlow Team
 * @since 1.0.0
 */
public enum SubjectKind {
    PROPOSAL,
    CATALOGUE_CHANGE,
    PHASE_REOPEN
}
