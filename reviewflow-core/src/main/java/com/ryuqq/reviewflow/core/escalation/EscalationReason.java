package com.ryuqq.reviewflow.core.escalation;

/**
 * Escalation 발생 사유.
 *
 * @author ReviewFlow Team
 * @since 1.0.0
 */
public enum EscalationReason {

    /** 재요청 예산 소진 후에도 투표가 모이지 않음 */
    VOTE_TIMEOUT,

    /** 토론 Position이 모이지 않음 */
    POSITION_TIMEOUT,

    /** 제안자가 수정본을 제출하지 않음 */
    REVISION_TIMEOUT,

    /** 토론과 해결기로도 합의 불가 */
    CONSENSUS_DEADLOCK,

    /** 잠긴 카탈로그 항목의 의미 변경 */
    BEHAVIORAL_CHANGE,

    /** 닫힌 Phase 재개 요청 */
    PHASE_REOPEN
}
