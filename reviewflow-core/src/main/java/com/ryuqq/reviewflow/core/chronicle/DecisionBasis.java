package com.ryuqq.reviewflow.core.chronicle;

/**
 * 최종 결정이 내려진 근거.
 *
 * @author ReviewFlow Team
 * @since 1.0.0
 */
public enum DecisionBasis {

    /** 필수 리뷰어 전원 APPROVED */
    UNANIMOUS,

    /** 토론 2라운드 후 ConflictResolver 판정 */
    RESOLVER,

    /** Escalation을 통한 사람의 결정 */
    HUMAN
}
