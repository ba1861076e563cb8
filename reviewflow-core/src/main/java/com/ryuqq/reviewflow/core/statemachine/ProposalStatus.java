package com.ryuqq.reviewflow.core.statemachine;

/**
 * Change Proposal의 생명주기 상태.
 *
 * <p><strong>상태 전이 다이어그램:</strong></p>
 * <pre>
 * PROPOSED
 *    │
 *    ▼ (리뷰 시작)
 * REVIEW_ROUND_1 ◄─┐ (수정 후 재실행)
 *    │  │          │
 *    │  └──────────┘
 *    ├─► DEBATE ◄─┐ (최대 2라운드)
 *    │     │ └────┘
 *    │     ├─► CONSENSUS
 *    │     └─► REJECTED
 *    ├─► CONSENSUS ─► COMMITTED
 *    └─► REJECTED
 *
 * CONSENSUS 이전의 모든 상태 ─► WITHDRAWN
 *
 * 금지된 전이:
 * - COMMITTED / REJECTED / WITHDRAWN → * ❌
 * - CONSENSUS → WITHDRAWN ❌ (합의 이후 철회 불가)
 * </pre>
 *
 * @author ReviewFlow Team
 * @since 1.0.0
 */
public enum ProposalStatus {

    /**
     * 제출됨 (리뷰 시작 전).
     */
    PROPOSED,

    /**
     * 1차 투표 라운드 진행 중.
     */
    REVIEW_ROUND_1,

    /**
     * 토론 진행 중.
     */
    DEBATE,

    /**
     * 합의 도달 (투표, Resolver 또는 사람의 결정).
     */
    CONSENSUS,

    /**
     * 기각 (영구).
     */
    REJECTED,

    /**
     * 제안자가 철회.
     */
    WITHDRAWN,

    /**
     * 원장(Chronicle/Catalogue)에 반영 완료.
     */
    COMMITTED;

    /**
     * 종료 상태인지 확인.
     *
     * @return REJECTED, WITHDRAWN, COMMITTED인 경우 true
     */
    public boolean isTerminal() {
        return this == REJECTED || this == WITHDRAWN || this == COMMITTED;
    }

    /**
     * 철회 가능한 상태인지 확인 (합의 이전).
     *
     * @return PROPOSED, REVIEW_ROUND_1, DEBATE인 경우 true
     */
    public boolean isWithdrawable() {
        return this == PROPOSED || this == REVIEW_ROUND_1 || this == DEBATE;
    }
}
