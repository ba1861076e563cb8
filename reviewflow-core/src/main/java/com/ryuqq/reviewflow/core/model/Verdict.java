package com.ryuqq.reviewflow.core.model;

/**
 * 리뷰 투표의 판정.
 *
 * @author ReviewFlow Team
 * @since 1.0.0
 */
public enum Verdict {

    /**
     * 승인.
     */
    APPROVED,

    /**
     * 수정 요청 (제안자에게 되돌려 보내고 Round 1 재실행).
     */
    REQUESTED_CHANGE,

    /**
     * 이의 제기 (토론 진입).
     */
    OBJECTION
}
