package com.ryuqq.reviewflow.application.review;

import com.ryuqq.reviewflow.core.model.ProposalId;

/**
 * 제안자 철회. 투표와 토론은 폐기되고 원장에는 아무것도 기록되지 않습니다.
 *
 * @param proposalId 제안 식별자
 * @param reason 철회 사유
 *
 * @author ReviewFlow Team
 * @since 1.0.0
 */
public record Withdrawn(ProposalId proposalId, String reason) implements ReviewOutcome {

    public Withdrawn {
        if (proposalId == null) {
            throw new IllegalArgumentException("proposalId cannot be null");
        }
        reason = reason == null || reason.isBlank() ? "withdrawn" : reason;
    }
}
