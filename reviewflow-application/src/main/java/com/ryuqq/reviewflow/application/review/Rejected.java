package com.ryuqq.reviewflow.application.review;

import com.ryuqq.reviewflow.core.model.ProposalId;

import java.util.OptionalLong;

/**
 * 현재 내용 유지 결정.
 *
 * <p>해결기나 사람이 내린 기각은 Chronicle에 기록되며 {@code sequence}가 양수입니다.
 * 투표 시간 초과 Escalation이 거부되어 끝난 경우는 기록할 투표가 없으므로 0입니다.</p>
 *
 * @param proposalId 제안 식별자
 * @param reason 기각 사유
 * @param sequence Chronicle 순번 (기록되지 않았으면 0)
 *
 * @author ReviewFlow Team
 * @since 1.0.0
 */
public record Rejected(ProposalId proposalId, String reason, long sequence) implements ReviewOutcome {

    public Rejected {
        if (proposalId == null) {
            throw new IllegalArgumentException("proposalId cannot be null");
        }
        if (reason == null || reason.isBlank()) {
            throw new IllegalArgumentException("reason cannot be null or blank");
        }
        if (sequence < 0) {
            throw new IllegalArgumentException("sequence cannot be negative");
        }
    }

    public OptionalLong chronicleSequence() {
        return sequence == 0 ? OptionalLong.empty() : OptionalLong.of(sequence);
    }
}
