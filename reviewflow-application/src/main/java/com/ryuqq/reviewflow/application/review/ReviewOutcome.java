package com.ryuqq.reviewflow.application.review;

import com.ryuqq.reviewflow.core.model.ProposalId;

/**
 * 리뷰 한 사이클의 최종 결과.
 *
 * <p>ReviewOutcome은 세 가지 가능한 결과를 나타냅니다:</p>
 * <ul>
 *   <li>{@link Committed}: 합의 후 Chronicle 기록과 카탈로그 반영까지 완료</li>
 *   <li>{@link Rejected}: 현재 내용 유지로 결정됨</li>
 *   <li>{@link Withdrawn}: 합의 전 제안자가 철회</li>
 * </ul>
 *
 * <p>합의 교착(deadlock)은 결과가 아닙니다. Escalation으로 전환되며,
 * 사람이 결정할 때까지 결과 future는 완료되지 않습니다.</p>
 *
 * @author ReviewFlow Team
 * @since 1.0.0
 */
public sealed interface ReviewOutcome permits Committed, Rejected, Withdrawn {

    ProposalId proposalId();

    default boolean isCommitted() {
        return this instanceof Committed;
    }

    default boolean isRejected() {
        return this instanceof Rejected;
    }

    default boolean isWithdrawn() {
        return this instanceof Withdrawn;
    }
}
