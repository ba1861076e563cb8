package com.ryuqq.reviewflow.application.review;

import com.ryuqq.reviewflow.core.chronicle.DecisionBasis;
import com.ryuqq.reviewflow.core.model.Payload;
import com.ryuqq.reviewflow.core.model.ProposalId;

/**
 * 합의 후 커밋 완료.
 *
 * @param proposalId 제안 식별자
 * @param sequence Chronicle 순번
 * @param basis 합의 근거
 * @param content 반영된 내용 (대안이 채택되면 원래 제안과 다를 수 있음)
 * @param catalogueRef 갱신된 카탈로그 항목 ("ID@vN", 대상이 없으면 null)
 *
 * @author ReviewFlow Team
 * @since 1.0.0
 */
public record Committed(
    ProposalId proposalId,
    long sequence,
    DecisionBasis basis,
    Payload content,
    String catalogueRef
) implements ReviewOutcome {

    public Committed {
        if (proposalId == null) {
            throw new IllegalArgumentException("proposalId cannot be null");
        }
        if (sequence < 1) {
            throw new IllegalArgumentException("a committed proposal must have a chronicle sequence");
        }
        if (basis == null || content == null) {
            throw new IllegalArgumentException("basis and content cannot be null");
        }
    }
}
