package com.ryuqq.reviewflow.core.exception;

import com.ryuqq.reviewflow.core.model.ProposalId;

/**
 * 필수 투표가 빠졌거나 최종 결정이 비어있는 Chronicle 기록.
 *
 * <p>프로토콜/프로그래밍 오류이며, 기록은 추가되지 않습니다.</p>
 *
 * @author ReviewFlow Team
 * @since 1.0.0
 */
public class IncompleteReviewRecordException extends ReviewFlowException {

    public static final String ERROR_CODE = "CHRON-001";

    private final ProposalId proposalId;

    public IncompleteReviewRecordException(ProposalId proposalId, String reason) {
        super(ERROR_CODE, "Incomplete review record for " + proposalId + ": " + reason);
        this.proposalId = proposalId;
    }

    public ProposalId getProposalId() {
        return proposalId;
    }
}
