package com.ryuqq.reviewflow.core.exception;

import com.ryuqq.reviewflow.core.model.ProposalId;

/**
 * 토론 라운드를 모두 소진했고 Resolver도 결정하지 못함.
 *
 * <p>이 오류는 승인이나 기각으로 기본 처리되지 않고 항상 Escalation으로 전환됩니다.</p>
 *
 * @author ReviewFlow Team
 * @since 1.0.0
 */
public class ConsensusDeadlockException extends ReviewFlowException {

    public static final String ERROR_CODE = "REVIEW-001";

    private final ProposalId proposalId;
    private final int debateRounds;

    public ConsensusDeadlockException(ProposalId proposalId, int debateRounds, String reason) {
        super(ERROR_CODE, String.format("Consensus deadlock for %s after %d debate round(s): %s",
            proposalId, debateRounds, reason));
        this.proposalId = proposalId;
        this.debateRounds = debateRounds;
    }

    public ProposalId getProposalId() {
        return proposalId;
    }

    public int getDebateRounds() {
        return debateRounds;
    }
}
