package com.ryuqq.reviewflow.application.logging;

import com.ryuqq.reviewflow.core.model.ChangeProposal;
import org.slf4j.MDC;

/**
 * 리뷰 진행 중 로그에 붙는 MDC 키 관리.
 *
 * <p>키: {@code proposalId}, {@code workItemId}, {@code phase}</p>
 *
 * @author ReviewFlow Team
 * @since 1.0.0
 */
public final class ReviewMdc {

    public static final String PROPOSAL_ID = "proposalId";
    public static final String WORK_ITEM_ID = "workItemId";
    public static final String PHASE = "phase";

    private ReviewMdc() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    public static void setReview(ChangeProposal proposal) {
        MDC.put(PROPOSAL_ID, proposal.id().getValue());
        MDC.put(WORK_ITEM_ID, proposal.workItemId().getValue());
        MDC.put(PHASE, String.valueOf(proposal.phase()));
    }

    public static void setPhase(int phase) {
        MDC.put(PHASE, String.valueOf(phase));
    }

    public static void clear() {
        MDC.remove(PROPOSAL_ID);
        MDC.remove(WORK_ITEM_ID);
        MDC.remove(PHASE);
    }
}
