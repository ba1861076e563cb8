package com.ryuqq.reviewflow.core.spi;

import com.ryuqq.reviewflow.core.model.ChangeProposal;
import com.ryuqq.reviewflow.core.model.Role;

/**
 * Outbound notifications to the worker roles.
 *
 * <p>Calls are fire-and-forget. Answers come back asynchronously through the review
 * coordinator ({@code castVote}, {@code postPosition}, {@code revise}). Implementations
 * must not block the caller.</p>
 *
 * @author ReviewFlow Team
 * @since 1.0.0
 */
public interface ReviewerGateway {

    /**
     * Asks a reviewer role for a vote.
     *
     * @param proposal proposal under review
     * @param reviewer role asked
     * @param round review round (1-based, counting every re-vote)
     */
    void requestVote(ChangeProposal proposal, Role reviewer, int round);

    /**
     * Asks a reviewer role for an evidence-backed debate position.
     */
    void requestPosition(ChangeProposal proposal, Role reviewer, int debateRound);

    /**
     * Returns the proposal to its author for revision.
     *
     * @param feedback rationale collected from the votes
     */
    void requestRevision(ChangeProposal proposal, String feedback);
}
