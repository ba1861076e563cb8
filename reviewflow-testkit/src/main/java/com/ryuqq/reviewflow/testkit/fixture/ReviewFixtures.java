package com.ryuqq.reviewflow.testkit.fixture;

import com.ryuqq.reviewflow.core.chronicle.ChronicleDraft;
import com.ryuqq.reviewflow.core.chronicle.DecisionBasis;
import com.ryuqq.reviewflow.core.model.ChangeProposal;
import com.ryuqq.reviewflow.core.model.Concern;
import com.ryuqq.reviewflow.core.model.CriterionKind;
import com.ryuqq.reviewflow.core.model.Evidence;
import com.ryuqq.reviewflow.core.model.EvidenceKind;
import com.ryuqq.reviewflow.core.model.EntryId;
import com.ryuqq.reviewflow.core.model.Payload;
import com.ryuqq.reviewflow.core.model.PhasePlan;
import com.ryuqq.reviewflow.core.model.Position;
import com.ryuqq.reviewflow.core.model.ProposalId;
import com.ryuqq.reviewflow.core.model.ReviewVote;
import com.ryuqq.reviewflow.core.model.Role;
import com.ryuqq.reviewflow.core.model.WorkItemId;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Shared fixtures for contract and integration tests.
 *
 * @author ReviewFlow Team
 * @since 1.0.0
 */
public final class ReviewFixtures {

    /**
     * Reviewers used by {@link #threePhasePlan()} in every phase.
     */
    public static final Set<Role> REVIEWERS =
        EnumSet.of(Role.ARCHITECT, Role.DOMAIN_EXPERT, Role.TEST_ENGINEER);

    private ReviewFixtures() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * Three phases (analysis, implementation, hardening), each reviewed by {@link #REVIEWERS}
     * and gated by a manual sign-off plus the system criteria.
     */
    public static PhasePlan threePhasePlan() {
        PhasePlan.Builder builder = PhasePlan.builder();
        for (String name : List.of("analysis", "implementation", "hardening")) {
            builder = builder.phase(name)
                .reviewers(Role.ARCHITECT, Role.DOMAIN_EXPERT, Role.TEST_ENGINEER)
                .manualCriterion(name + "-signed-off", name + " signed off")
                .criterion(name + "-items-done", "All work items done",
                    CriterionKind.ALL_WORK_ITEMS_DONE)
                .criterion(name + "-catalogue-settled", "Catalogue settled",
                    CriterionKind.CATALOGUE_SETTLED)
                .and();
        }
        return builder.build();
    }

    public static ChangeProposal entryProposal(String workItem, int phase, String entry, String content, int impact) {
        return ChangeProposal.forEntry(WorkItemId.of(workItem), phase, Role.IMPLEMENTER,
            Payload.of(content), EntryId.of(entry), impact);
    }

    public static ChangeProposal codeProposal(String workItem, int phase, String content, int impact) {
        return ChangeProposal.forCode(WorkItemId.of(workItem), phase, Role.IMPLEMENTER, Payload.of(content), impact);
    }

    /**
     * One APPROVED vote per role in the given round.
     */
    public static List<ReviewVote> approvals(ProposalId proposalId, Set<Role> roles, int round) {
        List<ReviewVote> votes = new ArrayList<>();
        for (Role role : roles) {
            votes.add(ReviewVote.approve(role, proposalId, round));
        }
        return votes;
    }

    public static Evidence evidence(String reference) {
        return Evidence.of(EvidenceKind.TEST_CITATION, reference);
    }

    public static Position support(Role role, ProposalId proposalId, int debateRound, Concern concern) {
        return Position.support(role, proposalId, debateRound, concern, evidence("test:" + role), "keeps behavior");
    }

    public static Position oppose(Role role, ProposalId proposalId, int debateRound, Concern concern) {
        return Position.oppose(role, proposalId, debateRound, concern, evidence("test:" + role), "changes behavior");
    }

    /**
     * A complete draft: every role in {@link #REVIEWERS} approved in round 1.
     */
    public static ChronicleDraft completeDraft(ProposalId proposalId, int phase) {
        return new ChronicleDraft(proposalId, WorkItemId.of("item-" + proposalId.getValue()), phase,
            "sha256:before", "sha256:after", REVIEWERS, approvals(proposalId, REVIEWERS, 1), List.of(),
            "approved unanimously", DecisionBasis.UNANIMOUS, List.of());
    }
}
