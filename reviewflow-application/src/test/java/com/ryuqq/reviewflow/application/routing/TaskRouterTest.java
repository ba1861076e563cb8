package com.ryuqq.reviewflow.application.routing;

import com.ryuqq.reviewflow.application.escalation.DefaultEscalationManager;
import com.ryuqq.reviewflow.application.review.Committed;
import com.ryuqq.reviewflow.application.review.Rejected;
import com.ryuqq.reviewflow.application.review.ReviewCoordinator;
import com.ryuqq.reviewflow.application.review.ReviewOutcome;
import com.ryuqq.reviewflow.application.review.Withdrawn;
import com.ryuqq.reviewflow.core.chronicle.DecisionBasis;
import com.ryuqq.reviewflow.core.escalation.Escalation;
import com.ryuqq.reviewflow.core.escalation.EscalationDecision;
import com.ryuqq.reviewflow.core.escalation.EscalationReason;
import com.ryuqq.reviewflow.core.escalation.SubjectKind;
import com.ryuqq.reviewflow.core.exception.DuplicateSubmissionException;
import com.ryuqq.reviewflow.core.model.ChangeProposal;
import com.ryuqq.reviewflow.core.model.Payload;
import com.ryuqq.reviewflow.core.model.Role;
import com.ryuqq.reviewflow.core.model.WorkItemDescriptor;
import com.ryuqq.reviewflow.core.model.WorkItemId;
import com.ryuqq.reviewflow.core.statemachine.WorkItemStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * TaskRouter 유닛 테스트.
 *
 * <ul>
 *   <li>리뷰 중 재배정/재제출 → DuplicateSubmission</li>
 *   <li>Committed → DONE, Rejected/Withdrawn → PENDING</li>
 *   <li>Escalation raise → BLOCKED, resolve → 이전 상태</li>
 * </ul>
 *
 * @author ReviewFlow Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class TaskRouterTest {

    private static final WorkItemId ITEM = WorkItemId.of("item-1");

    @Mock
    private ReviewCoordinator coordinator;

    private TaskRouter router;

    @BeforeEach
    void setUp() {
        router = new TaskRouter(coordinator);
        router.ingest(List.of(new WorkItemDescriptor(ITEM, 1)));
    }

    private ChangeProposal proposal() {
        return ChangeProposal.forCode(ITEM, 1, Role.IMPLEMENTER, Payload.of("impl"), 1);
    }

    @Test
    void ingest_등록된_항목은_PENDING() {
        assertThat(router.status(ITEM)).isEqualTo(WorkItemStatus.PENDING);
        assertThat(router.itemsOf(1)).containsExactly(ITEM);
    }

    @Test
    void ingest_다른_Phase로_재등록하면_IllegalArgumentException() {
        assertThatThrownBy(() -> router.ingest(List.of(new WorkItemDescriptor(ITEM, 2))))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void assign_PENDING에서_IN_PROGRESS로_전이() {
        // when
        router.assign(ITEM, Role.IMPLEMENTER);

        // then
        assertThat(router.status(ITEM)).isEqualTo(WorkItemStatus.IN_PROGRESS);
        assertThat(router.assignee(ITEM)).contains(Role.IMPLEMENTER);
    }

    @Test
    void assign_리뷰_중이면_DuplicateSubmission() {
        // given
        when(coordinator.submit(any())).thenReturn(new CompletableFuture<>());
        router.assign(ITEM, Role.IMPLEMENTER);
        router.complete(ITEM, proposal());

        // when & then
        assertThatThrownBy(() -> router.assign(ITEM, Role.IMPLEMENTER))
            .isInstanceOf(DuplicateSubmissionException.class)
            .hasMessageContaining("under review");
        assertThat(router.status(ITEM)).isEqualTo(WorkItemStatus.UNDER_REVIEW);
    }

    @Test
    void complete_리뷰_중_두번째_제출은_DuplicateSubmission() {
        // given
        when(coordinator.submit(any())).thenReturn(new CompletableFuture<>());
        router.assign(ITEM, Role.IMPLEMENTER);
        router.complete(ITEM, proposal());

        // when & then
        assertThatThrownBy(() -> router.complete(ITEM, proposal()))
            .isInstanceOf(DuplicateSubmissionException.class);
        verify(coordinator, times(1)).submit(any());
    }

    @Test
    void complete_Committed_결과면_DONE() {
        // given
        CompletableFuture<ReviewOutcome> review = new CompletableFuture<>();
        when(coordinator.submit(any())).thenReturn(review);
        router.assign(ITEM, Role.IMPLEMENTER);
        ChangeProposal proposal = proposal();
        CompletableFuture<ReviewOutcome> result = router.complete(ITEM, proposal);

        // when
        review.complete(new Committed(proposal.id(), 1, DecisionBasis.UNANIMOUS, proposal.content(), null));

        // then
        assertThat(result.join().isCommitted()).isTrue();
        assertThat(router.status(ITEM)).isEqualTo(WorkItemStatus.DONE);
        assertThat(router.allDone(1)).isTrue();
    }

    @Test
    void complete_Rejected_결과면_PENDING() {
        // given
        CompletableFuture<ReviewOutcome> review = new CompletableFuture<>();
        when(coordinator.submit(any())).thenReturn(review);
        router.assign(ITEM, Role.IMPLEMENTER);
        ChangeProposal proposal = proposal();
        router.complete(ITEM, proposal);

        // when
        review.complete(new Rejected(proposal.id(), "retain current", 3));

        // then
        assertThat(router.status(ITEM)).isEqualTo(WorkItemStatus.PENDING);
        assertThat(router.assignee(ITEM)).isEmpty();
    }

    @Test
    void complete_Withdrawn_결과면_PENDING() {
        // given
        CompletableFuture<ReviewOutcome> review = new CompletableFuture<>();
        when(coordinator.submit(any())).thenReturn(review);
        router.assign(ITEM, Role.IMPLEMENTER);
        ChangeProposal proposal = proposal();
        router.complete(ITEM, proposal);

        // when
        review.complete(new Withdrawn(proposal.id(), "author withdrew"));

        // then
        assertThat(router.status(ITEM)).isEqualTo(WorkItemStatus.PENDING);
    }

    @Test
    void complete_다른_Work_Item_제안이면_IllegalArgumentException() {
        // given
        router.assign(ITEM, Role.IMPLEMENTER);
        ChangeProposal other = ChangeProposal.forCode(WorkItemId.of("item-2"), 1, Role.IMPLEMENTER, Payload.of("x"), 0);

        // when & then
        assertThatThrownBy(() -> router.complete(ITEM, other)).isInstanceOf(IllegalArgumentException.class);
        verifyNoInteractions(coordinator);
    }

    @Test
    void complete_submit_실패시_IN_PROGRESS로_복원() {
        // given
        when(coordinator.submit(any())).thenThrow(new IllegalStateException("already running"));
        router.assign(ITEM, Role.IMPLEMENTER);

        // when & then
        assertThatThrownBy(() -> router.complete(ITEM, proposal())).isInstanceOf(IllegalStateException.class);
        assertThat(router.status(ITEM)).isEqualTo(WorkItemStatus.IN_PROGRESS);
    }

    @Test
    void escalation_raise면_BLOCKED_resolve면_이전_상태로_복원() {
        // given
        DefaultEscalationManager escalations = new DefaultEscalationManager();
        escalations.addListener(router);
        when(coordinator.submit(any())).thenReturn(new CompletableFuture<>());
        router.assign(ITEM, Role.IMPLEMENTER);
        router.complete(ITEM, proposal());

        // when
        Escalation escalation = escalations.raise(SubjectKind.PROPOSAL, "prop-1", ITEM,
            EscalationReason.CONSENSUS_DEADLOCK, "tie", List.of());

        // then
        assertThat(router.status(ITEM)).isEqualTo(WorkItemStatus.BLOCKED);

        // when
        escalations.resolve(escalation.id(), EscalationDecision.approve("go"));

        // then
        assertThat(router.status(ITEM)).isEqualTo(WorkItemStatus.UNDER_REVIEW);
    }

    @Test
    void 리뷰_중_BLOCKED_상태에서_재배정_재제출은_DuplicateSubmission() {
        // given
        when(coordinator.submit(any())).thenReturn(new CompletableFuture<>());
        router.assign(ITEM, Role.IMPLEMENTER);
        router.complete(ITEM, proposal());
        router.onRaised(Escalation.raise(SubjectKind.PROPOSAL, "prop-1", ITEM,
            EscalationReason.VOTE_TIMEOUT, "reviewer silent", List.of(), Instant.now()));
        assertThat(router.status(ITEM)).isEqualTo(WorkItemStatus.BLOCKED);

        // when & then
        assertThatThrownBy(() -> router.complete(ITEM, proposal()))
            .isInstanceOf(DuplicateSubmissionException.class);
        assertThatThrownBy(() -> router.assign(ITEM, Role.IMPLEMENTER))
            .isInstanceOf(DuplicateSubmissionException.class);
        verify(coordinator, times(1)).submit(any());
        assertThat(router.status(ITEM)).isEqualTo(WorkItemStatus.BLOCKED);
    }

    @Test
    void escalation_두개가_모두_해결되어야_차단_해제() {
        // given
        DefaultEscalationManager escalations = new DefaultEscalationManager();
        escalations.addListener(router);
        router.assign(ITEM, Role.IMPLEMENTER);
        Escalation first = escalations.raise(SubjectKind.CATALOGUE_CHANGE, "RULE-1@v1", ITEM,
            EscalationReason.BEHAVIORAL_CHANGE, "", List.of());
        Escalation second = escalations.raise(SubjectKind.CATALOGUE_CHANGE, "RULE-2@v1", ITEM,
            EscalationReason.BEHAVIORAL_CHANGE, "", List.of());

        // when
        escalations.resolve(first.id(), EscalationDecision.reject("no"));

        // then
        assertThat(router.status(ITEM)).isEqualTo(WorkItemStatus.BLOCKED);

        // when
        escalations.resolve(second.id(), EscalationDecision.reject("no"));

        // then
        assertThat(router.status(ITEM)).isEqualTo(WorkItemStatus.IN_PROGRESS);
    }

    @Test
    void allDone_미완료_항목이_있으면_false() {
        // given
        router.ingest(List.of(WorkItemDescriptor.of("item-2", 1), WorkItemDescriptor.of("item-3", 2)));

        // when & then
        assertThat(router.allDone(1)).isFalse();
        assertThat(router.allDone(5)).isTrue();
    }

    @Test
    void status_알수없는_항목이면_IllegalArgumentException() {
        assertThatThrownBy(() -> router.status(WorkItemId.of("nope"))).isInstanceOf(IllegalArgumentException.class);
    }
}
