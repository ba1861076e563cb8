package com.ryuqq.reviewflow.application.escalation;

import com.ryuqq.reviewflow.core.escalation.Escalation;
import com.ryuqq.reviewflow.core.escalation.EscalationDecision;
import com.ryuqq.reviewflow.core.escalation.EscalationListener;
import com.ryuqq.reviewflow.core.escalation.EscalationReason;
import com.ryuqq.reviewflow.core.escalation.SubjectKind;
import com.ryuqq.reviewflow.core.model.EscalationId;
import com.ryuqq.reviewflow.core.model.WorkItemId;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;

import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * DefaultEscalationManager 테스트.
 *
 * <ul>
 *   <li>raise → PENDING + 리스너 통지</li>
 *   <li>resolve → 리스너 통지 후 future 완료</li>
 *   <li>리스너 예외가 다른 리스너를 막지 않음</li>
 *   <li>완료된 waiter는 보관하지 않음</li>
 * </ul>
 *
 * @author ReviewFlow Team
 * @since 1.0.0
 */
class DefaultEscalationManagerTest {

    private DefaultEscalationManager manager;

    @BeforeEach
    void setUp() {
        manager = new DefaultEscalationManager();
    }

    @Test
    void raise_PENDING으로_기록되고_리스너에_통지됨() {
        // given
        EscalationListener listener = mock(EscalationListener.class);
        manager.addListener(listener);

        // when
        Escalation escalation = manager.raise(SubjectKind.PROPOSAL, "prop-1", WorkItemId.of("item-1"),
            EscalationReason.VOTE_TIMEOUT, "missing ARCHITECT", List.of());

        // then
        assertThat(escalation.isPending()).isTrue();
        assertThat(manager.open()).containsExactly(escalation);
        verify(listener).onRaised(escalation);
    }

    @Test
    void resolve_리스너_통지_후_대기_future가_완료됨() {
        // given
        EscalationListener listener = mock(EscalationListener.class);
        manager.addListener(listener);
        Escalation escalation = manager.raise(SubjectKind.PROPOSAL, "prop-1", null,
            EscalationReason.CONSENSUS_DEADLOCK, "", List.of());
        CompletableFuture<EscalationDecision> waiting = manager.awaitResolution(escalation.id());

        // when
        manager.resolve(escalation.id(), EscalationDecision.approve("ship it"));

        // then
        assertThat(waiting).isCompleted();
        assertThat(waiting.join().text()).isEqualTo("ship it");
        assertThat(manager.open()).isEmpty();
        verify(listener).onResolved(any());
    }

    @Test
    void resolve_리스너가_future보다_먼저_호출됨() {
        // given
        Escalation escalation = manager.raise(SubjectKind.PROPOSAL, "prop-1", null,
            EscalationReason.CONSENSUS_DEADLOCK, "", List.of());
        EscalationListener listener = mock(EscalationListener.class);
        Runnable resumed = mock(Runnable.class);
        manager.addListener(listener);
        manager.awaitResolution(escalation.id()).thenRun(resumed);

        // when
        manager.resolve(escalation.id(), EscalationDecision.reject("no"));

        // then
        InOrder order = inOrder(listener, resumed);
        order.verify(listener).onResolved(any());
        order.verify(resumed).run();
    }

    @Test
    void awaitResolution_이미_해결된_Escalation은_완료된_future_반환() {
        // given
        Escalation escalation = manager.raise(SubjectKind.CATALOGUE_CHANGE, "RULE-1@v1", null,
            EscalationReason.BEHAVIORAL_CHANGE, "", List.of());
        manager.resolve(escalation.id(), EscalationDecision.reject("keep"));

        // when
        CompletableFuture<EscalationDecision> future = manager.awaitResolution(escalation.id());

        // then
        assertThat(future.join().isApproved()).isFalse();
    }

    @Test
    void resolve_완료된_waiter는_제거됨() {
        // given
        Escalation escalation = manager.raise(SubjectKind.PROPOSAL, "prop-1", null,
            EscalationReason.CONSENSUS_DEADLOCK, "tie", List.of());
        CompletableFuture<EscalationDecision> first = manager.awaitResolution(escalation.id());
        CompletableFuture<EscalationDecision> second = manager.awaitResolution(escalation.id());
        assertThat(manager.pendingWaiters()).isEqualTo(1);

        // when
        manager.resolve(escalation.id(), EscalationDecision.approve("go"));

        // then
        assertThat(first).isCompleted();
        assertThat(second).isCompleted();
        assertThat(manager.pendingWaiters()).isZero();
        assertThat(manager.awaitResolution(escalation.id())).isCompleted();
        assertThat(manager.pendingWaiters()).isZero();
    }

    @Test
    void resolve_두번_호출하면_IllegalStateException() {
        // given
        Escalation escalation = manager.raise(SubjectKind.PROPOSAL, "prop-1", null,
            EscalationReason.VOTE_TIMEOUT, "", List.of());
        manager.resolve(escalation.id(), EscalationDecision.reject("no"));

        // when & then
        assertThatThrownBy(() -> manager.resolve(escalation.id(), EscalationDecision.approve("yes")))
            .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void resolve_알수없는_Escalation이면_IllegalArgumentException() {
        assertThatThrownBy(() -> manager.resolve(EscalationId.of("esc-unknown"), EscalationDecision.approve("x")))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void raise_리스너_예외가_발생해도_다른_리스너는_통지됨() {
        // given
        EscalationListener failing = mock(EscalationListener.class);
        EscalationListener healthy = mock(EscalationListener.class);
        doThrow(new IllegalStateException("boom")).when(failing).onRaised(any());
        manager.addListener(failing);
        manager.addListener(healthy);

        // when
        Escalation escalation = manager.raise(SubjectKind.PROPOSAL, "prop-1", null,
            EscalationReason.VOTE_TIMEOUT, "", List.of());

        // then
        verify(healthy).onRaised(escalation);
    }
}
