package com.ryuqq.reviewflow.adapter.runner;

import com.ryuqq.reviewflow.application.escalation.DefaultEscalationManager;
import com.ryuqq.reviewflow.core.escalation.Escalation;
import com.ryuqq.reviewflow.core.escalation.EscalationDecision;
import com.ryuqq.reviewflow.core.escalation.EscalationReason;
import com.ryuqq.reviewflow.core.escalation.SubjectKind;
import com.ryuqq.reviewflow.core.model.WorkItemId;
import com.ryuqq.reviewflow.core.spi.HumanDecisionPort;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * EscalationDispatcher 유닛 테스트.
 *
 * <ul>
 *   <li>scan: PENDING Escalation을 전달하고 결정을 반영</li>
 *   <li>결정을 기다리는 동안 같은 Escalation을 다시 전달하지 않음</li>
 *   <li>결정 요청 실패 시 다음 scan에서 재시도</li>
 *   <li>다른 경로로 먼저 처리된 경우 답을 버림</li>
 * </ul>
 *
 * @author ReviewFlow Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class EscalationDispatcherTest {

    @Mock
    private HumanDecisionPort humans;

    private DefaultEscalationManager escalations;
    private EscalationDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        escalations = new DefaultEscalationManager();
        dispatcher = new EscalationDispatcher(escalations, humans, new EscalationDispatcherConfig().withThreads(2));
    }

    @AfterEach
    void tearDown() {
        dispatcher.shutdown();
    }

    private Escalation raiseTimeout() {
        return escalations.raise(SubjectKind.PROPOSAL, "P-1", WorkItemId.of("ITEM-1"),
            EscalationReason.VOTE_TIMEOUT, "no vote", List.of());
    }

    @Test
    void scan_열린_Escalation을_전달하고_결정을_반영() {
        // given
        Escalation escalation = raiseTimeout();
        when(humans.requestDecision(any())).thenReturn(EscalationDecision.approve("keep waiting"));

        // when
        int dispatched = dispatcher.scan();

        // then
        assertThat(dispatched).isEqualTo(1);
        await().atMost(5, TimeUnit.SECONDS).until(() -> !escalations.find(escalation.id()).orElseThrow().isPending());
        assertThat(escalations.find(escalation.id()).orElseThrow().decision().text()).isEqualTo("keep waiting");
        await().atMost(5, TimeUnit.SECONDS).until(() -> dispatcher.inFlightCount() == 0);
    }

    @Test
    void onRaised_리스너로_등록되면_즉시_전달() {
        // given
        when(humans.requestDecision(any())).thenReturn(EscalationDecision.reject("no"));
        escalations.addListener(dispatcher);

        // when
        Escalation escalation = raiseTimeout();

        // then
        await().atMost(5, TimeUnit.SECONDS).until(() -> !escalations.find(escalation.id()).orElseThrow().isPending());
        verify(humans, times(1)).requestDecision(any());
    }

    @Test
    void 결정_대기_중에는_같은_Escalation을_다시_전달하지_않음() throws Exception {
        // given
        CountDownLatch answer = new CountDownLatch(1);
        when(humans.requestDecision(any())).thenAnswer(invocation -> {
            answer.await(5, TimeUnit.SECONDS);
            return EscalationDecision.approve("late");
        });
        raiseTimeout();

        // when
        int first = dispatcher.scan();
        int second = dispatcher.scan();
        answer.countDown();

        // then
        assertThat(first).isEqualTo(1);
        assertThat(second).isZero();
        await().atMost(5, TimeUnit.SECONDS).until(() -> escalations.open().isEmpty());
        verify(humans, times(1)).requestDecision(any());
    }

    @Test
    void 결정_요청이_실패하면_다음_scan에서_재시도() {
        // given
        Escalation escalation = raiseTimeout();
        when(humans.requestDecision(any()))
            .thenThrow(new IllegalStateException("chat service down"))
            .thenReturn(EscalationDecision.approve("retry worked"));

        // when
        dispatcher.scan();
        await().atMost(5, TimeUnit.SECONDS).until(() -> dispatcher.inFlightCount() == 0);
        assertThat(escalations.find(escalation.id()).orElseThrow().isPending()).isTrue();
        dispatcher.scan();

        // then
        await().atMost(5, TimeUnit.SECONDS).until(() -> !escalations.find(escalation.id()).orElseThrow().isPending());
        verify(humans, times(2)).requestDecision(any());
    }

    @Test
    void 먼저_처리된_Escalation의_답은_버림() throws Exception {
        // given
        CountDownLatch asked = new CountDownLatch(1);
        CountDownLatch answer = new CountDownLatch(1);
        when(humans.requestDecision(any())).thenAnswer(invocation -> {
            asked.countDown();
            answer.await(5, TimeUnit.SECONDS);
            return EscalationDecision.approve("too late");
        });
        Escalation escalation = raiseTimeout();
        dispatcher.scan();
        asked.await(5, TimeUnit.SECONDS);

        // when
        escalations.resolve(escalation.id(), EscalationDecision.reject("withdrawn: scope cut"));
        answer.countDown();

        // then
        await().atMost(5, TimeUnit.SECONDS).until(() -> dispatcher.inFlightCount() == 0);
        assertThat(escalations.find(escalation.id()).orElseThrow().decision().text())
            .isEqualTo("withdrawn: scope cut");
    }
}
