package com.ryuqq.reviewflow.adapter.inmemory.catalogue;

import com.ryuqq.reviewflow.core.catalogue.CatalogueEntry;
import com.ryuqq.reviewflow.core.catalogue.CatalogueListener;
import com.ryuqq.reviewflow.core.catalogue.ChangeDecision;
import com.ryuqq.reviewflow.core.catalogue.ChangeRequest;
import com.ryuqq.reviewflow.core.escalation.Escalation;
import com.ryuqq.reviewflow.core.escalation.EscalationDecision;
import com.ryuqq.reviewflow.core.escalation.EscalationReason;
import com.ryuqq.reviewflow.core.escalation.SubjectKind;
import com.ryuqq.reviewflow.core.model.EntryId;
import com.ryuqq.reviewflow.core.model.EscalationId;
import com.ryuqq.reviewflow.core.model.Payload;
import com.ryuqq.reviewflow.core.model.Role;
import com.ryuqq.reviewflow.core.model.WorkItemId;
import com.ryuqq.reviewflow.core.spi.EscalationManager;
import com.ryuqq.reviewflow.core.statemachine.EntryStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * InMemoryCatalogueStore 유닛 테스트.
 *
 * <p>Escalation 호출 인자와 잠기기 전 변경 요청 처리를 검증합니다.</p>
 *
 * @author ReviewFlow Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class InMemoryCatalogueStoreTest {

    private static final EntryId RULE = EntryId.of("RULE-010");

    @Mock
    private EscalationManager escalations;

    private InMemoryCatalogueStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryCatalogueStore(escalations,
            Clock.fixed(Instant.parse("2026-03-01T09:00:00Z"), ZoneOffset.UTC));
    }

    @Test
    void 행동_변경은_카탈로그_변경_Escalation으로_올라감() {
        // given
        lock("half-even");
        Escalation raised = Escalation.raise(SubjectKind.CATALOGUE_CHANGE, "RULE-010@v1", WorkItemId.of("ITEM-3"),
            EscalationReason.BEHAVIORAL_CHANGE, "", List.of(), Instant.now());
        when(escalations.raise(eq(SubjectKind.CATALOGUE_CHANGE), eq("RULE-010@v1"), eq(WorkItemId.of("ITEM-3")),
            eq(EscalationReason.BEHAVIORAL_CHANGE), anyString(), anyList())).thenReturn(raised);
        CompletableFuture<EscalationDecision> resolution = new CompletableFuture<>();
        when(escalations.awaitResolution(raised.id())).thenReturn(resolution);

        // when
        ChangeDecision decision = store.requestChange(RULE,
            ChangeRequest.behavioral(Payload.of("half-up"), "legacy parity", Role.DOMAIN_EXPERT, WorkItemId.of("ITEM-3")));

        // then
        assertThat(decision.isEscalated()).isTrue();
        assertThat(decision.pendingEscalation()).contains(raised.id());
        assertThat(decision.settled()).isNotDone();
        assertThat(store.history(RULE)).hasSize(1);
    }

    @Test
    void 승인_결정에_대체_내용이_있으면_그_내용으로_새_버전_생성() {
        // given
        lock("half-even");
        Escalation raised = Escalation.raise(SubjectKind.CATALOGUE_CHANGE, "RULE-010@v1", null,
            EscalationReason.BEHAVIORAL_CHANGE, "", List.of(), Instant.now());
        when(escalations.raise(any(), any(), any(), any(), anyString(), anyList())).thenReturn(raised);
        CompletableFuture<EscalationDecision> resolution = new CompletableFuture<>();
        when(escalations.awaitResolution(any(EscalationId.class))).thenReturn(resolution);
        ChangeDecision decision = store.requestChange(RULE,
            ChangeRequest.behavioral(Payload.of("half-up"), "legacy parity", Role.DOMAIN_EXPERT, null));

        // when
        resolution.complete(EscalationDecision.approveWith("use banker's rounding only for totals",
            Payload.of("half-even, totals half-up")));

        // then
        CatalogueEntry settled = decision.settled().join();
        assertThat(settled.version()).isEqualTo(2);
        assertThat(settled.content().getValue()).isEqualTo("half-even, totals half-up");
        assertThat(store.history(RULE).get(0).note()).contains("superseded by v2");
    }

    @Test
    void 잠기기_전_변경_요청은_일반_편집으로_처리() {
        // given
        store.propose(RULE, Payload.of("draft"));

        // when
        ChangeDecision decision = store.requestChange(RULE,
            ChangeRequest.behavioral(Payload.of("draft 2"), "rework", Role.ARCHITECT, null));

        // then
        assertThat(decision.isEscalated()).isFalse();
        assertThat(decision.entry().status()).isEqualTo(EntryStatus.DRAFT);
        assertThat(decision.entry().content().getValue()).isEqualTo("draft 2");
        verifyNoInteractions(escalations);
    }

    @Test
    void 잠기기_전_삭제_요청은_무효화() {
        // given
        store.propose(RULE, Payload.of("draft"));

        // when
        ChangeDecision decision = store.requestChange(RULE, ChangeRequest.deletion("duplicate of RULE-002", Role.ARCHITECT));

        // then
        assertThat(decision.entry().status()).isEqualTo(EntryStatus.INVALID);
        assertThat(decision.entry().note()).isEqualTo("duplicate of RULE-002");
    }

    @Test
    void 행동_변경_대기가_실패하면_settled가_예외로_끝나고_이후_변경은_다시_허용() {
        // given
        lock("half-even");
        Escalation raised = Escalation.raise(SubjectKind.CATALOGUE_CHANGE, "RULE-010@v1", null,
            EscalationReason.BEHAVIORAL_CHANGE, "", List.of(), Instant.now());
        when(escalations.raise(any(), anyString(), any(), any(), anyString(), anyList())).thenReturn(raised);
        CompletableFuture<EscalationDecision> resolution = new CompletableFuture<>();
        when(escalations.awaitResolution(raised.id())).thenReturn(resolution);
        ChangeDecision decision = store.requestChange(RULE,
            ChangeRequest.behavioral(Payload.of("half-up"), "legacy parity", Role.DOMAIN_EXPERT, null));

        // when
        resolution.completeExceptionally(new IllegalStateException("decision channel closed"));

        // then
        assertThat(decision.settled()).isCompletedExceptionally();
        ChangeDecision clerical = store.requestChange(RULE,
            ChangeRequest.clerical(Payload.of("Half-even."), "capitalization", Role.CATALOGUE_CURATOR));
        assertThat(clerical.entry().version()).isEqualTo(2);
    }

    @Test
    void 실패한_리스너가_있어도_변경은_적용되고_다른_리스너는_통지됨() {
        // given
        CatalogueListener failing = mock(CatalogueListener.class);
        doThrow(new IllegalStateException("boom")).when(failing).onSuperseded(any(), any(), any());
        CatalogueListener recording = mock(CatalogueListener.class);
        store.addListener(failing);
        store.addListener(recording);
        lock("half-even");

        // when
        ChangeDecision decision = store.requestChange(RULE,
            ChangeRequest.clerical(Payload.of("Half-even."), "capitalization", Role.CATALOGUE_CURATOR));

        // then
        assertThat(decision.entry().version()).isEqualTo(2);
        verify(recording).onSuperseded(argThat(e -> e.status() == EntryStatus.SUPERSEDED),
            eq(decision.entry()), any(ChangeRequest.class));
    }

    @Test
    void entries는_항목별_현재_버전을_id순으로_반환() {
        // given
        store.propose(EntryId.of("RULE-B"), Payload.of("b"));
        store.propose(EntryId.of("RULE-A"), Payload.of("a"));

        // when & then
        assertThat(store.entries()).extracting(e -> e.id().getValue()).containsExactly("RULE-A", "RULE-B");
    }

    private void lock(String content) {
        store.propose(RULE, Payload.of(content));
        store.submitForReview(RULE);
        store.approve(RULE);
        store.lock(RULE);
    }
}
