package com.ryuqq.reviewflow.core.escalation;

import com.ryuqq.reviewflow.core.model.EscalationId;
import com.ryuqq.reviewflow.core.model.Position;
import com.ryuqq.reviewflow.core.model.WorkItemId;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * 사람의 결정을 기다리는 분쟁 한 건.
 *
 * <p>PENDING으로 생성되고 {@link #resolve(EscalationDecision, Instant)}로 한 번만 RESOLVED가 됩니다.
 * 만료되지 않습니다.</p>
 *
 * @param id 식별자
 * @param subjectKind 대상 종류
 * @param subjectRef 대상 참조 (제안 ID, "ENTRY@vN", "phase-N")
 * @param dependentItem 결정 전까지 차단되는 Work Item (없으면 null)
 * @param reason 발생 사유
 * @param detail 상세 설명
 * @param positions 분쟁 중인 Position
 * @param resolution 처리 상태
 * @param decision 결정 (PENDING이면 null)
 * @param raisedAt 발생 시각
 * @param resolvedAt 처리 시각 (PENDING이면 null)
 *
 * @author ReviewFlow Team
 * @since 1.0.0
 */
public record Escalation(
    EscalationId id,
    SubjectKind subjectKind,
    String subjectRef,
    WorkItemId dependentItem,
    EscalationReason reason,
    String detail,
    List<Position> positions,
    Resolution resolution,
    EscalationDecision decision,
    Instant raisedAt,
    Instant resolvedAt
) {

    public Escalation {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        if (subjectKind == null) {
            throw new IllegalArgumentException("subjectKind cannot be null");
        }
        if (subjectRef == null || subjectRef.isBlank()) {
            throw new IllegalArgumentException("subjectRef cannot be null or blank");
        }
        if (reason == null) {
            throw new IllegalArgumentException("reason cannot be null");
        }
        if (resolution == null) {
            throw new IllegalArgumentException("resolution cannot be null");
        }
        if (raisedAt == null) {
            throw new IllegalArgumentException("raisedAt cannot be null");
        }
        if (resolution == Resolution.RESOLVED && (decision == null || resolvedAt == null)) {
            throw new IllegalArgumentException("a resolved escalation requires a decision and resolvedAt");
        }
        detail = detail == null ? "" : detail;
        positions = positions == null ? List.of() : List.copyOf(positions);
    }

    /**
     * PENDING Escalation 생성.
     */
    public static Escalation raise(SubjectKind subjectKind, String subjectRef, WorkItemId dependentItem,
                                   EscalationReason reason, String detail, List<Position> positions,
                                   Instant now) {
        return new Escalation(EscalationId.random(), subjectKind, subjectRef, dependentItem, reason, detail,
            positions, Resolution.PENDING, null, now, null);
    }

    /**
     * 결정을 붙인 RESOLVED 인스턴스.
     *
     * @throws IllegalStateException 이미 처리된 경우
     */
    public Escalation resolve(EscalationDecision newDecision, Instant now) {
        if (resolution == Resolution.RESOLVED) {
            throw new IllegalStateException("Escalation already resolved: " + id);
        }
        if (newDecision == null) {
            throw new IllegalArgumentException("decision cannot be null");
        }
        return new Escalation(id, subjectKind, subjectRef, dependentItem, reason, detail, positions,
            Resolution.RESOLVED, newDecision, raisedAt, now);
    }

    public boolean isPending() {
        return resolution == Resolution.PENDING;
    }

    public Optional<WorkItemId> dependentWorkItem() {
        return Optional.ofNullable(dependentItem);
    }

    public Optional<EscalationDecision> outcome() {
        return Optional.ofNullable(decision);
    }
}
