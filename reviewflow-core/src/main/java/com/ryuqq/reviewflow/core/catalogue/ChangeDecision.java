package com.ryuqq.reviewflow.core.catalogue;

import com.ryuqq.reviewflow.core.model.EscalationId;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * 카탈로그 변경 요청에 대한 결정.
 *
 * <ul>
 *   <li>APPLIED: 즉시 반영됨 ({@link #entry()}가 결과 버전)</li>
 *   <li>ESCALATED: 사람의 결정을 기다림 ({@link #escalationId()}), 내용은 아직 그대로</li>
 * </ul>
 *
 * <p>{@link #settled()}는 변경이 최종 정리된 뒤의 현재 버전으로 완료됩니다.
 * APPLIED는 이미 완료된 상태이고, ESCALATED는 승인 시 새 버전, 거부 시 기존 버전으로 완료됩니다.</p>
 *
 * @param type 결정 종류
 * @param entry 결정 시점의 현재 버전
 * @param escalationId ESCALATED인 경우 Escalation 식별자
 * @param settled 최종 정리 결과
 *
 * @author ReviewFlow Team
 * @since 1.0.0
 */
public record ChangeDecision(
    Type type,
    CatalogueEntry entry,
    EscalationId escalationId,
    CompletableFuture<CatalogueEntry> settled
) {

    public enum Type {
        APPLIED,
        ESCALATED
    }

    public ChangeDecision {
        if (type == null || entry == null || settled == null) {
            throw new IllegalArgumentException("type, entry and settled cannot be null");
        }
        if (type == Type.ESCALATED && escalationId == null) {
            throw new IllegalArgumentException("an escalated decision requires an escalationId");
        }
    }

    public static ChangeDecision applied(CatalogueEntry entry) {
        return new ChangeDecision(Type.APPLIED, entry, null, CompletableFuture.completedFuture(entry));
    }

    public static ChangeDecision escalated(CatalogueEntry current, EscalationId escalationId,
                                           CompletableFuture<CatalogueEntry> settled) {
        return new ChangeDecision(Type.ESCALATED, current, escalationId, settled);
    }

    public boolean isEscalated() {
        return type == Type.ESCALATED;
    }

    public Optional<EscalationId> pendingEscalation() {
        return Optional.ofNullable(escalationId);
    }
}
