package com.ryuqq.reviewflow.application.phase;

import java.time.Instant;

/**
 * Phase 전이 이력 한 건.
 *
 * @param phase Phase 번호
 * @param kind 전이 종류
 * @param at 전이 시각
 * @param detail 부가 정보 (근거 Escalation, 잠긴 항목 수 등)
 *
 * @author ReviewFlow Team
 * @since 1.0.0
 */
public record PhaseTransition(int phase, Kind kind, Instant at, String detail) {

    public enum Kind {
        OPENED,
        CLOSED,
        REOPENED,
        COMPLETED
    }

    public PhaseTransition {
        if (kind == null || at == null) {
            throw new IllegalArgumentException("kind and at cannot be null");
        }
        detail = detail == null ? "" : detail;
    }
}
