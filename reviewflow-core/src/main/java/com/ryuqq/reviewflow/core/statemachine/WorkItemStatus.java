package com.ryuqq.reviewflow.core.statemachine;

/**
 * Work Item 상태.
 *
 * <p>Work Item 상태는 TaskRouter만 변경할 수 있습니다.
 * 다른 컴포넌트는 읽기만 하고, 전이는 TaskRouter 계약을 통해 요청합니다.</p>
 *
 * <pre>
 * PENDING ─► IN_PROGRESS ─► UNDER_REVIEW ─► DONE
 *    ▲            │  ▲            │
 *    │            │  └ (재배정)    │
 *    └────────────┴── (기각/철회) ─┘
 *
 * PENDING / IN_PROGRESS / UNDER_REVIEW ─► BLOCKED ─► (이전 상태로 복귀)
 * </pre>
 *
 * @author ReviewFlow Team
 * @since 1.0.0
 */
public enum WorkItemStatus {

    PENDING,

    IN_PROGRESS,

    UNDER_REVIEW,

    DONE,

    /**
     * Escalation 해결 대기 중.
     */
    BLOCKED;

    public boolean isTerminal() {
        return this == DONE;
    }
}
