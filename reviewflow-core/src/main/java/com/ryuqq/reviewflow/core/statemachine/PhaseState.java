package com.ryuqq.reviewflow.core.statemachine;

/**
 * 단계의 상태.
 *
 * <p>단계는 엄격하게 순차적입니다: 건너뛰기 불가,
 * 닫힌 단계의 재개방은 승인된 Escalation을 통한 명시적 override만 허용됩니다.</p>
 *
 * @author ReviewFlow Team
 * @since 1.0.0
 */
public enum PhaseState {

    /**
     * 아직 열리지 않음.
     */
    PENDING,

    /**
     * 열림 (Gate Criterion 미충족 항목 존재 가능).
     */
    OPEN,

    /**
     * 닫힘 (모든 Criterion 충족 후 전이 기록됨).
     */
    CLOSED
}
