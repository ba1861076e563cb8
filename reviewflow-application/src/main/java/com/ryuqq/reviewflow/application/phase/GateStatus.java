package com.ryuqq.reviewflow.application.phase;

import com.ryuqq.reviewflow.core.escalation.Escalation;
import com.ryuqq.reviewflow.core.model.GateCriterion;
import com.ryuqq.reviewflow.core.statemachine.PhaseState;

import java.util.List;

/**
 * 게이트 평가 결과.
 *
 * <p>열린 Escalation은 게이트 조건에 포함되지 않더라도 항상 함께 노출됩니다.</p>
 *
 * @param phase Phase 번호
 * @param state Phase 상태
 * @param satisfied 모든 조건 충족 여부
 * @param criteria 전체 조건 (평가 시점 기준)
 * @param unmetCriteria 미충족 조건
 * @param openEscalations 열린 Escalation
 *
 * @author ReviewFlow Team
 * @since 1.0.0
 */
public record GateStatus(
    int phase,
    PhaseState state,
    boolean satisfied,
    List<GateCriterion> criteria,
    List<GateCriterion> unmetCriteria,
    List<Escalation> openEscalations
) {

    public GateStatus {
        criteria = List.copyOf(criteria);
        unmetCriteria = List.copyOf(unmetCriteria);
        openEscalations = List.copyOf(openEscalations);
    }
}
