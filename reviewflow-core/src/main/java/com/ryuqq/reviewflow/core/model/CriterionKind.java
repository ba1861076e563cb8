package com.ryuqq.reviewflow.core.model;

/**
 * Gate Criterion의 평가 방식.
 *
 * <p>MANUAL 이외의 종류는 각 컴포넌트(TaskRouter, ReviewCoordinator,
 * CatalogueStore, EscalationManager)가 보고하는 상태로 자동 평가됩니다.</p>
 *
 * @author ReviewFlow Team
 * @since 1.0.0
 */
public enum CriterionKind {

    /**
     * 외부에서 근거와 함께 명시적으로 충족 처리.
     */
    MANUAL,

    /**
     * 단계의 모든 Work Item이 DONE (TaskRouter).
     */
    ALL_WORK_ITEMS_DONE,

    /**
     * 단계에 진행 중인 리뷰가 없음 (ReviewCoordinator).
     */
    NO_ACTIVE_REVIEWS,

    /**
     * DRAFT/UNDER_REVIEW 상태의 카탈로그 항목이 없음 (CatalogueStore).
     */
    CATALOGUE_SETTLED,

    /**
     * 미해결 Escalation이 없음 (EscalationManager).
     */
    NO_OPEN_ESCALATIONS
}
