package com.ryuqq.reviewflow.core.model;

/**
 * 작업과 리뷰를 수행하는 역할(capability).
 *
 * <p>런타임 리플렉션이나 동적 디스패치 대신 고정된 역할 집합을 사용하며,
 * 단계별 필수 리뷰어는 {@link PhasePlan}의 조회 테이블로 결정됩니다.</p>
 *
 * @author ReviewFlow Team
 * @since 1.0.0
 */
public enum Role {

    /**
     * 구조와 경계 설계를 검토.
     */
    ARCHITECT,

    /**
     * 원본 동작과의 일치(fidelity)를 검토.
     */
    DOMAIN_EXPERT,

    /**
     * 테스트 가능성과 검증 근거를 검토.
     */
    TEST_ENGINEER,

    /**
     * 코드 품질과 관례 준수를 검토.
     */
    QUALITY_REVIEWER,

    /**
     * 작업을 수행하고 변경을 제안.
     */
    IMPLEMENTER,

    /**
     * 규칙 카탈로그를 관리.
     */
    CATALOGUE_CURATOR
}
