package com.ryuqq.reviewflow.core.model;

/**
 * 토론 입장이 인용할 수 있는 근거의 종류.
 *
 * @author ReviewFlow Team
 * @since 1.0.0
 */
public enum EvidenceKind {

    /**
     * 카탈로그 규칙 항목 참조.
     */
    CATALOGUE_ENTRY,

    /**
     * 이전 결정 (Chronicle 기록) 참조.
     */
    PRIOR_DECISION,

    /**
     * 테스트 인용.
     */
    TEST_CITATION,

    /**
     * Gate Criterion 인용.
     */
    CRITERION_CITATION
}
