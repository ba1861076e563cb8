package com.ryuqq.reviewflow.core.resolver;

/**
 * 충돌 해결 후보의 출처.
 *
 * @author ReviewFlow Team
 * @since 1.0.0
 */
public enum OptionKind {

    /** 제안자가 올린 내용 그대로 채택 */
    PROPOSED,

    /** 반대 측 Position이 제시한 대안 */
    ALTERNATIVE,

    /** 현재 상태 유지 (제안 기각) */
    RETAIN_CURRENT
}
