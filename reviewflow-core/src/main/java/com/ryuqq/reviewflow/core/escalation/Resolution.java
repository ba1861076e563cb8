package com.ryuqq.reviewflow.core.escalation;

/**
 * Escalation 처리 상태. 만료(timeout) 상태는 없습니다.
 *
 * @author ReviewFlow Team
 * @since 1.0.0
 */
public enum Resolution {
    PENDING,
    RESOLVED
}
