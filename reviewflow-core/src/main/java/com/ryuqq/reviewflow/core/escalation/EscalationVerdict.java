package com.ryuqq.reviewflow.core.escalation;

/**
 * 사람의 결정.
 *
 * @author ReviewFlow Team
 * @since 1.0.0
 */
public enum EscalationVerdict {
    APPROVE,
    REJECT
}
