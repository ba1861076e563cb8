package com.ryuqq.reviewflow.core.model;

/**
 * 토론에서 제안에 대한 입장.
 *
 * @author ReviewFlow Team
 * @since 1.0.0
 */
public enum Stance {

    SUPPORT,

    OPPOSE
}
