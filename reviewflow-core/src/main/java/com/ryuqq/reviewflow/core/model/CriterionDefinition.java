package com.ryuqq.reviewflow.core.model;

/**
 * 단계 설정에 선언된 Gate Criterion 정의.
 *
 * @param id 단계 내에서 고유한 식별자
 * @param description 조건 설명 (predicate description)
 * @param kind 평가 방식
 *
 * @author ReviewFlow Team
 * @since 1.0.0
 */
public record CriterionDefinition(String id, String description, CriterionKind kind) {

    public CriterionDefinition {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id cannot be null or blank");
        }
        if (description == null || description.isBlank()) {
            throw new IllegalArgumentException("description cannot be null or blank");
        }
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
    }
}
