package com.ryuqq.reviewflow.core.model;

import java.util.Collections;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * 단계 하나의 정적 설정.
 *
 * @param ordinal 단계 번호 (1..N)
 * @param name 단계 이름
 * @param criteria Gate Criterion 정의 목록
 * @param requiredReviewers 이 단계의 제안에 투표해야 하는 역할 집합 (비어있으면 안 됨)
 * @param safetyPriority 교착 해소 시 우선하는 관심사
 *
 * @author ReviewFlow Team
 * @since 1.0.0
 */
public record PhaseDefinition(
    int ordinal,
    String name,
    List<CriterionDefinition> criteria,
    Set<Role> requiredReviewers,
    Concern safetyPriority
) {

    public PhaseDefinition {
        if (ordinal < 1) {
            throw new IllegalArgumentException("ordinal must be positive (current: " + ordinal + ")");
        }
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (criteria == null || criteria.isEmpty()) {
            throw new IllegalArgumentException("phase " + ordinal + " must declare at least one gate criterion");
        }
        if (requiredReviewers == null || requiredReviewers.isEmpty()) {
            throw new IllegalArgumentException("phase " + ordinal + " must declare at least one required reviewer");
        }
        if (safetyPriority == null) {
            throw new IllegalArgumentException("safetyPriority cannot be null");
        }
        Set<String> ids = new HashSet<>();
        for (CriterionDefinition criterion : criteria) {
            if (!ids.add(criterion.id())) {
                throw new IllegalArgumentException("duplicate criterion id in phase " + ordinal + ": " + criterion.id());
            }
        }
        criteria = List.copyOf(criteria);
        requiredReviewers = Collections.unmodifiableSet(EnumSet.copyOf(requiredReviewers));
    }
}
