package com.ryuqq.reviewflow.core.model;

/**
 * 단계가 닫히기 전에 반드시 참이어야 하는 단일 조건.
 *
 * <p>불변 객체이며, 충족/초기화는 새 인스턴스를 반환합니다.</p>
 *
 * @param id 조건 식별자
 * @param description 조건 설명
 * @param kind 평가 방식
 * @param satisfied 충족 여부
 * @param evidence 충족 근거 참조 (미충족이면 null)
 *
 * @author ReviewFlow Team
 * @since 1.0.0
 */
public record GateCriterion(
    String id,
    String description,
    CriterionKind kind,
    boolean satisfied,
    String evidence
) {

    public GateCriterion {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id cannot be null or blank");
        }
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        if (satisfied && (evidence == null || evidence.isBlank())) {
            throw new IllegalArgumentException("a satisfied criterion must carry an evidence reference: " + id);
        }
    }

    /**
     * 정의로부터 미충족 상태의 조건 생성.
     */
    public static GateCriterion unsatisfied(CriterionDefinition definition) {
        return new GateCriterion(definition.id(), definition.description(), definition.kind(), false, null);
    }

    /**
     * 근거와 함께 충족된 새 인스턴스 반환.
     *
     * @param evidenceRef 근거 참조
     * @return 충족된 GateCriterion
     */
    public GateCriterion satisfy(String evidenceRef) {
        return new GateCriterion(id, description, kind, true, evidenceRef);
    }

    /**
     * 미충족 상태로 되돌린 새 인스턴스 반환.
     */
    public GateCriterion reset() {
        return new GateCriterion(id, description, kind, false, null);
    }
}
