package com.ryuqq.reviewflow.core.model;

/**
 * 토론 입장이 인용하는 구체적인 근거.
 *
 * @param kind 근거 종류
 * @param reference 근거 참조 (예: "RULE-004@v2", "chronicle#17", "ParserTest#roundTrip")
 *
 * @author ReviewFlow Team
 * @since 1.0.0
 */
public record Evidence(EvidenceKind kind, String reference) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException kind가 null이거나 reference가 비어있는 경우
     */
    public Evidence {
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        if (reference == null || reference.isBlank()) {
            throw new IllegalArgumentException("reference cannot be null or blank");
        }
    }

    public static Evidence of(EvidenceKind kind, String reference) {
        return new Evidence(kind, reference);
    }

    @Override
    public String toString() {
        return kind + ":" + reference;
    }
}
