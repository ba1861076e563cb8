package com.ryuqq.reviewflow.core.model;

/**
 * Escalation 식별자.
 *
 * <p>사람의 결정을 기다리는 사례 하나를 식별합니다.</p>
 *
 * <p><strong>불변성:</strong> 생성 후 값 변경 불가</p>
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>길이: 1~128자</li>
 *   <li>패턴: 영숫자, 하이픈(-), 언더스코어(_), 점(.)만 허용</li>
 * </ul>
 *
 * @author ReviewFlow Team
 * @since 1.0.0
 */
public final class EscalationId {

    private final String value;

    private EscalationId(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("EscalationId cannot be null or blank");
        }
        if (value.length() > 128) {
            throw new IllegalArgumentException("EscalationId length cannot exceed 128 characters");
        }
        if (!value.matches("^[a-zA-Z0-9\\-_.]+$")) {
            throw new IllegalArgumentException("EscalationId contains invalid characters. Only alphanumeric, hyphen, underscore and dot are allowed");
        }
        this.value = value;
    }

    /**
     * EscalationId 생성.
     *
     * @param value 식별자 값
     * @return EscalationId 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static EscalationId of(String value) {
        return new EscalationId(value);
    }

    /**
     * 무작위 EscalationId 생성 (UUID 기반).
     *
     * @return 새 EscalationId
     */
    public static EscalationId random() {
        return new EscalationId("esc-" + java.util.UUID.randomUUID());
    }

    /**
     * 식별자 값 조회.
     *
     * @return 식별자 값
     */
    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        EscalationId other = (EscalationId) o;
        return value.equals(other.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "EscalationId{" + value + '}';
    }
}
