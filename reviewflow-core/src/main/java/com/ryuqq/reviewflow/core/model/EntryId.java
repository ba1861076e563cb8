package com.ryuqq.reviewflow.core.model;

/**
 * Catalogue Entry 식별자.
 *
 * <p>규칙 항목의 안정적인 식별자이며, 버전이 바뀌어도 동일하게 유지됩니다.
 * 개별 버전은 {@code (EntryId, version)} 쌍으로 구분됩니다.</p>
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
public final class EntryId {

    private final String value;

    private EntryId(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("EntryId cannot be null or blank");
        }
        if (value.length() > 128) {
            throw new IllegalArgumentException("EntryId length cannot exceed 128 characters");
        }
        if (!value.matches("^[a-zA-Z0-9\\-_.]+$")) {
            throw new IllegalArgumentException("EntryId contains invalid characters. Only alphanumeric, hyphen, underscore and dot are allowed");
        }
        this.value = value;
    }

    /**
     * EntryId 생성.
     *
     * @param value 식별자 값
     * @return EntryId 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static EntryId of(String value) {
        return new EntryId(value);
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
        EntryId other = (EntryId) o;
        return value.equals(other.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "EntryId{" + value + '}';
    }
}
