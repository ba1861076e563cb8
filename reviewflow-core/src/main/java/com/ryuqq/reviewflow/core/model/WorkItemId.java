package com.ryuqq.reviewflow.core.model;

/**
 * Work Item 식별자.
 *
 * <p>외부 인벤토리/분석 협력자가 부여한 불투명(opaque) 식별자입니다.
 * 엔진은 값의 의미를 해석하지 않고 라우팅과 상태 추적에만 사용합니다.</p>
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
public final class WorkItemId {

    private final String value;

    private WorkItemId(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("WorkItemId cannot be null or blank");
        }
        if (value.length() > 128) {
            throw new IllegalArgumentException("WorkItemId length cannot exceed 128 characters");
        }
        if (!value.matches("^[a-zA-Z0-9\\-_.]+$")) {
            throw new IllegalArgumentException("WorkItemId contains invalid characters. Only alphanumeric, hyphen, underscore and dot are allowed");
        }
        this.value = value;
    }

    /**
     * WorkItemId 생성.
     *
     * @param value 식별자 값
     * @return WorkItemId 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static WorkItemId of(String value) {
        return new WorkItemId(value);
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
        WorkItemId other = (WorkItemId) o;
        return value.equals(other.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "WorkItemId{" + value + '}';
    }
}
