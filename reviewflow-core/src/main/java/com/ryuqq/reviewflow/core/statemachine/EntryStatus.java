package com.ryuqq.reviewflow.core.statemachine;

/**
 * Catalogue Entry 버전의 상태.
 *
 * <pre>
 * DRAFT ─► UNDER_REVIEW ─► APPROVED ─► LOCKED ─► SUPERSEDED
 *   │           │              │
 *   └───────────┴──────────────┴─► INVALID
 * UNDER_REVIEW ─► DRAFT (수정 요청)
 * </pre>
 *
 * <p><strong>불변식:</strong> LOCKED 버전의 내용은 변경 불가.
 * 변경은 항상 새 버전을 만들고 이전 버전은 SUPERSEDED가 됩니다.
 * 어떤 상태의 버전도 삭제되지 않습니다.</p>
 *
 * @author ReviewFlow Team
 * @since 1.0.0
 */
public enum EntryStatus {

    DRAFT,

    UNDER_REVIEW,

    APPROVED,

    LOCKED,

    SUPERSEDED,

    INVALID;

    /**
     * 잠금 이전 (내용 수정 가능) 상태인지 확인.
     */
    public boolean isMutable() {
        return this == DRAFT || this == UNDER_REVIEW || this == APPROVED;
    }

    /**
     * 다음 Gate 이전에 정리되어야 하는 상태인지 확인.
     */
    public boolean isUnsettled() {
        return this == DRAFT || this == UNDER_REVIEW;
    }

    /**
     * 전이 허용 여부.
     *
     * @param to 전이할 상태
     * @return 허용되면 true
     */
    public boolean canTransitionTo(EntryStatus to) {
        if (to == null) {
            return false;
        }
        return switch (this) {
            case DRAFT -> to == UNDER_REVIEW || to == INVALID;
            case UNDER_REVIEW -> to == APPROVED || to == DRAFT || to == INVALID;
            case APPROVED -> to == LOCKED || to == INVALID;
            case LOCKED -> to == SUPERSEDED;
            case SUPERSEDED, INVALID -> false;
        };
    }

    /**
     * 전이 검증.
     *
     * @param to 전이할 상태
     * @throws IllegalStateException 허용되지 않는 전이인 경우
     */
    public void validateTransition(EntryStatus to) {
        if (!canTransitionTo(to)) {
            throw new IllegalStateException(
                String.format("Invalid catalogue entry transition: %s → %s", this, to));
        }
    }
}
