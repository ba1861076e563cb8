package com.ryuqq.reviewflow.core.exception;

/**
 * 워크플로 엔진 도메인 오류의 기반 클래스.
 *
 * <p>모든 하위 예외는 안정적인 오류 코드를 가지며, 호출자/운영자에게 그대로 전달됩니다.
 * 인자 검증 오류는 {@link IllegalArgumentException}, 잘못된 상태 전이는
 * {@link IllegalStateException}을 사용하고 이 계층에 포함하지 않습니다.</p>
 *
 * <p><strong>오류 분류:</strong></p>
 * <ul>
 *   <li>GATE-001 {@link GateNotSatisfiedException}: 단계 전진 차단 (작업을 더 완료하면 복구 가능)</li>
 *   <li>ROUTE-001 {@link DuplicateSubmissionException}: 한 Work Item에 두 개의 활성 제안 (자동 재시도 없음)</li>
 *   <li>CHRON-001 {@link IncompleteReviewRecordException}: 투표가 빠진 Chronicle 기록 (항상 거부)</li>
 *   <li>CAT-001 {@link CatalogueLockViolationException}: 잠긴 항목의 직접 변경/삭제 (항상 거부)</li>
 *   <li>REVIEW-001 {@link ConsensusDeadlockException}: 토론 소진 후 Resolver 실패 (항상 Escalation)</li>
 * </ul>
 *
 * @author ReviewFlow Team
 * @since 1.0.0
 */
public abstract class ReviewFlowException extends RuntimeException {

    private final String errorCode;

    protected ReviewFlowException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    /**
     * 오류 코드 조회.
     *
     * @return 오류 코드 (예: GATE-001)
     */
    public String getErrorCode() {
        return errorCode;
    }
}
