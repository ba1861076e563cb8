package com.ryuqq.reviewflow.core.statemachine;

/**
 * Work Item 상태 전이 검증.
 *
 * <p>BLOCKED에서의 복귀는 차단 직전 상태로만 허용되므로
 * 호출자가 직전 상태를 함께 전달해야 합니다 ({@link #validateUnblock}).</p>
 *
 * @author ReviewFlow Team
 * @since 1.0.0
 */
public final class WorkItemTransition {

    private WorkItemTransition() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 일반 전이 검증 (BLOCKED 복귀 제외).
     *
     * @param from 현재 상태
     * @param to 전이할 상태
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static void validate(WorkItemStatus from, WorkItemStatus to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("States cannot be null (from: " + from + ", to: " + to + ")");
        }
        if (from.isTerminal()) {
            throw new IllegalStateException(
                String.format("Cannot transition from terminal state: %s → %s", from, to));
        }

        boolean valid = switch (from) {
            case PENDING -> to == WorkItemStatus.IN_PROGRESS || to == WorkItemStatus.BLOCKED;
            case IN_PROGRESS -> to == WorkItemStatus.IN_PROGRESS
                || to == WorkItemStatus.UNDER_REVIEW
                || to == WorkItemStatus.BLOCKED;
            case UNDER_REVIEW -> to == WorkItemStatus.DONE
                || to == WorkItemStatus.PENDING
                || to == WorkItemStatus.BLOCKED;
            // BLOCKED 복귀는 validateUnblock에서만 허용
            case BLOCKED, DONE -> false;
        };

        if (!valid) {
            throw new IllegalStateException(
                String.format("Invalid work item transition: %s → %s", from, to));
        }
    }

    /**
     * BLOCKED 해제 전이 검증.
     *
     * @param current 현재 상태 (BLOCKED여야 함)
     * @param restored 차단 직전 상태
     * @throws IllegalStateException current가 BLOCKED가 아니거나 restored가 유효하지 않은 경우
     */
    public static void validateUnblock(WorkItemStatus current, WorkItemStatus restored) {
        if (current != WorkItemStatus.BLOCKED) {
            throw new IllegalStateException("Work item is not blocked (current: " + current + ")");
        }
        if (restored == null || restored == WorkItemStatus.BLOCKED || restored.isTerminal()) {
            throw new IllegalStateException("Invalid restore state after unblock: " + restored);
        }
    }
}
