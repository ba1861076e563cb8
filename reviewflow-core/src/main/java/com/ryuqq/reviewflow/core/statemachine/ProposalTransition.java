package com.ryuqq.reviewflow.core.statemachine;

/**
 * Change Proposal 상태 전이 검증 및 실행.
 *
 * <p><strong>허용되는 전이:</strong></p>
 * <ul>
 *   <li>PROPOSED → REVIEW_ROUND_1, WITHDRAWN</li>
 *   <li>REVIEW_ROUND_1 → REVIEW_ROUND_1 (수정 후 재실행), DEBATE, CONSENSUS, REJECTED, WITHDRAWN</li>
 *   <li>DEBATE → DEBATE (다음 토론 라운드), CONSENSUS, REJECTED, WITHDRAWN</li>
 *   <li>CONSENSUS → COMMITTED</li>
 * </ul>
 *
 * @author ReviewFlow Team
 * @since 1.0.0
 */
public final class ProposalTransition {

    private ProposalTransition() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 상태 전이가 유효한지 검증.
     *
     * @param from 현재 상태
     * @param to 전이할 상태
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static void validate(ProposalStatus from, ProposalStatus to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("States cannot be null (from: " + from + ", to: " + to + ")");
        }

        if (from.isTerminal()) {
            throw new IllegalStateException(
                String.format("Cannot transition from terminal state: %s → %s", from, to)
            );
        }

        boolean valid = switch (from) {
            case PROPOSED -> to == ProposalStatus.REVIEW_ROUND_1 || to == ProposalStatus.WITHDRAWN;
            case REVIEW_ROUND_1 -> to == ProposalStatus.REVIEW_ROUND_1
                || to == ProposalStatus.DEBATE
                || to == ProposalStatus.CONSENSUS
                || to == ProposalStatus.REJECTED
                || to == ProposalStatus.WITHDRAWN;
            case DEBATE -> to == ProposalStatus.DEBATE
                || to == ProposalStatus.CONSENSUS
                || to == ProposalStatus.REJECTED
                || to == ProposalStatus.WITHDRAWN;
            case CONSENSUS -> to == ProposalStatus.COMMITTED;
            case REJECTED, WITHDRAWN, COMMITTED -> false;
        };

        if (!valid) {
            throw new IllegalStateException(
                String.format("Invalid proposal transition: %s → %s", from, to)
            );
        }
    }

    /**
     * 상태 전이 실행 (검증 후).
     *
     * @param current 현재 상태
     * @param next 다음 상태
     * @return 전이된 상태 (next)
     */
    public static ProposalStatus transition(ProposalStatus current, ProposalStatus next) {
        validate(current, next);
        return next;
    }
}
