package com.ryuqq.reviewflow.core.model;

/**
 * 리뷰어 역할 하나가 특정 라운드에 던진 투표.
 *
 * <p>투표는 {@code (proposalId, reviewer, round)} 키에 대해 멱등입니다.
 * 같은 키로 다시 투표하면 추가되지 않고 덮어씁니다.</p>
 *
 * @param reviewer 리뷰어 역할
 * @param proposalId 대상 제안
 * @param round 라운드 번호 (1 이상)
 * @param verdict 판정
 * @param rationale 판단 근거 설명 (null이면 빈 문자열로 저장)
 *
 * @author ReviewFlow Team
 * @since 1.0.0
 */
public record ReviewVote(
    Role reviewer,
    ProposalId proposalId,
    int round,
    Verdict verdict,
    String rationale
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필수 필드가 null이거나 round가 양수가 아닌 경우
     */
    public ReviewVote {
        if (reviewer == null) {
            throw new IllegalArgumentException("reviewer cannot be null");
        }
        if (proposalId == null) {
            throw new IllegalArgumentException("proposalId cannot be null");
        }
        if (round < 1) {
            throw new IllegalArgumentException("round must be positive (current: " + round + ")");
        }
        if (verdict == null) {
            throw new IllegalArgumentException("verdict cannot be null");
        }
        rationale = rationale == null ? "" : rationale;
    }

    public static ReviewVote approve(Role reviewer, ProposalId proposalId, int round) {
        return new ReviewVote(reviewer, proposalId, round, Verdict.APPROVED, "");
    }

    public static ReviewVote requestChange(Role reviewer, ProposalId proposalId, int round, String rationale) {
        return new ReviewVote(reviewer, proposalId, round, Verdict.REQUESTED_CHANGE, rationale);
    }

    public static ReviewVote object(Role reviewer, ProposalId proposalId, int round, String rationale) {
        return new ReviewVote(reviewer, proposalId, round, Verdict.OBJECTION, rationale);
    }
}
