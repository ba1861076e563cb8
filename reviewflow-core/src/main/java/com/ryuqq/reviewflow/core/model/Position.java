package com.ryuqq.reviewflow.core.model;

import java.util.Optional;

/**
 * 토론 라운드에서 한 역할이 게시한 입장.
 *
 * <p>모든 입장은 구체적인 근거({@link Evidence})를 인용해야 합니다.
 * 반대 입장은 대안 내용과 그 영향도(impact)를 함께 제시할 수 있으며,
 * 대안이 없는 반대는 "현재 상태 유지"를 지지하는 것으로 해석됩니다.</p>
 *
 * @param role 입장을 게시한 역할
 * @param proposalId 대상 제안
 * @param debateRound 토론 라운드 (1 또는 2)
 * @param stance 지지/반대
 * @param concern 입장의 관심사 (단계 안전 우선순위 비교에 사용)
 * @param evidence 인용 근거 (필수)
 * @param statement 입장 설명
 * @param alternative 대안 내용 (없으면 null)
 * @param alternativeImpact 대안의 영향도 (대안이 없으면 무시, 0 이상)
 *
 * @author ReviewFlow Team
 * @since 1.0.0
 */
public record Position(
    Role role,
    ProposalId proposalId,
    int debateRound,
    Stance stance,
    Concern concern,
    Evidence evidence,
    String statement,
    Payload alternative,
    int alternativeImpact
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public Position {
        if (role == null) {
            throw new IllegalArgumentException("role cannot be null");
        }
        if (proposalId == null) {
            throw new IllegalArgumentException("proposalId cannot be null");
        }
        if (debateRound < 1) {
            throw new IllegalArgumentException("debateRound must be positive (current: " + debateRound + ")");
        }
        if (stance == null) {
            throw new IllegalArgumentException("stance cannot be null");
        }
        if (concern == null) {
            throw new IllegalArgumentException("concern cannot be null");
        }
        if (evidence == null) {
            throw new IllegalArgumentException("position must reference concrete evidence");
        }
        if (alternative != null && stance == Stance.SUPPORT) {
            throw new IllegalArgumentException("a supporting position cannot carry an alternative");
        }
        if (alternativeImpact < 0) {
            throw new IllegalArgumentException("alternativeImpact must be non-negative (current: " + alternativeImpact + ")");
        }
        statement = statement == null ? "" : statement;
    }

    /**
     * 지지 입장 생성.
     */
    public static Position support(Role role, ProposalId proposalId, int debateRound,
                                   Concern concern, Evidence evidence, String statement) {
        return new Position(role, proposalId, debateRound, Stance.SUPPORT, concern, evidence, statement, null, 0);
    }

    /**
     * 대안 없는 반대 입장 생성 (현재 상태 유지 지지).
     */
    public static Position oppose(Role role, ProposalId proposalId, int debateRound,
                                  Concern concern, Evidence evidence, String statement) {
        return new Position(role, proposalId, debateRound, Stance.OPPOSE, concern, evidence, statement, null, 0);
    }

    /**
     * 대안을 제시하는 반대 입장 생성.
     */
    public static Position counterPropose(Role role, ProposalId proposalId, int debateRound,
                                          Concern concern, Evidence evidence, String statement,
                                          Payload alternative, int alternativeImpact) {
        if (alternative == null) {
            throw new IllegalArgumentException("alternative cannot be null for a counter-proposal");
        }
        return new Position(role, proposalId, debateRound, Stance.OPPOSE, concern, evidence, statement,
            alternative, alternativeImpact);
    }

    /**
     * 대안 내용 조회.
     *
     * @return 대안 (없으면 empty)
     */
    public Optional<Payload> alternativeContent() {
        return Optional.ofNullable(alternative);
    }
}
