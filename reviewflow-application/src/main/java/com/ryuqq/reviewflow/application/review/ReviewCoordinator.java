package com.ryuqq.reviewflow.application.review;

import com.ryuqq.reviewflow.core.model.ChangeProposal;
import com.ryuqq.reviewflow.core.model.Payload;
import com.ryuqq.reviewflow.core.model.Position;
import com.ryuqq.reviewflow.core.model.ProposalId;
import com.ryuqq.reviewflow.core.model.ReviewVote;
import com.ryuqq.reviewflow.core.statemachine.ProposalStatus;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Peer-review 및 합의 프로토콜 실행기.
 *
 * <p><strong>리뷰 흐름:</strong></p>
 * <pre>
 * submit(proposal)
 *   ↓
 * Round 1: 필수 역할 전원 투표 대기 (누락 시 backoff 재요청 → 예산 소진 시 VOTE_TIMEOUT escalation)
 *   ├─ 전원 APPROVED → CONSENSUS
 *   ├─ REQUESTED_CHANGE만 → 수정 요청 → revise → Round 1 재실행
 *   └─ OBJECTION 포함 → DEBATE
 *        ↓
 * Debate (최대 2라운드): Position 수집 → 수정 기회 → 재투표
 *   ├─ 전원 APPROVED → CONSENSUS
 *   └─ 2라운드 후에도 분열 → ConflictResolver
 *        ├─ 채택 → CONSENSUS 또는 REJECTED
 *        └─ 보류 → CONSENSUS_DEADLOCK escalation
 *   ↓
 * CONSENSUS → Chronicle 기록 → 카탈로그 반영 → COMMITTED
 * </pre>
 *
 * <p>{@code castVote}, {@code postPosition}, {@code revise}는 리뷰어/제안자의 비동기 응답입니다.
 * 같은 (제안, 역할, 라운드)의 투표가 다시 오면 덮어씁니다.</p>
 *
 * @author ReviewFlow Team
 * @since 1.0.0
 */
public interface ReviewCoordinator {

    /**
     * 리뷰 시작.
     *
     * @param proposal 제안
     * @return 최종 결과 future (교착 시 사람이 결정할 때까지 미완료)
     * @throws IllegalStateException 같은 제안이 이미 진행 중인 경우
     */
    CompletableFuture<ReviewOutcome> submit(ChangeProposal proposal);

    /**
     * 투표 접수.
     *
     * @throws IllegalArgumentException 진행 중이지 않은 제안이거나 필수 역할이 아닌 경우
     */
    void castVote(ReviewVote vote);

    /**
     * 토론 Position 접수.
     *
     * @throws IllegalArgumentException 진행 중이지 않은 제안이거나 필수 역할이 아닌 경우
     */
    void postPosition(Position position);

    /**
     * 제안자의 수정본 접수.
     */
    void revise(ProposalId proposalId, Payload revisedContent);

    /**
     * 합의 전 철회. 협조적 취소이며 진행 중인 대기는 즉시 깨어납니다.
     *
     * @return 철회가 받아들여졌으면 true, 이미 CONSENSUS 이후이거나 알 수 없는 제안이면 false
     */
    boolean withdraw(ProposalId proposalId, String reason);

    Optional<ProposalStatus> status(ProposalId proposalId);

    /**
     * 해당 Phase에 아직 끝나지 않은 리뷰가 있는지.
     */
    boolean hasActiveReviews(int phase);
}
