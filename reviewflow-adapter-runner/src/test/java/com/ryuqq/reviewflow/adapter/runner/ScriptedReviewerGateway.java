package com.ryuqq.reviewflow.adapter.runner;

import com.ryuqq.reviewflow.application.review.ReviewCoordinator;
import com.ryuqq.reviewflow.core.model.ChangeProposal;
import com.ryuqq.reviewflow.core.model.Concern;
import com.ryuqq.reviewflow.core.model.Payload;
import com.ryuqq.reviewflow.core.model.Position;
import com.ryuqq.reviewflow.core.model.ProposalId;
import com.ryuqq.reviewflow.core.model.ReviewVote;
import com.ryuqq.reviewflow.core.model.Role;
import com.ryuqq.reviewflow.core.model.Verdict;
import com.ryuqq.reviewflow.core.spi.ReviewerGateway;
import com.ryuqq.reviewflow.testkit.fixture.ReviewFixtures;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BiFunction;

/**
 * 스크립트대로 즉시 응답하는 테스트용 ReviewerGateway.
 *
 * <ul>
 *   <li>투표: 역할별 판정 목록을 라운드마다 하나씩 사용, 목록이 끝나면 마지막 판정 반복</li>
 *   <li>Position: 역할별 생성 함수, 없으면 GENERAL 지지</li>
 *   <li>수정 요청: {@link #revisesWith(Payload)}가 있으면 그 내용으로 즉시 revise</li>
 *   <li>{@link #silent(Role)}: 해당 역할은 아무 응답도 하지 않음</li>
 * </ul>
 *
 * @author ReviewFlow Team
 * @since 1.0.0
 */
class ScriptedReviewerGateway implements ReviewerGateway {

    private final Map<Role, List<Verdict>> verdicts = new ConcurrentHashMap<>();
    private final Map<Role, BiFunction<ProposalId, Integer, Position>> positions = new ConcurrentHashMap<>();
    private final Map<Role, AtomicInteger> answeredRounds = new ConcurrentHashMap<>();
    private final Set<Role> silent = ConcurrentHashMap.newKeySet();
    private final Map<Role, AtomicInteger> voteRequests = new ConcurrentHashMap<>();
    private final AtomicInteger positionRequests = new AtomicInteger();
    private final AtomicInteger revisionRequests = new AtomicInteger();
    private final AtomicInteger highestVoteRound = new AtomicInteger();
    private final AtomicInteger highestDebateRound = new AtomicInteger();

    private volatile ReviewCoordinator coordinator;
    private volatile Payload revision;

    void bind(ReviewCoordinator coordinator) {
        this.coordinator = coordinator;
    }

    ScriptedReviewerGateway votes(Role role, Verdict... sequence) {
        verdicts.put(role, List.of(sequence));
        return this;
    }

    ScriptedReviewerGateway position(Role role, BiFunction<ProposalId, Integer, Position> factory) {
        positions.put(role, factory);
        return this;
    }

    ScriptedReviewerGateway silent(Role role) {
        silent.add(role);
        return this;
    }

    ScriptedReviewerGateway revisesWith(Payload content) {
        this.revision = content;
        return this;
    }

    @Override
    public void requestVote(ChangeProposal proposal, Role reviewer, int round) {
        voteRequests.computeIfAbsent(reviewer, r -> new AtomicInteger()).incrementAndGet();
        highestVoteRound.accumulateAndGet(round, Math::max);
        if (silent.contains(reviewer)) {
            return;
        }
        List<Verdict> script = verdicts.getOrDefault(reviewer, List.of(Verdict.APPROVED));
        int index = answeredRounds.computeIfAbsent(reviewer, r -> new AtomicInteger()).getAndIncrement();
        Verdict verdict = script.get(Math.min(index, script.size() - 1));
        coordinator.castVote(new ReviewVote(reviewer, proposal.id(), round, verdict,
            verdict == Verdict.APPROVED ? "" : reviewer + " has concerns"));
    }

    @Override
    public void requestPosition(ChangeProposal proposal, Role reviewer, int debateRound) {
        positionRequests.incrementAndGet();
        highestDebateRound.accumulateAndGet(debateRound, Math::max);
        if (silent.contains(reviewer)) {
            return;
        }
        BiFunction<ProposalId, Integer, Position> factory = positions.getOrDefault(reviewer,
            (id, d) -> ReviewFixtures.support(reviewer, id, d, Concern.GENERAL));
        coordinator.postPosition(factory.apply(proposal.id(), debateRound));
    }

    @Override
    public void requestRevision(ChangeProposal proposal, String feedback) {
        revisionRequests.incrementAndGet();
        Payload content = revision;
        if (content != null) {
            coordinator.revise(proposal.id(), content);
        }
    }

    int voteRequests(Role role) {
        AtomicInteger count = voteRequests.get(role);
        return count == null ? 0 : count.get();
    }

    int positionRequests() {
        return positionRequests.get();
    }

    int revisionRequests() {
        return revisionRequests.get();
    }

    int highestVoteRound() {
        return highestVoteRound.get();
    }

    int highestDebateRound() {
        return highestDebateRound.get();
    }
}
