package com.ryuqq.reviewflow.adapter.runner;

import com.ryuqq.reviewflow.application.review.ReviewOutcome;
import com.ryuqq.reviewflow.core.model.ChangeProposal;
import com.ryuqq.reviewflow.core.model.EscalationId;
import com.ryuqq.reviewflow.core.model.Payload;
import com.ryuqq.reviewflow.core.model.Position;
import com.ryuqq.reviewflow.core.model.ReviewVote;
import com.ryuqq.reviewflow.core.model.Role;
import com.ryuqq.reviewflow.core.statemachine.ProposalStatus;
import com.ryuqq.reviewflow.core.statemachine.ProposalTransition;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * 제안 하나의 리뷰 진행 상태.
 *
 * <p>리뷰 스레드와 응답(투표, Position, 수정본, 철회) 스레드가 공유합니다.
 * 모든 변경은 {@code lock} 아래에서 일어나고, 응답이 도착하면 {@code changed}로 리뷰 스레드를 깨웁니다.</p>
 *
 * <p>투표는 (역할, 라운드) 키로 덮어씁니다. 이미 닫힌 라운드의 투표는 무시합니다.</p>
 *
 * @author ReviewFlow Team
 * @since 1.0.0
 */
final class ReviewSession {

    private final ChangeProposal original;
    private final Set<Role> required;
    private final CompletableFuture<ReviewOutcome> result = new CompletableFuture<>();

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition changed = lock.newCondition();

    private final Map<Integer, Map<Role, ReviewVote>> votes = new TreeMap<>();
    private final Map<Integer, Map<Role, Position>> positions = new TreeMap<>();

    private ChangeProposal proposal;
    private ProposalStatus status = ProposalStatus.PROPOSED;
    private int round;
    private int debateRound;
    private Payload pendingRevision;
    private boolean withdrawn;
    private String withdrawReason;
    private EscalationId pendingEscalation;
    private volatile boolean closed;
    private volatile long closedAtNanos;

    ReviewSession(ChangeProposal proposal, Set<Role> required) {
        this.original = proposal;
        this.proposal = proposal;
        this.required = required.isEmpty() ? EnumSet.noneOf(Role.class) : EnumSet.copyOf(required);
    }

    ChangeProposal original() {
        return original;
    }

    Set<Role> required() {
        return EnumSet.copyOf(required);
    }

    CompletableFuture<ReviewOutcome> result() {
        return result;
    }

    ChangeProposal proposal() {
        lock.lock();
        try {
            return proposal;
        } finally {
            lock.unlock();
        }
    }

    ProposalStatus status() {
        lock.lock();
        try {
            return status;
        } finally {
            lock.unlock();
        }
    }

    /**
     * 리뷰 스레드가 아직 끝나지 않았는지.
     */
    boolean isActive() {
        return !closed;
    }

    void close() {
        closedAtNanos = System.nanoTime();
        closed = true;
    }

    /**
     * 리뷰가 끝난 뒤 주어진 시간 이상 지났는지.
     */
    boolean finishedLongerThan(long retentionMs) {
        return closed && System.nanoTime() - closedAtNanos >= TimeUnit.MILLISECONDS.toNanos(retentionMs);
    }

    /**
     * 상태 전이. 철회가 요청되어 있으면 전이하지 않고 {@link WithdrawnSignal}을 던집니다.
     */
    void transition(ProposalStatus next) {
        lock.lock();
        try {
            checkWithdrawnLocked();
            status = ProposalTransition.transition(status, next);
        } finally {
            lock.unlock();
        }
    }

    void markWithdrawn() {
        lock.lock();
        try {
            status = ProposalTransition.transition(status, ProposalStatus.WITHDRAWN);
        } finally {
            lock.unlock();
        }
    }

    // ---- votes

    /**
     * 새 투표 라운드 시작. 대기 중인 수정본이 있으면 먼저 반영합니다.
     *
     * @return 라운드 번호
     */
    int openVoteRound() {
        lock.lock();
        try {
            checkWithdrawnLocked();
            if (pendingRevision != null) {
                proposal = proposal.withContent(pendingRevision);
                pendingRevision = null;
            }
            round++;
            votes.put(round, new EnumMap<>(Role.class));
            return round;
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return 반영되었으면 true, 닫힌 라운드의 투표라 무시했으면 false
     */
    boolean acceptVote(ReviewVote vote) {
        lock.lock();
        try {
            requireOpen(vote.reviewer());
            if (vote.round() > round) {
                throw new IllegalArgumentException(String.format(
                    "vote for round %d of %s but round %d is open", vote.round(), original.id(), round));
            }
            if (vote.round() < round) {
                return false;
            }
            votes.get(round).put(vote.reviewer(), vote);
            changed.signalAll();
            return true;
        } finally {
            lock.unlock();
        }
    }

    Set<Role> missingVotes(int voteRound) {
        lock.lock();
        try {
            Set<Role> missing = EnumSet.copyOf(required);
            missing.removeAll(votes.get(voteRound).keySet());
            return missing;
        } finally {
            lock.unlock();
        }
    }

    Map<Role, ReviewVote> votes(int voteRound) {
        lock.lock();
        try {
            return Map.copyOf(votes.get(voteRound));
        } finally {
            lock.unlock();
        }
    }

    /**
     * 모든 라운드의 투표 (라운드 순, 역할 순).
     */
    List<ReviewVote> allVotes() {
        lock.lock();
        try {
            List<ReviewVote> all = new ArrayList<>();
            for (Map<Role, ReviewVote> perRound : votes.values()) {
                all.addAll(perRound.values());
            }
            return all;
        } finally {
            lock.unlock();
        }
    }

    // ---- debate

    void openDebateRound(int number) {
        lock.lock();
        try {
            checkWithdrawnLocked();
            debateRound = number;
            positions.put(number, new EnumMap<>(Role.class));
        } finally {
            lock.unlock();
        }
    }

    boolean acceptPosition(Position position) {
        lock.lock();
        try {
            requireOpen(position.role());
            if (position.debateRound() > debateRound) {
                throw new IllegalArgumentException(String.format(
                    "position for debate round %d of %s but round %d is open",
                    position.debateRound(), original.id(), debateRound));
            }
            if (position.debateRound() < debateRound) {
                return false;
            }
            positions.get(debateRound).put(position.role(), position);
            changed.signalAll();
            return true;
        } finally {
            lock.unlock();
        }
    }

    Set<Role> missingPositions(int number) {
        lock.lock();
        try {
            Set<Role> missing = EnumSet.copyOf(required);
            missing.removeAll(positions.get(number).keySet());
            return missing;
        } finally {
            lock.unlock();
        }
    }

    List<Position> positions(int number) {
        lock.lock();
        try {
            return List.copyOf(positions.get(number).values());
        } finally {
            lock.unlock();
        }
    }

    List<Position> allPositions() {
        lock.lock();
        try {
            List<Position> all = new ArrayList<>();
            for (Map<Role, Position> perRound : positions.values()) {
                all.addAll(perRound.values());
            }
            return all;
        } finally {
            lock.unlock();
        }
    }

    // ---- revision

    void acceptRevision(Payload content) {
        lock.lock();
        try {
            if (closed || status.isTerminal() || status == ProposalStatus.CONSENSUS) {
                throw new IllegalArgumentException(original.id() + " is not open for revision");
            }
            pendingRevision = content;
            changed.signalAll();
        } finally {
            lock.unlock();
        }
    }

    boolean hasRevision() {
        lock.lock();
        try {
            return pendingRevision != null;
        } finally {
            lock.unlock();
        }
    }

    // ---- withdraw & escalation

    /**
     * 철회 표시. 합의 이후이거나, 대기 중인 Escalation이 이미 승인되어 되돌릴 수 없으면 거부합니다.
     *
     * @param approved 대기 중인 Escalation이 되돌릴 수 없게 승인되었는지 판단
     * @return 받아들여졌으면 true
     */
    boolean requestWithdraw(String reason, Predicate<EscalationId> approved) {
        lock.lock();
        try {
            if (closed || !status.isWithdrawable()) {
                return false;
            }
            if (pendingEscalation != null && approved.test(pendingEscalation)) {
                return false;
            }
            withdrawn = true;
            withdrawReason = reason;
            changed.signalAll();
            return true;
        } finally {
            lock.unlock();
        }
    }

    String withdrawReason() {
        lock.lock();
        try {
            return withdrawReason;
        } finally {
            lock.unlock();
        }
    }

    EscalationId pendingEscalation() {
        lock.lock();
        try {
            return pendingEscalation;
        } finally {
            lock.unlock();
        }
    }

    /**
     * 대기할 Escalation 등록.
     *
     * @return 이미 철회가 요청되어 있으면 true (호출자가 직접 Escalation을 닫아야 함)
     */
    boolean attachEscalation(EscalationId id) {
        lock.lock();
        try {
            pendingEscalation = id;
            return withdrawn;
        } finally {
            lock.unlock();
        }
    }

    void detachEscalation() {
        lock.lock();
        try {
            pendingEscalation = null;
        } finally {
            lock.unlock();
        }
    }

    /**
     * 승인된 카탈로그 변경이 이미 새 버전을 만든 뒤 CONSENSUS로 전이합니다.
     * 그 사이 들어온 철회 요청은 버립니다.
     *
     * @return 버려진 철회 사유, 없으면 null
     */
    String enterConsensusAfterApproval() {
        lock.lock();
        try {
            String overridden = withdrawn ? withdrawReason : null;
            withdrawn = false;
            withdrawReason = null;
            pendingEscalation = null;
            status = ProposalTransition.transition(status, ProposalStatus.CONSENSUS);
            return overridden;
        } finally {
            lock.unlock();
        }
    }

    void checkWithdrawn() {
        lock.lock();
        try {
            checkWithdrawnLocked();
        } finally {
            lock.unlock();
        }
    }

    /**
     * 응답이 모두 도착하거나 시간이 다 될 때까지 대기.
     *
     * @param missing 아직 응답하지 않은 역할 (lock 아래에서 평가)
     * @param timeoutMs 최대 대기 시간
     * @return 시간이 다 된 시점에 남은 역할 (모두 응답했으면 빈 집합)
     * @throws WithdrawnSignal 대기 중 철회된 경우
     */
    Set<Role> awaitResponses(Supplier<Set<Role>> missing, long timeoutMs) {
        lock.lock();
        try {
            long nanos = TimeUnit.MILLISECONDS.toNanos(timeoutMs);
            while (true) {
                checkWithdrawnLocked();
                Set<Role> left = missing.get();
                if (left.isEmpty() || nanos <= 0) {
                    return left;
                }
                nanos = changed.awaitNanos(nanos);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for responses to " + original.id(), e);
        } finally {
            lock.unlock();
        }
    }

    private void requireOpen(Role role) {
        if (closed || status.isTerminal() || status == ProposalStatus.CONSENSUS) {
            throw new IllegalArgumentException(original.id() + " is not under review (status " + status + ")");
        }
        if (!required.contains(role)) {
            throw new IllegalArgumentException(role + " is not a required reviewer in phase " + original.phase());
        }
    }

    private void checkWithdrawnLocked() {
        if (withdrawn) {
            throw new WithdrawnSignal();
        }
    }

    /**
     * 철회로 리뷰를 중단할 때 리뷰 스레드 안에서만 쓰이는 신호.
     */
    static final class WithdrawnSignal extends RuntimeException {
        WithdrawnSignal() {
            super("withdrawn", null, false, false);
        }
    }

    /**
     * 응답 대기 Escalation이 거부되어 기록 없이 리뷰를 끝낼 때 쓰이는 신호.
     */
    static final class AbortSignal extends RuntimeException {
        AbortSignal(String reason) {
            super(reason, null, false, false);
        }
    }
}
