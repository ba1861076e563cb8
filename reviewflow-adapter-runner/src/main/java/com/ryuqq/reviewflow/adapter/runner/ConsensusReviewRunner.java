package com.ryuqq.reviewflow.adapter.runner;

import com.ryuqq.reviewflow.application.logging.ReviewMdc;
import com.ryuqq.reviewflow.application.review.Committed;
import com.ryuqq.reviewflow.application.review.Rejected;
import com.ryuqq.reviewflow.application.review.ReviewCoordinator;
import com.ryuqq.reviewflow.application.review.ReviewOutcome;
import com.ryuqq.reviewflow.application.review.Withdrawn;
import com.ryuqq.reviewflow.core.catalogue.CatalogueEntry;
import com.ryuqq.reviewflow.core.catalogue.ChangeDecision;
import com.ryuqq.reviewflow.core.catalogue.ChangeRequest;
import com.ryuqq.reviewflow.core.chronicle.ChronicleDraft;
import com.ryuqq.reviewflow.core.chronicle.DecisionBasis;
import com.ryuqq.reviewflow.core.escalation.Escalation;
import com.ryuqq.reviewflow.core.escalation.EscalationDecision;
import com.ryuqq.reviewflow.core.escalation.EscalationReason;
import com.ryuqq.reviewflow.core.escalation.SubjectKind;
import com.ryuqq.reviewflow.core.exception.ConsensusDeadlockException;
import com.ryuqq.reviewflow.core.model.ChangeProposal;
import com.ryuqq.reviewflow.core.model.EntryId;
import com.ryuqq.reviewflow.core.model.EscalationId;
import com.ryuqq.reviewflow.core.model.Payload;
import com.ryuqq.reviewflow.core.model.PhasePlan;
import com.ryuqq.reviewflow.core.model.Position;
import com.ryuqq.reviewflow.core.model.ProposalId;
import com.ryuqq.reviewflow.core.model.ReviewVote;
import com.ryuqq.reviewflow.core.model.Role;
import com.ryuqq.reviewflow.core.model.Verdict;
import com.ryuqq.reviewflow.core.resolver.ConflictResolver;
import com.ryuqq.reviewflow.core.resolver.ResolutionRequest;
import com.ryuqq.reviewflow.core.resolver.ResolverDecision;
import com.ryuqq.reviewflow.core.spi.CatalogueStore;
import com.ryuqq.reviewflow.core.spi.ChronicleStore;
import com.ryuqq.reviewflow.core.spi.EscalationManager;
import com.ryuqq.reviewflow.core.spi.ReviewerGateway;
import com.ryuqq.reviewflow.core.statemachine.EntryStatus;
import com.ryuqq.reviewflow.core.statemachine.ProposalStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * 합의 리뷰 프로토콜 실행기.
 *
 * <p>리뷰 하나를 worker 스레드 하나가 끝까지 진행합니다. 동시에 진행되는 리뷰 수는
 * {@link ReviewRunnerConfig#concurrency()}로 제한됩니다.</p>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * submit(proposal)
 *   ↓
 * REVIEW_ROUND_1: 필수 역할에 투표 요청 → 전원 응답까지 대기
 *   (누락 역할은 backoff 후 재요청, 재요청 예산 소진 시 VOTE_TIMEOUT Escalation)
 *   ├─ 전원 APPROVED → commit (UNANIMOUS)
 *   ├─ REQUESTED_CHANGE만 → 수정 요청 → revise 대기 → 재투표 (maxRevisionCycles 초과 시 교착)
 *   └─ OBJECTION 포함 → DEBATE
 * DEBATE (최대 2라운드): Position 수집 → 재투표 (그 사이 revise는 재투표에 반영)
 *   ├─ 전원 APPROVED → commit (UNANIMOUS)
 *   └─ 2라운드 후 분열 → ConflictResolver
 *        ├─ Adopt(내용 변경) → commit (RESOLVER)
 *        ├─ Adopt(현재 유지) → REJECTED, Chronicle 기록 (RESOLVER)
 *        └─ Defer → CONSENSUS_DEADLOCK Escalation → 사람 결정 (HUMAN)
 * commit: CONSENSUS → 카탈로그 반영 → Chronicle append → COMMITTED
 * </pre>
 *
 * <p><strong>잠긴 카탈로그 항목:</strong> 대상 항목이 LOCKED이면 합의된 내용도 BEHAVIORAL 변경
 * 요청으로 올라가며, 사람이 승인한 경우에만 새 버전이 생깁니다. 거부되면 REJECTED로 기록합니다.</p>
 *
 * <p><strong>철회:</strong> 협조적 취소입니다. 대기 중인 리뷰 스레드를 깨우고, 걸려 있는
 * Escalation은 REJECT "withdrawn"으로 닫습니다. 원장에는 아무것도 쓰지 않습니다.</p>
 *
 * @author ReviewFlow Team
 * @since 1.0.0
 */
public final class ConsensusReviewRunner implements ReviewCoordinator {

    /**
     * 교착 판정 전 최대 토론 라운드.
     */
    public static final int MAX_DEBATE_ROUNDS = 2;

    private static final Logger log = LoggerFactory.getLogger(ConsensusReviewRunner.class);

    private final PhasePlan plan;
    private final ReviewerGateway gateway;
    private final CatalogueStore catalogue;
    private final ChronicleStore chronicle;
    private final EscalationManager escalations;
    private final ReviewRunnerConfig config;
    private final BackoffCalculator backoff;
    private final ConflictResolver resolver = new ConflictResolver();
    private final ExecutorService workers;
    private final Map<ProposalId, ReviewSession> sessions = new ConcurrentHashMap<>();

    public ConsensusReviewRunner(PhasePlan plan, ReviewerGateway gateway, CatalogueStore catalogue,
                                 ChronicleStore chronicle, EscalationManager escalations, ReviewRunnerConfig config) {
        this(plan, gateway, catalogue, chronicle, escalations, config, config == null ? null : BackoffCalculator.from(config));
    }

    /**
     * 생성자 (커스텀 BackoffCalculator 주입).
     *
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public ConsensusReviewRunner(PhasePlan plan, ReviewerGateway gateway, CatalogueStore catalogue,
                                 ChronicleStore chronicle, EscalationManager escalations, ReviewRunnerConfig config,
                                 BackoffCalculator backoff) {
        if (plan == null) {
            throw new IllegalArgumentException("plan cannot be null");
        }
        if (gateway == null) {
            throw new IllegalArgumentException("gateway cannot be null");
        }
        if (catalogue == null) {
            throw new IllegalArgumentException("catalogue cannot be null");
        }
        if (chronicle == null) {
            throw new IllegalArgumentException("chronicle cannot be null");
        }
        if (escalations == null) {
            throw new IllegalArgumentException("escalations cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (backoff == null) {
            throw new IllegalArgumentException("backoff cannot be null");
        }
        this.plan = plan;
        this.gateway = gateway;
        this.catalogue = catalogue;
        this.chronicle = chronicle;
        this.escalations = escalations;
        this.config = config;
        this.backoff = backoff;
        this.workers = Executors.newFixedThreadPool(config.concurrency());
    }

    @Override
    public CompletableFuture<ReviewOutcome> submit(ChangeProposal proposal) {
        if (proposal == null) {
            throw new IllegalArgumentException("proposal cannot be null");
        }
        evictFinished();
        Set<Role> required = plan.requiredReviewers(proposal.phase());
        ReviewSession session = new ReviewSession(proposal, required);
        if (sessions.putIfAbsent(proposal.id(), session) != null) {
            throw new IllegalStateException(proposal.id() + " was already submitted");
        }
        try {
            workers.execute(() -> run(session));
        } catch (RejectedExecutionException e) {
            sessions.remove(proposal.id());
            throw new IllegalStateException("Review runner is shut down", e);
        }
        log.info("Review submitted: proposal={}, workItem={}, phase={}, reviewers={}",
            proposal.id().getValue(), proposal.workItemId().getValue(), proposal.phase(), required);
        return session.result();
    }

    @Override
    public void castVote(ReviewVote vote) {
        if (vote == null) {
            throw new IllegalArgumentException("vote cannot be null");
        }
        if (!require(vote.proposalId()).acceptVote(vote)) {
            log.warn("Ignored late vote: proposal={}, reviewer={}, round={}",
                vote.proposalId().getValue(), vote.reviewer(), vote.round());
        }
    }

    @Override
    public void postPosition(Position position) {
        if (position == null) {
            throw new IllegalArgumentException("position cannot be null");
        }
        if (!require(position.proposalId()).acceptPosition(position)) {
            log.warn("Ignored late position: proposal={}, role={}, debateRound={}",
                position.proposalId().getValue(), position.role(), position.debateRound());
        }
    }

    @Override
    public void revise(ProposalId proposalId, Payload revisedContent) {
        if (revisedContent == null) {
            throw new IllegalArgumentException("revisedContent cannot be null");
        }
        require(proposalId).acceptRevision(revisedContent);
        log.info("Revision received: proposal={}, content={}", proposalId.getValue(), revisedContent.snapshotRef());
    }

    @Override
    public boolean withdraw(ProposalId proposalId, String reason) {
        if (proposalId == null) {
            throw new IllegalArgumentException("proposalId cannot be null");
        }
        ReviewSession session = sessions.get(proposalId);
        String why = reason == null || reason.isBlank() ? "withdrawn" : reason;
        if (session == null || !session.requestWithdraw(why, this::approvedCatalogueChange)) {
            return false;
        }
        EscalationId pending = session.pendingEscalation();
        if (pending != null && !closeWithdrawn(pending, why) && approvedCatalogueChange(pending)) {
            // 승인된 변경은 이미 카탈로그에 있으므로 리뷰는 커밋으로 끝남
            log.info("Withdraw ignored: proposal={}, catalogue change {} was already approved",
                proposalId.getValue(), pending.getValue());
            return false;
        }
        log.info("Withdraw requested: proposal={}, reason={}", proposalId.getValue(), why);
        return true;
    }

    @Override
    public Optional<ProposalStatus> status(ProposalId proposalId) {
        ReviewSession session = sessions.get(proposalId);
        return session == null ? Optional.empty() : Optional.of(session.status());
    }

    @Override
    public boolean hasActiveReviews(int phase) {
        for (ReviewSession session : sessions.values()) {
            if (session.original().phase() == phase && session.isActive()) {
                return true;
            }
        }
        return false;
    }

    /**
     * Runner 종료. 진행 중인 리뷰가 끝나기를 최대 60초 기다립니다.
     *
     * @throws InterruptedException 대기 중 인터럽트 발생 시
     */
    public void shutdown() throws InterruptedException {
        workers.shutdown();
        if (!workers.awaitTermination(60, TimeUnit.SECONDS)) {
            workers.shutdownNow();
        }
    }

    // ------------------------------------------------------------------ review thread

    private void run(ReviewSession session) {
        ChangeProposal proposal = session.original();
        ReviewMdc.setReview(proposal);
        ReviewOutcome outcome = null;
        RuntimeException failure = null;
        try {
            outcome = review(session);
        } catch (ReviewSession.WithdrawnSignal signal) {
            outcome = withdrawn(session);
        } catch (ReviewSession.AbortSignal abort) {
            outcome = abort(session, abort.getMessage());
        } catch (RuntimeException e) {
            log.error("Review failed: proposal={}, status={}", proposal.id().getValue(), session.status(), e);
            failure = e;
        } finally {
            // 결과를 알리기 전에 닫아야 게이트 평가가 끝난 리뷰를 진행 중으로 보지 않음
            session.close();
            ReviewMdc.clear();
        }
        if (failure != null) {
            session.result().completeExceptionally(failure);
        } else {
            session.result().complete(outcome);
        }
    }

    private ReviewOutcome withdrawn(ReviewSession session) {
        session.markWithdrawn();
        log.info("Review withdrawn: proposal={}, reason={}",
            session.original().id().getValue(), session.withdrawReason());
        return new Withdrawn(session.original().id(), session.withdrawReason());
    }

    private ReviewOutcome abort(ReviewSession session, String reason) {
        try {
            session.transition(ProposalStatus.REJECTED);
        } catch (ReviewSession.WithdrawnSignal signal) {
            return withdrawn(session);
        }
        log.warn("Review rejected without a ledger record: proposal={}, reason={}",
            session.original().id().getValue(), reason);
        return new Rejected(session.original().id(), reason, 0);
    }

    private ReviewOutcome review(ReviewSession session) {
        session.transition(ProposalStatus.REVIEW_ROUND_1);

        int revisions = 0;
        while (true) {
            Map<Role, ReviewVote> votes = collectVotes(session);
            if (allApproved(votes)) {
                return commit(session, DecisionBasis.UNANIMOUS, session.proposal().content(),
                    "approved unanimously by " + session.required());
            }
            if (votes.values().stream().anyMatch(v -> v.verdict() == Verdict.OBJECTION)) {
                break;
            }
            if (revisions >= config.maxRevisionCycles()) {
                return escalateDeadlock(session, 0,
                    "changes still requested after " + revisions + " revision cycles", List.of());
            }
            revisions++;
            awaitRevision(session, feedback(votes));
            session.transition(ProposalStatus.REVIEW_ROUND_1);
        }

        List<Position> lastPositions = List.of();
        for (int debateRound = 1; debateRound <= MAX_DEBATE_ROUNDS; debateRound++) {
            session.transition(ProposalStatus.DEBATE);
            log.info("Debate round {} started: proposal={}", debateRound, session.original().id().getValue());
            lastPositions = collectPositions(session, debateRound);

            Map<Role, ReviewVote> votes = collectVotes(session);
            if (allApproved(votes)) {
                return commit(session, DecisionBasis.UNANIMOUS, session.proposal().content(),
                    "approved unanimously after debate round " + debateRound);
            }
        }
        return resolveSplit(session, lastPositions);
    }

    private ReviewOutcome resolveSplit(ReviewSession session, List<Position> positions) {
        ChangeProposal proposal = session.proposal();
        ResolverDecision decision = resolver.decide(
            new ResolutionRequest(proposal, plan.safetyPriority(proposal.phase()), positions));

        if (decision instanceof ResolverDecision.Adopt) {
            ResolverDecision.Adopt adopt = (ResolverDecision.Adopt) decision;
            log.info("Resolver decided: proposal={}, {}", proposal.id().getValue(), adopt.describe());
            if (adopt.option().changesContent()) {
                return commit(session, DecisionBasis.RESOLVER, adopt.option().content(), adopt.describe());
            }
            return rejectRecorded(session, DecisionBasis.RESOLVER, adopt.describe());
        }
        ResolverDecision.Defer defer = (ResolverDecision.Defer) decision;
        return escalateDeadlock(session, MAX_DEBATE_ROUNDS, defer.reason(), positions);
    }

    /**
     * 교착은 승인도 거부도 아니며 항상 사람에게 넘깁니다.
     */
    private ReviewOutcome escalateDeadlock(ReviewSession session, int debateRounds, String reason,
                                           List<Position> positions) {
        ConsensusDeadlockException deadlock =
            new ConsensusDeadlockException(session.original().id(), debateRounds, reason);
        log.warn("{} [{}]", deadlock.getMessage(), deadlock.getErrorCode());

        EscalationDecision human = escalateAndAwait(session, EscalationReason.CONSENSUS_DEADLOCK,
            deadlock.getMessage(), positions);
        if (human.isApproved()) {
            Payload content = human.replacementContent().orElse(session.proposal().content());
            return commit(session, DecisionBasis.HUMAN, content, "human approved: " + human.text());
        }
        return rejectRecorded(session, DecisionBasis.HUMAN, "human rejected: " + human.text());
    }

    // ------------------------------------------------------------------ collecting responses

    private Map<Role, ReviewVote> collectVotes(ReviewSession session) {
        int round = session.openVoteRound();
        ChangeProposal proposal = session.proposal();
        for (Role role : session.required()) {
            gateway.requestVote(proposal, role, round);
        }
        awaitResponses(session, () -> session.missingVotes(round),
            role -> gateway.requestVote(proposal, role, round),
            EscalationReason.VOTE_TIMEOUT, "vote for round " + round);
        return session.votes(round);
    }

    private List<Position> collectPositions(ReviewSession session, int debateRound) {
        session.openDebateRound(debateRound);
        ChangeProposal proposal = session.proposal();
        for (Role role : session.required()) {
            gateway.requestPosition(proposal, role, debateRound);
        }
        awaitResponses(session, () -> session.missingPositions(debateRound),
            role -> gateway.requestPosition(proposal, role, debateRound),
            EscalationReason.POSITION_TIMEOUT, "position for debate round " + debateRound);
        return session.positions(debateRound);
    }

    private void awaitRevision(ReviewSession session, String feedback) {
        ChangeProposal proposal = session.proposal();
        Role proposer = proposal.proposer();
        gateway.requestRevision(proposal, feedback);
        awaitResponses(session, () -> session.hasRevision() ? Set.of() : Set.of(proposer),
            role -> gateway.requestRevision(proposal, feedback),
            EscalationReason.REVISION_TIMEOUT, "revision");
    }

    /**
     * 모든 응답이 올 때까지 backoff 간격으로 재요청합니다. 예산을 다 쓰면 사람에게 묻고,
     * 승인이면 예산을 새로 채워 계속 기다리고 거부면 기록 없이 리뷰를 끝냅니다.
     */
    private void awaitResponses(ReviewSession session, Supplier<Set<Role>> missing, Consumer<Role> rerequest,
                                EscalationReason timeoutReason, String what) {
        int attempt = 1;
        while (true) {
            Set<Role> left = session.awaitResponses(missing, backoff.calculate(attempt));
            if (left.isEmpty()) {
                return;
            }
            if (attempt > config.maxResponseRetries()) {
                String detail = String.format("no %s from %s after %d attempts", what, left, attempt);
                EscalationDecision decision = escalateAndAwait(session, timeoutReason, detail, List.of());
                if (!decision.isApproved()) {
                    throw new ReviewSession.AbortSignal(timeoutReason + ": " + decision.text());
                }
                attempt = 1;
            } else {
                log.warn("Re-requesting {}: proposal={}, missing={}, attempt={}",
                    what, session.original().id().getValue(), left, attempt);
                attempt++;
            }
            for (Role role : left) {
                rerequest.accept(role);
            }
        }
    }

    private EscalationDecision escalateAndAwait(ReviewSession session, EscalationReason reason, String detail,
                                                List<Position> positions) {
        ChangeProposal proposal = session.original();
        Escalation escalation = escalations.raise(SubjectKind.PROPOSAL, proposal.id().getValue(),
            proposal.workItemId(), reason, detail, positions);
        return awaitEscalation(session, escalation.id());
    }

    private EscalationDecision awaitEscalation(ReviewSession session, EscalationId escalationId) {
        CompletableFuture<EscalationDecision> resolution = escalations.awaitResolution(escalationId);
        if (session.attachEscalation(escalationId)) {
            closeWithdrawn(escalationId, session.withdrawReason());
        }
        try {
            return join(resolution);
        } finally {
            session.detachEscalation();
            session.checkWithdrawn();
        }
    }

    // ------------------------------------------------------------------ outcomes

    private ReviewOutcome commit(ReviewSession session, DecisionBasis basis, Payload content, String decision) {
        ChangeProposal proposal = session.proposal();
        Optional<EntryId> target = proposal.targetEntry();
        String beforeRef = session.original().content().snapshotRef();
        String catalogueRef = null;
        Payload committed = content;
        String decisionText = decision;

        if (target.isPresent()) {
            Optional<CatalogueEntry> current = catalogue.current(target.get());
            beforeRef = current.map(e -> e.content().snapshotRef()).orElse("");

            if (current.isPresent() && current.get().status() == EntryStatus.LOCKED) {
                CatalogueEntry locked = current.get();
                ChangeDecision change = catalogue.requestChange(target.get(), ChangeRequest.behavioral(content,
                    "agreed in review of " + proposal.id().getValue(), proposal.proposer(), proposal.workItemId()));
                CatalogueEntry settled = awaitCatalogueChange(session, change);
                if (settled.version() == locked.version()) {
                    session.detachEscalation();
                    session.checkWithdrawn();
                    String why = escalations.find(change.escalationId())
                        .flatMap(Escalation::outcome)
                        .map(EscalationDecision::text)
                        .orElse("rejected");
                    return rejectRecorded(session, DecisionBasis.HUMAN,
                        "behavioral change to " + locked.ref() + " rejected: " + why);
                }
                String overridden = session.enterConsensusAfterApproval();
                if (overridden != null) {
                    log.warn("Withdrawal of {} ignored: behavioral change already approved as {} (reason: {})",
                        proposal.id().getValue(), settled.ref(), overridden);
                }
                catalogueRef = settled.ref();
                committed = settled.content();
                decisionText = decision + "; behavioral change approved as " + settled.ref();
            } else {
                session.transition(ProposalStatus.CONSENSUS);
                catalogueRef = catalogue.acceptReviewed(target.get(), content).ref();
            }
        } else {
            session.transition(ProposalStatus.CONSENSUS);
        }

        long sequence = chronicle.append(new ChronicleDraft(proposal.id(), proposal.workItemId(), proposal.phase(),
            beforeRef, committed.snapshotRef(), session.required(), session.allVotes(), session.allPositions(),
            decisionText, basis, catalogueRef == null ? List.of() : List.of(catalogueRef)));

        session.transition(ProposalStatus.COMMITTED);
        log.info("Review committed: proposal={}, seq={}, basis={}, catalogue={}",
            proposal.id().getValue(), sequence, basis, catalogueRef == null ? "-" : catalogueRef);
        return new Committed(proposal.id(), sequence, basis, committed, catalogueRef);
    }

    private CatalogueEntry awaitCatalogueChange(ReviewSession session, ChangeDecision change) {
        if (!change.isEscalated()) {
            return change.entry();
        }
        if (session.attachEscalation(change.escalationId())) {
            closeWithdrawn(change.escalationId(), session.withdrawReason());
        }
        try {
            return join(change.settled());
        } catch (RuntimeException e) {
            session.detachEscalation();
            throw e;
        }
    }

    private ReviewOutcome rejectRecorded(ReviewSession session, DecisionBasis basis, String reason) {
        session.transition(ProposalStatus.REJECTED);

        ChangeProposal proposal = session.proposal();
        String currentRef = proposal.targetEntry()
            .flatMap(catalogue::current)
            .map(e -> e.content().snapshotRef())
            .orElse(session.original().content().snapshotRef());
        List<String> refs = proposal.targetEntry()
            .flatMap(catalogue::current)
            .map(e -> List.of(e.ref()))
            .orElse(List.of());

        long sequence = chronicle.append(new ChronicleDraft(proposal.id(), proposal.workItemId(), proposal.phase(),
            currentRef, currentRef, session.required(), session.allVotes(), session.allPositions(),
            "rejected: " + reason, basis, refs));
        log.info("Review rejected: proposal={}, seq={}, basis={}, reason={}",
            proposal.id().getValue(), sequence, basis, reason);
        return new Rejected(proposal.id(), reason, sequence);
    }

    // ------------------------------------------------------------------ helpers

    /**
     * @return Escalation을 철회로 닫았으면 true, 이미 결정되어 있었으면 false
     */
    private boolean closeWithdrawn(EscalationId escalationId, String reason) {
        try {
            escalations.resolve(escalationId, EscalationDecision.reject("withdrawn: " + reason));
            return true;
        } catch (IllegalStateException alreadyResolved) {
            log.info("Escalation {} was resolved before the withdrawal: {}",
                escalationId.getValue(), alreadyResolved.getMessage());
            return false;
        }
    }

    private boolean approvedCatalogueChange(EscalationId escalationId) {
        return escalations.find(escalationId)
            .filter(e -> e.subjectKind() == SubjectKind.CATALOGUE_CHANGE)
            .flatMap(Escalation::outcome)
            .map(EscalationDecision::isApproved)
            .orElse(false);
    }

    /**
     * 끝난 지 보존 시간이 지난 세션을 제거합니다.
     */
    private void evictFinished() {
        long retentionMs = config.finishedRetentionMs();
        sessions.values().removeIf(session -> session.finishedLongerThan(retentionMs));
    }

    /**
     * @return 보관 중인 세션 수 (진행 중 + 보존 기간 내 종료)
     */
    int retainedSessions() {
        return sessions.size();
    }

    private ReviewSession require(ProposalId proposalId) {
        if (proposalId == null) {
            throw new IllegalArgumentException("proposalId cannot be null");
        }
        ReviewSession session = sessions.get(proposalId);
        if (session == null) {
            throw new IllegalArgumentException("Unknown proposal: " + proposalId);
        }
        return session;
    }

    private static boolean allApproved(Map<Role, ReviewVote> votes) {
        return votes.values().stream().allMatch(v -> v.verdict() == Verdict.APPROVED);
    }

    private static String feedback(Map<Role, ReviewVote> votes) {
        List<String> lines = new ArrayList<>();
        for (ReviewVote vote : votes.values()) {
            if (vote.verdict() == Verdict.REQUESTED_CHANGE) {
                lines.add(vote.reviewer() + ": " + vote.rationale());
            }
        }
        return String.join("; ", lines);
    }

    private static <T> T join(CompletableFuture<T> future) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for a human decision", e);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Waiting for a human decision failed", e.getCause());
        }
    }
}
