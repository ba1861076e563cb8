package com.ryuqq.reviewflow.adapter.runner;

import com.ryuqq.reviewflow.application.export.LedgerExporter;
import com.ryuqq.reviewflow.application.phase.GateProbe;
import com.ryuqq.reviewflow.application.phase.GateStatus;
import com.ryuqq.reviewflow.application.phase.PhaseController;
import com.ryuqq.reviewflow.application.review.ReviewCoordinator;
import com.ryuqq.reviewflow.application.review.ReviewOutcome;
import com.ryuqq.reviewflow.application.routing.TaskRouter;
import com.ryuqq.reviewflow.core.catalogue.ChangeDecision;
import com.ryuqq.reviewflow.core.catalogue.ChangeRequest;
import com.ryuqq.reviewflow.core.escalation.Escalation;
import com.ryuqq.reviewflow.core.escalation.EscalationDecision;
import com.ryuqq.reviewflow.core.model.ChangeProposal;
import com.ryuqq.reviewflow.core.model.CriterionKind;
import com.ryuqq.reviewflow.core.model.EntryId;
import com.ryuqq.reviewflow.core.model.EscalationId;
import com.ryuqq.reviewflow.core.model.PhasePlan;
import com.ryuqq.reviewflow.core.model.Role;
import com.ryuqq.reviewflow.core.model.WorkItemDescriptor;
import com.ryuqq.reviewflow.core.model.WorkItemId;
import com.ryuqq.reviewflow.core.spi.CatalogueStore;
import com.ryuqq.reviewflow.core.spi.ChronicleStore;
import com.ryuqq.reviewflow.core.spi.EscalationManager;
import com.ryuqq.reviewflow.core.spi.HumanDecisionPort;
import com.ryuqq.reviewflow.core.spi.ReviewerGateway;
import com.ryuqq.reviewflow.core.statemachine.PhaseState;
import com.ryuqq.reviewflow.core.statemachine.WorkItemStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * 조립 루트.
 *
 * <p>PhaseController, TaskRouter, ConsensusReviewRunner, EscalationDispatcher를 하나의
 * EscalationManager와 두 원장(Catalogue, Chronicle) 위에 연결합니다.</p>
 *
 * <p><strong>연결:</strong></p>
 * <ul>
 *   <li>ALL_WORK_ITEMS_DONE 조건 → {@link TaskRouter#allDone(int)}</li>
 *   <li>NO_ACTIVE_REVIEWS 조건 → {@link ReviewCoordinator#hasActiveReviews(int)}의 부정</li>
 *   <li>EscalationListener: TaskRouter (차단/해제), EscalationDispatcher (사람에게 전달)</li>
 * </ul>
 *
 * @author ReviewFlow Team
 * @since 1.0.0
 */
public final class ReviewFlowEngine {

    private static final Logger log = LoggerFactory.getLogger(ReviewFlowEngine.class);

    private final PhasePlan plan;
    private final CatalogueStore catalogue;
    private final ChronicleStore chronicle;
    private final EscalationManager escalations;
    private final ConsensusReviewRunner runner;
    private final TaskRouter router;
    private final PhaseController phases;
    private final EscalationDispatcher dispatcher;
    private final LedgerExporter exporter;

    /**
     * @param humanDecisions 사람의 결정 창구 (null이면 {@link #resolve}로만 Escalation을 처리)
     * @throws IllegalArgumentException 필수 의존성이 null인 경우
     */
    public ReviewFlowEngine(PhasePlan plan, ReviewerGateway gateway, HumanDecisionPort humanDecisions,
                            CatalogueStore catalogue, ChronicleStore chronicle, EscalationManager escalations,
                            ReviewRunnerConfig runnerConfig, EscalationDispatcherConfig dispatcherConfig,
                            Clock clock) {
        if (dispatcherConfig == null) {
            throw new IllegalArgumentException("dispatcherConfig cannot be null");
        }
        this.plan = plan;
        this.catalogue = catalogue;
        this.chronicle = chronicle;
        this.escalations = escalations;
        this.runner = new ConsensusReviewRunner(plan, gateway, catalogue, chronicle, escalations, runnerConfig);
        this.router = new TaskRouter(runner);

        Map<CriterionKind, GateProbe> probes = new EnumMap<>(CriterionKind.class);
        probes.put(CriterionKind.ALL_WORK_ITEMS_DONE, router::allDone);
        probes.put(CriterionKind.NO_ACTIVE_REVIEWS, phase -> !runner.hasActiveReviews(phase));
        this.phases = new PhaseController(plan, catalogue, escalations, probes, clock);

        escalations.addListener(router);
        if (humanDecisions != null) {
            this.dispatcher = new EscalationDispatcher(escalations, humanDecisions, dispatcherConfig);
            escalations.addListener(dispatcher);
        } else {
            this.dispatcher = null;
        }
        this.exporter = new LedgerExporter(catalogue, chronicle);
        log.info("ReviewFlow engine assembled: phases={}, humanDecisions={}", plan.size(), humanDecisions != null);
    }

    /**
     * 주기적인 Escalation 스캔 시작.
     */
    public void start() {
        if (dispatcher != null) {
            dispatcher.start();
        }
    }

    public void shutdown() throws InterruptedException {
        if (dispatcher != null) {
            dispatcher.shutdown();
        }
        runner.shutdown();
    }

    // ---- work intake & routing

    /**
     * @throws IllegalArgumentException Phase 번호가 계획 밖이거나 이미 다른 Phase에 등록된 경우
     */
    public void ingest(List<WorkItemDescriptor> descriptors) {
        if (descriptors == null) {
            throw new IllegalArgumentException("descriptors cannot be null");
        }
        for (WorkItemDescriptor descriptor : descriptors) {
            if (descriptor.phase() > plan.size()) {
                throw new IllegalArgumentException(String.format(
                    "%s targets phase %d but the plan has %d phases", descriptor.id(), descriptor.phase(), plan.size()));
            }
        }
        router.ingest(descriptors);
    }

    /**
     * 열린 Phase의 Work Item만 배정할 수 있습니다.
     *
     * @throws IllegalStateException Work Item의 Phase가 열려 있지 않은 경우
     */
    public void assign(WorkItemId id, Role assignee) {
        int phase = router.phaseOf(id)
            .orElseThrow(() -> new IllegalArgumentException("Unknown work item: " + id));
        PhaseState state = phases.state(phase);
        if (state != PhaseState.OPEN) {
            throw new IllegalStateException(String.format("Phase %d is %s, cannot assign %s", phase, state, id));
        }
        router.assign(id, assignee);
    }

    public CompletableFuture<ReviewOutcome> complete(WorkItemId id, ChangeProposal proposal) {
        return router.complete(id, proposal);
    }

    public WorkItemStatus itemStatus(WorkItemId id) {
        return router.status(id);
    }

    // ---- gate

    public GateStatus gateStatus(int phase) {
        return phases.evaluateGate(phase);
    }

    public void satisfyCriterion(int phase, String criterionId, String evidence) {
        phases.satisfyCriterion(phase, criterionId, evidence);
    }

    public int advancePhase() {
        return phases.advancePhase();
    }

    public Escalation requestReopen(int phase, Role requestedBy, String reason) {
        return phases.requestReopen(phase, requestedBy, reason);
    }

    public void reopenPhase(int phase, EscalationId approvedOverride) {
        phases.reopenPhase(phase, approvedOverride);
    }

    // ---- catalogue & escalations

    public ChangeDecision requestCatalogueChange(EntryId id, ChangeRequest request) {
        return catalogue.requestChange(id, request);
    }

    /**
     * 사람의 결정을 직접 반영 (HumanDecisionPort를 거치지 않는 경로).
     */
    public Escalation resolve(EscalationId id, EscalationDecision decision) {
        return escalations.resolve(id, decision);
    }

    public List<Escalation> openEscalations() {
        return escalations.open();
    }

    // ---- components

    public ReviewCoordinator reviews() {
        return runner;
    }

    public PhaseController phases() {
        return phases;
    }

    public LedgerExporter exporter() {
        return exporter;
    }

    public CatalogueStore catalogue() {
        return catalogue;
    }

    public ChronicleStore chronicle() {
        return chronicle;
    }
}
