package com.ryuqq.reviewflow.application.phase;

import com.ryuqq.reviewflow.core.catalogue.CatalogueEntry;
import com.ryuqq.reviewflow.core.escalation.Escalation;
import com.ryuqq.reviewflow.core.escalation.EscalationReason;
import com.ryuqq.reviewflow.core.escalation.SubjectKind;
import com.ryuqq.reviewflow.core.exception.GateNotSatisfiedException;
import com.ryuqq.reviewflow.core.model.CriterionDefinition;
import com.ryuqq.reviewflow.core.model.CriterionKind;
import com.ryuqq.reviewflow.core.model.EscalationId;
import com.ryuqq.reviewflow.core.model.GateCriterion;
import com.ryuqq.reviewflow.core.model.PhaseDefinition;
import com.ryuqq.reviewflow.core.model.PhasePlan;
import com.ryuqq.reviewflow.core.model.Role;
import com.ryuqq.reviewflow.core.spi.CatalogueStore;
import com.ryuqq.reviewflow.core.spi.EscalationManager;
import com.ryuqq.reviewflow.core.statemachine.PhaseState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Phase 순서와 게이트 조건의 단일 소유자.
 *
 * <p><strong>규칙:</strong></p>
 * <ul>
 *   <li>생성 시 Phase 1이 열림</li>
 *   <li>한 번에 하나의 Phase만 열림, 건너뛰기 불가</li>
 *   <li>advancePhase는 모든 조건이 충족될 때만 진행하며, 실패 시 아무것도 바꾸지 않음</li>
 *   <li>게이트 경계에서 APPROVED 카탈로그 항목을 모두 잠금</li>
 *   <li>닫힌 Phase는 승인된 PHASE_REOPEN Escalation으로만 다시 열 수 있으며, 각 승인은 한 번만 사용 가능</li>
 * </ul>
 *
 * <p><strong>조건 평가:</strong> MANUAL 조건은 {@link #satisfyCriterion}으로 기록하고,
 * 나머지는 평가 시점마다 {@link GateProbe}로 계산합니다. CATALOGUE_SETTLED와
 * NO_OPEN_ESCALATIONS는 기본 probe가 제공됩니다.</p>
 *
 * <p><strong>Thread-Safety:</strong> 모든 공개 메서드는 synchronized입니다.</p>
 *
 * @author ReviewFlow Team
 * @since 1.0.0
 */
public class PhaseController {

    private static final Logger log = LoggerFactory.getLogger(PhaseController.class);

    private final PhasePlan plan;
    private final CatalogueStore catalogue;
    private final EscalationManager escalations;
    private final Map<CriterionKind, GateProbe> probes;
    private final Clock clock;

    private final PhaseState[] states;
    private final List<Map<String, GateCriterion>> manualCriteria;
    private final List<PhaseTransition> transitions = new ArrayList<>();
    private final Set<EscalationId> usedOverrides = new HashSet<>();
    private int current;

    public PhaseController(PhasePlan plan, CatalogueStore catalogue, EscalationManager escalations,
                           Map<CriterionKind, GateProbe> probes, Clock clock) {
        if (plan == null || catalogue == null || escalations == null || clock == null) {
            throw new IllegalArgumentException("plan, catalogue, escalations and clock cannot be null");
        }
        this.plan = plan;
        this.catalogue = catalogue;
        this.escalations = escalations;
        this.clock = clock;

        Map<CriterionKind, GateProbe> merged = new EnumMap<>(CriterionKind.class);
        merged.put(CriterionKind.CATALOGUE_SETTLED, phase -> !catalogue.hasUnsettled());
        merged.put(CriterionKind.NO_OPEN_ESCALATIONS, phase -> escalations.open().isEmpty());
        if (probes != null) {
            merged.putAll(probes);
        }
        this.probes = merged;

        this.states = new PhaseState[plan.size() + 1];
        this.manualCriteria = new ArrayList<>(plan.size() + 1);
        this.manualCriteria.add(Map.of());
        for (PhaseDefinition definition : plan.phases()) {
            Map<String, GateCriterion> criteria = new LinkedHashMap<>();
            for (CriterionDefinition criterion : definition.criteria()) {
                if (criterion.kind() != CriterionKind.MANUAL && !this.probes.containsKey(criterion.kind())) {
                    throw new IllegalArgumentException(String.format(
                        "phase %d criterion '%s' needs a probe for %s", definition.ordinal(), criterion.id(), criterion.kind()));
                }
                criteria.put(criterion.id(), GateCriterion.unsatisfied(criterion));
            }
            manualCriteria.add(criteria);
            states[definition.ordinal()] = PhaseState.PENDING;
        }

        this.current = 1;
        states[1] = PhaseState.OPEN;
        record(1, PhaseTransition.Kind.OPENED, "initial phase");
    }

    /**
     * Phase 열기.
     *
     * <p>현재 열린 Phase면 아무 일도 하지 않습니다.</p>
     *
     * @throws IllegalStateException 순서를 건너뛰거나 닫힌 Phase를 여는 경우
     */
    public synchronized void openPhase(int phase) {
        plan.definition(phase);
        PhaseState state = states[phase];
        if (state == PhaseState.OPEN) {
            return;
        }
        if (state == PhaseState.CLOSED) {
            throw new IllegalStateException(String.format(
                "phase %d is closed; reopening requires an approved override (requestReopen)", phase));
        }
        throw new IllegalStateException(String.format(
            "cannot open phase %d out of sequence; phase %d must pass its gate first", phase, current));
    }

    /**
     * 게이트 평가. 상태를 바꾸지 않습니다.
     */
    public synchronized GateStatus evaluateGate(int phase) {
        plan.definition(phase);
        List<GateCriterion> criteria = new ArrayList<>();
        List<GateCriterion> unmet = new ArrayList<>();
        for (GateCriterion stored : manualCriteria.get(phase).values()) {
            GateCriterion evaluated = evaluate(phase, stored);
            criteria.add(evaluated);
            if (!evaluated.satisfied()) {
                unmet.add(evaluated);
            }
        }
        List<Escalation> open = escalations.open();
        return new GateStatus(phase, states[phase], unmet.isEmpty(), criteria, unmet, open);
    }

    /**
     * MANUAL 조건 충족 기록.
     *
     * @throws IllegalArgumentException 알 수 없는 조건이거나 MANUAL이 아닌 경우
     * @throws IllegalStateException 열린 Phase가 아닌 경우
     */
    public synchronized void satisfyCriterion(int phase, String criterionId, String evidence) {
        plan.definition(phase);
        if (states[phase] != PhaseState.OPEN) {
            throw new IllegalStateException("phase " + phase + " is not open (state: " + states[phase] + ")");
        }
        GateCriterion criterion = manualCriteria.get(phase).get(criterionId);
        if (criterion == null) {
            throw new IllegalArgumentException("unknown criterion in phase " + phase + ": " + criterionId);
        }
        if (criterion.kind() != CriterionKind.MANUAL) {
            throw new IllegalArgumentException(
                "criterion " + criterionId + " is evaluated by the system (" + criterion.kind() + ")");
        }
        manualCriteria.get(phase).put(criterionId, criterion.satisfy(evidence));
        log.info("Gate criterion satisfied: phase={}, criterion={}, evidence={}", phase, criterionId, evidence);
    }

    /**
     * 현재 Phase를 닫고 다음 Phase를 엽니다.
     *
     * <p>성공 시 순서: APPROVED 항목 잠금 → 현재 Phase 닫기 → 전이 기록 → 다음 Phase 열기.
     * 마지막 Phase를 닫으면 종료 상태가 됩니다.</p>
     *
     * @return 새로 열린 Phase 번호 (종료 상태면 plan 크기 + 1)
     * @throws GateNotSatisfiedException 조건이 하나라도 미충족이면 (상태 변경 없음)
     * @throws IllegalStateException 이미 종료 상태인 경우
     */
    public synchronized int advancePhase() {
        if (isComplete()) {
            throw new IllegalStateException("all " + plan.size() + " phases are closed");
        }
        int closing = current;
        GateStatus gate = evaluateGate(closing);
        if (!gate.satisfied()) {
            log.warn("Gate not satisfied: phase={}, unmet={}", closing,
                gate.unmetCriteria().stream().map(GateCriterion::id).toList());
            throw new GateNotSatisfiedException(closing, gate.unmetCriteria());
        }

        // 시스템 조건은 충족 시점의 근거로 고정
        Map<String, GateCriterion> stored = manualCriteria.get(closing);
        for (GateCriterion evaluated : gate.criteria()) {
            stored.put(evaluated.id(), evaluated);
        }

        List<CatalogueEntry> locked = catalogue.lockApproved();
        states[closing] = PhaseState.CLOSED;
        record(closing, PhaseTransition.Kind.CLOSED, "locked " + locked.size() + " catalogue entries");
        log.info("Phase closed: phase={}, lockedEntries={}", closing, locked.size());

        current = closing + 1;
        if (isComplete()) {
            record(closing, PhaseTransition.Kind.COMPLETED, "final phase closed");
            log.info("All phases closed");
        } else {
            states[current] = PhaseState.OPEN;
            record(current, PhaseTransition.Kind.OPENED, "gate of phase " + closing + " passed");
            log.info("Phase opened: phase={}", current);
        }
        return current;
    }

    /**
     * 닫힌 Phase 재개 요청. PHASE_REOPEN Escalation을 올립니다.
     *
     * @throws IllegalStateException 닫힌 Phase가 아닌 경우
     */
    public synchronized Escalation requestReopen(int phase, Role requestedBy, String reason) {
        plan.definition(phase);
        if (states[phase] != PhaseState.CLOSED) {
            throw new IllegalStateException("only a closed phase can be reopened (phase " + phase + " is " + states[phase] + ")");
        }
        if (requestedBy == null || reason == null || reason.isBlank()) {
            throw new IllegalArgumentException("requestedBy and reason are required");
        }
        return escalations.raise(SubjectKind.PHASE_REOPEN, subjectRef(phase), null,
            EscalationReason.PHASE_REOPEN, requestedBy + ": " + reason, List.of());
    }

    /**
     * 승인된 Escalation에 근거해 닫힌 Phase를 다시 엽니다.
     *
     * <p>대상 Phase의 조건은 미충족으로 초기화되고, 이후 Phase는 PENDING으로 돌아갑니다.
     * 이미 잠긴 카탈로그 항목은 그대로 잠긴 상태를 유지합니다.</p>
     *
     * @throws IllegalStateException Escalation이 이 Phase에 대해 승인되지 않았거나 이미 사용된 경우
     */
    public synchronized void reopenPhase(int phase, EscalationId escalationId) {
        plan.definition(phase);
        if (states[phase] != PhaseState.CLOSED) {
            throw new IllegalStateException("phase " + phase + " is not closed (state: " + states[phase] + ")");
        }
        Escalation escalation = escalations.find(escalationId)
            .orElseThrow(() -> new IllegalArgumentException("Unknown escalation: " + escalationId));
        if (escalation.reason() != EscalationReason.PHASE_REOPEN || !subjectRef(phase).equals(escalation.subjectRef())) {
            throw new IllegalStateException(escalationId + " is not a reopen request for phase " + phase);
        }
        if (escalation.isPending() || !escalation.decision().isApproved()) {
            throw new IllegalStateException(escalationId + " has not approved reopening phase " + phase);
        }
        if (usedOverrides.contains(escalationId)) {
            log.warn("Rejected reuse of reopen override: phase={}, escalation={}", phase, escalationId.getValue());
            throw new IllegalStateException(escalationId + " has already been used to reopen phase " + phase);
        }
        usedOverrides.add(escalationId);

        for (int later = phase; later <= plan.size(); later++) {
            Map<String, GateCriterion> criteria = manualCriteria.get(later);
            criteria.replaceAll((id, criterion) -> criterion.reset());
            states[later] = later == phase ? PhaseState.OPEN : PhaseState.PENDING;
        }
        current = phase;
        record(phase, PhaseTransition.Kind.REOPENED, "override " + escalationId.getValue());
        log.warn("Phase reopened by override: phase={}, escalation={}, decision={}",
            phase, escalationId.getValue(), escalation.decision().text());
    }

    public synchronized PhaseState state(int phase) {
        plan.definition(phase);
        return states[phase];
    }

    /**
     * @return 열린 Phase 번호 (종료 상태면 plan 크기 + 1)
     */
    public synchronized int currentPhase() {
        return current;
    }

    public synchronized boolean isComplete() {
        return current > plan.size();
    }

    public synchronized List<PhaseTransition> transitions() {
        return List.copyOf(transitions);
    }

    public PhasePlan plan() {
        return plan;
    }

    private GateCriterion evaluate(int phase, GateCriterion stored) {
        if (stored.kind() == CriterionKind.MANUAL || states[phase] == PhaseState.CLOSED) {
            return stored;
        }
        boolean holds = probes.get(stored.kind()).holds(phase);
        return holds
            ? stored.reset().satisfy("system:" + stored.kind() + "@" + clock.instant())
            : stored.reset();
    }

    private void record(int phase, PhaseTransition.Kind kind, String detail) {
        transitions.add(new PhaseTransition(phase, kind, clock.instant(), detail));
    }

    private static String subjectRef(int phase) {
        return "phase-" + phase;
    }
}
