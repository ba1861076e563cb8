package com.ryuqq.reviewflow.core.exception;

import com.ryuqq.reviewflow.core.model.GateCriterion;

import java.util.List;
import java.util.stream.Collectors;

/**
 * 미충족 Gate Criterion이 있어 단계를 전진할 수 없음.
 *
 * <p>전진은 부분적으로 일어나지 않으며, 단계는 열린 상태로 유지됩니다.</p>
 *
 * @author ReviewFlow Team
 * @since 1.0.0
 */
public class GateNotSatisfiedException extends ReviewFlowException {

    public static final String ERROR_CODE = "GATE-001";

    private final int phase;
    private final List<GateCriterion> unmetCriteria;

    public GateNotSatisfiedException(int phase, List<GateCriterion> unmetCriteria) {
        super(ERROR_CODE, String.format("Phase %d gate not satisfied, unmet criteria: %s", phase,
            unmetCriteria.stream().map(GateCriterion::id).collect(Collectors.joining(", ", "[", "]"))));
        this.phase = phase;
        this.unmetCriteria = List.copyOf(unmetCriteria);
    }

    public int getPhase() {
        return phase;
    }

    /**
     * 미충족 조건 목록.
     *
     * @return 불변 목록
     */
    public List<GateCriterion> getUnmetCriteria() {
        return unmetCriteria;
    }
}
