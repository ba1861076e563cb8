package com.ryuqq.reviewflow.application.phase;

/**
 * 시스템이 평가하는 게이트 조건.
 *
 * @author ReviewFlow Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface GateProbe {

    /**
     * @param phase 평가 대상 Phase
     * @return 조건이 충족되면 true
     */
    boolean holds(int phase);
}
