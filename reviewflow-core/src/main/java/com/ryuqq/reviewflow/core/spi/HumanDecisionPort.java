package com.ryuqq.reviewflow.core.spi;

import com.ryuqq.reviewflow.core.escalation.Escalation;
import com.ryuqq.reviewflow.core.escalation.EscalationDecision;

/**
 * Blocking request/response channel to the human decision maker.
 *
 * <p>There is no timeout. The call may block for as long as the human needs;
 * callers run it on dedicated threads so only the affected work item waits.</p>
 *
 * @author ReviewFlow Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface HumanDecisionPort {

    EscalationDecision requestDecision(Escalation escalation);
}
