package com.ryuqq.reviewflow.core.spi;

import com.ryuqq.reviewflow.core.escalation.Escalation;
import com.ryuqq.reviewflow.core.escalation.EscalationDecision;
import com.ryuqq.reviewflow.core.escalation.EscalationListener;
import com.ryuqq.reviewflow.core.escalation.EscalationReason;
import com.ryuqq.reviewflow.core.escalation.SubjectKind;
import com.ryuqq.reviewflow.core.model.EscalationId;
import com.ryuqq.reviewflow.core.model.Position;
import com.ryuqq.reviewflow.core.model.WorkItemId;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Human escalation registry.
 *
 * <p>Escalations never expire. A raised escalation stays PENDING until
 * {@link #resolve(EscalationId, EscalationDecision)} is called exactly once.</p>
 *
 * @author ReviewFlow Team
 * @since 1.0.0
 */
public interface EscalationManager {

    /**
     * Records a PENDING escalation and notifies listeners.
     *
     * @return the raised escalation
     */
    Escalation raise(SubjectKind subjectKind, String subjectRef, WorkItemId dependentItem,
                     EscalationReason reason, String detail, List<Position> positions);

    /**
     * Resolves a pending escalation, notifies listeners and completes the resumption future.
     *
     * @throws IllegalArgumentException if the escalation is unknown
     * @throws IllegalStateException if it was already resolved
     */
    Escalation resolve(EscalationId id, EscalationDecision decision);

    Optional<Escalation> find(EscalationId id);

    /**
     * All PENDING escalations in raise order.
     */
    List<Escalation> open();

    /**
     * Future completed with the decision once the escalation is resolved.
     * Already-resolved escalations return a completed future.
     *
     * @throws IllegalArgumentException if the escalation is unknown
     */
    CompletableFuture<EscalationDecision> awaitResolution(EscalationId id);

    void addListener(EscalationListener listener);
}
