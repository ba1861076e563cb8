package com.ryuqq.reviewflow.application.escalation;

import com.ryuqq.reviewflow.core.escalation.Escalation;
import com.ryuqq.reviewflow.core.escalation.EscalationDecision;
import com.ryuqq.reviewflow.core.escalation.EscalationListener;
import com.ryuqq.reviewflow.core.escalation.EscalationReason;
import com.ryuqq.reviewflow.core.escalation.SubjectKind;
import com.ryuqq.reviewflow.core.model.EscalationId;
import com.ryuqq.reviewflow.core.model.Position;
import com.ryuqq.reviewflow.core.model.WorkItemId;
import com.ryuqq.reviewflow.core.spi.EscalationManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * 메모리 기반 Escalation 레지스트리.
 *
 * <p><strong>동작 방식:</strong></p>
 * <ul>
 *   <li>raise: PENDING 기록 → 리스너 onRaised 호출 (Work Item 차단)</li>
 *   <li>resolve: RESOLVED 기록 → 리스너 onResolved 호출 (차단 해제) → 대기 중인 future 완료</li>
 * </ul>
 *
 * <p>리스너가 먼저 호출되므로, future를 기다리던 리뷰가 재개될 때
 * Work Item 상태는 이미 복원되어 있습니다.</p>
 *
 * <p><strong>Thread-Safety:</strong> 레지스트리 변경은 내부 lock으로 직렬화하고,
 * 리스너와 future 완료는 lock 밖에서 수행합니다.</p>
 *
 * @author ReviewFlow Team
 * @since 1.0.0
 */
public class DefaultEscalationManager implements EscalationManager {

    private static final Logger log = LoggerFactory.getLogger(DefaultEscalationManager.class);

    private final Clock clock;
    private final Object lock = new Object();
    private final Map<EscalationId, Escalation> escalations = new LinkedHashMap<>();
    private final Map<EscalationId, CompletableFuture<EscalationDecision>> waiters = new ConcurrentHashMap<>();
    private final List<EscalationListener> listeners = new CopyOnWriteArrayList<>();

    public DefaultEscalationManager() {
        this(Clock.systemUTC());
    }

    public DefaultEscalationManager(Clock clock) {
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.clock = clock;
    }

    @Override
    public Escalation raise(SubjectKind subjectKind, String subjectRef, WorkItemId dependentItem,
                            EscalationReason reason, String detail, List<Position> positions) {
        Escalation escalation = Escalation.raise(subjectKind, subjectRef, dependentItem, reason, detail,
            positions, clock.instant());
        synchronized (lock) {
            escalations.put(escalation.id(), escalation);
        }
        log.warn("Escalation raised: id={}, subject={} {}, reason={}, dependentItem={}, detail={}",
            escalation.id().getValue(), subjectKind, subjectRef, reason,
            dependentItem == null ? "-" : dependentItem.getValue(), escalation.detail());

        for (EscalationListener listener : listeners) {
            try {
                listener.onRaised(escalation);
            } catch (RuntimeException e) {
                log.error("Escalation listener failed on raise: id={}, listener={}",
                    escalation.id().getValue(), listener.getClass().getSimpleName(), e);
            }
        }
        return escalation;
    }

    @Override
    public Escalation resolve(EscalationId id, EscalationDecision decision) {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        if (decision == null) {
            throw new IllegalArgumentException("decision cannot be null");
        }

        Escalation resolved;
        synchronized (lock) {
            Escalation current = escalations.get(id);
            if (current == null) {
                throw new IllegalArgumentException("Unknown escalation: " + id);
            }
            resolved = current.resolve(decision, clock.instant());
            escalations.put(id, resolved);
        }
        log.info("Escalation resolved: id={}, verdict={}, decision={}",
            id.getValue(), decision.verdict(), decision.text());

        for (EscalationListener listener : listeners) {
            try {
                listener.onResolved(resolved);
            } catch (RuntimeException e) {
                log.error("Escalation listener failed on resolve: id={}, listener={}",
                    id.getValue(), listener.getClass().getSimpleName(), e);
            }
        }
        CompletableFuture<EscalationDecision> waiter = waiters.remove(id);
        if (waiter != null) {
            waiter.complete(decision);
        }
        return resolved;
    }

    @Override
    public Optional<Escalation> find(EscalationId id) {
        synchronized (lock) {
            return Optional.ofNullable(escalations.get(id));
        }
    }

    @Override
    public List<Escalation> open() {
        synchronized (lock) {
            List<Escalation> pending = new ArrayList<>();
            for (Escalation escalation : escalations.values()) {
                if (escalation.isPending()) {
                    pending.add(escalation);
                }
            }
            return List.copyOf(pending);
        }
    }

    @Override
    public CompletableFuture<EscalationDecision> awaitResolution(EscalationId id) {
        Escalation escalation = find(id)
            .orElseThrow(() -> new IllegalArgumentException("Unknown escalation: " + id));
        if (!escalation.isPending()) {
            return CompletableFuture.completedFuture(escalation.decision());
        }
        CompletableFuture<EscalationDecision> waiter = waiter(id);
        // resolve가 find 이후 waiter 등록 전에 끝났으면 직접 완료
        Escalation latest = find(id).orElse(escalation);
        if (!latest.isPending()) {
            waiters.remove(id, waiter);
            waiter.complete(latest.decision());
        }
        return waiter;
    }

    /**
     * @return 아직 결정을 기다리는 waiter 수
     */
    int pendingWaiters() {
        return waiters.size();
    }

    @Override
    public void addListener(EscalationListener listener) {
        if (listener == null) {
            throw new IllegalArgumentException("listener cannot be null");
        }
        listeners.add(listener);
    }

    private CompletableFuture<EscalationDecision> waiter(EscalationId id) {
        return waiters.computeIfAbsent(id, k -> new CompletableFuture<>());
    }
}
