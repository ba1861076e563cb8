package com.ryuqq.reviewflow.adapter.runner;

import com.ryuqq.reviewflow.core.escalation.Escalation;
import com.ryuqq.reviewflow.core.escalation.EscalationDecision;
import com.ryuqq.reviewflow.core.escalation.EscalationListener;
import com.ryuqq.reviewflow.core.model.EscalationId;
import com.ryuqq.reviewflow.core.spi.EscalationManager;
import com.ryuqq.reviewflow.core.spi.HumanDecisionPort;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * 열린 Escalation을 사람에게 전달하고 답을 받아 처리하는 컴포넌트.
 *
 * <p>{@link HumanDecisionPort#requestDecision(Escalation)}는 타임아웃 없이 블로킹되므로
 * 전용 스레드에서 호출합니다. 기다리는 동안 막히는 것은 해당 Escalation에 걸린 Work Item뿐입니다.</p>
 *
 * <p><strong>전달 경로:</strong></p>
 * <ul>
 *   <li>onRaised: Escalation이 생기는 즉시 전달</li>
 *   <li>scan(): 주기적으로 PENDING Escalation을 다시 훑어 전달되지 않은 것을 전달
 *       (결정 요청이 실패한 경우 포함)</li>
 * </ul>
 *
 * <p>같은 Escalation을 동시에 두 번 묻지 않습니다. 사람의 답이 오기 전에 다른 경로로
 * 처리된 경우(예: 철회) 답은 버리고 로그만 남깁니다.</p>
 *
 * @author ReviewFlow Team
 * @since 1.0.0
 */
public final class EscalationDispatcher implements EscalationListener {

    private static final Logger log = LoggerFactory.getLogger(EscalationDispatcher.class);

    private final EscalationManager escalations;
    private final HumanDecisionPort humans;
    private final EscalationDispatcherConfig config;
    private final ExecutorService deciders;
    private final Set<EscalationId> inFlight = ConcurrentHashMap.newKeySet();
    private ScheduledExecutorService scanner;

    /**
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public EscalationDispatcher(EscalationManager escalations, HumanDecisionPort humans,
                                EscalationDispatcherConfig config) {
        if (escalations == null) {
            throw new IllegalArgumentException("escalations cannot be null");
        }
        if (humans == null) {
            throw new IllegalArgumentException("humans cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.escalations = escalations;
        this.humans = humans;
        this.config = config;
        this.deciders = Executors.newFixedThreadPool(config.threads());
    }

    @Override
    public void onRaised(Escalation escalation) {
        dispatch(escalation);
    }

    @Override
    public void onResolved(Escalation escalation) {
        // 결정 요청 스레드가 스스로 정리
    }

    /**
     * PENDING Escalation 스캔 및 전달.
     *
     * @return 이번 스캔에서 새로 전달한 수
     */
    public int scan() {
        List<Escalation> open = escalations.open();
        int dispatched = 0;
        for (Escalation escalation : open) {
            if (dispatch(escalation)) {
                dispatched++;
            }
        }
        log.debug("Escalation scan completed: {} dispatched out of {} open", dispatched, open.size());
        return dispatched;
    }

    /**
     * {@code scanIntervalMs} 주기로 {@link #scan()} 시작.
     */
    public synchronized void start() {
        if (scanner != null) {
            return;
        }
        scanner = Executors.newSingleThreadScheduledExecutor();
        scanner.scheduleWithFixedDelay(this::scanSafely, config.scanIntervalMs(), config.scanIntervalMs(),
            TimeUnit.MILLISECONDS);
    }

    /**
     * 종료. 사람의 답을 기다리는 스레드는 인터럽트됩니다.
     */
    public synchronized void shutdown() {
        if (scanner != null) {
            scanner.shutdownNow();
            scanner = null;
        }
        deciders.shutdownNow();
    }

    int inFlightCount() {
        return inFlight.size();
    }

    private boolean dispatch(Escalation escalation) {
        if (!escalation.isPending() || !inFlight.add(escalation.id())) {
            return false;
        }
        try {
            deciders.execute(() -> decide(escalation));
            return true;
        } catch (RejectedExecutionException e) {
            inFlight.remove(escalation.id());
            log.error("Cannot dispatch escalation {}: dispatcher is shut down", escalation.id().getValue(), e);
            return false;
        }
    }

    private void decide(Escalation escalation) {
        EscalationId id = escalation.id();
        try {
            log.info("Requesting human decision: escalation={}, reason={}, subject={}",
                id.getValue(), escalation.reason(), escalation.subjectRef());
            EscalationDecision decision = humans.requestDecision(escalation);
            if (decision == null) {
                throw new IllegalStateException("HumanDecisionPort returned no decision for " + id);
            }
            resolve(id, decision);
        } catch (RuntimeException e) {
            log.error("Human decision request failed: escalation={}, will retry on next scan", id.getValue(), e);
        } finally {
            inFlight.remove(id);
        }
    }

    private void resolve(EscalationId id, EscalationDecision decision) {
        boolean stillPending = escalations.find(id).map(Escalation::isPending).orElse(false);
        if (!stillPending) {
            log.info("Discarding human decision for escalation {}: already resolved", id.getValue());
            return;
        }
        try {
            escalations.resolve(id, decision);
        } catch (IllegalStateException raced) {
            log.info("Discarding human decision for escalation {}: {}", id.getValue(), raced.getMessage());
        }
    }

    private void scanSafely() {
        try {
            scan();
        } catch (RuntimeException e) {
            log.error("Escalation scan failed", e);
        }
    }
}
