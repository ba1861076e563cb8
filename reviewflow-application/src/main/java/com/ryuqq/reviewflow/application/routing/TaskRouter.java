package com.ryuqq.reviewflow.application.routing;

import com.ryuqq.reviewflow.application.review.Committed;
import com.ryuqq.reviewflow.application.review.ReviewCoordinator;
import com.ryuqq.reviewflow.application.review.ReviewOutcome;
import com.ryuqq.reviewflow.core.escalation.Escalation;
import com.ryuqq.reviewflow.core.escalation.EscalationListener;
import com.ryuqq.reviewflow.core.exception.DuplicateSubmissionException;
import com.ryuqq.reviewflow.core.model.ChangeProposal;
import com.ryuqq.reviewflow.core.model.EscalationId;
import com.ryuqq.reviewflow.core.model.Role;
import com.ryuqq.reviewflow.core.model.WorkItemDescriptor;
import com.ryuqq.reviewflow.core.model.WorkItemId;
import com.ryuqq.reviewflow.core.statemachine.WorkItemStatus;
import com.ryuqq.reviewflow.core.statemachine.WorkItemTransition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Work Item 상태의 단일 소유자.
 *
 * <p>Work Item 상태는 이 클래스만 변경합니다. 리뷰 결과와 Escalation 이벤트도
 * 모두 이 클래스를 거쳐 상태에 반영됩니다.</p>
 *
 * <p><strong>상태 흐름:</strong></p>
 * <pre>
 * ingest → PENDING
 * assign → IN_PROGRESS
 * complete → UNDER_REVIEW → (Committed) DONE
 *                         → (Rejected / Withdrawn) PENDING
 * escalation raise → BLOCKED, resolve → 이전 상태
 * </pre>
 *
 * <p><strong>Thread-Safety:</strong> Work Item 단위로 동기화합니다.</p>
 *
 * @author ReviewFlow Team
 * @since 1.0.0
 */
public class TaskRouter implements EscalationListener {

    private static final Logger log = LoggerFactory.getLogger(TaskRouter.class);

    private final ReviewCoordinator coordinator;
    private final Map<WorkItemId, WorkItem> items = new ConcurrentHashMap<>();

    public TaskRouter(ReviewCoordinator coordinator) {
        if (coordinator == null) {
            throw new IllegalArgumentException("coordinator cannot be null");
        }
        this.coordinator = coordinator;
    }

    /**
     * Work Item 등록. 같은 Phase로 다시 등록하면 무시합니다.
     *
     * @throws IllegalArgumentException 이미 다른 Phase로 등록된 경우
     */
    public void ingest(List<WorkItemDescriptor> descriptors) {
        if (descriptors == null) {
            throw new IllegalArgumentException("descriptors cannot be null");
        }
        for (WorkItemDescriptor descriptor : descriptors) {
            WorkItem existing = items.putIfAbsent(descriptor.id(), new WorkItem(descriptor.id(), descriptor.phase()));
            if (existing == null) {
                log.info("Work item ingested: id={}, phase={}", descriptor.id().getValue(), descriptor.phase());
            } else if (existing.phase != descriptor.phase()) {
                throw new IllegalArgumentException(String.format(
                    "%s is already owned by phase %d (requested phase %d)",
                    descriptor.id(), existing.phase, descriptor.phase()));
            }
        }
    }

    /**
     * 역할에 작업 배정.
     *
     * @throws DuplicateSubmissionException 리뷰 중인 제안이 있는 경우 (리뷰 중 BLOCKED 포함)
     * @throws IllegalStateException DONE 또는 BLOCKED인 경우
     */
    public void assign(WorkItemId id, Role assignee) {
        if (assignee == null) {
            throw new IllegalArgumentException("assignee cannot be null");
        }
        WorkItem item = require(id);
        synchronized (item) {
            if (item.activeProposal != null) {
                throw new DuplicateSubmissionException(id, "work item is under review (" + item.activeProposal.id() + ")");
            }
            WorkItemTransition.validate(item.status, WorkItemStatus.IN_PROGRESS);
            item.status = WorkItemStatus.IN_PROGRESS;
            item.assignee = assignee;
        }
        log.info("Work item assigned: id={}, assignee={}", id.getValue(), assignee);
    }

    /**
     * 작업 완료 제출. 제안을 리뷰에 넘기고, 결과가 나오면 Work Item 상태에 반영한 뒤 future를 완료합니다.
     *
     * @throws DuplicateSubmissionException 이미 리뷰 중인 제안이 있는 경우 (리뷰 중 BLOCKED 포함)
     * @throws IllegalStateException IN_PROGRESS가 아닌 경우
     * @throws IllegalArgumentException 제안이 다른 Work Item이나 Phase를 가리키는 경우
     */
    public CompletableFuture<ReviewOutcome> complete(WorkItemId id, ChangeProposal proposal) {
        if (proposal == null) {
            throw new IllegalArgumentException("proposal cannot be null");
        }
        WorkItem item = require(id);
        if (!proposal.workItemId().equals(id)) {
            throw new IllegalArgumentException(proposal.id() + " targets " + proposal.workItemId() + ", not " + id);
        }
        if (proposal.phase() != item.phase) {
            throw new IllegalArgumentException(String.format(
                "%s declares phase %d but %s belongs to phase %d", proposal.id(), proposal.phase(), id, item.phase));
        }

        synchronized (item) {
            if (item.activeProposal != null) {
                throw new DuplicateSubmissionException(id,
                    "a proposal is already under review (" + item.activeProposal + ")");
            }
            WorkItemTransition.validate(item.status, WorkItemStatus.UNDER_REVIEW);
            item.status = WorkItemStatus.UNDER_REVIEW;
            item.activeProposal = proposal;
        }
        log.info("Work item submitted for review: id={}, proposal={}", id.getValue(), proposal.id().getValue());

        CompletableFuture<ReviewOutcome> review;
        try {
            review = coordinator.submit(proposal);
        } catch (RuntimeException e) {
            synchronized (item) {
                item.status = WorkItemStatus.IN_PROGRESS;
                item.activeProposal = null;
            }
            throw e;
        }

        return review.whenComplete((outcome, error) -> {
            if (error != null) {
                log.error("Review failed: workItem={}, proposal={}", id.getValue(), proposal.id().getValue(), error);
                settle(item, WorkItemStatus.PENDING);
            } else {
                settle(item, outcome instanceof Committed ? WorkItemStatus.DONE : WorkItemStatus.PENDING);
            }
        });
    }

    /**
     * @throws IllegalArgumentException 등록되지 않은 Work Item
     */
    public WorkItemStatus status(WorkItemId id) {
        WorkItem item = require(id);
        synchronized (item) {
            return item.status;
        }
    }

    public Optional<Role> assignee(WorkItemId id) {
        WorkItem item = require(id);
        synchronized (item) {
            return Optional.ofNullable(item.assignee);
        }
    }

    public Optional<Integer> phaseOf(WorkItemId id) {
        WorkItem item = items.get(id);
        return item == null ? Optional.empty() : Optional.of(item.phase);
    }

    /**
     * Phase 소속 Work Item이 모두 DONE인지. 소속 항목이 없으면 true.
     */
    public boolean allDone(int phase) {
        for (WorkItem item : items.values()) {
            if (item.phase == phase) {
                synchronized (item) {
                    if (item.status != WorkItemStatus.DONE) {
                        return false;
                    }
                }
            }
        }
        return true;
    }

    public List<WorkItemId> itemsOf(int phase) {
        List<WorkItemId> result = new ArrayList<>();
        for (WorkItem item : items.values()) {
            if (item.phase == phase) {
                result.add(item.id);
            }
        }
        return result;
    }

    @Override
    public void onRaised(Escalation escalation) {
        Optional<WorkItemId> dependent = escalation.dependentWorkItem();
        if (dependent.isEmpty()) {
            return;
        }
        WorkItem item = items.get(dependent.get());
        if (item == null) {
            log.warn("Escalation {} references unknown work item {}", escalation.id().getValue(), dependent.get().getValue());
            return;
        }
        synchronized (item) {
            if (item.status == WorkItemStatus.DONE) {
                log.warn("Escalation {} raised for finished work item {}", escalation.id().getValue(), item.id.getValue());
                return;
            }
            if (item.blockers.isEmpty()) {
                WorkItemTransition.validate(item.status, WorkItemStatus.BLOCKED);
                item.restoreTo = item.status;
                item.status = WorkItemStatus.BLOCKED;
            }
            item.blockers.add(escalation.id());
        }
        log.warn("Work item blocked: id={}, escalation={}, reason={}",
            item.id.getValue(), escalation.id().getValue(), escalation.reason());
    }

    @Override
    public void onResolved(Escalation escalation) {
        Optional<WorkItemId> dependent = escalation.dependentWorkItem();
        if (dependent.isEmpty()) {
            return;
        }
        WorkItem item = items.get(dependent.get());
        if (item == null) {
            return;
        }
        synchronized (item) {
            if (!item.blockers.remove(escalation.id()) || !item.blockers.isEmpty()) {
                return;
            }
            WorkItemTransition.validateUnblock(item.status, item.restoreTo);
            item.status = item.restoreTo;
            item.restoreTo = null;
        }
        log.info("Work item unblocked: id={}, status={}", item.id.getValue(), status(item.id));
    }

    private void settle(WorkItem item, WorkItemStatus next) {
        synchronized (item) {
            item.activeProposal = null;
            if (item.status == WorkItemStatus.BLOCKED && next == WorkItemStatus.DONE) {
                // 커밋된 항목은 남은 차단과 무관하게 종료
                item.blockers.clear();
                item.restoreTo = null;
                item.status = WorkItemStatus.DONE;
            } else if (item.status == WorkItemStatus.BLOCKED) {
                // 남은 Escalation이 해제될 때 반영
                item.restoreTo = next;
            } else {
                WorkItemTransition.validate(item.status, next);
                item.status = next;
            }
            if (next == WorkItemStatus.PENDING) {
                item.assignee = null;
            }
        }
        log.info("Review settled: workItem={}, status={}", item.id.getValue(), next);
    }

    private WorkItem require(WorkItemId id) {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        WorkItem item = items.get(id);
        if (item == null) {
            throw new IllegalArgumentException("Unknown work item: " + id);
        }
        return item;
    }

    private static final class WorkItem {
        private final WorkItemId id;
        private final int phase;
        private WorkItemStatus status = WorkItemStatus.PENDING;
        private WorkItemStatus restoreTo;
        private Role assignee;
        private ChangeProposal activeProposal;
        private final Set<EscalationId> blockers = new LinkedHashSet<>();

        private WorkItem(WorkItemId id, int phase) {
            this.id = id;
            this.phase = phase;
        }
    }
}
