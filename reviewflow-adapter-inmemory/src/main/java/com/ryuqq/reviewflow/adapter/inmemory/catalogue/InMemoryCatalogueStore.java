package com.ryuqq.reviewflow.adapter.inmemory.catalogue;

import com.ryuqq.reviewflow.core.catalogue.CatalogueEntry;
import com.ryuqq.reviewflow.core.catalogue.CatalogueListener;
import com.ryuqq.reviewflow.core.catalogue.ChangeDecision;
import com.ryuqq.reviewflow.core.catalogue.ChangeKind;
import com.ryuqq.reviewflow.core.catalogue.ChangeRequest;
import com.ryuqq.reviewflow.core.escalation.Escalation;
import com.ryuqq.reviewflow.core.escalation.EscalationDecision;
import com.ryuqq.reviewflow.core.escalation.EscalationReason;
import com.ryuqq.reviewflow.core.escalation.SubjectKind;
import com.ryuqq.reviewflow.core.exception.CatalogueLockViolationException;
import com.ryuqq.reviewflow.core.model.EntryId;
import com.ryuqq.reviewflow.core.model.EscalationId;
import com.ryuqq.reviewflow.core.model.Payload;
import com.ryuqq.reviewflow.core.spi.CatalogueStore;
import com.ryuqq.reviewflow.core.spi.EscalationManager;
import com.ryuqq.reviewflow.core.statemachine.EntryStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.UnaryOperator;

/**
 * In-memory implementation of {@link CatalogueStore}.
 *
 * <p><strong>Data Structures:</strong></p>
 * <ul>
 *   <li><strong>chains:</strong> ConcurrentHashMap&lt;EntryId, AtomicReference&lt;List&lt;CatalogueEntry&gt;&gt;&gt;
 *       - immutable version chain per entry, oldest first</li>
 *   <li><strong>pendingBehavioral:</strong> ConcurrentHashMap&lt;EntryId, EscalationId&gt;
 *       - locked entries with an unresolved behavioral change</li>
 * </ul>
 *
 * <p><strong>Concurrency:</strong> every transition builds a new chain and publishes it with
 * compare-and-set on the entry's reference, retrying on contention. Readers always see a
 * complete chain. Different entries never contend. Change requests against a locked entry
 * and the settlement of its behavioral escalation are additionally serialized on the entry's
 * reference, so a pending behavioral change cannot be overtaken by another supersession.</p>
 *
 * <p><strong>Limitations:</strong> data is lost on process restart.</p>
 *
 * @author ReviewFlow Team
 * @since 1.0.0
 */
public class InMemoryCatalogueStore implements CatalogueStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryCatalogueStore.class);

    private final ConcurrentHashMap<EntryId, AtomicReference<List<CatalogueEntry>>> chains = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<EntryId, EscalationId> pendingBehavioral = new ConcurrentHashMap<>();
    private final List<CatalogueListener> listeners = new CopyOnWriteArrayList<>();
    private final EscalationManager escalations;
    private final Clock clock;

    public InMemoryCatalogueStore(EscalationManager escalations) {
        this(escalations, Clock.systemUTC());
    }

    public InMemoryCatalogueStore(EscalationManager escalations, Clock clock) {
        if (escalations == null || clock == null) {
            throw new IllegalArgumentException("escalations and clock cannot be null");
        }
        this.escalations = escalations;
        this.clock = clock;
    }

    @Override
    public CatalogueEntry propose(EntryId id, Payload content) {
        requireContent(content);
        List<CatalogueEntry> chain = transform(id, current -> {
            if (current.isEmpty()) {
                return List.of(CatalogueEntry.draft(id, content, clock.instant()));
            }
            CatalogueEntry head = head(current);
            requireNotLocked(head, "propose");
            requireNotInvalid(head);
            return replaceHead(current, head.redraft(content, clock.instant()));
        });
        CatalogueEntry entry = head(chain);
        log.info("Catalogue entry drafted: {}", entry.ref());
        return entry;
    }

    @Override
    public CatalogueEntry submitForReview(EntryId id) {
        return transition(id, EntryStatus.UNDER_REVIEW, null);
    }

    @Override
    public CatalogueEntry approve(EntryId id) {
        return transition(id, EntryStatus.APPROVED, null);
    }

    @Override
    public CatalogueEntry invalidate(EntryId id, String reason) {
        if (reason == null || reason.isBlank()) {
            throw new IllegalArgumentException("reason cannot be null or blank");
        }
        List<CatalogueEntry> chain = transform(id, current -> {
            CatalogueEntry head = existingHead(id, current);
            requireNotLocked(head, "invalidate");
            return replaceHead(current, head.transitionTo(EntryStatus.INVALID, reason, clock.instant()));
        });
        CatalogueEntry entry = head(chain);
        log.info("Catalogue entry invalidated: {}, reason={}", entry.ref(), reason);
        return entry;
    }

    @Override
    public CatalogueEntry acceptReviewed(EntryId id, Payload content) {
        requireContent(content);
        List<CatalogueEntry> chain = transform(id, current -> {
            if (current.isEmpty()) {
                return List.of(new CatalogueEntry(id, 1, EntryStatus.APPROVED, content, null,
                    "accepted by review", clock.instant()));
            }
            CatalogueEntry head = head(current);
            requireNotLocked(head, "accept reviewed content");
            requireNotInvalid(head);
            return replaceHead(current, new CatalogueEntry(id, head.version(), EntryStatus.APPROVED, content,
                head.supersedes(), "accepted by review", clock.instant()));
        });
        CatalogueEntry entry = head(chain);
        log.info("Catalogue entry approved by review: {}", entry.ref());
        return entry;
    }

    @Override
    public CatalogueEntry lock(EntryId id) {
        List<CatalogueEntry> chain = transform(id, current -> {
            CatalogueEntry head = existingHead(id, current);
            if (head.status() == EntryStatus.LOCKED) {
                return current;
            }
            return replaceHead(current, head.transitionTo(EntryStatus.LOCKED, null, clock.instant()));
        });
        return head(chain);
    }

    @Override
    public List<CatalogueEntry> lockApproved() {
        List<CatalogueEntry> locked = new ArrayList<>();
        for (EntryId id : chains.keySet()) {
            Optional<CatalogueEntry> current = current(id);
            if (current.isEmpty() || current.get().status() != EntryStatus.APPROVED) {
                continue;
            }
            try {
                CatalogueEntry entry = lock(id);
                locked.add(entry);
                log.info("Catalogue entry locked: {}", entry.ref());
            } catch (IllegalStateException e) {
                // 동시에 상태가 바뀐 항목은 이번 경계에서 제외
                log.warn("Skipped locking {}: {}", id.getValue(), e.getMessage());
            }
        }
        return locked;
    }

    @Override
    public ChangeDecision requestChange(EntryId id, ChangeRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("request cannot be null");
        }
        CatalogueEntry head = current(id)
            .orElseThrow(() -> new IllegalArgumentException("Unknown catalogue entry: " + id));

        if (head.status() != EntryStatus.LOCKED) {
            // 잠기기 전에는 일반 편집으로 처리
            if (request.kind() == ChangeKind.DELETION) {
                return ChangeDecision.applied(invalidate(id, request.reason()));
            }
            return ChangeDecision.applied(update(id, head.version(), request.newContent()));
        }

        if (request.kind() == ChangeKind.DELETION) {
            log.warn("Rejected deletion of locked entry {} requested by {}", head.ref(), request.requestedBy());
            throw new CatalogueLockViolationException(id, head.version(), "deletion");
        }
        synchronized (chains.get(id)) {
            CatalogueEntry locked = current(id).orElse(head);
            EscalationId pending = pendingBehavioral.get(id);
            if (pending != null) {
                log.warn("Rejected {} change to {} requested by {}: behavioral change pending (escalation {})",
                    request.kind(), locked.ref(), request.requestedBy(), pending.getValue());
                throw new IllegalStateException(String.format(
                    "%s has a pending behavioral change (escalation %s)", locked.ref(), pending.getValue()));
            }
            switch (request.kind()) {
                case CLERICAL:
                    return ChangeDecision.applied(supersede(id, locked.version(), request.newContent(),
                        "clerical: " + request.reason(), request));
                case BEHAVIORAL:
                    return escalateBehavioral(locked, request);
                default:
                    throw new IllegalArgumentException("Unsupported change kind: " + request.kind());
            }
        }
    }

    @Override
    public CatalogueEntry update(EntryId id, int expectedVersion, Payload content) {
        requireContent(content);
        List<CatalogueEntry> chain = transform(id, current -> {
            CatalogueEntry head = existingHead(id, current);
            requireNotLocked(head, "update");
            if (head.version() != expectedVersion) {
                throw new IllegalStateException(String.format(
                    "stale update of %s: expected version %d, current %d", id.getValue(), expectedVersion, head.version()));
            }
            requireNotInvalid(head);
            return replaceHead(current, head.redraft(content, clock.instant()));
        });
        return head(chain);
    }

    @Override
    public Optional<CatalogueEntry> current(EntryId id) {
        List<CatalogueEntry> chain = chainOf(id);
        return chain.isEmpty() ? Optional.empty() : Optional.of(head(chain));
    }

    @Override
    public List<CatalogueEntry> history(EntryId id) {
        return chainOf(id);
    }

    @Override
    public List<CatalogueEntry> entries() {
        List<CatalogueEntry> result = new ArrayList<>();
        for (AtomicReference<List<CatalogueEntry>> ref : chains.values()) {
            List<CatalogueEntry> chain = ref.get();
            if (!chain.isEmpty()) {
                result.add(head(chain));
            }
        }
        result.sort((a, b) -> a.id().getValue().compareTo(b.id().getValue()));
        return result;
    }

    @Override
    public void addListener(CatalogueListener listener) {
        if (listener == null) {
            throw new IllegalArgumentException("listener cannot be null");
        }
        listeners.add(listener);
    }

    @Override
    public boolean hasUnsettled() {
        for (AtomicReference<List<CatalogueEntry>> ref : chains.values()) {
            List<CatalogueEntry> chain = ref.get();
            if (!chain.isEmpty() && head(chain).status().isUnsettled()) {
                return true;
            }
        }
        return false;
    }

    private ChangeDecision escalateBehavioral(CatalogueEntry head, ChangeRequest request) {
        Escalation escalation = escalations.raise(SubjectKind.CATALOGUE_CHANGE, head.ref(), request.dependentItem(),
            EscalationReason.BEHAVIORAL_CHANGE,
            String.format("%s requests a behavioral change to %s: %s", request.requestedBy(), head.ref(), request.reason()),
            List.of());
        pendingBehavioral.put(head.id(), escalation.id());

        CompletableFuture<CatalogueEntry> settled = escalations.awaitResolution(escalation.id())
            .thenApply(decision -> settleBehavioral(head, request, escalation.id(), decision));
        settled.whenComplete((entry, failure) -> {
            pendingBehavioral.remove(head.id(), escalation.id());
            if (failure != null) {
                log.error("Behavioral change to {} could not be settled (escalation {})",
                    head.ref(), escalation.id().getValue(), failure);
            }
        });
        return ChangeDecision.escalated(head, escalation.id(), settled);
    }

    private CatalogueEntry settleBehavioral(CatalogueEntry head, ChangeRequest request, EscalationId escalationId,
                                            EscalationDecision decision) {
        synchronized (chains.get(head.id())) {
            try {
                if (!decision.isApproved()) {
                    log.info("Behavioral change to {} rejected: {}", head.ref(), decision.text());
                    return current(head.id()).orElse(head);
                }
                Payload content = decision.replacementContent().orElse(request.newContent());
                return supersede(head.id(), head.version(), content, "behavioral: " + request.reason()
                    + " (approved: " + decision.text() + ")", request);
            } finally {
                pendingBehavioral.remove(head.id(), escalationId);
            }
        }
    }

    /**
     * 잠긴 버전 v를 SUPERSEDED로 보관하고 잠긴 v+1을 만듭니다.
     */
    private CatalogueEntry supersede(EntryId id, int lockedVersion, Payload content, String note,
                                     ChangeRequest request) {
        List<CatalogueEntry> chain = transform(id, current -> {
            CatalogueEntry head = existingHead(id, current);
            if (head.version() != lockedVersion || head.status() != EntryStatus.LOCKED) {
                throw new IllegalStateException(String.format(
                    "%s changed while the request was pending (expected v%d LOCKED, found %s)",
                    id.getValue(), lockedVersion, head.ref() + " " + head.status()));
            }
            String diff = String.format("superseded by v%d, %s: %s -> %s", head.version() + 1, note,
                head.content().snapshotRef(), content.snapshotRef());
            CatalogueEntry archived = head.transitionTo(EntryStatus.SUPERSEDED, diff, clock.instant());
            CatalogueEntry next = head.successor(content, EntryStatus.LOCKED, note, clock.instant());
            List<CatalogueEntry> updated = new ArrayList<>(current);
            updated.set(updated.size() - 1, archived);
            updated.add(next);
            return List.copyOf(updated);
        });
        CatalogueEntry entry = head(chain);
        log.info("Catalogue entry superseded: {} (supersedes v{}), {}", entry.ref(), entry.supersedes(), note);
        notifySuperseded(chain.get(chain.size() - 2), entry, request);
        return entry;
    }

    private void notifySuperseded(CatalogueEntry archived, CatalogueEntry next, ChangeRequest request) {
        for (CatalogueListener listener : listeners) {
            try {
                listener.onSuperseded(archived, next, request);
            } catch (RuntimeException e) {
                log.error("Catalogue listener failed on supersede: entry={}, listener={}",
                    next.ref(), listener.getClass().getSimpleName(), e);
            }
        }
    }

    private CatalogueEntry transition(EntryId id, EntryStatus next, String note) {
        List<CatalogueEntry> chain = transform(id, current -> {
            CatalogueEntry head = existingHead(id, current);
            return replaceHead(current, head.transitionTo(next, note, clock.instant()));
        });
        CatalogueEntry entry = head(chain);
        log.info("Catalogue entry {} is now {}", entry.ref(), entry.status());
        return entry;
    }

    private List<CatalogueEntry> transform(EntryId id, UnaryOperator<List<CatalogueEntry>> change) {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        AtomicReference<List<CatalogueEntry>> ref = chains.computeIfAbsent(id, k -> new AtomicReference<>(List.of()));
        while (true) {
            List<CatalogueEntry> current = ref.get();
            List<CatalogueEntry> updated = change.apply(current);
            if (updated == current || ref.compareAndSet(current, updated)) {
                return updated;
            }
        }
    }

    private List<CatalogueEntry> chainOf(EntryId id) {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        AtomicReference<List<CatalogueEntry>> ref = chains.get(id);
        return ref == null ? List.of() : ref.get();
    }

    private static CatalogueEntry head(List<CatalogueEntry> chain) {
        return chain.get(chain.size() - 1);
    }

    private static CatalogueEntry existingHead(EntryId id, List<CatalogueEntry> chain) {
        if (chain.isEmpty()) {
            throw new IllegalArgumentException("Unknown catalogue entry: " + id);
        }
        return head(chain);
    }

    private static List<CatalogueEntry> replaceHead(List<CatalogueEntry> chain, CatalogueEntry head) {
        List<CatalogueEntry> updated = new ArrayList<>(chain);
        updated.set(updated.size() - 1, head);
        return List.copyOf(updated);
    }

    private static void requireNotLocked(CatalogueEntry head, String attempted) {
        if (head.status() == EntryStatus.LOCKED) {
            throw new CatalogueLockViolationException(head.id(), head.version(), attempted);
        }
    }

    private static void requireNotInvalid(CatalogueEntry head) {
        if (head.status() == EntryStatus.INVALID) {
            throw new IllegalStateException(head.ref() + " is INVALID");
        }
    }

    private static void requireContent(Payload content) {
        if (content == null) {
            throw new IllegalArgumentException("content cannot be null");
        }
    }
}
