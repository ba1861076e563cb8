package com.ryuqq.reviewflow.adapter.inmemory.chronicle;

import com.ryuqq.reviewflow.core.chronicle.ChronicleDraft;
import com.ryuqq.reviewflow.core.chronicle.ChronicleRecord;
import com.ryuqq.reviewflow.core.exception.IncompleteReviewRecordException;
import com.ryuqq.reviewflow.core.model.ProposalId;
import com.ryuqq.reviewflow.core.model.ReviewVote;
import com.ryuqq.reviewflow.core.model.Role;
import com.ryuqq.reviewflow.core.spi.ChronicleStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * In-memory implementation of {@link ChronicleStore}.
 *
 * <p><strong>Concurrency:</strong> append is serialized on the store, so the sequence
 * counter and the record list always advance together and no gap can appear.
 * Readers take a snapshot under the same lock.</p>
 *
 * <p><strong>Limitations:</strong> data is lost on process restart.</p>
 *
 * @author ReviewFlow Team
 * @since 1.0.0
 */
public class InMemoryChronicleStore implements ChronicleStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryChronicleStore.class);

    private final List<ChronicleRecord> records = new ArrayList<>();
    private final Clock clock;
    private long lastSequence;

    public InMemoryChronicleStore() {
        this(Clock.systemUTC());
    }

    public InMemoryChronicleStore(Clock clock) {
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.clock = clock;
    }

    @Override
    public synchronized long append(ChronicleDraft draft) {
        if (draft == null) {
            throw new IllegalArgumentException("draft cannot be null");
        }
        validate(draft);

        long sequence = lastSequence + 1;
        records.add(draft.sequenced(sequence, clock.instant()));
        lastSequence = sequence;

        log.info("Chronicle record appended: seq={}, proposal={}, basis={}",
            sequence, draft.proposalId().getValue(), draft.basis());
        return sequence;
    }

    @Override
    public synchronized List<ChronicleRecord> records() {
        return List.copyOf(records);
    }

    @Override
    public synchronized List<ChronicleRecord> findByProposal(ProposalId proposalId) {
        if (proposalId == null) {
            throw new IllegalArgumentException("proposalId cannot be null");
        }
        return records.stream().filter(r -> r.proposalId().equals(proposalId)).toList();
    }

    @Override
    public synchronized List<ChronicleRecord> findByPhase(int phase) {
        return records.stream().filter(r -> r.phase() == phase).toList();
    }

    @Override
    public synchronized List<ChronicleRecord> findBetween(Instant from, Instant to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("from and to cannot be null");
        }
        return records.stream()
            .filter(r -> !r.recordedAt().isBefore(from) && r.recordedAt().isBefore(to))
            .toList();
    }

    @Override
    public synchronized long lastSequence() {
        return lastSequence;
    }

    private static void validate(ChronicleDraft draft) {
        if (draft.decision() == null || draft.decision().isBlank()) {
            throw new IncompleteReviewRecordException(draft.proposalId(), "decision is blank");
        }
        Set<Role> voted = EnumSet.noneOf(Role.class);
        for (ReviewVote vote : draft.votes()) {
            voted.add(vote.reviewer());
        }
        for (Role role : draft.requiredRoles()) {
            if (!voted.contains(role)) {
                throw new IncompleteReviewRecordException(draft.proposalId(), "missing vote from " + role);
            }
        }
    }
}
