package com.ryuqq.reviewflow.core.spi;

import com.ryuqq.reviewflow.core.chronicle.ChronicleDraft;
import com.ryuqq.reviewflow.core.chronicle.ChronicleRecord;
import com.ryuqq.reviewflow.core.model.ProposalId;

import java.time.Instant;
import java.util.List;

/**
 * Append-only change chronicle SPI.
 *
 * <p>Records are immutable once appended. Sequence numbers start at 1 and are
 * strictly increasing with no gaps, regardless of how many threads append concurrently.</p>
 *
 * @author ReviewFlow Team
 * @since 1.0.0
 */
public interface ChronicleStore {

    /**
     * Appends a review record.
     *
     * <p>Validation happens before anything is written: every required role must have
     * at least one recorded vote and the decision must not be blank.</p>
     *
     * @param draft the record to append
     * @return the assigned sequence number
     * @throws com.ryuqq.reviewflow.core.exception.IncompleteReviewRecordException if the record is incomplete
     * @throws IllegalArgumentException if draft is null
     */
    long append(ChronicleDraft draft);

    /**
     * All records in sequence order.
     */
    List<ChronicleRecord> records();

    List<ChronicleRecord> findByProposal(ProposalId proposalId);

    List<ChronicleRecord> findByPhase(int phase);

    /**
     * Records whose recorded-at lies in {@code [from, to)}.
     */
    List<ChronicleRecord> findBetween(Instant from, Instant to);

    /**
     * @return last assigned sequence, 0 when empty
     */
    long lastSequence();
}
