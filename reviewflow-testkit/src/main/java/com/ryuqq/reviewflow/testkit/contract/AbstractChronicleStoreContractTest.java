package com.ryuqq.reviewflow.testkit.contract;

import com.ryuqq.reviewflow.core.chronicle.ChronicleDraft;
import com.ryuqq.reviewflow.core.chronicle.ChronicleRecord;
import com.ryuqq.reviewflow.core.chronicle.DecisionBasis;
import com.ryuqq.reviewflow.core.exception.IncompleteReviewRecordException;
import com.ryuqq.reviewflow.core.model.ProposalId;
import com.ryuqq.reviewflow.core.model.ReviewVote;
import com.ryuqq.reviewflow.core.model.Role;
import com.ryuqq.reviewflow.core.model.WorkItemId;
import com.ryuqq.reviewflow.core.spi.ChronicleStore;
import com.ryuqq.reviewflow.testkit.fixture.ReviewFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test for {@link ChronicleStore} implementations.
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>Sequences start at 1 and grow by exactly one</li>
 *   <li>An incomplete record is rejected and nothing is written</li>
 *   <li>N concurrent writers produce a gapless, strictly increasing sequence</li>
 *   <li>Queries by proposal, phase and time range</li>
 * </ul>
 *
 * @author ReviewFlow Team
 * @since 1.0.0
 */
public abstract class AbstractChronicleStoreContractTest {

    protected ChronicleStore store;

    protected abstract ChronicleStore createStore();

    @BeforeEach
    void setUpStore() {
        store = createStore();
    }

    @Test
    void testAppend_AssignsSequenceFromOne() {
        // When
        long first = store.append(ReviewFixtures.completeDraft(ProposalId.of("P-1"), 1));
        long second = store.append(ReviewFixtures.completeDraft(ProposalId.of("P-2"), 1));

        // Then
        assertEquals(1L, first);
        assertEquals(2L, second);
        assertEquals(2L, store.lastSequence());
    }

    @Test
    void testAppend_WhenRequiredRoleDidNotVote_RejectsAndWritesNothing() {
        // Given: TEST_ENGINEER is required but never voted
        ProposalId proposalId = ProposalId.of("P-1");
        ChronicleDraft draft = new ChronicleDraft(proposalId, WorkItemId.of("ITEM-1"), 1, "a", "b",
            ReviewFixtures.REVIEWERS,
            List.of(ReviewVote.approve(Role.ARCHITECT, proposalId, 1), ReviewVote.approve(Role.DOMAIN_EXPERT, proposalId, 1)),
            List.of(), "approved", DecisionBasis.UNANIMOUS, List.of());

        // When & Then
        IncompleteReviewRecordException exception =
            assertThrows(IncompleteReviewRecordException.class, () -> store.append(draft));
        assertEquals("CHRON-001", exception.getErrorCode());
        assertTrue(exception.getMessage().contains("TEST_ENGINEER"));
        assertEquals(0L, store.lastSequence());
        assertTrue(store.records().isEmpty());
    }

    @Test
    void testAppend_WhenDecisionBlank_Rejects() {
        // Given
        ProposalId proposalId = ProposalId.of("P-1");
        ChronicleDraft draft = new ChronicleDraft(proposalId, WorkItemId.of("ITEM-1"), 1, "a", "b",
            ReviewFixtures.REVIEWERS, ReviewFixtures.approvals(proposalId, ReviewFixtures.REVIEWERS, 1),
            List.of(), "  ", DecisionBasis.UNANIMOUS, List.of());

        // When & Then
        assertThrows(IncompleteReviewRecordException.class, () -> store.append(draft));
        assertEquals(0L, store.lastSequence());
    }

    @Test
    void testAppend_ConcurrentWriters_ProduceGaplessSequence() throws Exception {
        // Given
        int writers = 8;
        int perWriter = 50;
        ExecutorService executor = Executors.newFixedThreadPool(writers);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<List<Long>>> futures = new ArrayList<>();

        // When
        for (int w = 0; w < writers; w++) {
            int writer = w;
            futures.add(executor.submit(() -> {
                start.await();
                List<Long> assigned = new ArrayList<>();
                for (int i = 0; i < perWriter; i++) {
                    assigned.add(store.append(ReviewFixtures.completeDraft(ProposalId.of("P-" + writer + "-" + i), 1)));
                }
                return assigned;
            }));
        }
        start.countDown();
        List<Long> all = new ArrayList<>();
        for (Future<List<Long>> future : futures) {
            all.addAll(future.get(30, TimeUnit.SECONDS));
        }
        executor.shutdown();

        // Then
        int total = writers * perWriter;
        assertThat(all).hasSize(total).doesNotHaveDuplicates();
        assertEquals((long) total, store.lastSequence());

        List<ChronicleRecord> records = store.records();
        assertEquals(total, records.size());
        for (int i = 0; i < records.size(); i++) {
            assertEquals(i + 1L, records.get(i).sequence(), "sequence gap at index " + i);
        }
    }

    @Test
    void testFindByProposalAndPhase_FilterRecords() {
        // Given
        store.append(ReviewFixtures.completeDraft(ProposalId.of("P-1"), 1));
        store.append(ReviewFixtures.completeDraft(ProposalId.of("P-2"), 2));
        store.append(ReviewFixtures.completeDraft(ProposalId.of("P-1"), 1));

        // When & Then
        assertEquals(2, store.findByProposal(ProposalId.of("P-1")).size());
        assertEquals(1, store.findByPhase(2).size());
        assertEquals(ProposalId.of("P-2"), store.findByPhase(2).get(0).proposalId());
    }

    @Test
    void testFindBetween_IsHalfOpen() {
        // Given
        store.append(ReviewFixtures.completeDraft(ProposalId.of("P-1"), 1));
        Instant recordedAt = store.records().get(0).recordedAt();

        // When & Then
        assertEquals(1, store.findBetween(recordedAt, recordedAt.plusMillis(1)).size());
        assertTrue(store.findBetween(recordedAt.minusSeconds(1), recordedAt).isEmpty());
    }

    @Test
    void testRecords_AreImmutableSnapshots() {
        // Given
        store.append(ReviewFixtures.completeDraft(ProposalId.of("P-1"), 1));
        List<ChronicleRecord> snapshot = store.records();

        // When
        store.append(ReviewFixtures.completeDraft(ProposalId.of("P-2"), 1));

        // Then
        assertEquals(1, snapshot.size());
        assertThrows(UnsupportedOperationException.class, () -> snapshot.remove(0));
    }
}
