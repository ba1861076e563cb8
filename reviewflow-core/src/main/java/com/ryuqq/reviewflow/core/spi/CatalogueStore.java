package com.ryuqq.reviewflow.core.spi;

import com.ryuqq.reviewflow.core.catalogue.CatalogueEntry;
import com.ryuqq.reviewflow.core.catalogue.CatalogueListener;
import com.ryuqq.reviewflow.core.catalogue.ChangeDecision;
import com.ryuqq.reviewflow.core.catalogue.ChangeRequest;
import com.ryuqq.reviewflow.core.model.EntryId;
import com.ryuqq.reviewflow.core.model.Payload;

import java.util.List;
import java.util.Optional;

/**
 * Versioned rule catalogue SPI.
 *
 * <p>Each entry is an immutable chain of versions. A version moves through
 * DRAFT → UNDER_REVIEW → APPROVED → LOCKED; once LOCKED its content never changes.
 * Any later change produces version v+1 with {@code supersedes = v} and marks v SUPERSEDED.
 * Entries are never deleted.</p>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Thread-safe: version transitions on the same entry must be linearizable (per-entry CAS)</li>
 *   <li>Copy-on-write: readers never observe a partially applied transition</li>
 *   <li>A BEHAVIORAL change to a LOCKED entry must always go through an escalation</li>
 * </ul>
 *
 * @author ReviewFlow Team
 * @since 1.0.0
 */
public interface CatalogueStore {

    /**
     * Creates version 1 as DRAFT, or replaces the content of a non-locked version.
     *
     * @param id entry id
     * @param content draft content
     * @return the current version after the call
     * @throws com.ryuqq.reviewflow.core.exception.CatalogueLockViolationException if the entry is locked
     * @throws IllegalStateException if the entry is INVALID
     */
    CatalogueEntry propose(EntryId id, Payload content);

    /**
     * DRAFT → UNDER_REVIEW.
     *
     * @throws IllegalStateException if the transition is not allowed
     * @throws IllegalArgumentException if the entry does not exist
     */
    CatalogueEntry submitForReview(EntryId id);

    /**
     * UNDER_REVIEW → APPROVED.
     *
     * @throws IllegalStateException if the transition is not allowed
     * @throws IllegalArgumentException if the entry does not exist
     */
    CatalogueEntry approve(EntryId id);

    /**
     * Marks a non-locked version INVALID with the given reason.
     *
     * @throws com.ryuqq.reviewflow.core.exception.CatalogueLockViolationException if the entry is locked
     */
    CatalogueEntry invalidate(EntryId id, String reason);

    /**
     * Records content agreed by a completed review: creates or replaces the non-locked
     * version and leaves it APPROVED, to be locked at the next gate boundary.
     *
     * @throws com.ryuqq.reviewflow.core.exception.CatalogueLockViolationException if the entry is locked
     */
    CatalogueEntry acceptReviewed(EntryId id, Payload content);

    /**
     * APPROVED → LOCKED. Idempotent for an already LOCKED entry.
     *
     * @throws IllegalStateException if the entry is neither APPROVED nor LOCKED
     */
    CatalogueEntry lock(EntryId id);

    /**
     * Locks every APPROVED entry. Called by the phase controller at a gate boundary.
     *
     * @return entries locked by this call
     */
    List<CatalogueEntry> lockApproved();

    /**
     * Requests a change to an entry.
     *
     * <p>Before the entry is locked the request is an ordinary edit: a deletion invalidates
     * the current version, anything else replaces its content as DRAFT. Once LOCKED:</p>
     * <ul>
     *   <li>CLERICAL: version v+1 is created LOCKED immediately, v is archived SUPERSEDED</li>
     *   <li>BEHAVIORAL: an escalation is raised, nothing changes until it is resolved with APPROVE</li>
     *   <li>DELETION: always rejected</li>
     * </ul>
     *
     * <p>While a BEHAVIORAL escalation on a locked entry is pending, further CLERICAL or
     * BEHAVIORAL requests for that entry are refused, so the approved change always lands on
     * the version it was raised against. Every supersession is reported to the registered
     * {@link CatalogueListener}s.</p>
     *
     * @throws com.ryuqq.reviewflow.core.exception.CatalogueLockViolationException for a deletion
     * @throws IllegalStateException if a behavioral change to the locked entry is still pending
     * @throws IllegalArgumentException if the entry does not exist
     */
    ChangeDecision requestChange(EntryId id, ChangeRequest request);

    /**
     * Direct content mutation guarded by the expected version.
     *
     * @throws com.ryuqq.reviewflow.core.exception.CatalogueLockViolationException if the entry is locked
     * @throws IllegalStateException if {@code expectedVersion} is stale
     */
    CatalogueEntry update(EntryId id, int expectedVersion, Payload content);

    Optional<CatalogueEntry> current(EntryId id);

    /**
     * Full version chain, oldest first.
     */
    List<CatalogueEntry> history(EntryId id);

    /**
     * Current version of every entry.
     */
    List<CatalogueEntry> entries();

    /**
     * @return true if any current version is DRAFT or UNDER_REVIEW
     */
    boolean hasUnsettled();

    /**
     * Registers a listener notified whenever a locked entry is superseded.
     */
    void addListener(CatalogueListener listener);
}
