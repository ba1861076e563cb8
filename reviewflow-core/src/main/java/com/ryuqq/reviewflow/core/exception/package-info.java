/**
 * Domain error taxonomy. Every error carries a stable error code.
 *
 * <ul>
 *   <li>GATE-001 {@link com.ryuqq.reviewflow.core.exception.GateNotSatisfiedException}</li>
 *   <li>ROUTE-001 {@link com.ryuqq.reviewflow.core.exception.DuplicateSubmissionException}</li>
 *   <li>CHRON-001 {@link com.ryuqq.reviewflow.core.exception.IncompleteReviewRecordException}</li>
 *   <li>CAT-001 {@link com.ryuqq.reviewflow.core.exception.CatalogueLockViolationException}</li>
 *   <li>REVIEW-001 {@link com.ryuqq.reviewflow.core.exception.ConsensusDeadlockException}</li>
 * </ul>
 *
 * @since 1.0.0
 * @author ReviewFlow Team
 */
package com.ryuqq.reviewflow.core.exception;
