/**
 * Lifecycle state machines for proposals, work items and catalogue entries.
 *
 * <h2>Proposal</h2>
 * <pre>
 * PROPOSED → REVIEW_ROUND_1 → (REVIEW_ROUND_1 | DEBATE) → CONSENSUS → COMMITTED
 *                                                       → REJECTED
 * any state before CONSENSUS → WITHDRAWN
 * </pre>
 *
 * <h2>Work Item</h2>
 * <pre>
 * PENDING → IN_PROGRESS → UNDER_REVIEW → DONE
 *                                      → PENDING (rejected / withdrawn)
 * any non-terminal state → BLOCKED → previous state
 * </pre>
 *
 * <h2>Catalogue Entry</h2>
 * <pre>
 * DRAFT → UNDER_REVIEW → APPROVED → LOCKED → SUPERSEDED
 * DRAFT / UNDER_REVIEW / APPROVED → INVALID
 * </pre>
 *
 * @since 1.0.0
 * @author ReviewFlow Team
 */
package com.ryuqq.reviewflow.core.statemachine;
