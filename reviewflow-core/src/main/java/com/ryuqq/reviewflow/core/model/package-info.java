/**
 * Core domain model: identifiers, review inputs and the phase plan.
 *
 * <h2>Value Objects</h2>
 * <ul>
 *   <li>{@link com.ryuqq.reviewflow.core.model.WorkItemId} - Opaque work item identifier</li>
 *   <li>{@link com.ryuqq.reviewflow.core.model.ProposalId} - Change proposal identifier</li>
 *   <li>{@link com.ryuqq.reviewflow.core.model.EntryId} - Catalogue entry identifier</li>
 *   <li>{@link com.ryuqq.reviewflow.core.model.EscalationId} - Escalation identifier</li>
 *   <li>{@link com.ryuqq.reviewflow.core.model.Payload} - Opaque content, never interpreted by the engine</li>
 * </ul>
 *
 * <h2>Review Inputs</h2>
 * <ul>
 *   <li>{@link com.ryuqq.reviewflow.core.model.ChangeProposal} - A proposed change to one work item</li>
 *   <li>{@link com.ryuqq.reviewflow.core.model.ReviewVote} - One vote per role per round</li>
 *   <li>{@link com.ryuqq.reviewflow.core.model.Position} - Evidence-backed debate position</li>
 * </ul>
 *
 * <h2>Phase Plan</h2>
 * <ul>
 *   <li>{@link com.ryuqq.reviewflow.core.model.PhasePlan} - Ordered phases with criteria, reviewers and safety priority</li>
 * </ul>
 *
 * @since 1.0.0
 * @author ReviewFlow Team
 */
package com.ryuqq.reviewflow.core.model;
