/**
 * Review protocol contract and its outcomes.
 *
 * <h2>Outcome Cases</h2>
 * <ul>
 *   <li>{@link com.ryuqq.reviewflow.application.review.Committed} - Chronicled and applied</li>
 *   <li>{@link com.ryuqq.reviewflow.application.review.Rejected} - Current content retained</li>
 *   <li>{@link com.ryuqq.reviewflow.application.review.Withdrawn} - Withdrawn before consensus, nothing recorded</li>
 * </ul>
 *
 * @since 1.0.0
 * @author ReviewFlow Team
 */
package com.ryuqq.reviewflow.application.review;
