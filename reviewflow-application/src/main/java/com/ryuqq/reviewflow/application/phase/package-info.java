/**
 * Phase ordering and gate evaluation.
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.reviewflow.application.phase.PhaseController} - Opens, gates, closes and reopens phases</li>
 *   <li>{@link com.ryuqq.reviewflow.application.phase.GateProbe} - System-evaluated criterion</li>
 *   <li>{@link com.ryuqq.reviewflow.application.phase.GateStatus} - Gate evaluation snapshot</li>
 * </ul>
 *
 * @since 1.0.0
 * @author ReviewFlow Team
 */
package com.ryuqq.reviewflow.application.phase;
