/**
 * Deterministic tie-breaking for disputes left open after debate.
 *
 * <h2>Rules</h2>
 * <ol>
 *   <li>Phase safety priority: the single option backed by the phase's priority concern wins</li>
 *   <li>Conservatism: the single option with the lowest impact wins</li>
 *   <li>Otherwise the dispute is deferred to a human</li>
 * </ol>
 *
 * @since 1.0.0
 * @author ReviewFlow Team
 */
package com.ryuqq.reviewflow.core.resolver;
