/**
 * Human escalation model.
 *
 * <p>An {@link com.ryuqq.reviewflow.core.escalation.Escalation} is raised PENDING, blocks its
 * dependent work item, and is resolved once by a human decision. There is no expiry.</p>
 *
 * @since 1.0.0
 * @author ReviewFlow Team
 */
package com.ryuqq.reviewflow.core.escalation;
