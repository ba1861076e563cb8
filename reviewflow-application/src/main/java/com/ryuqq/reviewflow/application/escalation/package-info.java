/**
 * Default in-process escalation registry.
 *
 * @since 1.0.0
 * @author ReviewFlow Team
 */
package com.ryuqq.reviewflow.application.escalation;
