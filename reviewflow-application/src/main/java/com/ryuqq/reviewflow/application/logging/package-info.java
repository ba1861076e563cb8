/**
 * MDC keys for review logging.
 *
 * @since 1.0.0
 * @author ReviewFlow Team
 */
package com.ryuqq.reviewflow.application.logging;
