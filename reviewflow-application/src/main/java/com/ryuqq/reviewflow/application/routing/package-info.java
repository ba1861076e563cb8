/**
 * Work item routing. {@link com.ryuqq.reviewflow.application.routing.TaskRouter} is the only writer
 * of work item status.
 *
 * @since 1.0.0
 * @author ReviewFlow Team
 */
package com.ryuqq.reviewflow.application.routing;
