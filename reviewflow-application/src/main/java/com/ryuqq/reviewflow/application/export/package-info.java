/**
 * JSON export of the catalogue version chains and chronicle records.
 *
 * @since 1.0.0
 * @author ReviewFlow Team
 */
package com.ryuqq.reviewflow.application.export;
