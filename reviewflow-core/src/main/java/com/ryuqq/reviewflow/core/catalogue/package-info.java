/**
 * Versioned catalogue records and change requests against locked entries.
 *
 * @since 1.0.0
 * @author ReviewFlow Team
 */
package com.ryuqq.reviewflow.core.catalogue;
