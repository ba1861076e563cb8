/**
 * In-memory append-only ChronicleStore adapter.
 *
 * @author ReviewFlow Team
 * @since 1.0.0
 */
package com.ryuqq.reviewflow.adapter.inmemory.chronicle;
