/**
 * In-memory CatalogueStore adapter implementation package.
 *
 * <p><strong>Main Components:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.reviewflow.adapter.inmemory.catalogue.InMemoryCatalogueStore}:
 *       Thread-safe implementation of {@link com.ryuqq.reviewflow.core.spi.CatalogueStore}</li>
 * </ul>
 *
 * <p><strong>Design Principles:</strong></p>
 * <ul>
 *   <li><strong>Concurrency:</strong> per-entry {@link java.util.concurrent.atomic.AtomicReference}
 *       over an immutable version chain</li>
 *   <li><strong>Immutability:</strong> a LOCKED version is never rewritten, changes append v+1</li>
 * </ul>
 *
 * @author ReviewFlow Team
 * @since 1.0.0
 */
package com.ryuqq.reviewflow.adapter.inmemory.catalogue;
