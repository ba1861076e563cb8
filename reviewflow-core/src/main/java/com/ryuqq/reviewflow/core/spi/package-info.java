/**
 * Service Provider Interface (SPI) package.
 *
 * <p>Interfaces implemented by adapters to back the engine's ledgers and its
 * outbound channels.</p>
 *
 * <h2>SPI Interfaces</h2>
 * <ul>
 *   <li>{@link com.ryuqq.reviewflow.core.spi.CatalogueStore} - Versioned rule catalogue</li>
 *   <li>{@link com.ryuqq.reviewflow.core.spi.ChronicleStore} - Append-only change chronicle</li>
 *   <li>{@link com.ryuqq.reviewflow.core.spi.EscalationManager} - Human escalation registry</li>
 *   <li>{@link com.ryuqq.reviewflow.core.spi.ReviewerGateway} - Outbound vote/position/revision requests</li>
 *   <li>{@link com.ryuqq.reviewflow.core.spi.HumanDecisionPort} - Blocking human decision channel</li>
 * </ul>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Hexagonal Architecture:</strong> Core defines interfaces, adapters provide implementations</li>
 *   <li><strong>Dependency Inversion:</strong> Core does not depend on persistence or transport</li>
 * </ul>
 *
 * @since 1.0.0
 * @author ReviewFlow Team
 */
package com.ryuqq.reviewflow.core.spi;
