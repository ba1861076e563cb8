/**
 * Reusable SPI contract tests.
 *
 * <p>Store adapters extend {@link com.ryuqq.reviewflow.testkit.contract.AbstractCatalogueStoreContractTest}
 * and {@link com.ryuqq.reviewflow.testkit.contract.AbstractChronicleStoreContractTest} and only supply
 * the store under test.</p>
 *
 * @author ReviewFlow Team
 * @since 1.0.0
 */
package com.ryuqq.reviewflow.testkit.contract;
