package com.ryuqq.reviewflow.adapter.inmemory.catalogue;

import com.ryuqq.reviewflow.core.spi.CatalogueStore;
import com.ryuqq.reviewflow.core.spi.EscalationManager;
import com.ryuqq.reviewflow.testkit.contract.AbstractCatalogueStoreContractTest;

/**
 * Contract Tests for {@link InMemoryCatalogueStore}.
 *
 * @author ReviewFlow Team
 * @since 1.0.0
 */
class InMemoryCatalogueStoreContractTest extends AbstractCatalogueStoreContractTest {

    @Override
    protected CatalogueStore createStore(EscalationManager escalations) {
        return new InMemoryCatalogueStore(escalations);
    }
}
