package com.ryuqq.reviewflow.adapter.inmemory.chronicle;

import com.ryuqq.reviewflow.core.spi.ChronicleStore;
import com.ryuqq.reviewflow.testkit.contract.AbstractChronicleStoreContractTest;

/**
 * Contract Tests for {@link InMemoryChronicleStore}.
 *
 * @author ReviewFlow Team
 * @since 1.0.0
 */
class InMemoryChronicleStoreContractTest extends AbstractChronicleStoreContractTest {

    @Override
    protected ChronicleStore createStore() {
        return new InMemoryChronicleStore();
    }
}
