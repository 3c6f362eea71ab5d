package com.ryuqq.kvstream.adapter.inmemory.store;

import com.ryuqq.kvstream.core.spi.KeyValueStore;
import com.ryuqq.kvstream.testkit.contract.AbstractKeyValueStoreContractTest;

/**
 * Contract Test for {@link InMemoryKeyValueStore} with synchronous write completion.
 *
 * @author KvStream Team
 * @since 1.0.0
 * @see AbstractKeyValueStoreContractTest
 */
class InMemoryKeyValueStoreContractTest extends AbstractKeyValueStoreContractTest {

    @Override
    protected KeyValueStore createStore() {
        return new InMemoryKeyValueStore();
    }
}
