package com.ryuqq.bilevel.adapter.inmemory.copy;

import com.ryuqq.bilevel.core.config.Capacity;
import com.ryuqq.bilevel.core.contract.BilevelMap;
import com.ryuqq.bilevel.testkit.contract.AbstractBilevelMapContractTest;

/**
 * {@link CopyBilevelMap} Contract Test.
 *
 * @author Bilevel Team
 * @since 1.0.0
 */
class CopyBilevelMapContractTest extends AbstractBilevelMapContractTest {

    @Override
    protected <G, K, V> BilevelMap<G, K, V> createMap(Capacity capacity) {
        return new CopyBilevelMap<>(capacity);
    }
}
