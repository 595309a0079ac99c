package com.ryuqq.bilevel.adapter.inmemory.hybrid;

import com.ryuqq.bilevel.core.config.Capacity;
import com.ryuqq.bilevel.core.contract.BilevelSet;
import com.ryuqq.bilevel.testkit.contract.AbstractBilevelSetContractTest;

/**
 * {@link HybridBilevelSet} Contract Test.
 *
 * @author Bilevel Team
 * @since 1.0.0
 */
class HybridBilevelSetContractTest extends AbstractBilevelSetContractTest {

    @Override
    protected <G, K> BilevelSet<G, K> createSet(Capacity capacity) {
        return new HybridBilevelSet<>(capacity);
    }
}
