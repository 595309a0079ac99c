package com.ryuqq.bilevel.adapter.inmemory.hybrid;

import com.ryuqq.bilevel.adapter.inmemory.handle.HandleBilevelSet;
import com.ryuqq.bilevel.adapter.inmemory.support.IndexedBilevelSet;
import com.ryuqq.bilevel.core.config.Capacity;
import com.ryuqq.bilevel.core.contract.BilevelSet;
import com.ryuqq.bilevel.core.key.KeyCopier;

/**
 * 그룹 키만 복제하고 집계 키는 공유하는 {@link BilevelSet} (HYBRID 전략).
 *
 * <p>{@link HybridIndex} 기반.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * BilevelSet&lt;Integer, String&gt; set = new HybridBilevelSet&lt;&gt;();
 * set.insert(1, "2");
 * set.insert(2, "1");
 * set.insert(1, "2");   // false
 * set.insert(2, "2");
 * </pre>
 *
 * @param <G> 그룹 키 타입
 * @param <K> 집계 키 타입
 * @author Bilevel Team
 * @since 1.0.0
 */
public class HybridBilevelSet<G, K> extends IndexedBilevelSet<G, K> {

    private final HybridIndex<G, K, Object> index;

    /**
     * 불변 그룹 키용 빈 Set을 기본 용량으로 생성합니다.
     */
    public HybridBilevelSet() {
        this(new Capacity());
    }

    /**
     * 불변 그룹 키용 빈 Set을 생성합니다.
     *
     * @param capacity 사전 할당 크기
     */
    public HybridBilevelSet(Capacity capacity) {
        this(capacity, KeyCopier.identity());
    }

    /**
     * 빈 Set을 기본 용량으로 생성합니다.
     *
     * @param groupCopier 그룹 키 복제기
     */
    public HybridBilevelSet(KeyCopier<G> groupCopier) {
        this(new Capacity(), groupCopier);
    }

    /**
     * 빈 Set을 생성합니다.
     *
     * @param capacity 사전 할당 크기
     * @param groupCopier 그룹 키 복제기
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public HybridBilevelSet(Capacity capacity, KeyCopier<G> groupCopier) {
        this(new HybridIndex<>(capacity, groupCopier), capacity);
    }

    private HybridBilevelSet(HybridIndex<G, K, Object> index, Capacity capacity) {
        super(index, capacity);
        this.index = index;
    }

    /**
     * {@inheritDoc}
     *
     * <p>집계 키가 피벗의 그룹 키가 되는데 복제할 수 없으므로
     * {@link HandleBilevelSet}을 반환합니다.</p>
     */
    @Override
    protected BilevelSet<K, G> newPivot(Capacity capacity) {
        return new HandleBilevelSet<>(capacity);
    }

    /**
     * @return 저장된 서로 다른 집계 키 수 (그룹 간 공유 키는 한 번만 계산)
     */
    public int distinctAggregationKeys() {
        return index.memberSlots().liveCount();
    }
}
