package com.ryuqq.bilevel.adapter.inmemory.hybrid;

import com.ryuqq.bilevel.adapter.inmemory.support.IndexedBilevelMap;
import com.ryuqq.bilevel.core.config.Capacity;
import com.ryuqq.bilevel.core.contract.BilevelMap;
import com.ryuqq.bilevel.core.key.KeyCopier;

/**
 * 그룹 키만 복제하고 집계 키는 공유하는 {@link BilevelMap} (HYBRID 전략).
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * BilevelMap&lt;Integer, String, LongAdder&gt; map = new HybridBilevelMap&lt;&gt;();
 * map.getOrCreate(1, "2", LongAdder::new).increment();
 * map.getOrCreate(2, "1", LongAdder::new).increment();
 * map.getOrCreate(1, "2", LongAdder::new).increment();
 *
 * // (1, "2") -&gt; 2, (2, "1") -&gt; 1
 * </pre>
 *
 * @param <G> 그룹 키 타입
 * @param <K> 집계 키 타입
 * @param <V> 값 타입
 * @author Bilevel Team
 * @since 1.0.0
 */
public class HybridBilevelMap<G, K, V> extends IndexedBilevelMap<G, K, V> {

    private final HybridIndex<G, K, V> index;

    /**
     * 불변 그룹 키용 빈 Map을 기본 용량으로 생성합니다.
     */
    public HybridBilevelMap() {
        this(new Capacity());
    }

    /**
     * 불변 그룹 키용 빈 Map을 생성합니다.
     *
     * @param capacity 사전 할당 크기
     */
    public HybridBilevelMap(Capacity capacity) {
        this(capacity, KeyCopier.identity());
    }

    /**
     * 빈 Map을 기본 용량으로 생성합니다.
     *
     * @param groupCopier 그룹 키 복제기
     * @throws IllegalArgumentException groupCopier가 null인 경우
     */
    public HybridBilevelMap(KeyCopier<G> groupCopier) {
        this(new Capacity(), groupCopier);
    }

    /**
     * 빈 Map을 생성합니다.
     *
     * @param capacity 사전 할당 크기
     * @param groupCopier 그룹 키 복제기
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public HybridBilevelMap(Capacity capacity, KeyCopier<G> groupCopier) {
        this(new HybridIndex<>(capacity, groupCopier));
    }

    private HybridBilevelMap(HybridIndex<G, K, V> index) {
        super(index);
        this.index = index;
    }

    /**
     * @return 저장된 서로 다른 집계 키 수 (그룹 간 공유 키는 한 번만 계산)
     */
    public int distinctAggregationKeys() {
        return index.memberSlots().liveCount();
    }
}
