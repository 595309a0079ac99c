package com.ryuqq.bilevel.adapter.inmemory.copy;

import com.ryuqq.bilevel.adapter.inmemory.support.IndexedBilevelMap;
import com.ryuqq.bilevel.core.config.Capacity;
import com.ryuqq.bilevel.core.contract.BilevelMap;
import com.ryuqq.bilevel.core.key.KeyCopier;

/**
 * 두 키 구성요소를 모두 복제할 수 있는 {@link BilevelMap} (COPY 전략).
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * BilevelMap&lt;Integer, Integer, AtomicLong&gt; map = new CopyBilevelMap&lt;&gt;();
 * map.getOrCreate(1, 2, AtomicLong::new).incrementAndGet();
 * map.getOrCreate(2, 1, AtomicLong::new).incrementAndGet();
 * map.getOrCreate(1, 2, AtomicLong::new).incrementAndGet();
 *
 * // (1, 2) -&gt; 2, (2, 1) -&gt; 1
 * </pre>
 *
 * @param <G> 그룹 키 타입
 * @param <K> 집계 키 타입
 * @param <V> 값 타입
 * @author Bilevel Team
 * @since 1.0.0
 */
public class CopyBilevelMap<G, K, V> extends IndexedBilevelMap<G, K, V> {

    /**
     * 불변 키용 빈 Map을 기본 용량으로 생성합니다.
     */
    public CopyBilevelMap() {
        this(new Capacity());
    }

    /**
     * 불변 키용 빈 Map을 생성합니다.
     *
     * @param capacity 사전 할당 크기
     */
    public CopyBilevelMap(Capacity capacity) {
        this(capacity, KeyCopier.identity(), KeyCopier.identity());
    }

    /**
     * 빈 Map을 기본 용량으로 생성합니다.
     *
     * @param groupCopier 그룹 키 복제기
     * @param aggregationCopier 집계 키 복제기
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public CopyBilevelMap(KeyCopier<G> groupCopier, KeyCopier<K> aggregationCopier) {
        this(new Capacity(), groupCopier, aggregationCopier);
    }

    /**
     * 빈 Map을 생성합니다.
     *
     * @param capacity 사전 할당 크기
     * @param groupCopier 그룹 키 복제기
     * @param aggregationCopier 집계 키 복제기
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public CopyBilevelMap(Capacity capacity, KeyCopier<G> groupCopier, KeyCopier<K> aggregationCopier) {
        super(new CopyIndex<>(capacity, groupCopier, aggregationCopier));
    }
}
