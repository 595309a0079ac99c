package com.ryuqq.bilevel.adapter.inmemory.copy;

import com.ryuqq.bilevel.adapter.inmemory.support.IndexedBilevelSet;
import com.ryuqq.bilevel.core.config.Capacity;
import com.ryuqq.bilevel.core.contract.BilevelSet;
import com.ryuqq.bilevel.core.key.KeyCopier;

/**
 * 두 키 구성요소를 모두 복제할 수 있는 {@link BilevelSet} (COPY 전략).
 *
 * <p>{@link CopyIndex} 기반. 불변 키 타입은 복제기 없는 생성자를, 가변 키 타입은
 * {@link KeyCopier}를 받는 생성자를 사용합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * BilevelSet&lt;Integer, Integer&gt; set = new CopyBilevelSet&lt;&gt;();
 * set.insert(1, 2);
 * set.insert(2, 1);
 * set.insert(1, 2);   // false, de-duplicated
 * set.insert(2, 2);
 *
 * for (FullKey&lt;Integer, Integer&gt; key : set.entries()) {
 *     System.out.println(key.group() + ", " + key.aggregation());
 * }
 * // 1, 2
 * // 2, 1
 * // 2, 2
 * </pre>
 *
 * @param <G> 그룹 키 타입
 * @param <K> 집계 키 타입
 * @author Bilevel Team
 * @since 1.0.0
 */
public class CopyBilevelSet<G, K> extends IndexedBilevelSet<G, K> {

    private final KeyCopier<G> groupCopier;
    private final KeyCopier<K> aggregationCopier;

    /**
     * 불변 키용 빈 Set을 기본 용량으로 생성합니다.
     */
    public CopyBilevelSet() {
        this(new Capacity());
    }

    /**
     * 불변 키용 빈 Set을 생성합니다.
     *
     * @param capacity 사전 할당 크기
     */
    public CopyBilevelSet(Capacity capacity) {
        this(capacity, KeyCopier.identity(), KeyCopier.identity());
    }

    /**
     * 빈 Set을 기본 용량으로 생성합니다.
     *
     * @param groupCopier 그룹 키 복제기
     * @param aggregationCopier 집계 키 복제기
     */
    public CopyBilevelSet(KeyCopier<G> groupCopier, KeyCopier<K> aggregationCopier) {
        this(new Capacity(), groupCopier, aggregationCopier);
    }

    /**
     * 빈 Set을 생성합니다.
     *
     * @param capacity 사전 할당 크기
     * @param groupCopier 그룹 키 복제기
     * @param aggregationCopier 집계 키 복제기
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public CopyBilevelSet(Capacity capacity, KeyCopier<G> groupCopier, KeyCopier<K> aggregationCopier) {
        super(new CopyIndex<>(capacity, groupCopier, aggregationCopier), capacity);
        this.groupCopier = groupCopier;
        this.aggregationCopier = aggregationCopier;
    }

    /**
     * {@inheritDoc}
     *
     * <p>복제기를 맞바꾼 {@code CopyBilevelSet}을 반환합니다.</p>
     */
    @Override
    protected BilevelSet<K, G> newPivot(Capacity capacity) {
        return new CopyBilevelSet<>(capacity, aggregationCopier, groupCopier);
    }
}
