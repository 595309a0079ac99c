package com.ryuqq.bilevel.adapter.inmemory.handle;

import com.ryuqq.bilevel.adapter.inmemory.support.IndexedBilevelSet;
import com.ryuqq.bilevel.core.config.Capacity;
import com.ryuqq.bilevel.core.contract.BilevelSet;

/**
 * 어떤 키 구성요소도 복제하지 않는 {@link BilevelSet} (HANDLE 전략).
 *
 * <p>{@link HandleIndex} 기반: 서로 다른 키 구성요소는 한 번만 저장되고 슬롯 핸들로
 * 참조됩니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * BilevelSet&lt;String, String&gt; set = new HandleBilevelSet&lt;&gt;();
 * set.insert("1", "2");
 * set.insert("2", "1");
 * set.insert("1", "2");   // false
 * set.insert("2", "2");
 *
 * set.group("2");         // [1, 2]
 * </pre>
 *
 * @param <G> 그룹 키 타입
 * @param <K> 집계 키 타입
 * @author Bilevel Team
 * @since 1.0.0
 */
public class HandleBilevelSet<G, K> extends IndexedBilevelSet<G, K> {

    private final HandleIndex<G, K, Object> index;

    /**
     * 빈 Set을 기본 용량으로 생성합니다.
     */
    public HandleBilevelSet() {
        this(new Capacity());
    }

    /**
     * 빈 Set을 생성합니다.
     *
     * @param capacity 사전 할당 크기
     * @throws IllegalArgumentException capacity가 null인 경우
     */
    public HandleBilevelSet(Capacity capacity) {
        this(new HandleIndex<>(capacity), capacity);
    }

    private HandleBilevelSet(HandleIndex<G, K, Object> index, Capacity capacity) {
        super(index, capacity);
        this.index = index;
    }

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
