package com.ryuqq.bilevel.adapter.inmemory.handle;

import com.ryuqq.bilevel.adapter.inmemory.support.IndexedBilevelMap;
import com.ryuqq.bilevel.core.config.Capacity;
import com.ryuqq.bilevel.core.contract.BilevelMap;

/**
 * 어떤 키 구성요소도 복제하지 않는 {@link BilevelMap} (HANDLE 전략).
 *
 * @param <G> 그룹 키 타입
 * @param <K> 집계 키 타입
 * @param <V> 값 타입
 * @author Bilevel Team
 * @since 1.0.0
 */
public class HandleBilevelMap<G, K, V> extends IndexedBilevelMap<G, K, V> {

    private final HandleIndex<G, K, V> index;

    /**
     * 빈 Map을 기본 용량으로 생성합니다.
     */
    public HandleBilevelMap() {
        this(new Capacity());
    }

    /**
     * 빈 Map을 생성합니다.
     *
     * @param capacity 사전 할당 크기
     * @throws IllegalArgumentException capacity가 null인 경우
     */
    public HandleBilevelMap(Capacity capacity) {
        this(new HandleIndex<>(capacity));
    }

    private HandleBilevelMap(HandleIndex<G, K, V> index) {
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
