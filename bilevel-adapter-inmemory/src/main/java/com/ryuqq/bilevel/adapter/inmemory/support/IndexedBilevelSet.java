package com.ryuqq.bilevel.adapter.inmemory.support;

import com.ryuqq.bilevel.core.config.Capacity;
import com.ryuqq.bilevel.core.contract.BilevelSet;
import com.ryuqq.bilevel.core.key.FullKey;
import com.ryuqq.bilevel.core.spi.DualIndex;
import com.ryuqq.bilevel.core.spi.Ownership;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Set;

/**
 * {@link DualIndex} 위의 {@link BilevelSet} 구현.
 *
 * <p>인자를 검증하고 Set 의미를 색인 연산으로 옮깁니다. 색인에는 pair마다 공유 표식 값이
 * 저장됩니다. 하위 클래스는 소유권 전략과 피벗 결과 생성 방법만 정합니다.</p>
 *
 * @param <G> 그룹 키 타입
 * @param <K> 집계 키 타입
 * @author Bilevel Team
 * @since 1.0.0
 */
public abstract class IndexedBilevelSet<G, K> implements BilevelSet<G, K> {

    private static final Logger log = LoggerFactory.getLogger(IndexedBilevelSet.class);

    /**
     * 모든 pair에 저장되는 값.
     */
    private static final Object PRESENT = new Object();

    private final DualIndex<G, K, Object> index;
    private final Capacity capacity;

    /**
     * @param index 소유권 전략
     * @param capacity 색인 생성에 사용한 용량
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    protected IndexedBilevelSet(DualIndex<G, K, Object> index, Capacity capacity) {
        if (index == null) {
            throw new IllegalArgumentException("index cannot be null");
        }
        if (capacity == null) {
            throw new IllegalArgumentException("capacity cannot be null");
        }
        this.index = index;
        this.capacity = capacity;
    }

    /**
     * 피벗된 pair를 받을 빈 Set을 생성합니다.
     *
     * <p>결과의 소유권은 {@link Ownership#pivoted()}와 같아야 합니다.</p>
     *
     * @param capacity 피벗 Set의 용량
     * @return 집계 키 기준으로 묶일 빈 Set
     */
    protected abstract BilevelSet<K, G> newPivot(Capacity capacity);

    @Override
    public boolean insert(G group, K aggregation) {
        checkKeys(group, aggregation);
        return index.put(group, aggregation, PRESENT) == null;
    }

    @Override
    public boolean contains(G group, K aggregation) {
        checkKeys(group, aggregation);
        return index.get(group, aggregation) != null;
    }

    @Override
    public boolean remove(G group, K aggregation) {
        checkKeys(group, aggregation);
        return index.remove(group, aggregation) != null;
    }

    @Override
    public Collection<K> group(G group) {
        if (group == null) {
            throw new IllegalArgumentException("group key cannot be null");
        }
        return index.group(group).keySet();
    }

    @Override
    public Set<G> groups() {
        return index.groups();
    }

    @Override
    public Iterable<FullKey<G, K>> entries() {
        return () -> index.groups().stream()
                .flatMap(g -> index.group(g).keySet().stream().map(k -> FullKey.of(g, k)))
                .iterator();
    }

    @Override
    public BilevelSet<K, G> pivot() {
        // 피벗의 그룹 수는 서로 다른 집계 키 수이며 여기서는 알 수 없음
        Capacity pivotCapacity = new Capacity(groupCount(), capacity.perGroup(), groupCount());
        BilevelSet<K, G> pivoted = newPivot(pivotCapacity);
        if (pivoted.ownership() != ownership().pivoted()) {
            throw new IllegalStateException(
                    "Pivot of " + ownership() + " must be " + ownership().pivoted() + " but was " + pivoted.ownership());
        }
        for (FullKey<G, K> key : entries()) {
            pivoted.insert(key.aggregation(), key.group());
        }
        log.debug("Pivoted {} pairs: {} groups -> {} groups", size(), groupCount(), pivoted.groupCount());
        return pivoted;
    }

    @Override
    public int size() {
        return index.size();
    }

    @Override
    public int groupCount() {
        return index.groupCount();
    }

    @Override
    public void clear() {
        log.debug("Clearing {} pairs in {} groups", index.size(), index.groupCount());
        index.clear();
    }

    @Override
    public Ownership ownership() {
        return index.ownership();
    }

    /**
     * @return 생성 시 지정한 용량
     */
    protected Capacity capacity() {
        return capacity;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{pairs=" + size() + ", groups=" + groupCount() + '}';
    }

    private static void checkKeys(Object group, Object aggregation) {
        if (group == null) {
            throw new IllegalArgumentException("group key cannot be null");
        }
        if (aggregation == null) {
            throw new IllegalArgumentException("aggregation key cannot be null");
        }
    }
}
