package com.ryuqq.bilevel.adapter.inmemory.copy;

import com.ryuqq.bilevel.adapter.inmemory.support.MemberView;
import com.ryuqq.bilevel.core.config.Capacity;
import com.ryuqq.bilevel.core.key.FullKey;
import com.ryuqq.bilevel.core.key.KeyCopier;
import com.ryuqq.bilevel.core.spi.DualIndex;
import com.ryuqq.bilevel.core.spi.Ownership;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * 두 키 구성 요소를 모두 복제할 수 있는 {@link DualIndex} (COPY 전략).
 *
 * <p>주 저장소와 그룹 색인은 호출자의 {@link KeyCopier}로 만든 각자의 복제본을 보관합니다.
 * 구조끼리 서로를 참조하지 않으므로 멤버십 외에는 맞춰야 할 상태가 없습니다.</p>
 *
 * <p><strong>자료 구조:</strong></p>
 * <ul>
 *   <li><strong>primary:</strong> HashMap&lt;FullKey&lt;G, K&gt;, E&gt; - pair 복제본과 값 (O(1) 접근)</li>
 *   <li><strong>buckets:</strong> LinkedHashMap&lt;G, LinkedHashSet&lt;K&gt;&gt; - 그룹 키 복제본 → 집계 키 복제본</li>
 * </ul>
 *
 * <p><strong>복제 시점:</strong></p>
 * <ul>
 *   <li>새 pair: 주 저장소용 그룹 키와 집계 키 각 1회, 버킷용 집계 키 1회</li>
 *   <li>새 그룹: 버킷 라벨용 그룹 키 1회 추가</li>
 *   <li>교체, 조회, 제거: 복제 없음</li>
 * </ul>
 *
 * @param <G> 그룹 키 타입
 * @param <K> 집계 키 타입
 * @param <E> 값 타입
 * @author Bilevel Team
 * @since 1.0.0
 */
public final class CopyIndex<G, K, E> implements DualIndex<G, K, E> {

    private static final Logger log = LoggerFactory.getLogger(CopyIndex.class);

    private final KeyCopier<G> groupCopier;
    private final KeyCopier<K> aggregationCopier;
    private final int perGroup;
    private final Map<FullKey<G, K>, E> primary;
    private final Map<G, Set<K>> buckets;

    /**
     * @param capacity 사전 할당 크기
     * @param groupCopier 그룹 키 복제기
     * @param aggregationCopier 집계 키 복제기
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public CopyIndex(Capacity capacity, KeyCopier<G> groupCopier, KeyCopier<K> aggregationCopier) {
        if (capacity == null) {
            throw new IllegalArgumentException("capacity cannot be null");
        }
        if (groupCopier == null) {
            throw new IllegalArgumentException("groupCopier cannot be null");
        }
        if (aggregationCopier == null) {
            throw new IllegalArgumentException("aggregationCopier cannot be null");
        }
        this.groupCopier = groupCopier;
        this.aggregationCopier = aggregationCopier;
        this.perGroup = capacity.perGroup();
        this.primary = new HashMap<>(capacity.fullKeys());
        this.buckets = new LinkedHashMap<>(capacity.groups());
    }

    @Override
    public E get(G group, K aggregation) {
        return primary.get(FullKey.of(group, aggregation));
    }

    @Override
    public E put(G group, K aggregation, E value) {
        FullKey<G, K> lookupKey = FullKey.of(group, aggregation);
        E previous = primary.get(lookupKey);
        if (previous != null) {
            // HashMap은 기존 키를 유지하므로 조회용 키는 저장되지 않음
            primary.replace(lookupKey, value);
            return previous;
        }

        Set<K> bucket = buckets.get(group);
        if (bucket == null) {
            bucket = new LinkedHashSet<>(perGroup);
            buckets.put(groupCopier.copy(group), bucket);
            log.trace("Created bucket for group {}", group);
        }
        bucket.add(aggregationCopier.copy(aggregation));
        primary.put(FullKey.of(groupCopier.copy(group), aggregationCopier.copy(aggregation)), value);
        return null;
    }

    @Override
    public E remove(G group, K aggregation) {
        E removed = primary.remove(FullKey.of(group, aggregation));
        if (removed == null) {
            return null;
        }

        Set<K> bucket = buckets.get(group);
        bucket.remove(aggregation);
        if (bucket.isEmpty()) {
            buckets.remove(group);
            log.trace("Dropped empty bucket for group {}", group);
        }
        return removed;
    }

    @Override
    public Map<K, E> group(G group) {
        return new MemberView<K, K, E>(
                () -> buckets.get(group),
                k -> k,
                k -> primary.get(FullKey.of(group, k)),
                key -> primary.get(FullKey.of(group, key))
        );
    }

    @Override
    public Set<G> groups() {
        return Collections.unmodifiableSet(buckets.keySet());
    }

    @Override
    public int size() {
        return primary.size();
    }

    @Override
    public int groupCount() {
        return buckets.size();
    }

    @Override
    public void clear() {
        primary.clear();
        buckets.clear();
    }

    @Override
    public Ownership ownership() {
        return Ownership.COPY;
    }
}
