package com.ryuqq.bilevel.adapter.inmemory.hybrid;

import com.ryuqq.bilevel.adapter.inmemory.arena.SlotArena;
import com.ryuqq.bilevel.adapter.inmemory.support.MemberView;
import com.ryuqq.bilevel.core.config.Capacity;
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

import static com.ryuqq.bilevel.adapter.inmemory.arena.SlotArena.NO_SLOT;

/**
 * 그룹 키는 복제하고 집계 키는 복제하지 않는 {@link DualIndex} (HYBRID 전략).
 *
 * <p>그룹 키는 필요한 곳(버킷 라벨, 주 저장소 키)마다 복제됩니다. 집계 키는
 * {@link SlotArena}에 한 번만 저장되고 슬롯 핸들로 참조되므로, 여러 그룹에 나오는
 * 집계 키도 한 번만 저장됩니다.</p>
 *
 * <p><strong>자료 구조:</strong></p>
 * <ul>
 *   <li><strong>memberSlots:</strong> SlotArena&lt;K&gt; - 집계 키의 유일한 소유자</li>
 *   <li><strong>primary:</strong> HashMap&lt;MemberKey&lt;G&gt;, E&gt; - (그룹 키 복제본, 멤버 핸들) → 값 (O(1) 접근)</li>
 *   <li><strong>buckets:</strong> LinkedHashMap&lt;G, LinkedHashSet&lt;Integer&gt;&gt; - 그룹 키 복제본 → 멤버 핸들</li>
 * </ul>
 *
 * @param <G> 그룹 키 타입
 * @param <K> 집계 키 타입
 * @param <E> 값 타입
 * @author Bilevel Team
 * @since 1.0.0
 */
public final class HybridIndex<G, K, E> implements DualIndex<G, K, E> {

    private static final Logger log = LoggerFactory.getLogger(HybridIndex.class);

    private final KeyCopier<G> groupCopier;
    private final int perGroup;
    private final SlotArena<K> memberSlots;
    private final Map<MemberKey<G>, E> primary;
    private final Map<G, Set<Integer>> buckets;

    /**
     * @param capacity 사전 할당 크기
     * @param groupCopier 그룹 키 복제기
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public HybridIndex(Capacity capacity, KeyCopier<G> groupCopier) {
        if (capacity == null) {
            throw new IllegalArgumentException("capacity cannot be null");
        }
        if (groupCopier == null) {
            throw new IllegalArgumentException("groupCopier cannot be null");
        }
        this.groupCopier = groupCopier;
        this.perGroup = capacity.perGroup();
        this.memberSlots = new SlotArena<>(capacity.aggregationKeys());
        this.primary = new HashMap<>(capacity.fullKeys());
        this.buckets = new LinkedHashMap<>(capacity.groups());
    }

    @Override
    public E get(G group, K aggregation) {
        int member = memberSlots.find(aggregation);
        return member == NO_SLOT ? null : primary.get(new MemberKey<>(group, member));
    }

    @Override
    public E put(G group, K aggregation, E value) {
        int member = memberSlots.find(aggregation);
        if (member != NO_SLOT) {
            MemberKey<G> lookupKey = new MemberKey<>(group, member);
            E previous = primary.get(lookupKey);
            if (previous != null) {
                primary.replace(lookupKey, value);
                return previous;
            }
        }

        Set<Integer> bucket = buckets.get(group);
        if (bucket == null) {
            bucket = new LinkedHashSet<>(perGroup);
            buckets.put(groupCopier.copy(group), bucket);
            log.trace("Created bucket for group {}", group);
        }

        member = memberSlots.acquire(aggregation);
        bucket.add(member);
        primary.put(new MemberKey<>(groupCopier.copy(group), member), value);
        return null;
    }

    @Override
    public E remove(G group, K aggregation) {
        int member = memberSlots.find(aggregation);
        if (member == NO_SLOT) {
            return null;
        }
        E removed = primary.remove(new MemberKey<>(group, member));
        if (removed == null) {
            return null;
        }

        Set<Integer> bucket = buckets.get(group);
        bucket.remove(member);
        memberSlots.release(member);
        if (bucket.isEmpty()) {
            buckets.remove(group);
            log.trace("Dropped empty bucket for group {}", group);
        }
        return removed;
    }

    @Override
    public Map<K, E> group(G group) {
        return new MemberView<Integer, K, E>(
                () -> buckets.get(group),
                memberSlots::get,
                member -> primary.get(new MemberKey<>(group, member)),
                key -> {
                    int member = memberSlots.find(key);
                    return member == NO_SLOT ? null : primary.get(new MemberKey<>(group, member));
                }
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
        memberSlots.clear();
    }

    @Override
    public Ownership ownership() {
        return Ownership.HYBRID;
    }

    /**
     * @return 집계 키를 소유한 arena
     */
    SlotArena<K> memberSlots() {
        return memberSlots;
    }
}
