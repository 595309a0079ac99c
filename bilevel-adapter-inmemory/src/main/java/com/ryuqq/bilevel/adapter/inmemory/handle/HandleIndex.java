package com.ryuqq.bilevel.adapter.inmemory.handle;

import com.ryuqq.bilevel.adapter.inmemory.arena.SlotArena;
import com.ryuqq.bilevel.adapter.inmemory.support.LabelView;
import com.ryuqq.bilevel.adapter.inmemory.support.MemberView;
import com.ryuqq.bilevel.core.config.Capacity;
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
 * 어떤 키 구성 요소도 복제할 수 없는 {@link DualIndex} (HANDLE 전략).
 *
 * <p>서로 다른 그룹 키와 집계 키는 각각 {@link SlotArena}에 한 번만 저장됩니다.
 * 주 저장소와 그룹 색인은 슬롯 핸들로만 이 값들을 참조합니다.</p>
 *
 * <p><strong>자료 구조:</strong></p>
 * <ul>
 *   <li><strong>groupSlots:</strong> SlotArena&lt;G&gt; - 그룹 키의 유일한 소유자, 살아있는 버킷마다 참조 1</li>
 *   <li><strong>memberSlots:</strong> SlotArena&lt;K&gt; - 집계 키의 유일한 소유자, 키를 쓰는 pair마다 참조 1</li>
 *   <li><strong>primary:</strong> HashMap&lt;SlotKey, E&gt; - (그룹 핸들, 멤버 핸들) → 값 (O(1) 접근)</li>
 *   <li><strong>buckets:</strong> LinkedHashMap&lt;Integer, LinkedHashSet&lt;Integer&gt;&gt; - 그룹 핸들 → 멤버 핸들</li>
 * </ul>
 *
 * <p><strong>제거:</strong> 멤버 슬롯 참조를 해제하고, 그룹의 마지막 멤버라면 버킷과
 * 그룹 슬롯 참조도 해제합니다. 해제된 슬롯은 이후 삽입에서 재사용되며 살아있는 핸들은
 * 바뀌지 않습니다. 재사용 때문에 뷰는 핸들을 보관하지 않고 호출마다 그룹 키로 다시 찾습니다.</p>
 *
 * @param <G> 그룹 키 타입
 * @param <K> 집계 키 타입
 * @param <E> 값 타입
 * @author Bilevel Team
 * @since 1.0.0
 */
public final class HandleIndex<G, K, E> implements DualIndex<G, K, E> {

    private static final Logger log = LoggerFactory.getLogger(HandleIndex.class);

    private final int perGroup;
    private final SlotArena<G> groupSlots;
    private final SlotArena<K> memberSlots;
    private final Map<SlotKey, E> primary;
    private final Map<Integer, Set<Integer>> buckets;

    /**
     * @param capacity 사전 할당 크기
     * @throws IllegalArgumentException capacity가 null인 경우
     */
    public HandleIndex(Capacity capacity) {
        if (capacity == null) {
            throw new IllegalArgumentException("capacity cannot be null");
        }
        this.perGroup = capacity.perGroup();
        this.groupSlots = new SlotArena<>(capacity.groups());
        this.memberSlots = new SlotArena<>(capacity.aggregationKeys());
        this.primary = new HashMap<>(capacity.fullKeys());
        this.buckets = new LinkedHashMap<>(capacity.groups());
    }

    @Override
    public E get(G group, K aggregation) {
        SlotKey key = locate(group, aggregation);
        return key != null ? primary.get(key) : null;
    }

    @Override
    public E put(G group, K aggregation, E value) {
        SlotKey existing = locate(group, aggregation);
        if (existing != null && primary.containsKey(existing)) {
            return primary.put(existing, value);
        }

        int groupHandle = groupSlots.find(group);
        Set<Integer> bucket;
        if (groupHandle == NO_SLOT) {
            groupHandle = groupSlots.acquire(group);
            bucket = new LinkedHashSet<>(perGroup);
            buckets.put(groupHandle, bucket);
            log.trace("Created bucket {} for group {}", groupHandle, group);
        } else {
            bucket = buckets.get(groupHandle);
        }

        int memberHandle = memberSlots.acquire(aggregation);
        bucket.add(memberHandle);
        primary.put(new SlotKey(groupHandle, memberHandle), value);
        return null;
    }

    @Override
    public E remove(G group, K aggregation) {
        SlotKey key = locate(group, aggregation);
        if (key == null) {
            return null;
        }
        E removed = primary.remove(key);
        if (removed == null) {
            return null;
        }

        Set<Integer> bucket = buckets.get(key.group());
        bucket.remove(key.member());
        memberSlots.release(key.member());
        if (bucket.isEmpty()) {
            buckets.remove(key.group());
            groupSlots.release(key.group());
            log.trace("Dropped empty bucket {} for group {}", key.group(), group);
        }
        return removed;
    }

    @Override
    public Map<K, E> group(G group) {
        // 삭제된 그룹의 슬롯은 다른 그룹이 재사용할 수 있으므로 핸들은 호출마다 조회
        return new MemberView<Integer, K, E>(
                () -> {
                    int groupHandle = groupSlots.find(group);
                    return groupHandle == NO_SLOT ? null : buckets.get(groupHandle);
                },
                memberSlots::get,
                member -> primary.get(new SlotKey(groupSlots.find(group), member)),
                key -> {
                    SlotKey slotKey = locate(group, key);
                    return slotKey != null ? primary.get(slotKey) : null;
                }
        );
    }

    @Override
    public Set<G> groups() {
        return new LabelView<Integer, G>(
                Collections.unmodifiableSet(buckets.keySet()),
                groupSlots::get,
                group -> groupSlots.find(group) != NO_SLOT
        );
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
        groupSlots.clear();
        memberSlots.clear();
    }

    @Override
    public Ownership ownership() {
        return Ownership.HANDLE;
    }

    /**
     * @return 그룹 키를 소유한 arena
     */
    SlotArena<G> groupSlots() {
        return groupSlots;
    }

    /**
     * @return 집계 키를 소유한 arena
     */
    SlotArena<K> memberSlots() {
        return memberSlots;
    }

    private SlotKey locate(Object group, Object aggregation) {
        int groupHandle = groupSlots.find(group);
        if (groupHandle == NO_SLOT) {
            return null;
        }
        int memberHandle = memberSlots.find(aggregation);
        if (memberHandle == NO_SLOT) {
            return null;
        }
        return new SlotKey(groupHandle, memberHandle);
    }
}
