package com.ryuqq.bilevel.testkit.contract;

import com.ryuqq.bilevel.core.contract.BilevelMap;
import com.ryuqq.bilevel.core.contract.BilevelSet;
import com.ryuqq.bilevel.core.key.BilevelEntry;
import com.ryuqq.bilevel.core.key.FullKey;
import com.ryuqq.bilevel.core.key.GroupEntry;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * 모든 컨테이너가 지켜야 하는 구조 불변식 검증.
 *
 * <p>공개 컨테이너 API만 사용하므로 어떤 구현체에도 적용됩니다.</p>
 * <ul>
 *   <li>그룹 아래 나열된 멤버는 그 그룹으로 직접 조회하면 찾아짐</li>
 *   <li>그룹 순회와 직접 조회가 같은 pair를 보며, 그 수가 size()와 같음</li>
 *   <li>같은 pair가 두 번 나열되지 않음</li>
 *   <li>나열된 그룹은 비어 있지 않음</li>
 * </ul>
 *
 * @author Bilevel Team
 * @since 1.0.0
 */
public final class BilevelAssertions {

    private BilevelAssertions() {
    }

    /**
     * Set의 구조 불변식 검증.
     *
     * @param set 검증 대상 Set
     * @param <G> 그룹 키 타입
     * @param <K> 집계 키 타입
     */
    public static <G, K> void assertInvariants(BilevelSet<G, K> set) {
        int pairs = 0;
        Set<G> seenGroups = new HashSet<>();
        for (G group : set.groups()) {
            assertTrue(seenGroups.add(group), "Group listed twice: " + group);

            Collection<K> members = set.group(group);
            assertFalse(members.isEmpty(), "Empty group retained: " + group);
            assertEquals(members.size(), new HashSet<>(members).size(),
                    "Duplicate member in group " + group + ": " + members);

            for (K aggregation : members) {
                assertTrue(set.contains(group, aggregation),
                        String.format("Pair (%s, %s) listed in group but not found directly", group, aggregation));
            }
            pairs += members.size();
        }

        assertEquals(set.size(), pairs, "size() disagrees with the pairs reachable through groups");
        assertEquals(set.groupCount(), seenGroups.size(), "groupCount() disagrees with groups()");
        assertEquals(set.isEmpty(), pairs == 0, "isEmpty() disagrees with size()");

        int listed = 0;
        for (FullKey<G, K> key : set.entries()) {
            assertTrue(set.contains(key), "Entry not found directly: " + key);
            listed++;
        }
        assertEquals(pairs, listed, "entries() disagrees with the pairs reachable through groups");
    }

    /**
     * Map의 구조 불변식과, 순회와 조회의 값 일치 검증.
     *
     * @param map 검증 대상 Map
     * @param <G> 그룹 키 타입
     * @param <K> 집계 키 타입
     * @param <V> 값 타입
     */
    public static <G, K, V> void assertInvariants(BilevelMap<G, K, V> map) {
        int pairs = 0;
        Set<G> seenGroups = new HashSet<>();
        for (G group : map.groups()) {
            assertTrue(seenGroups.add(group), "Group listed twice: " + group);

            Collection<GroupEntry<K, V>> members = map.group(group);
            assertFalse(members.isEmpty(), "Empty group retained: " + group);

            Set<K> seenKeys = new HashSet<>();
            for (GroupEntry<K, V> entry : members) {
                assertTrue(seenKeys.add(entry.aggregation()),
                        "Duplicate member in group " + group + ": " + entry.aggregation());
                assertEquals(Optional.of(entry.payload()), map.get(group, entry.aggregation()),
                        String.format("Payload of (%s, %s) differs between group traversal and lookup",
                                group, entry.aggregation()));
            }
            pairs += members.size();
        }

        assertEquals(map.size(), pairs, "size() disagrees with the pairs reachable through groups");
        assertEquals(map.groupCount(), seenGroups.size(), "groupCount() disagrees with groups()");

        int listed = 0;
        for (BilevelEntry<G, K, V> entry : map.entries()) {
            assertEquals(Optional.of(entry.payload()), map.get(entry.fullKey()),
                    "Entry payload differs from lookup: " + entry);
            listed++;
        }
        assertEquals(pairs, listed, "entries() disagrees with the pairs reachable through groups");
    }

    /**
     * Set이 모델의 pair를 모델의 순회 순서 그대로 보관하는지 검증.
     *
     * @param model 그룹 키 → 멤버 (기대 순서)
     * @param set 검증 대상 Set
     * @param <G> 그룹 키 타입
     * @param <K> 집계 키 타입
     */
    public static <G, K> void assertMatches(Map<G, ? extends Collection<K>> model, BilevelSet<G, K> set) {
        assertEquals(new ArrayList<>(model.keySet()), new ArrayList<>(set.groups()), "Group order differs");
        for (Map.Entry<G, ? extends Collection<K>> group : model.entrySet()) {
            assertEquals(new ArrayList<>(group.getValue()), new ArrayList<>(set.group(group.getKey())),
                    "Members of group " + group.getKey() + " differ");
        }
    }

    /**
     * Map이 모델의 항목을 모델의 순회 순서 그대로 보관하는지 검증.
     *
     * @param model 그룹 키 → (집계 키 → 값) (기대 순서)
     * @param map 검증 대상 Map
     * @param <G> 그룹 키 타입
     * @param <K> 집계 키 타입
     * @param <V> 값 타입
     */
    public static <G, K, V> void assertMatches(Map<G, ? extends Map<K, V>> model, BilevelMap<G, K, V> map) {
        assertEquals(new ArrayList<>(model.keySet()), new ArrayList<>(map.groups()), "Group order differs");
        for (Map.Entry<G, ? extends Map<K, V>> group : model.entrySet()) {
            assertEquals(toEntries(group.getValue()), new ArrayList<>(map.group(group.getKey())),
                    "Members of group " + group.getKey() + " differ");
        }
    }

    /**
     * 두 Set이 같은 pair를 같은 순서로 보관하는지 검증.
     *
     * @param expected 기준 Set
     * @param actual 검증 대상 Set
     * @param <G> 그룹 키 타입
     * @param <K> 집계 키 타입
     */
    public static <G, K> void assertSameContents(BilevelSet<G, K> expected, BilevelSet<G, K> actual) {
        Map<G, List<K>> model = new LinkedHashMap<>();
        for (G group : expected.groups()) {
            model.put(group, new ArrayList<>(expected.group(group)));
        }
        assertMatches(model, actual);
        assertEquals(expected.size(), actual.size(), "size() differs");
    }

    private static <K, V> List<GroupEntry<K, V>> toEntries(Map<K, V> members) {
        List<GroupEntry<K, V>> entries = new ArrayList<>(members.size());
        for (Map.Entry<K, V> member : members.entrySet()) {
            entries.add(new GroupEntry<>(member.getKey(), member.getValue()));
        }
        return entries;
    }
}
