package com.ryuqq.bilevel.adapter.inmemory;

import com.ryuqq.bilevel.adapter.inmemory.copy.CopyBilevelMap;
import com.ryuqq.bilevel.adapter.inmemory.copy.CopyBilevelSet;
import com.ryuqq.bilevel.adapter.inmemory.handle.HandleBilevelMap;
import com.ryuqq.bilevel.adapter.inmemory.handle.HandleBilevelSet;
import com.ryuqq.bilevel.adapter.inmemory.hybrid.HybridBilevelMap;
import com.ryuqq.bilevel.adapter.inmemory.hybrid.HybridBilevelSet;
import com.ryuqq.bilevel.core.config.Capacity;
import com.ryuqq.bilevel.core.contract.BilevelMap;
import com.ryuqq.bilevel.core.contract.BilevelSet;
import com.ryuqq.bilevel.core.key.BilevelEntry;
import com.ryuqq.bilevel.core.key.FullKey;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Random;

import static com.ryuqq.bilevel.testkit.contract.BilevelAssertions.assertInvariants;
import static com.ryuqq.bilevel.testkit.contract.BilevelAssertions.assertSameContents;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;

/**
 * 세 가지 소유권 전략의 동등성 테스트.
 *
 * <p>같은 연산 순서를 적용하면 반환값, 내용, 순회 순서가 모두 같아야 합니다.</p>
 *
 * @author Bilevel Team
 * @since 1.0.0
 */
class VariantEquivalenceTest {

    @ParameterizedTest
    @ValueSource(longs = {1L, 42L, 2024L, 987654321L})
    void 임의_연산_순서에서_세_집합이_같은_결과(long seed) {
        // given
        Capacity capacity = Capacity.ofFullKeys(64);
        List<BilevelSet<String, Integer>> sets = List.of(
            new CopyBilevelSet<>(capacity),
            new HandleBilevelSet<>(capacity),
            new HybridBilevelSet<>(capacity)
        );
        Random random = new Random(seed);

        // when
        for (int step = 0; step < 2000; step++) {
            String group = "g" + random.nextInt(8);
            Integer aggregation = random.nextInt(24);
            boolean insert = random.nextInt(3) != 0;

            List<Boolean> results = new ArrayList<>();
            for (BilevelSet<String, Integer> set : sets) {
                results.add(insert ? set.insert(group, aggregation) : set.remove(group, aggregation));
            }

            // then
            assertThat(results).as("step %d", step).containsOnly(results.get(0));
        }

        for (BilevelSet<String, Integer> set : sets) {
            assertInvariants(set);
            assertSameContents(sets.get(0), set);
            assertEquals(entries(sets.get(0)), entries(set));
            assertSameContents(sets.get(0).pivot(), set.pivot());
        }
    }

    @ParameterizedTest
    @ValueSource(longs = {3L, 77L, 31337L})
    void 임의_연산_순서에서_세_맵이_같은_결과(long seed) {
        // given
        List<BilevelMap<Integer, String, Long>> maps = List.of(
            new CopyBilevelMap<>(),
            new HandleBilevelMap<>(),
            new HybridBilevelMap<>()
        );
        Random random = new Random(seed);

        // when
        for (int step = 0; step < 2000; step++) {
            Integer group = random.nextInt(6);
            String aggregation = "k" + random.nextInt(20);
            int op = random.nextInt(4);
            long payload = step;

            List<Optional<Long>> results = new ArrayList<>();
            for (BilevelMap<Integer, String, Long> map : maps) {
                switch (op) {
                    case 0:
                        results.add(map.remove(group, aggregation));
                        break;
                    case 1:
                        results.add(map.update(group, aggregation, p -> p + 1));
                        break;
                    case 2:
                        results.add(Optional.of(map.getOrCreate(group, aggregation, () -> payload)));
                        break;
                    default:
                        results.add(map.insert(group, aggregation, payload));
                        break;
                }
            }

            // then
            assertThat(results).as("step %d", step).containsOnly(results.get(0));
        }

        List<BilevelEntry<Integer, String, Long>> expected = entries(maps.get(0));
        for (BilevelMap<Integer, String, Long> map : maps) {
            assertInvariants(map);
            assertEquals(expected, entries(map));
            assertEquals(maps.get(0).size(), map.size());
            assertEquals(maps.get(0).groupCount(), map.groupCount());
        }
    }

    private static <G, K> List<FullKey<G, K>> entries(BilevelSet<G, K> set) {
        List<FullKey<G, K>> result = new ArrayList<>();
        set.entries().forEach(result::add);
        return result;
    }

    private static <G, K, V> List<BilevelEntry<G, K, V>> entries(BilevelMap<G, K, V> map) {
        List<BilevelEntry<G, K, V>> result = new ArrayList<>();
        map.entries().forEach(result::add);
        return result;
    }
}
