package com.ryuqq.bilevel.testkit.contract;

import com.ryuqq.bilevel.core.contract.BilevelMap;
import com.ryuqq.bilevel.core.contract.BilevelSet;
import com.ryuqq.bilevel.core.key.FullKey;
import com.ryuqq.bilevel.core.key.GroupEntry;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

/**
 * BilevelAssertions 유닛 테스트.
 *
 * <p>깨진 상태를 흉내 내는 mock 컨테이너로 각 검사가 실제로 실패하는지 확인합니다.</p>
 *
 * @author Bilevel Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class BilevelAssertionsTest {

    @Mock
    private BilevelSet<String, Integer> set;

    @Mock
    private BilevelMap<String, Integer, String> map;

    @Test
    void assertInvariants_빈_그룹이_남아있으면_실패() {
        // given
        when(set.groups()).thenReturn(Set.of("A"));
        when(set.group("A")).thenReturn(List.of());

        // when & then
        assertThatThrownBy(() -> BilevelAssertions.assertInvariants(set))
                .isInstanceOf(AssertionError.class)
                .hasMessageContaining("Empty group retained: A");
    }

    @Test
    void assertInvariants_그룹_멤버가_직접_조회되지_않으면_실패() {
        // given
        when(set.groups()).thenReturn(Set.of("A"));
        when(set.group("A")).thenReturn(List.of(1));

        // when & then
        assertThatThrownBy(() -> BilevelAssertions.assertInvariants(set))
                .isInstanceOf(AssertionError.class)
                .hasMessageContaining("not found directly");
    }

    @Test
    void assertInvariants_size가_그룹_합계와_다르면_실패() {
        // given
        when(set.groups()).thenReturn(Set.of("A"));
        when(set.group("A")).thenReturn(List.of(1));
        when(set.contains("A", 1)).thenReturn(true);
        when(set.size()).thenReturn(2);

        // when & then
        assertThatThrownBy(() -> BilevelAssertions.assertInvariants(set))
                .isInstanceOf(AssertionError.class)
                .hasMessageContaining("size()");
    }

    @Test
    void assertInvariants_일관된_상태면_통과() {
        // given
        when(set.groups()).thenReturn(Set.of("A"));
        when(set.group("A")).thenReturn(List.of(1, 2));
        when(set.contains("A", 1)).thenReturn(true);
        when(set.contains("A", 2)).thenReturn(true);
        when(set.contains(FullKey.of("A", 1))).thenReturn(true);
        when(set.contains(FullKey.of("A", 2))).thenReturn(true);
        when(set.size()).thenReturn(2);
        when(set.groupCount()).thenReturn(1);
        when(set.entries()).thenReturn(List.of(FullKey.of("A", 1), FullKey.of("A", 2)));

        // when & then
        assertThatCode(() -> BilevelAssertions.assertInvariants(set)).doesNotThrowAnyException();
    }

    @Test
    void assertInvariants_Map_페이로드가_조회와_다르면_실패() {
        // given
        when(map.groups()).thenReturn(Set.of("A"));
        when(map.group("A")).thenReturn(List.of(new GroupEntry<>(1, "x")));
        when(map.get("A", 1)).thenReturn(Optional.of("y"));

        // when & then
        assertThatThrownBy(() -> BilevelAssertions.assertInvariants(map))
                .isInstanceOf(AssertionError.class)
                .hasMessageContaining("differs between group traversal and lookup");
    }

    @Test
    void assertMatches_그룹_순서가_다르면_실패() {
        // given
        Map<String, List<Integer>> model = new LinkedHashMap<>();
        model.put("A", List.of(1));
        model.put("B", List.of(2));
        when(set.groups()).thenReturn(new LinkedHashSet<>(List.of("B", "A")));

        // when & then
        assertThatThrownBy(() -> BilevelAssertions.assertMatches(model, set))
                .isInstanceOf(AssertionError.class)
                .hasMessageContaining("Group order differs");
    }

    @Test
    void assertMatches_같은_순서면_통과() {
        // given
        Map<String, List<Integer>> model = new LinkedHashMap<>();
        model.put("A", List.of(1, 3));
        model.put("B", List.of(2));
        when(set.groups()).thenReturn(new LinkedHashSet<>(List.of("A", "B")));
        when(set.group("A")).thenReturn(List.of(1, 3));
        when(set.group("B")).thenReturn(List.of(2));

        // when & then
        assertThatCode(() -> BilevelAssertions.assertMatches(model, set)).doesNotThrowAnyException();
    }
}
