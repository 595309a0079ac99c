package com.ryuqq.bilevel.adapter.inmemory.copy;

import com.ryuqq.bilevel.core.config.Capacity;
import com.ryuqq.bilevel.core.contract.BilevelSet;
import com.ryuqq.bilevel.core.key.KeyCopier;
import com.ryuqq.bilevel.core.spi.Ownership;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

/**
 * COPY 전략 소유권 테스트.
 *
 * <p>새 pair를 저장할 때만 키를 복제하고, 조회와 payload 교체는 복제하지 않는지 검증합니다.</p>
 *
 * @author Bilevel Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class CopyOwnershipTest {

    @Mock
    private KeyCopier<String> groupCopier;

    @Mock
    private KeyCopier<Integer> aggregationCopier;

    @BeforeEach
    void setUp() {
        lenient().when(groupCopier.copy(anyString())).thenAnswer(inv -> new String(inv.<String>getArgument(0)));
        lenient().when(aggregationCopier.copy(any())).thenAnswer(inv -> inv.getArgument(0));
    }

    @Test
    void insert_새_그룹이면_그룹키를_버킷과_주저장소에_각각_복제() {
        // given
        CopyBilevelSet<String, Integer> set = new CopyBilevelSet<>(new Capacity(), groupCopier, aggregationCopier);

        // when
        set.insert("A", 1);

        // then
        verify(groupCopier, times(2)).copy("A");
        verify(aggregationCopier, times(2)).copy(1);
    }

    @Test
    void insert_기존_그룹이면_주저장소용으로만_그룹키를_복제() {
        // given
        CopyBilevelSet<String, Integer> set = new CopyBilevelSet<>(new Capacity(), groupCopier, aggregationCopier);
        set.insert("A", 1);
        clearInvocations(groupCopier, aggregationCopier);

        // when
        set.insert("A", 2);

        // then
        verify(groupCopier, times(1)).copy("A");
        verify(aggregationCopier, times(2)).copy(2);
    }

    @Test
    void 중복_insert와_조회는_복제하지_않음() {
        // given
        CopyBilevelSet<String, Integer> set = new CopyBilevelSet<>(new Capacity(), groupCopier, aggregationCopier);
        set.insert("A", 1);
        clearInvocations(groupCopier, aggregationCopier);

        // when
        set.insert("A", 1);
        set.contains("A", 1);
        set.group("A").forEach(k -> { });
        set.remove("A", 9);

        // then
        verifyNoInteractions(groupCopier, aggregationCopier);
    }

    @Test
    void payload_교체는_복제하지_않음() {
        // given
        CopyBilevelMap<String, Integer, String> map = new CopyBilevelMap<>(new Capacity(), groupCopier, aggregationCopier);
        map.insert("A", 1, "x");
        clearInvocations(groupCopier, aggregationCopier);

        // when
        map.insert("A", 1, "y");
        map.update("A", 1, p -> p + "!");
        map.getOrCreate("A", 1, () -> "z");

        // then
        verifyNoInteractions(groupCopier, aggregationCopier);
        assertThat(map.get("A", 1)).contains("y!");
    }

    @Test
    void 저장된_그룹키는_호출자_인스턴스와_분리됨() {
        // given
        CopyBilevelSet<String, Integer> set = new CopyBilevelSet<>(new Capacity(), groupCopier, aggregationCopier);
        String callerKey = new String("A");

        // when
        set.insert(callerKey, 1);

        // then
        String stored = set.groups().iterator().next();
        assertThat(stored).isEqualTo("A").isNotSameAs(callerKey);
    }

    @Test
    void 가변_키를_변경해도_저장된_키는_영향없음() {
        // given
        CopyBilevelSet<List<Integer>, String> set = new CopyBilevelSet<>(List::copyOf, KeyCopier.identity());
        List<Integer> key = new ArrayList<>(List.of(1));
        set.insert(key, "x");

        // when
        key.add(2);

        // then
        assertThat(set.contains(List.of(1), "x")).isTrue();
        assertThat(set.contains(key, "x")).isFalse();
        assertThat(set.groups()).containsExactly(List.of(1));
    }

    @Test
    void map_복제기만_받는_생성자도_가변_키를_복제() {
        // given
        CopyBilevelMap<List<Integer>, String, String> map = new CopyBilevelMap<>(List::copyOf, KeyCopier.identity());
        List<Integer> key = new ArrayList<>(List.of(1));
        map.insert(key, "x", "v");

        // when
        key.add(2);

        // then
        assertThat(map.get(List.of(1), "x")).contains("v");
        assertThat(map.containsKey(key, "x")).isFalse();
        assertThat(map.groups()).containsExactly(List.of(1));
    }

    @Test
    void pivot_복제기를_맞바꾼_COPY_집합() {
        // given
        CopyBilevelSet<String, Integer> set = new CopyBilevelSet<>(new Capacity(), groupCopier, aggregationCopier);
        set.insert("A", 1);
        clearInvocations(groupCopier, aggregationCopier);

        // when
        BilevelSet<Integer, String> pivoted = set.pivot();

        // then
        assertThat(pivoted).isInstanceOf(CopyBilevelSet.class);
        assertThat(pivoted.ownership()).isEqualTo(Ownership.COPY);
        assertThat(pivoted.contains(1, "A")).isTrue();
        verify(aggregationCopier, times(2)).copy(1);
        verify(groupCopier, times(2)).copy("A");
    }

    @Test
    void ownership_COPY() {
        assertThat(new CopyBilevelSet<String, Integer>().ownership()).isEqualTo(Ownership.COPY);
        assertThat(new CopyBilevelMap<String, Integer, String>().ownership()).isEqualTo(Ownership.COPY);
    }
}
