package com.ryuqq.bilevel.adapter.inmemory.arena;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * SlotArena 유닛 테스트.
 *
 * <p>핸들 발급, 참조 카운트, tombstone 및 재사용 동작을 검증합니다.</p>
 *
 * @author Bilevel Team
 * @since 1.0.0
 */
class SlotArenaTest {

    private SlotArena<String> arena;

    @BeforeEach
    void setUp() {
        arena = new SlotArena<>();
    }

    @Test
    void acquire_같은_값은_같은_핸들과_증가된_참조카운트() {
        // when
        int first = arena.acquire("k");
        int second = arena.acquire(new String("k"));

        // then
        assertThat(second).isEqualTo(first);
        assertThat(arena.referenceCount(first)).isEqualTo(2);
        assertThat(arena.liveCount()).isEqualTo(1);
    }

    @Test
    void acquire_동등한_값은_최초_인스턴스를_유지() {
        // given
        String original = new String("k");
        int handle = arena.acquire(original);

        // when
        arena.acquire(new String("k"));

        // then
        assertThat(arena.get(handle)).isSameAs(original);
    }

    @Test
    void release_마지막_참조가_사라지면_tombstone() {
        // given
        int handle = arena.acquire("k");
        arena.acquire("k");

        // when
        arena.release(handle);

        // then: one reference left
        assertThat(arena.get(handle)).isEqualTo("k");
        assertThat(arena.find("k")).isEqualTo(handle);

        // when
        arena.release(handle);

        // then
        assertThat(arena.find("k")).isEqualTo(SlotArena.NO_SLOT);
        assertThat(arena.referenceCount(handle)).isZero();
        assertThat(arena.liveCount()).isZero();
        assertThatThrownBy(() -> arena.get(handle))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("is not live");
        assertThatThrownBy(() -> arena.release(handle))
            .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void release_다른_핸들은_그대로_유효() {
        // given
        int a = arena.acquire("a");
        int b = arena.acquire("b");
        int c = arena.acquire("c");

        // when
        arena.release(b);

        // then
        assertThat(arena.get(a)).isEqualTo("a");
        assertThat(arena.get(c)).isEqualTo("c");
        assertThat(arena.find("a")).isEqualTo(a);
        assertThat(arena.find("c")).isEqualTo(c);
    }

    @Test
    void acquire_tombstone_슬롯을_재사용() {
        // given
        arena.acquire("a");
        int b = arena.acquire("b");
        arena.release(b);

        // when
        int d = arena.acquire("d");

        // then
        assertThat(d).isEqualTo(b);
        assertThat(arena.get(d)).isEqualTo("d");
        assertThat(arena.slotCount()).isEqualTo(2);
    }

    @Test
    void acquire_여러_슬롯이_비면_마지막에_비운_슬롯부터_재사용() {
        // given
        int a = arena.acquire("a");
        int b = arena.acquire("b");
        arena.release(a);
        arena.release(b);

        // when & then
        assertThat(arena.acquire("x")).isEqualTo(b);
        assertThat(arena.acquire("y")).isEqualTo(a);
        assertThat(arena.acquire("z")).isEqualTo(2);
    }

    @Test
    void acquire_초기_용량을_넘어도_핸들은_유효() {
        // given
        SlotArena<Integer> small = new SlotArena<>(2);

        // when
        for (int i = 0; i < 100; i++) {
            assertThat(small.acquire(i)).isEqualTo(i);
        }

        // then
        for (int i = 0; i < 100; i++) {
            assertThat(small.get(i)).isEqualTo(i);
            assertThat(small.referenceCount(i)).isEqualTo(1);
        }
        assertThat(small.liveCount()).isEqualTo(100);
    }

    @Test
    void find_null과_없는_값은_NO_SLOT() {
        assertThat(arena.find(null)).isEqualTo(SlotArena.NO_SLOT);
        assertThat(arena.find("missing")).isEqualTo(SlotArena.NO_SLOT);
        assertThat(arena.find(42)).isEqualTo(SlotArena.NO_SLOT);
    }

    @Test
    void clear_모든_핸들을_무효화() {
        // given
        int handle = arena.acquire("k");

        // when
        arena.clear();

        // then
        assertThat(arena.liveCount()).isZero();
        assertThat(arena.slotCount()).isZero();
        assertThatThrownBy(() -> arena.get(handle)).isInstanceOf(IllegalStateException.class);
        assertThat(arena.acquire("n")).isZero();
    }

    @Test
    void 잘못된_인자는_예외() {
        assertThatThrownBy(() -> arena.acquire(null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("value cannot be null");
        assertThatThrownBy(() -> new SlotArena<String>(-1))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> arena.get(-1)).isInstanceOf(IllegalStateException.class);
        assertThat(arena.referenceCount(7)).isZero();
    }
}
