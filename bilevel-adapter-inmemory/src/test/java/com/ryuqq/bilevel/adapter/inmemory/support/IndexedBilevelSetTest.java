package com.ryuqq.bilevel.adapter.inmemory.support;

import com.ryuqq.bilevel.core.config.Capacity;
import com.ryuqq.bilevel.core.contract.BilevelSet;
import com.ryuqq.bilevel.core.spi.DualIndex;
import com.ryuqq.bilevel.core.spi.Ownership;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.*;

/**
 * IndexedBilevelSet 유닛 테스트.
 *
 * <p>pivot 결과의 소유권이 {@link Ownership#pivoted()} 규칙을 따르는지 검증합니다.</p>
 *
 * @author Bilevel Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class IndexedBilevelSetTest {

    @Mock
    private DualIndex<String, Integer, Object> index;

    @Mock
    private BilevelSet<Integer, String> pivotTarget;

    @Test
    void pivot_규칙과_다른_소유권이면_IllegalStateException() {
        // given
        when(index.ownership()).thenReturn(Ownership.HYBRID);
        when(pivotTarget.ownership()).thenReturn(Ownership.COPY);
        IndexedBilevelSet<String, Integer> set = newSet(pivotTarget);

        // when & then
        assertThatThrownBy(set::pivot)
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("Pivot of HYBRID must be HANDLE but was COPY");
        verify(pivotTarget, never()).insert(any(), any());
    }

    @Test
    void pivot_모든_pair를_맞바꿔_삽입() {
        // given
        when(index.ownership()).thenReturn(Ownership.COPY);
        when(index.groups()).thenReturn(Set.of("A"));
        when(index.group("A")).thenReturn(Map.of(1, "present"));
        when(pivotTarget.ownership()).thenReturn(Ownership.COPY);
        IndexedBilevelSet<String, Integer> set = newSet(pivotTarget);

        // when
        BilevelSet<Integer, String> pivoted = set.pivot();

        // then
        assertThat(pivoted).isSameAs(pivotTarget);
        verify(pivotTarget).insert(1, "A");
    }

    private IndexedBilevelSet<String, Integer> newSet(BilevelSet<Integer, String> target) {
        return new IndexedBilevelSet<String, Integer>(index, new Capacity()) {
            @Override
            protected BilevelSet<Integer, String> newPivot(Capacity capacity) {
                return target;
            }
        };
    }
}
