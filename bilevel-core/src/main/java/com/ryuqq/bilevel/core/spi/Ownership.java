package com.ryuqq.bilevel.core.spi;

/**
 * 소유권 전략: 어떤 키 구성요소를 복제할 수 있는지.
 *
 * <p>전략은 호출자가 생성하는 클래스로 정해지며, 이 enum은 그 전략을 설명합니다.</p>
 *
 * <p><strong>Pivot 규칙:</strong> 피벗하면 두 구성요소의 역할이 바뀌므로 복제 가능 여부도
 * 맞바뀝니다. 맞바꾼 조합에 해당하는 전략이 없으면 아무것도 복제하지 않는
 * {@link #HANDLE}을 사용합니다.</p>
 * <pre>
 * COPY   → COPY
 * HANDLE → HANDLE
 * HYBRID → HANDLE (집계 키는 복제 불가이므로)
 * </pre>
 *
 * @author Bilevel Team
 * @since 1.0.0
 */
public enum Ownership {

    /**
     * Group key and aggregation key are both duplicated into the group index.
     */
    COPY(true, true),

    /**
     * Neither component is duplicated; the group index holds slot handles.
     */
    HANDLE(false, false),

    /**
     * Group key is duplicated; aggregation key is referenced by slot handle.
     */
    HYBRID(true, false);

    private final boolean copiesGroupKey;
    private final boolean copiesAggregationKey;

    Ownership(boolean copiesGroupKey, boolean copiesAggregationKey) {
        this.copiesGroupKey = copiesGroupKey;
        this.copiesAggregationKey = copiesAggregationKey;
    }

    /**
     * @return true if group keys are duplicated into the group index
     */
    public boolean copiesGroupKey() {
        return copiesGroupKey;
    }

    /**
     * @return true if aggregation keys are duplicated into the group index
     */
    public boolean copiesAggregationKey() {
        return copiesAggregationKey;
    }

    /**
     * 집계 키로 다시 그룹핑한 컨테이너의 소유권.
     *
     * @return 구성요소 역할을 맞바꾼 전략, 없으면 {@link #HANDLE}
     */
    public Ownership pivoted() {
        for (Ownership candidate : values()) {
            if (candidate.copiesGroupKey == copiesAggregationKey
                    && candidate.copiesAggregationKey == copiesGroupKey) {
                return candidate;
            }
        }
        return HANDLE;
    }
}
