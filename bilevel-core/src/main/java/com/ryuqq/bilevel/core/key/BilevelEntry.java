package com.ryuqq.bilevel.core.key;

/**
 * Map 전체 순회의 한 항목 (그룹 키, 집계 키, 값).
 *
 * @param group 그룹 키
 * @param aggregation 집계 키
 * @param payload 값
 * @param <G> 그룹 키 타입
 * @param <K> 집계 키 타입
 * @param <V> 값 타입
 * @author Bilevel Team
 * @since 1.0.0
 */
public record BilevelEntry<G, K, V>(G group, K aggregation, V payload) {

    public BilevelEntry {
        if (group == null) {
            throw new IllegalArgumentException("group key cannot be null");
        }
        if (aggregation == null) {
            throw new IllegalArgumentException("aggregation key cannot be null");
        }
        if (payload == null) {
            throw new IllegalArgumentException("payload cannot be null");
        }
    }

    /**
     * 이 항목의 전체 키.
     *
     * @return 전체 키
     */
    public FullKey<G, K> fullKey() {
        return FullKey.of(group, aggregation);
    }
}
