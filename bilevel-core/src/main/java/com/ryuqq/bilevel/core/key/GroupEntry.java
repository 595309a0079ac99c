package com.ryuqq.bilevel.core.key;

/**
 * 한 그룹 안의 항목: 집계 키와 그 값.
 *
 * @param aggregation 집계 키
 * @param payload 값
 * @param <K> 집계 키 타입
 * @param <V> 값 타입
 * @author Bilevel Team
 * @since 1.0.0
 */
public record GroupEntry<K, V>(K aggregation, V payload) {

    public GroupEntry {
        if (aggregation == null) {
            throw new IllegalArgumentException("aggregation key cannot be null");
        }
        if (payload == null) {
            throw new IllegalArgumentException("payload cannot be null");
        }
    }
}
