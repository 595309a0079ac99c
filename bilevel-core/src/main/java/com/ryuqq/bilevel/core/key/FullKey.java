package com.ryuqq.bilevel.core.key;

/**
 * 그룹 키와 집계 키로 구성된 전체 키.
 *
 * <p>FullKey는 컨테이너 안의 한 행(row)을 고유하게 식별합니다.
 * 항상 두 구성 요소로 분해할 수 있으며, 두 구성 요소로부터 다시 만들 수 있습니다.</p>
 *
 * <p><strong>구성 요소:</strong></p>
 * <ul>
 *   <li><strong>group:</strong> 행을 묶는 기준 (여러 FullKey가 공유 가능)</li>
 *   <li><strong>aggregation:</strong> 같은 그룹 안에서 행을 구분하는 나머지 키</li>
 * </ul>
 *
 * <p><strong>예시:</strong></p>
 * <pre>
 * FullKey&lt;String, Integer&gt; key = FullKey.of("REGION-EU", 2024);
 * key.group();       // "REGION-EU"
 * key.aggregation(); // 2024
 * </pre>
 *
 * <p><strong>불변성:</strong> 생성 후 값 변경 불가 (단, 구성 요소 자체의 불변성은 호출자 책임)</p>
 *
 * @param group 그룹 키
 * @param aggregation 집계 키
 * @param <G> 그룹 키 타입
 * @param <K> 집계 키 타입
 *
 * @author Bilevel Team
 * @since 1.0.0
 */
public record FullKey<G, K>(G group, K aggregation) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 구성 요소가 null인 경우
     */
    public FullKey {
        if (group == null) {
            throw new IllegalArgumentException("group key cannot be null");
        }
        if (aggregation == null) {
            throw new IllegalArgumentException("aggregation key cannot be null");
        }
    }

    /**
     * FullKey 생성.
     *
     * @param group 그룹 키
     * @param aggregation 집계 키
     * @param <G> 그룹 키 타입
     * @param <K> 집계 키 타입
     * @return FullKey 인스턴스
     * @throws IllegalArgumentException 구성 요소가 null인 경우
     */
    public static <G, K> FullKey<G, K> of(G group, K aggregation) {
        return new FullKey<>(group, aggregation);
    }

    /**
     * 그룹 키와 집계 키의 역할을 바꾼 FullKey 생성.
     *
     * @return (aggregation, group) 순서의 새 FullKey
     */
    public FullKey<K, G> swap() {
        return new FullKey<>(aggregation, group);
    }
}
