package com.ryuqq.bilevel.core.key;

import java.util.function.Function;

/**
 * 호출자의 행(row) 타입을 그룹 키와 집계 키로 분해합니다.
 *
 * <p>컨테이너는 행 내부를 보지 않습니다. 호출자가 행을 두 구성 요소로 나누는 방법을
 * 한 번 정의하고 {@link FullKey}를 넣습니다. 두 추출 함수는 순수해야 합니다.
 * 같은 행은 항상 같은 구성 요소를 내고, 한쪽 추출이 다른 쪽에 필요한 정보를
 * 소비하면 안 됩니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * record Sale(String region, String product, int year, long amount) { }
 *
 * KeyComposition&lt;Sale, String, List&lt;Object&gt;&gt; composition = KeyComposition.of(
 *     Sale::region,
 *     sale -&gt; List.of(sale.product(), sale.year())
 * );
 *
 * set.insert(composition.decompose(sale));
 * </pre>
 *
 * @param <R> 행 타입
 * @param <G> 그룹 키 타입
 * @param <K> 집계 키 타입
 * @author Bilevel Team
 * @since 1.0.0
 */
public interface KeyComposition<R, G, K> {

    /**
     * 행의 그룹 키 추출.
     *
     * @param row 행 (null 아님)
     * @return 그룹 키
     */
    G groupKey(R row);

    /**
     * 행의 집계 키 추출.
     *
     * @param row 행 (null 아님)
     * @return 집계 키
     */
    K aggregationKey(R row);

    /**
     * 행을 전체 키로 분해합니다.
     *
     * @param row 행
     * @return 행의 전체 키
     * @throws IllegalArgumentException row가 null이거나 추출 결과가 null인 경우
     */
    default FullKey<G, K> decompose(R row) {
        if (row == null) {
            throw new IllegalArgumentException("row cannot be null");
        }
        return FullKey.of(groupKey(row), aggregationKey(row));
    }

    /**
     * 두 추출 함수로 KeyComposition 생성.
     *
     * @param groupKey 그룹 키 추출 함수
     * @param aggregationKey 집계 키 추출 함수
     * @param <R> 행 타입
     * @param <G> 그룹 키 타입
     * @param <K> 집계 키 타입
     * @return 새 KeyComposition
     * @throws IllegalArgumentException 함수가 null인 경우
     */
    static <R, G, K> KeyComposition<R, G, K> of(Function<? super R, ? extends G> groupKey,
                                                Function<? super R, ? extends K> aggregationKey) {
        if (groupKey == null) {
            throw new IllegalArgumentException("groupKey function cannot be null");
        }
        if (aggregationKey == null) {
            throw new IllegalArgumentException("aggregationKey function cannot be null");
        }
        return new KeyComposition<>() {
            @Override
            public G groupKey(R row) {
                return groupKey.apply(row);
            }

            @Override
            public K aggregationKey(R row) {
                return aggregationKey.apply(row);
            }
        };
    }
}
