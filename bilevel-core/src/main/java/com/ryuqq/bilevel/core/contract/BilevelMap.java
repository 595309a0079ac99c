package com.ryuqq.bilevel.core.contract;

import com.ryuqq.bilevel.core.key.BilevelEntry;
import com.ryuqq.bilevel.core.key.FullKey;
import com.ryuqq.bilevel.core.key.GroupEntry;
import com.ryuqq.bilevel.core.spi.Ownership;

import java.util.Collection;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;

/**
 * 그룹 키별로 묶인 (그룹 키, 집계 키) pair마다 값을 하나씩 보관하는 Map.
 *
 * <p>값은 불투명합니다. Map은 값을 합치거나 들여다보지 않습니다. 집계(합계, 개수 등)는
 * 호출자가 {@link #update(Object, Object, UnaryOperator)}로 값을 교체하거나
 * {@link #getOrCreate(Object, Object, Supplier)}로 받은 가변 값을 직접 변경해서 수행합니다.</p>
 *
 * <p><strong>상태 전이:</strong> 모든 연산은 전체 키 하나를 "없음"과 "값과 함께 있음" 사이에서
 * 한 번에 옮깁니다. 중간 상태는 없습니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * BilevelMap&lt;String, Integer, LongAdder&gt; counts = new HybridBilevelMap&lt;&gt;();
 * counts.getOrCreate("A", 1, LongAdder::new).increment();
 * counts.getOrCreate("A", 1, LongAdder::new).increment();
 *
 * counts.get("A", 1).map(LongAdder::sum); // Optional[2]
 * </pre>
 *
 * @param <G> 그룹 키 타입
 * @param <K> 집계 키 타입
 * @param <V> 값 타입
 * @author Bilevel Team
 * @since 1.0.0
 */
public interface BilevelMap<G, K, V> {

    /**
     * pair를 삽입하거나 값을 교체합니다. 교체 시 순회 위치는 유지됩니다.
     *
     * @param group 그룹 키
     * @param aggregation 집계 키
     * @param payload 값
     * @return 이전 값 (새 pair면 empty)
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    Optional<V> insert(G group, K aggregation, V payload);

    /**
     * 전체 키를 삽입하거나 값을 교체합니다.
     *
     * @param key 전체 키
     * @param payload 값
     * @return 이전 값 (새 키면 empty)
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    default Optional<V> insert(FullKey<? extends G, ? extends K> key, V payload) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        return insert(key.group(), key.aggregation(), payload);
    }

    /**
     * pair의 값을 조회합니다.
     *
     * @param group 그룹 키
     * @param aggregation 집계 키
     * @return 값 (없으면 empty)
     * @throws IllegalArgumentException 키가 null인 경우
     */
    Optional<V> get(G group, K aggregation);

    /**
     * 전체 키의 값을 조회합니다.
     *
     * @param key 전체 키
     * @return 값 (없으면 empty)
     * @throws IllegalArgumentException key가 null인 경우
     */
    default Optional<V> get(FullKey<? extends G, ? extends K> key) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        return get(key.group(), key.aggregation());
    }

    /**
     * pair의 값을 반환합니다. 없으면 먼저 새 값을 삽입합니다.
     *
     * @param group 그룹 키
     * @param aggregation 집계 키
     * @param factory 새 pair의 값 생성
     * @return 기존 값 또는 새로 만든 값
     * @throws IllegalArgumentException 인자가 null이거나 factory가 null을 반환한 경우
     */
    V getOrCreate(G group, K aggregation, Supplier<? extends V> factory);

    /**
     * 기존 pair의 값을 함수 결과로 교체합니다.
     *
     * @param group 그룹 키
     * @param aggregation 집계 키
     * @param function 현재 값을 새 값으로 변환
     * @return 새 값 (pair가 없으면 empty, function 호출 안 함)
     * @throws IllegalArgumentException 인자가 null이거나 function이 null을 반환한 경우
     */
    Optional<V> update(G group, K aggregation, UnaryOperator<V> function);

    /**
     * pair 존재 여부 확인.
     *
     * @param group 그룹 키
     * @param aggregation 집계 키
     * @return 존재하면 true
     * @throws IllegalArgumentException 키가 null인 경우
     */
    boolean containsKey(G group, K aggregation);

    /**
     * pair를 제거합니다. 마지막 멤버가 제거되면 그룹도 사라집니다.
     *
     * @param group 그룹 키
     * @param aggregation 집계 키
     * @return 제거된 값 (없으면 empty)
     * @throws IllegalArgumentException 키가 null인 경우
     */
    Optional<V> remove(G group, K aggregation);

    /**
     * 전체 키를 제거합니다.
     *
     * @param key 전체 키
     * @return 제거된 값 (없으면 empty)
     * @throws IllegalArgumentException key가 null인 경우
     */
    default Optional<V> remove(FullKey<? extends G, ? extends K> key) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        return remove(key.group(), key.aggregation());
    }

    /**
     * 한 그룹의 (집계 키, 값)을 삽입 순서로 나열합니다.
     *
     * @param group 그룹 키
     * @return 수정 불가 live 뷰 (그룹이 없으면 비어 있음)
     * @throws IllegalArgumentException group이 null인 경우
     */
    Collection<GroupEntry<K, V>> group(G group);

    /**
     * 멤버가 하나 이상 있는 그룹 키 목록.
     *
     * @return 그룹 생성 순서의 수정 불가 뷰
     */
    Set<G> groups();

    /**
     * 전체 (그룹 키, 집계 키, 값)을 나열합니다. 같은 그룹은 연속으로 나옵니다.
     *
     * @return 전체 항목의 수정 불가 뷰
     */
    Iterable<BilevelEntry<G, K, V>> entries();

    /**
     * @return pair 수
     */
    int size();

    /**
     * @return pair가 없으면 true
     */
    default boolean isEmpty() {
        return size() == 0;
    }

    /**
     * @return 멤버가 있는 그룹 수
     */
    int groupCount();

    /**
     * 모든 pair와 그룹을 제거합니다.
     */
    void clear();

    /**
     * @return 이 Map의 소유권 전략
     */
    Ownership ownership();
}
