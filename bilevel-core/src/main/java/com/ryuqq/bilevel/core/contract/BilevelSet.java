package com.ryuqq.bilevel.core.contract;

import com.ryuqq.bilevel.core.key.FullKey;
import com.ryuqq.bilevel.core.spi.Ownership;

import java.util.Collection;
import java.util.Set;

/**
 * 그룹 키별로 묶인 서로 다른 (그룹 키, 집계 키) pair의 집합.
 *
 * <p>pair는 발견될 때 없으면 추가됩니다. 한 그룹의 pair는 다른 그룹을 보지 않고
 * 나열할 수 있고, 개별 pair는 전체 키로 바로 확인할 수 있습니다.</p>
 *
 * <p><strong>연산:</strong></p>
 * <ul>
 *   <li>{@link #insert(Object, Object)}: pair 추가 (멱등)</li>
 *   <li>{@link #contains(Object, Object)}: 존재 여부 확인</li>
 *   <li>{@link #remove(Object, Object)}: pair 제거, 비게 된 그룹은 사라짐</li>
 *   <li>{@link #group(Object)}: 한 그룹의 집계 키</li>
 *   <li>{@link #groups()}: 현재 멤버가 있는 그룹 키</li>
 *   <li>{@link #entries()}: 그룹 단위로 묶인 전체 pair</li>
 *   <li>{@link #pivot()}: 집계 키 기준으로 다시 묶은 복사본</li>
 * </ul>
 *
 * <p><strong>뷰:</strong> {@link #group(Object)}, {@link #groups()},
 * {@link #entries()}는 지연 평가되고 반복 순회 가능한 수정 불가 뷰입니다.
 * 뷰는 호출 시점의 Set 상태를 보여주며, 그룹이 삭제 후 다시 생성되어도
 * 같은 그룹 키의 현재 멤버만 보여줍니다. 순회 도중 Set을 변경하는 것은 지원하지 않습니다.</p>
 *
 * <p><strong>Thread Safety:</strong> 없음. 스레드 간 공유 시 외부 동기화가 필요합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * BilevelSet&lt;String, Integer&gt; set = new CopyBilevelSet&lt;&gt;();
 * set.insert("A", 1);   // true
 * set.insert("A", 2);   // true
 * set.insert("A", 1);   // false (이미 존재)
 * set.insert("B", 1);   // true
 *
 * set.group("A");       // [1, 2]
 * set.groups();         // [A, B]
 * </pre>
 *
 * @param <G> 그룹 키 타입
 * @param <K> 집계 키 타입
 * @author Bilevel Team
 * @since 1.0.0
 */
public interface BilevelSet<G, K> {

    /**
     * pair가 없으면 추가합니다.
     *
     * @param group 그룹 키
     * @param aggregation 집계 키
     * @return Set이 변경되면 true, 이미 있던 pair면 false
     * @throws IllegalArgumentException 키가 null인 경우
     */
    boolean insert(G group, K aggregation);

    /**
     * 전체 키가 없으면 추가합니다.
     *
     * @param key 전체 키
     * @return Set이 변경되면 true
     * @throws IllegalArgumentException key가 null인 경우
     */
    default boolean insert(FullKey<? extends G, ? extends K> key) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        return insert(key.group(), key.aggregation());
    }

    /**
     * pair 존재 여부 확인.
     *
     * @param group 그룹 키
     * @param aggregation 집계 키
     * @return 존재하면 true
     * @throws IllegalArgumentException 키가 null인 경우
     */
    boolean contains(G group, K aggregation);

    /**
     * 전체 키 존재 여부 확인.
     *
     * @param key 전체 키
     * @return 존재하면 true
     * @throws IllegalArgumentException key가 null인 경우
     */
    default boolean contains(FullKey<? extends G, ? extends K> key) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        return contains(key.group(), key.aggregation());
    }

    /**
     * pair가 있으면 제거합니다. 마지막 멤버가 제거되면 그룹도 사라집니다.
     *
     * @param group 그룹 키
     * @param aggregation 집계 키
     * @return 제거되면 true
     * @throws IllegalArgumentException 키가 null인 경우
     */
    boolean remove(G group, K aggregation);

    /**
     * 전체 키가 있으면 제거합니다.
     *
     * @param key 전체 키
     * @return 제거되면 true
     * @throws IllegalArgumentException key가 null인 경우
     */
    default boolean remove(FullKey<? extends G, ? extends K> key) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        return remove(key.group(), key.aggregation());
    }

    /**
     * 한 그룹의 집계 키를 삽입 순서로 나열합니다.
     *
     * @param group 그룹 키
     * @return 수정 불가 live 뷰 (그룹이 없으면 비어 있음)
     * @throws IllegalArgumentException group이 null인 경우
     */
    Collection<K> group(G group);

    /**
     * 멤버가 하나 이상 있는 그룹 키 목록.
     *
     * @return 그룹 생성 순서의 수정 불가 뷰
     */
    Set<G> groups();

    /**
     * 전체 pair를 나열합니다. 같은 그룹의 pair는 연속으로 나옵니다.
     *
     * @return 전체 키의 수정 불가 뷰
     */
    Iterable<FullKey<G, K>> entries();

    /**
     * 집계 키 기준으로 묶은 새 Set에 pair를 복사합니다.
     *
     * <p>결과의 소유권은 {@link Ownership#pivoted()}를 따릅니다.</p>
     *
     * @return 모든 pair (g, k)가 (k, g)로 들어간 새 Set
     */
    BilevelSet<K, G> pivot();

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
     * @return 이 Set의 소유권 전략
     */
    Ownership ownership();
}
