package com.ryuqq.bilevel.adapter.inmemory.support;

import java.util.AbstractMap;
import java.util.AbstractSet;
import java.util.Collections;
import java.util.Iterator;
import java.util.Set;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * 그룹 하나에 대한 읽기 전용 Map 뷰.
 *
 * <p>버킷에는 멤버 라벨({@code M})이 저장됩니다. COPY 전략에서는 집계 키 자체,
 * 나머지 전략에서는 슬롯 핸들입니다. 뷰는 라벨을 집계 키와 값으로 그때그때 변환하므로
 * 그룹을 나열할 때 아무것도 복사하지 않습니다.</p>
 *
 * <p><strong>Live View:</strong></p>
 * <ul>
 *   <li>버킷은 뷰를 만들 때가 아니라 매 호출마다 그룹 키로 다시 찾습니다</li>
 *   <li>그룹이 삭제되면 빈 뷰가 되고, 다시 생성되면 새 버킷을 보여줍니다</li>
 *   <li>조회({@link #get(Object)})도 그룹 키 기준으로 현재 상태를 봅니다</li>
 * </ul>
 *
 * @param <M> the label type stored in the bucket
 * @param <K> the aggregation key type
 * @param <E> the value type
 * @author Bilevel Team
 * @since 1.0.0
 */
public final class MemberView<M, K, E> extends AbstractMap<K, E> {

    private final Supplier<Set<M>> bucket;
    private final Function<? super M, ? extends K> keyOf;
    private final Function<? super M, ? extends E> valueOf;
    private final Function<Object, ? extends E> lookup;

    /**
     * 생성자.
     *
     * @param bucket 현재 버킷을 반환 (그룹이 없으면 null)
     * @param keyOf 라벨을 집계 키로 변환
     * @param valueOf 라벨을 주 저장소의 값으로 변환
     * @param lookup null이 아닌 집계 키를 이 그룹의 값으로 변환, 없으면 null
     */
    public MemberView(Supplier<Set<M>> bucket,
                      Function<? super M, ? extends K> keyOf,
                      Function<? super M, ? extends E> valueOf,
                      Function<Object, ? extends E> lookup) {
        this.bucket = bucket;
        this.keyOf = keyOf;
        this.valueOf = valueOf;
        this.lookup = lookup;
    }

    @Override
    public Set<Entry<K, E>> entrySet() {
        return new AbstractSet<>() {
            @Override
            public Iterator<Entry<K, E>> iterator() {
                Iterator<M> labels = members().iterator();
                return new Iterator<>() {
                    @Override
                    public boolean hasNext() {
                        return labels.hasNext();
                    }

                    @Override
                    public Entry<K, E> next() {
                        M label = labels.next();
                        return new SimpleImmutableEntry<>(keyOf.apply(label), valueOf.apply(label));
                    }
                };
            }

            @Override
            public int size() {
                return members().size();
            }
        };
    }

    @Override
    public int size() {
        return members().size();
    }

    @Override
    public boolean isEmpty() {
        return members().isEmpty();
    }

    @Override
    public E get(Object key) {
        return key == null ? null : lookup.apply(key);
    }

    @Override
    public boolean containsKey(Object key) {
        return get(key) != null;
    }

    private Set<M> members() {
        Set<M> current = bucket.get();
        return current != null ? current : Collections.emptySet();
    }
}
