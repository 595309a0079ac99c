package com.ryuqq.bilevel.adapter.inmemory.support;

import java.util.AbstractSet;
import java.util.Iterator;
import java.util.Set;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * 저장된 라벨(슬롯 핸들)을 실제 값으로 변환해 보여주는 수정 불가 Set 뷰.
 *
 * @param <L> 저장된 라벨 타입
 * @param <T> 변환된 값 타입
 * @author Bilevel Team
 * @since 1.0.0
 */
public final class LabelView<L, T> extends AbstractSet<T> {

    private final Set<L> labels;
    private final Function<? super L, ? extends T> resolve;
    private final Predicate<Object> membership;

    /**
     * @param labels 저장된 라벨
     * @param resolve 라벨을 값으로 변환
     * @param membership null이 아닌 값에 대한 O(1) 포함 여부 확인
     */
    public LabelView(Set<L> labels, Function<? super L, ? extends T> resolve, Predicate<Object> membership) {
        this.labels = labels;
        this.resolve = resolve;
        this.membership = membership;
    }

    @Override
    public Iterator<T> iterator() {
        Iterator<L> it = labels.iterator();
        return new Iterator<>() {
            @Override
            public boolean hasNext() {
                return it.hasNext();
            }

            @Override
            public T next() {
                return resolve.apply(it.next());
            }
        };
    }

    @Override
    public int size() {
        return labels.size();
    }

    @Override
    public boolean contains(Object o) {
        return o != null && membership.test(o);
    }
}
