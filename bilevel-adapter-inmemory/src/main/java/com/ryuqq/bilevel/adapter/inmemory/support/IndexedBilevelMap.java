package com.ryuqq.bilevel.adapter.inmemory.support;

import com.ryuqq.bilevel.core.contract.BilevelMap;
import com.ryuqq.bilevel.core.key.BilevelEntry;
import com.ryuqq.bilevel.core.key.GroupEntry;
import com.ryuqq.bilevel.core.spi.DualIndex;
import com.ryuqq.bilevel.core.spi.Ownership;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.AbstractCollection;
import java.util.Collection;
import java.util.Iterator;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;

/**
 * {@link DualIndex} 위의 {@link BilevelMap} 구현.
 *
 * <p>값은 색인의 주 저장소에 보관됩니다. 그룹 색인은 멤버만 나열하고 값은 주 저장소를
 * 통해 찾습니다.</p>
 *
 * @param <G> 그룹 키 타입
 * @param <K> 집계 키 타입
 * @param <V> 값 타입
 * @author Bilevel Team
 * @since 1.0.0
 */
public abstract class IndexedBilevelMap<G, K, V> implements BilevelMap<G, K, V> {

    private static final Logger log = LoggerFactory.getLogger(IndexedBilevelMap.class);

    private final DualIndex<G, K, V> index;

    /**
     * @param index 소유권 전략
     * @throws IllegalArgumentException index가 null인 경우
     */
    protected IndexedBilevelMap(DualIndex<G, K, V> index) {
        if (index == null) {
            throw new IllegalArgumentException("index cannot be null");
        }
        this.index = index;
    }

    @Override
    public Optional<V> insert(G group, K aggregation, V payload) {
        checkKeys(group, aggregation);
        if (payload == null) {
            throw new IllegalArgumentException("payload cannot be null");
        }
        return Optional.ofNullable(index.put(group, aggregation, payload));
    }

    @Override
    public Optional<V> get(G group, K aggregation) {
        checkKeys(group, aggregation);
        return Optional.ofNullable(index.get(group, aggregation));
    }

    @Override
    public V getOrCreate(G group, K aggregation, Supplier<? extends V> factory) {
        checkKeys(group, aggregation);
        if (factory == null) {
            throw new IllegalArgumentException("factory cannot be null");
        }

        V existing = index.get(group, aggregation);
        if (existing != null) {
            return existing;
        }

        V created = factory.get();
        if (created == null) {
            throw new IllegalArgumentException("factory returned null payload for " + group + "/" + aggregation);
        }
        index.put(group, aggregation, created);
        return created;
    }

    @Override
    public Optional<V> update(G group, K aggregation, UnaryOperator<V> function) {
        checkKeys(group, aggregation);
        if (function == null) {
            throw new IllegalArgumentException("function cannot be null");
        }

        V current = index.get(group, aggregation);
        if (current == null) {
            return Optional.empty();
        }

        V next = function.apply(current);
        if (next == null) {
            throw new IllegalArgumentException("function returned null payload for " + group + "/" + aggregation);
        }
        index.put(group, aggregation, next);
        return Optional.of(next);
    }

    @Override
    public boolean containsKey(G group, K aggregation) {
        checkKeys(group, aggregation);
        return index.get(group, aggregation) != null;
    }

    @Override
    public Optional<V> remove(G group, K aggregation) {
        checkKeys(group, aggregation);
        return Optional.ofNullable(index.remove(group, aggregation));
    }

    @Override
    public Collection<GroupEntry<K, V>> group(G group) {
        if (group == null) {
            throw new IllegalArgumentException("group key cannot be null");
        }
        Map<K, V> members = index.group(group);
        return new AbstractCollection<>() {
            @Override
            public Iterator<GroupEntry<K, V>> iterator() {
                Iterator<Map.Entry<K, V>> it = members.entrySet().iterator();
                return new Iterator<>() {
                    @Override
                    public boolean hasNext() {
                        return it.hasNext();
                    }

                    @Override
                    public GroupEntry<K, V> next() {
                        Map.Entry<K, V> entry = it.next();
                        return new GroupEntry<>(entry.getKey(), entry.getValue());
                    }
                };
            }

            @Override
            public int size() {
                return members.size();
            }
        };
    }

    @Override
    public Set<G> groups() {
        return index.groups();
    }

    @Override
    public Iterable<BilevelEntry<G, K, V>> entries() {
        return () -> index.groups().stream()
                .flatMap(g -> index.group(g).entrySet().stream()
                        .map(e -> new BilevelEntry<G, K, V>(g, e.getKey(), e.getValue())))
                .iterator();
    }

    @Override
    public int size() {
        return index.size();
    }

    @Override
    public int groupCount() {
        return index.groupCount();
    }

    @Override
    public void clear() {
        log.debug("Clearing {} pairs in {} groups", index.size(), index.groupCount());
        index.clear();
    }

    @Override
    public Ownership ownership() {
        return index.ownership();
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{pairs=" + size() + ", groups=" + groupCount() + '}';
    }

    private static void checkKeys(Object group, Object aggregation) {
        if (group == null) {
            throw new IllegalArgumentException("group key cannot be null");
        }
        if (aggregation == null) {
            throw new IllegalArgumentException("aggregation key cannot be null");
        }
    }
}
