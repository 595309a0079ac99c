package com.ryuqq.bilevel.core.spi;

import java.util.Map;
import java.util.Set;

/**
 * Ownership strategy SPI: a primary store keyed by full key kept in lockstep
 * with a group index keyed by group key.
 *
 * <p>Every {@code BilevelSet} and {@code BilevelMap} implementation delegates its
 * bookkeeping to a DualIndex. Implementations differ only in how they store the
 * key components; the observable behaviour below is identical for all of them.</p>
 *
 * <p><strong>Invariants (after every completed call):</strong></p>
 * <ul>
 *   <li>Every member listed under group {@code g} was stored with group key {@code g}</li>
 *   <li>The pairs reachable through {@link #group(Object)} are exactly the pairs
 *       reachable through {@link #get(Object, Object)}</li>
 *   <li>A pair (group, aggregation) is stored at most once</li>
 *   <li>A group key is listed by {@link #groups()} only while it has members</li>
 * </ul>
 *
 * <p><strong>Iteration Order:</strong></p>
 * <ul>
 *   <li>{@link #groups()}: order in which the group buckets were created</li>
 *   <li>{@link #group(Object)}: order in which the members were inserted</li>
 *   <li>Replacing a value keeps its position; removing and re-inserting moves it to the end</li>
 * </ul>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Arguments are validated by the calling container; implementations may assume non-null input</li>
 *   <li>Direct pair operations run in expected O(1)</li>
 *   <li>Not thread-safe: callers synchronize externally</li>
 * </ul>
 *
 * @param <G> the group key type
 * @param <K> the aggregation key type
 * @param <E> the value stored per pair
 * @author Bilevel Team
 * @since 1.0.0
 */
public interface DualIndex<G, K, E> {

    /**
     * Looks a pair up in the primary store.
     *
     * @param group the group key
     * @param aggregation the aggregation key
     * @return the stored value, or null if the pair is absent
     */
    E get(G group, K aggregation);

    /**
     * Stores a value for a pair, creating the group bucket if needed.
     *
     * <p>If the pair is already present only its value is replaced; the stored
     * key components and the member's position are kept.</p>
     *
     * @param group the group key
     * @param aggregation the aggregation key
     * @param value the value, never null
     * @return the previous value, or null if the pair was absent
     */
    E put(G group, K aggregation, E value);

    /**
     * Removes a pair, dropping its group bucket if it becomes empty.
     *
     * @param group the group key
     * @param aggregation the aggregation key
     * @return the removed value, or null if the pair was absent
     */
    E remove(G group, K aggregation);

    /**
     * Returns an unmodifiable live view of the members of one group.
     * The view looks the group up on every call, so it follows the group
     * through removal and recreation.
     *
     * @param group the group key
     * @return aggregation key to value view; empty if the group is absent
     */
    Map<K, E> group(G group);

    /**
     * Returns an unmodifiable live view of the group keys that have members.
     *
     * @return group keys in bucket creation order
     */
    Set<G> groups();

    /**
     * @return the number of stored pairs
     */
    int size();

    /**
     * @return the number of non-empty groups
     */
    int groupCount();

    /**
     * Removes every pair and every bucket.
     */
    void clear();

    /**
     * @return the strategy this index implements
     */
    Ownership ownership();
}
