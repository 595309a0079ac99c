package com.ryuqq.bilevel.adapter.inmemory.arena;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Single-owner storage for values that must not be duplicated, addressed by
 * stable {@code int} handles.
 *
 * <p>Each distinct value (by {@code equals}) lives in exactly one slot. Index
 * structures store the slot handle instead of the value, so no second copy of the
 * value is ever made.</p>
 *
 * <p><strong>Handle Scheme: reference counting + tombstoning + free list</strong></p>
 * <ul>
 *   <li>{@link #acquire(Object)} returns the slot of an equal value if one is live
 *       (incrementing its reference count), otherwise fills a free slot or appends one</li>
 *   <li>{@link #release(int)} decrements the count; at zero the slot is tombstoned
 *       (value cleared) and its handle pushed onto the free list</li>
 *   <li>A live handle never changes while it is live: releasing one handle leaves
 *       every other handle valid</li>
 *   <li>A tombstoned handle may be handed out again by a later acquire</li>
 * </ul>
 *
 * <p><strong>Data Structures:</strong></p>
 * <ul>
 *   <li><strong>slots:</strong> ArrayList&lt;T&gt; - Slot contents, null when tombstoned</li>
 *   <li><strong>refCounts:</strong> int[] - Live references per slot, 0 when tombstoned</li>
 *   <li><strong>handles:</strong> HashMap&lt;T, Integer&gt; - Value to slot lookup (O(1)); the key is the slot's own instance</li>
 *   <li><strong>freeSlots:</strong> ArrayDeque&lt;Integer&gt; - Tombstoned slots ready for reuse (LIFO)</li>
 * </ul>
 *
 * <p>Not thread-safe.</p>
 *
 * @param <T> the value type
 * @author Bilevel Team
 * @since 1.0.0
 */
public final class SlotArena<T> {

    /**
     * Returned by {@link #find(Object)} when no live slot holds the value.
     */
    public static final int NO_SLOT = -1;

    private static final Logger log = LoggerFactory.getLogger(SlotArena.class);

    private static final int MIN_REF_CAPACITY = 8;

    private final List<T> slots;
    private int[] refCounts;
    private final Map<T, Integer> handles;
    private final Deque<Integer> freeSlots;

    /**
     * Creates an empty arena.
     */
    public SlotArena() {
        this(0);
    }

    /**
     * Creates an empty arena pre-sized for the given number of values.
     *
     * @param initialCapacity expected number of distinct values
     * @throws IllegalArgumentException if initialCapacity is negative
     */
    public SlotArena(int initialCapacity) {
        if (initialCapacity < 0) {
            throw new IllegalArgumentException("initialCapacity cannot be negative, but was: " + initialCapacity);
        }
        this.slots = new ArrayList<>(initialCapacity);
        this.refCounts = new int[Math.max(MIN_REF_CAPACITY, initialCapacity)];
        this.handles = new HashMap<>(initialCapacity);
        this.freeSlots = new ArrayDeque<>();
    }

    /**
     * Finds the live slot holding a value equal to the argument.
     *
     * @param value the value to look for (null is never found)
     * @return the slot handle, or {@link #NO_SLOT}
     */
    public int find(Object value) {
        if (value == null) {
            return NO_SLOT;
        }
        Integer handle = handles.get(value);
        return handle != null ? handle : NO_SLOT;
    }

    /**
     * Takes a reference to the slot holding the value, storing the value if it is new.
     *
     * @param value the value, never null
     * @return the slot handle
     * @throws IllegalArgumentException if value is null
     * @throws IllegalStateException if every possible handle is in use
     */
    public int acquire(T value) {
        if (value == null) {
            throw new IllegalArgumentException("value cannot be null");
        }

        Integer existing = handles.get(value);
        if (existing != null) {
            refCounts[existing]++;
            return existing;
        }

        int handle;
        if (!freeSlots.isEmpty()) {
            handle = freeSlots.pop();
            slots.set(handle, value);
            log.trace("Reusing tombstoned slot {}", handle);
        } else {
            if (slots.size() == Integer.MAX_VALUE) {
                throw new IllegalStateException("SlotArena exhausted: " + slots.size() + " slots in use");
            }
            handle = slots.size();
            slots.add(value);
            ensureRefCapacity(handle + 1);
        }

        refCounts[handle] = 1;
        handles.put(value, handle);
        return handle;
    }

    /**
     * Drops one reference to a slot, tombstoning it when no reference remains.
     *
     * @param handle a live slot handle
     * @throws IllegalStateException if the handle is not live
     */
    public void release(int handle) {
        checkLive(handle);

        if (--refCounts[handle] == 0) {
            T value = slots.set(handle, null);
            handles.remove(value);
            freeSlots.push(handle);
        }
    }

    /**
     * Reads the value of a live slot.
     *
     * @param handle a live slot handle
     * @return the stored value
     * @throws IllegalStateException if the handle is not live
     */
    public T get(int handle) {
        checkLive(handle);
        return slots.get(handle);
    }

    /**
     * Returns the number of references held on a slot.
     *
     * @param handle the slot handle
     * @return the reference count, 0 for a tombstoned or unknown slot
     */
    public int referenceCount(int handle) {
        if (handle < 0 || handle >= slots.size()) {
            return 0;
        }
        return refCounts[handle];
    }

    /**
     * @return the number of live values
     */
    public int liveCount() {
        return handles.size();
    }

    /**
     * @return the number of allocated slots, live or tombstoned
     */
    public int slotCount() {
        return slots.size();
    }

    /**
     * Drops every slot. All handles become invalid.
     */
    public void clear() {
        slots.clear();
        handles.clear();
        freeSlots.clear();
        Arrays.fill(refCounts, 0);
    }

    private void checkLive(int handle) {
        if (handle < 0 || handle >= slots.size() || refCounts[handle] == 0) {
            throw new IllegalStateException("Slot " + handle + " is not live");
        }
    }

    private void ensureRefCapacity(int required) {
        if (required > refCounts.length) {
            int grown = (int) Math.min(Integer.MAX_VALUE, Math.max(required, (long) refCounts.length * 2));
            refCounts = Arrays.copyOf(refCounts, grown);
        }
    }
}
