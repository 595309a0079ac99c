/**
 * Handle ownership strategy: neither key component is duplicable.
 *
 * <p>Group keys and aggregation keys each live once in a
 * {@link com.ryuqq.bilevel.adapter.inmemory.arena.SlotArena}; the primary store and
 * the group index hold slot handles.</p>
 *
 * <p><strong>Main Components:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.bilevel.adapter.inmemory.handle.HandleIndex}</li>
 *   <li>{@link com.ryuqq.bilevel.adapter.inmemory.handle.HandleBilevelSet}</li>
 *   <li>{@link com.ryuqq.bilevel.adapter.inmemory.handle.HandleBilevelMap}</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Bilevel Team
 */
package com.ryuqq.bilevel.adapter.inmemory.handle;
