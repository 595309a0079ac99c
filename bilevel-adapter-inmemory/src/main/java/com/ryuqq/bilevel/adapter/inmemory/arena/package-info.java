/**
 * Handle-addressed storage for values that are never duplicated.
 *
 * <p>{@link com.ryuqq.bilevel.adapter.inmemory.arena.SlotArena} backs the handle and
 * hybrid ownership strategies.</p>
 *
 * @see com.ryuqq.bilevel.adapter.inmemory.handle.HandleIndex
 * @see com.ryuqq.bilevel.adapter.inmemory.hybrid.HybridIndex
 * @since 1.0.0
 * @author Bilevel Team
 */
package com.ryuqq.bilevel.adapter.inmemory.arena;
