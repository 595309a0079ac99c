/**
 * Hybrid ownership strategy: the group key is duplicable, the aggregation key is not.
 *
 * <p><strong>Main Components:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.bilevel.adapter.inmemory.hybrid.HybridIndex}</li>
 *   <li>{@link com.ryuqq.bilevel.adapter.inmemory.hybrid.HybridBilevelSet}</li>
 *   <li>{@link com.ryuqq.bilevel.adapter.inmemory.hybrid.HybridBilevelMap}</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Bilevel Team
 */
package com.ryuqq.bilevel.adapter.inmemory.hybrid;
