/**
 * Copying ownership strategy: group key and aggregation key are both duplicable.
 *
 * <p><strong>Main Components:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.bilevel.adapter.inmemory.copy.CopyIndex}: primary store and group index with independent copies</li>
 *   <li>{@link com.ryuqq.bilevel.adapter.inmemory.copy.CopyBilevelSet}: set over the copying index</li>
 *   <li>{@link com.ryuqq.bilevel.adapter.inmemory.copy.CopyBilevelMap}: map over the copying index</li>
 * </ul>
 *
 * @see com.ryuqq.bilevel.core.key.KeyCopier
 * @since 1.0.0
 * @author Bilevel Team
 */
package com.ryuqq.bilevel.adapter.inmemory.copy;
