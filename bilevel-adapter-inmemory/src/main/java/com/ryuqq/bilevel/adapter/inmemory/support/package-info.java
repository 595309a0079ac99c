/**
 * Container engines shared by every ownership strategy.
 *
 * <p>{@link com.ryuqq.bilevel.adapter.inmemory.support.IndexedBilevelSet} and
 * {@link com.ryuqq.bilevel.adapter.inmemory.support.IndexedBilevelMap} implement the
 * container contracts once on top of the
 * {@link com.ryuqq.bilevel.core.spi.DualIndex} SPI; the views in this package expose
 * group buckets without copying them.</p>
 *
 * @since 1.0.0
 * @author Bilevel Team
 */
package com.ryuqq.bilevel.adapter.inmemory.support;
