/**
 * Service Provider Interface (SPI) package.
 *
 * <p>This package defines the storage seam between the containers and the three
 * ownership strategies.</p>
 *
 * <h2>SPI Interfaces</h2>
 * <ul>
 *   <li>{@link com.ryuqq.bilevel.core.spi.DualIndex} - Primary store plus group index</li>
 *   <li>{@link com.ryuqq.bilevel.core.spi.Ownership} - Which components a strategy duplicates</li>
 * </ul>
 *
 * <h2>Implementation Responsibility</h2>
 * <p>Adapter modules (e.g., bilevel-adapter-inmemory) provide the concrete
 * implementations: copying, handle-based and hybrid.</p>
 *
 * @since 1.0.0
 * @author Bilevel Team
 */
package com.ryuqq.bilevel.core.spi;
