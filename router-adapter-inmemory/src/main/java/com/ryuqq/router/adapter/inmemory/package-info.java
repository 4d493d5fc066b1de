/**
 * In-memory implementation of the Routing SPI.
 *
 * <p>This package provides a map-backed {@link com.ryuqq.router.core.spi.Routing}
 * suitable for unit tests and for exercising composite routers without a network.</p>
 *
 * <h2>Implementations</h2>
 * <ul>
 *   <li>{@link com.ryuqq.router.adapter.inmemory.InMemoryRouting} - provider records, peers and values</li>
 * </ul>
 *
 * @author Router Team
 * @since 1.0.0
 */
package com.ryuqq.router.adapter.inmemory;
