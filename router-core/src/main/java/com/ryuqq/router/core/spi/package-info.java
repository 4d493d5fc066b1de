/**
 * Service Provider Interface (SPI) package.
 *
 * <p>This package defines the capability contract that every routing backend implements.</p>
 *
 * <h2>SPI Interfaces</h2>
 * <ul>
 *   <li>{@link com.ryuqq.router.core.spi.Routing} - provide, find providers, find peer, put/get/search value, bootstrap</li>
 *   <li>{@link com.ryuqq.router.core.spi.ProvideManyRouting} - optional batch publishing extension</li>
 * </ul>
 *
 * <h2>Implementation Responsibility</h2>
 * <p>Adapter layers (e.g., router-adapter-inmemory, a DHT client, an HTTP delegated router)
 * provide concrete implementations. Composite routers in router-adapter-runner implement the
 * same contract, so composites can be nested.</p>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Hexagonal Architecture:</strong> Core defines interfaces, adapters provide implementations</li>
 *   <li><strong>Dependency Inversion:</strong> Core does not depend on any concrete backend</li>
 *   <li><strong>Cooperative Cancellation:</strong> Every call receives a RoutingContext and should return promptly once it is done</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Router Team
 */
package com.ryuqq.router.core.spi;
