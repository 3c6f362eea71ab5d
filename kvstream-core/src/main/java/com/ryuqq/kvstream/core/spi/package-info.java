/**
 * Service Provider Interface (SPI) package.
 *
 * <p>This package defines the interfaces that infrastructure adapters implement
 * to plug a concrete storage backend into the streaming layer.</p>
 *
 * <h2>SPI Interfaces</h2>
 * <ul>
 *   <li>{@link com.ryuqq.kvstream.core.spi.KeyValueStore} - synchronous typed reads, asynchronous writes</li>
 *   <li>{@link com.ryuqq.kvstream.core.spi.KeyValueStoreProvider} - asynchronous store resolution for a session</li>
 *   <li>{@link com.ryuqq.kvstream.core.spi.ChangeBus} - broadcast of changed keys</li>
 * </ul>
 *
 * <h2>Implementation Responsibility</h2>
 * <p>Adapter modules (e.g., kvstream-adapter-inmemory) provide {@code KeyValueStore}
 * implementations. The core ships the default {@code ChangeBus}
 * ({@link com.ryuqq.kvstream.core.bus.BroadcastChangeBus}).</p>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Hexagonal Architecture:</strong> Core defines interfaces, adapters provide implementations</li>
 *   <li><strong>Dependency Inversion:</strong> Core does not depend on any storage technology</li>
 *   <li><strong>Pluggability:</strong> In-memory for tests, platform preferences or files in production</li>
 * </ul>
 *
 * @since 1.0.0
 * @author KvStream Team
 */
package com.ryuqq.kvstream.core.spi;
