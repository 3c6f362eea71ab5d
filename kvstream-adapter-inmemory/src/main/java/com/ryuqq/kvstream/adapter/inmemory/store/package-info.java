/**
 * In-memory reference adapter for the {@link com.ryuqq.kvstream.core.spi.KeyValueStore} SPI.
 *
 * <p>Intended for tests, examples and single-process use. Every value keeps its Java type so
 * that the SPI's type-mismatch contract can be honoured.</p>
 *
 * @since 1.0.0
 * @author KvStream Team
 */
package com.ryuqq.kvstream.adapter.inmemory.store;
