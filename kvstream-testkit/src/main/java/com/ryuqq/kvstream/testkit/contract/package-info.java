/**
 * Contract tests and test doubles for the {@link com.ryuqq.kvstream.core.spi.KeyValueStore} SPI.
 *
 * @since 1.0.0
 * @author KvStream Team
 */
package com.ryuqq.kvstream.testkit.contract;
