package com.ryuqq.kvstream.core.spi;

import java.util.concurrent.CompletableFuture;

/**
 * Backing store resolution SPI.
 *
 * <p>Opening a persistent store is usually asynchronous (file or platform
 * preferences load). The session initializer invokes {@link #open()} at most
 * once per successful session.</p>
 *
 * @author KvStream Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface KeyValueStoreProvider {

    /**
     * Opens (or obtains) the backing store.
     *
     * @return future completing with the store, or exceptionally if it cannot be opened
     */
    CompletableFuture<KeyValueStore> open();
}
