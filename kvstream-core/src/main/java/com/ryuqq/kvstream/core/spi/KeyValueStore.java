package com.ryuqq.kvstream.core.spi;

import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Backing Storage SPI for typed key-value pairs.
 *
 * <p>This interface is the synchronous-read, asynchronous-write storage contract
 * that the streaming layer decorates with change notifications. Implementations
 * know nothing about subscribers; notification is the responsibility of the caller.</p>
 *
 * <p><strong>Responsibilities:</strong></p>
 * <ul>
 *   <li>Synchronous typed reads (bool, int, double, String, List of String)</li>
 *   <li>Asynchronous typed writes reporting a boolean outcome</li>
 *   <li>Key listing, single-key removal and full clear</li>
 * </ul>
 *
 * <p><strong>Absence vs. empty:</strong></p>
 * <ul>
 *   <li>Getters return {@code null} when no value exists for the key</li>
 *   <li>An empty String or empty list is a valid stored value and is returned as such</li>
 *   <li>A value of another type raises {@link IllegalStateException}</li>
 * </ul>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Thread-safe: All methods must be safely callable from multiple threads</li>
 *   <li>Failure reporting: I/O failures complete the future with {@code false}
 *       (or exceptionally); they are never retried by the streaming layer</li>
 *   <li>Read-your-writes: once a write future completes with {@code true},
 *       subsequent getters observe the written value</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * KeyValueStore store = ...;
 *
 * store.setString("nickname", "ryu").thenAccept(ok -&gt; {
 *     if (ok) {
 *         String nickname = store.getString("nickname"); // "ryu"
 *     }
 * });
 *
 * Integer missing = store.getInt("unknown"); // null
 * </pre>
 *
 * @author KvStream Team
 * @since 1.0.0
 */
public interface KeyValueStore {

    /**
     * Returns every key that currently has a value.
     *
     * @return the current keys (never null, possibly empty)
     */
    Set<String> getKeys();

    /**
     * Returns the boolean value stored for {@code key}.
     *
     * @param key the key
     * @return the stored value, or null if absent
     * @throws IllegalStateException if the stored value is not a boolean
     */
    Boolean getBool(String key);

    /**
     * Returns the integer value stored for {@code key}.
     *
     * @param key the key
     * @return the stored value, or null if absent
     * @throws IllegalStateException if the stored value is not an integer
     */
    Integer getInt(String key);

    /**
     * Returns the double value stored for {@code key}.
     *
     * @param key the key
     * @return the stored value, or null if absent
     * @throws IllegalStateException if the stored value is not a double
     */
    Double getDouble(String key);

    /**
     * Returns the String value stored for {@code key}.
     *
     * @param key the key
     * @return the stored value, or null if absent
     * @throws IllegalStateException if the stored value is not a String
     */
    String getString(String key);

    /**
     * Returns the String list stored for {@code key}.
     *
     * @param key the key
     * @return the stored list, or null if absent
     * @throws IllegalStateException if the stored value is not a String list
     */
    List<String> getStringList(String key);

    /**
     * Persists a boolean value in the background.
     *
     * @param key the key
     * @param value the value
     * @return future completing with true if the value was persisted
     */
    CompletableFuture<Boolean> setBool(String key, boolean value);

    /**
     * Persists an integer value in the background.
     *
     * @param key the key
     * @param value the value
     * @return future completing with true if the value was persisted
     */
    CompletableFuture<Boolean> setInt(String key, int value);

    /**
     * Persists a double value in the background.
     *
     * @param key the key
     * @param value the value
     * @return future completing with true if the value was persisted
     */
    CompletableFuture<Boolean> setDouble(String key, double value);

    /**
     * Persists a String value in the background.
     *
     * @param key the key
     * @param value the value (non-null)
     * @return future completing with true if the value was persisted
     */
    CompletableFuture<Boolean> setString(String key, String value);

    /**
     * Persists a String list in the background.
     *
     * @param key the key
     * @param values the values (non-null)
     * @return future completing with true if the value was persisted
     */
    CompletableFuture<Boolean> setStringList(String key, List<String> values);

    /**
     * Removes the entry associated with {@code key}.
     *
     * @param key the key
     * @return future completing with true if the entry was removed
     */
    CompletableFuture<Boolean> remove(String key);

    /**
     * Removes every entry.
     *
     * @return future completing with true if the store was cleared
     */
    CompletableFuture<Boolean> clear();
}
