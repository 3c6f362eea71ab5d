package com.ryuqq.kvstream.adapter.inmemory.store;

import com.ryuqq.kvstream.core.spi.KeyValueStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * In-memory implementation of {@link KeyValueStore} SPI for testing and reference purposes.
 *
 * <p>Values are held in a {@link ConcurrentHashMap} keyed by the entry key; each value keeps its
 * Java type ({@link Boolean}, {@link Integer}, {@link Double}, {@link String} or an unmodifiable
 * {@code List<String>}) so that reading it as another type can be detected.</p>
 *
 * <p><strong>Write Completion:</strong></p>
 * <ul>
 *   <li>Default constructor: writes are applied and completed on the calling thread</li>
 *   <li>{@link #InMemoryKeyValueStore(Executor)}: writes are applied and completed on the
 *       given executor, simulating an asynchronous backend</li>
 * </ul>
 *
 * <p><strong>Failure Injection:</strong></p>
 * <ul>
 *   <li>{@link #rejectWrites(boolean)}: writes complete with {@code false} and are not applied</li>
 *   <li>{@link #failWritesWith(RuntimeException)}: writes complete exceptionally and are not applied</li>
 * </ul>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Data lost on process restart</li>
 *   <li>Not suitable for production use</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * KeyValueStore store = new InMemoryKeyValueStore();
 * store.setInt("counter", 1).join();   // true
 * store.getInt("counter");             // 1
 * store.getString("counter");          // IllegalStateException
 * </pre>
 *
 * @author KvStream Team
 * @since 1.0.0
 */
public class InMemoryKeyValueStore implements KeyValueStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryKeyValueStore.class);

    private final ConcurrentHashMap<String, Object> entries = new ConcurrentHashMap<>();

    /**
     * Executor applying writes; {@code null} means the calling thread.
     */
    private final Executor writeExecutor;

    private volatile boolean rejectWrites;
    private volatile RuntimeException writeFailure;

    /**
     * Creates a store completing writes synchronously.
     */
    public InMemoryKeyValueStore() {
        this.writeExecutor = null;
    }

    /**
     * Creates a store completing writes on the given executor.
     *
     * @param writeExecutor executor applying writes
     * @throws IllegalArgumentException if writeExecutor is null
     */
    public InMemoryKeyValueStore(Executor writeExecutor) {
        if (writeExecutor == null) {
            throw new IllegalArgumentException("writeExecutor cannot be null");
        }
        this.writeExecutor = writeExecutor;
    }

    /**
     * Creates a synchronous store pre-populated with the given entries.
     *
     * <p>Supported value types: Boolean, Integer, Double, String, List of String.</p>
     *
     * @param initial initial entries
     * @return populated store
     * @throws IllegalArgumentException if a value has an unsupported type
     */
    public static InMemoryKeyValueStore of(Map<String, ?> initial) {
        if (initial == null) {
            throw new IllegalArgumentException("initial cannot be null");
        }
        InMemoryKeyValueStore store = new InMemoryKeyValueStore();
        initial.forEach((key, value) -> store.entries.put(requireKey(key), normalize(value)));
        return store;
    }

    /**
     * Makes subsequent writes complete with {@code false} without being applied.
     *
     * @param reject true to reject writes
     */
    public void rejectWrites(boolean reject) {
        this.rejectWrites = reject;
    }

    /**
     * Makes subsequent writes complete exceptionally without being applied.
     *
     * @param failure failure to complete with, or null to stop failing
     */
    public void failWritesWith(RuntimeException failure) {
        this.writeFailure = failure;
    }

    /**
     * @return number of stored entries
     */
    public int size() {
        return entries.size();
    }

    @Override
    public Set<String> getKeys() {
        return Set.copyOf(entries.keySet());
    }

    @Override
    public Boolean getBool(String key) {
        return read(key, Boolean.class);
    }

    @Override
    public Integer getInt(String key) {
        return read(key, Integer.class);
    }

    @Override
    public Double getDouble(String key) {
        return read(key, Double.class);
    }

    @Override
    public String getString(String key) {
        return read(key, String.class);
    }

    @Override
    @SuppressWarnings("unchecked")
    public List<String> getStringList(String key) {
        return read(key, List.class);
    }

    @Override
    public CompletableFuture<Boolean> setBool(String key, boolean value) {
        return put(key, value);
    }

    @Override
    public CompletableFuture<Boolean> setInt(String key, int value) {
        return put(key, value);
    }

    @Override
    public CompletableFuture<Boolean> setDouble(String key, double value) {
        return put(key, value);
    }

    @Override
    public CompletableFuture<Boolean> setString(String key, String value) {
        if (value == null) {
            throw new IllegalArgumentException("value cannot be null");
        }
        return put(key, value);
    }

    @Override
    public CompletableFuture<Boolean> setStringList(String key, List<String> value) {
        if (value == null) {
            throw new IllegalArgumentException("value cannot be null");
        }
        return put(key, List.copyOf(value));
    }

    @Override
    public CompletableFuture<Boolean> remove(String key) {
        requireKey(key);
        return write("remove " + key, () -> {
            entries.remove(key);
            return true;
        });
    }

    @Override
    public CompletableFuture<Boolean> clear() {
        return write("clear", () -> {
            entries.clear();
            return true;
        });
    }

    private CompletableFuture<Boolean> put(String key, Object value) {
        requireKey(key);
        return write("set " + key, () -> {
            entries.put(key, value);
            return true;
        });
    }

    private CompletableFuture<Boolean> write(String description, Supplier<Boolean> mutation) {
        if (writeExecutor == null) {
            return completedWrite(description, mutation);
        }
        return CompletableFuture.supplyAsync(() -> completedWrite(description, mutation), writeExecutor)
            .thenCompose(Function.identity());
    }

    private CompletableFuture<Boolean> completedWrite(String description, Supplier<Boolean> mutation) {
        RuntimeException failure = writeFailure;
        if (failure != null) {
            log.debug("Injected failure for '{}'", description);
            return CompletableFuture.failedFuture(failure);
        }
        if (rejectWrites) {
            log.debug("Rejected '{}'", description);
            return CompletableFuture.completedFuture(false);
        }
        return CompletableFuture.completedFuture(mutation.get());
    }

    private <T> T read(String key, Class<T> type) {
        Object value = entries.get(requireKey(key));
        if (value == null) {
            return null;
        }
        if (!type.isInstance(value)) {
            throw new IllegalStateException("Value for key '" + key + "' is a "
                + value.getClass().getSimpleName() + ", not a " + type.getSimpleName());
        }
        return type.cast(value);
    }

    private static Object normalize(Object value) {
        if (value instanceof Boolean || value instanceof Integer || value instanceof Double
            || value instanceof String) {
            return value;
        }
        if (value instanceof List) {
            return ((List<?>) value).stream().map(element -> {
                if (!(element instanceof String)) {
                    throw new IllegalArgumentException("List values must contain only Strings");
                }
                return (String) element;
            }).toList();
        }
        throw new IllegalArgumentException("Unsupported value type: "
            + (value == null ? "null" : value.getClass().getName()));
    }

    private static String requireKey(String key) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        return key;
    }
}
