package com.ryuqq.kvstream.testkit.contract;

import com.ryuqq.kvstream.core.spi.KeyValueStore;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Test double for the {@link KeyValueStore} SPI with manually controlled write completion.
 *
 * <p>By default every mutation is applied and completed immediately. After
 * {@link #holdWrites()} mutations are queued and neither applied nor completed until the
 * test calls {@link #completeNext(boolean)}, {@link #completeAll(boolean)} or
 * {@link #failNext(Throwable)}. This makes "publish only after the write completes"
 * observable in a deterministic way.</p>
 *
 * <p><strong>Behaviour:</strong></p>
 * <ul>
 *   <li>Completing with {@code true} applies the mutation, then completes the future</li>
 *   <li>Completing with {@code false} discards the mutation</li>
 *   <li>Failing completes the future exceptionally and discards the mutation</li>
 * </ul>
 *
 * <p>Type mismatches on reads throw {@link IllegalStateException}, as the SPI requires.</p>
 *
 * @author KvStream Team
 * @since 1.0.0
 */
public class ControllableKeyValueStore implements KeyValueStore {

    private final Map<String, Object> values = new ConcurrentHashMap<>();
    private final Deque<PendingWrite> pending = new ArrayDeque<>();
    private boolean holding;

    /**
     * Queue subsequent writes until explicitly completed.
     */
    public synchronized void holdWrites() {
        holding = true;
    }

    /**
     * Complete queued writes successfully and return to immediate completion.
     */
    public void releaseWrites() {
        synchronized (this) {
            holding = false;
        }
        completeAll(true);
    }

    /**
     * @return number of writes waiting for completion
     */
    public synchronized int pendingWrites() {
        return pending.size();
    }

    /**
     * Complete the oldest queued write.
     *
     * @param success write outcome
     * @throws IllegalStateException if no write is pending
     */
    public void completeNext(boolean success) {
        PendingWrite write = poll();
        if (success) {
            write.mutation.run();
        }
        write.future.complete(success);
    }

    /**
     * Fail the oldest queued write.
     *
     * @param error cause
     * @throws IllegalStateException if no write is pending
     */
    public void failNext(Throwable error) {
        poll().future.completeExceptionally(error);
    }

    /**
     * Complete every queued write in order.
     *
     * @param success write outcome
     */
    public void completeAll(boolean success) {
        while (pendingWrites() > 0) {
            completeNext(success);
        }
    }

    private synchronized PendingWrite poll() {
        PendingWrite write = pending.pollFirst();
        if (write == null) {
            throw new IllegalStateException("No pending write");
        }
        return write;
    }

    @Override
    public Set<String> getKeys() {
        return Set.copyOf(values.keySet());
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
        requireKey(key);
        return submit(() -> values.put(key, value));
    }

    @Override
    public CompletableFuture<Boolean> setInt(String key, int value) {
        requireKey(key);
        return submit(() -> values.put(key, value));
    }

    @Override
    public CompletableFuture<Boolean> setDouble(String key, double value) {
        requireKey(key);
        return submit(() -> values.put(key, value));
    }

    @Override
    public CompletableFuture<Boolean> setString(String key, String value) {
        requireKey(key);
        if (value == null) {
            throw new IllegalArgumentException("value cannot be null");
        }
        return submit(() -> values.put(key, value));
    }

    @Override
    public CompletableFuture<Boolean> setStringList(String key, List<String> value) {
        requireKey(key);
        if (value == null) {
            throw new IllegalArgumentException("value cannot be null");
        }
        List<String> copy = List.copyOf(value);
        return submit(() -> values.put(key, copy));
    }

    @Override
    public CompletableFuture<Boolean> remove(String key) {
        requireKey(key);
        return submit(() -> values.remove(key));
    }

    @Override
    public CompletableFuture<Boolean> clear() {
        return submit(values::clear);
    }

    private CompletableFuture<Boolean> submit(Runnable mutation) {
        synchronized (this) {
            if (holding) {
                CompletableFuture<Boolean> future = new CompletableFuture<>();
                pending.addLast(new PendingWrite(mutation, future));
                return future;
            }
        }
        mutation.run();
        return CompletableFuture.completedFuture(true);
    }

    private <T> T read(String key, Class<T> type) {
        Object value = values.get(requireKey(key));
        if (value == null) {
            return null;
        }
        if (!type.isInstance(value)) {
            throw new IllegalStateException("Value for key '" + key + "' is a "
                + value.getClass().getSimpleName() + ", not a " + type.getSimpleName());
        }
        return type.cast(value);
    }

    private static String requireKey(String key) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        return key;
    }

    private static final class PendingWrite {

        private final Runnable mutation;
        private final CompletableFuture<Boolean> future;

        private PendingWrite(Runnable mutation, CompletableFuture<Boolean> future) {
            this.mutation = mutation;
            this.future = future;
        }
    }
}
