package com.ryuqq.kvstream.core.adapter;

import com.ryuqq.kvstream.core.spi.KeyValueStore;

import java.util.concurrent.CompletableFuture;

/**
 * {@code Double} 값 어댑터.
 *
 * <p>{@link KeyValueStore#getDouble(String)} / {@link KeyValueStore#setDouble}에 그대로 위임합니다.</p>
 *
 * @author KvStream Team
 * @since 1.0.0
 */
public final class DoubleAdapter implements ValueAdapter<Double> {

    /**
     * 공유 인스턴스 (무상태).
     */
    public static final DoubleAdapter INSTANCE = new DoubleAdapter();

    private DoubleAdapter() {
    }

    @Override
    public Double read(KeyValueStore store, String key) {
        return store.getDouble(key);
    }

    @Override
    public CompletableFuture<Boolean> write(KeyValueStore store, String key, Double value) {
        return store.setDouble(key, value);
    }

    @Override
    public Class<?> valueType() {
        return Double.class;
    }

    @Override
    public String toString() {
        return "DoubleAdapter";
    }
}
