package com.ryuqq.kvstream.core.adapter;

import com.ryuqq.kvstream.core.spi.KeyValueStore;

import java.util.concurrent.CompletableFuture;

/**
 * {@code Integer} 값 어댑터.
 *
 * <p>{@link KeyValueStore#getInt(String)} / {@link KeyValueStore#setInt}에 그대로 위임합니다.</p>
 *
 * @author KvStream Team
 * @since 1.0.0
 */
public final class IntAdapter implements ValueAdapter<Integer> {

    /**
     * 공유 인스턴스 (무상태).
     */
    public static final IntAdapter INSTANCE = new IntAdapter();

    private IntAdapter() {
    }

    @Override
    public Integer read(KeyValueStore store, String key) {
        return store.getInt(key);
    }

    @Override
    public CompletableFuture<Boolean> write(KeyValueStore store, String key, Integer value) {
        return store.setInt(key, value);
    }

    @Override
    public Class<?> valueType() {
        return Integer.class;
    }

    @Override
    public String toString() {
        return "IntAdapter";
    }
}
