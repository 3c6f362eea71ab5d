package com.ryuqq.kvstream.core.adapter;

import com.ryuqq.kvstream.core.spi.KeyValueStore;

import java.util.concurrent.CompletableFuture;

/**
 * {@code String} 값 어댑터.
 *
 * <p>{@link KeyValueStore#getString(String)} / {@link KeyValueStore#setString}에 그대로 위임합니다.</p>
 *
 * @author KvStream Team
 * @since 1.0.0
 */
public final class StringAdapter implements ValueAdapter<String> {

    /**
     * 공유 인스턴스 (무상태).
     */
    public static final StringAdapter INSTANCE = new StringAdapter();

    private StringAdapter() {
    }

    @Override
    public String read(KeyValueStore store, String key) {
        return store.getString(key);
    }

    @Override
    public CompletableFuture<Boolean> write(KeyValueStore store, String key, String value) {
        return store.setString(key, value);
    }

    @Override
    public Class<?> valueType() {
        return String.class;
    }

    @Override
    public String toString() {
        return "StringAdapter";
    }
}
