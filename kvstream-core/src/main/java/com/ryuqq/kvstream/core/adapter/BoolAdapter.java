package com.ryuqq.kvstream.core.adapter;

import com.ryuqq.kvstream.core.spi.KeyValueStore;

import java.util.concurrent.CompletableFuture;

/**
 * {@code Boolean} 값 어댑터.
 *
 * <p>{@link KeyValueStore#getBool(String)} / {@link KeyValueStore#setBool}에 그대로 위임합니다.</p>
 *
 * @author KvStream Team
 * @since 1.0.0
 */
public final class BoolAdapter implements ValueAdapter<Boolean> {

    /**
     * 공유 인스턴스 (무상태).
     */
    public static final BoolAdapter INSTANCE = new BoolAdapter();

    private BoolAdapter() {
    }

    @Override
    public Boolean read(KeyValueStore store, String key) {
        return store.getBool(key);
    }

    @Override
    public CompletableFuture<Boolean> write(KeyValueStore store, String key, Boolean value) {
        return store.setBool(key, value);
    }

    @Override
    public Class<?> valueType() {
        return Boolean.class;
    }

    @Override
    public String toString() {
        return "BoolAdapter";
    }
}
