package com.ryuqq.kvstream.core.adapter;

import com.ryuqq.kvstream.core.spi.KeyValueStore;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * {@code List<String>} 값 어댑터.
 *
 * <p>{@link KeyValueStore#getStringList(String)} / {@link KeyValueStore#setStringList}에 그대로 위임합니다.</p>
 *
 * @author KvStream Team
 * @since 1.0.0
 */
public final class StringListAdapter implements ValueAdapter<List<String>> {

    /**
     * 공유 인스턴스 (무상태).
     */
    public static final StringListAdapter INSTANCE = new StringListAdapter();

    private StringListAdapter() {
    }

    @Override
    public List<String> read(KeyValueStore store, String key) {
        return store.getStringList(key);
    }

    @Override
    public CompletableFuture<Boolean> write(KeyValueStore store, String key, List<String> value) {
        return store.setStringList(key, value);
    }

    @Override
    public Class<?> valueType() {
        return List.class;
    }

    @Override
    public String toString() {
        return "StringListAdapter";
    }
}
