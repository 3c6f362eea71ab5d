package com.ryuqq.kvstream.core.adapter;

import com.ryuqq.kvstream.core.spi.KeyValueStore;

import java.util.Collections;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * 집계 뷰 전용 어댑터: 현재 존재하는 모든 키.
 *
 * <p>키 인자는 무시됩니다. 저장소가 null 또는 빈 집합을 반환하면
 * 명시적인 빈 집합으로 정규화합니다. 반환 집합은 수정 불가입니다.</p>
 *
 * <p>쓰기는 지원하지 않습니다.</p>
 *
 * @author KvStream Team
 * @since 1.0.0
 */
public final class KeySetAdapter implements ValueAdapter<Set<String>> {

    public static final KeySetAdapter INSTANCE = new KeySetAdapter();

    private KeySetAdapter() {
    }

    @Override
    public Set<String> read(KeyValueStore store, String ignored) {
        Set<String> keys = store.getKeys();
        if (keys == null || keys.isEmpty()) {
            return Collections.emptySet();
        }
        return Set.copyOf(keys);
    }

    /**
     * 지원하지 않음.
     *
     * @throws UnsupportedOperationException 항상
     */
    @Override
    public CompletableFuture<Boolean> write(KeyValueStore store, String key, Set<String> value) {
        throw new UnsupportedOperationException("Writing the key set is not supported");
    }

    @Override
    public Class<?> valueType() {
        return Set.class;
    }

    @Override
    public String toString() {
        return "KeySetAdapter";
    }
}
