package com.ryuqq.kvstream.core.adapter;

import com.ryuqq.kvstream.core.spi.KeyValueStore;

import java.time.Instant;
import java.util.concurrent.CompletableFuture;

/**
 * {@link Instant} 값 어댑터.
 *
 * <p>UTC epoch milliseconds를 10진수 문자열로 저장합니다 (예: {@code "1546300800000"}).
 * 밀리초 미만 정밀도는 저장 시 버려집니다.</p>
 *
 * @author KvStream Team
 * @since 1.0.0
 */
public final class DateTimeAdapter implements ValueAdapter<Instant> {

    public static final DateTimeAdapter INSTANCE = new DateTimeAdapter();

    private DateTimeAdapter() {
    }

    /**
     * {@inheritDoc}
     *
     * @throws IllegalStateException 저장된 문자열이 epoch milliseconds 형식이 아닌 경우
     */
    @Override
    public Instant read(KeyValueStore store, String key) {
        String raw = store.getString(key);
        if (raw == null) {
            return null;
        }
        try {
            return Instant.ofEpochMilli(Long.parseLong(raw));
        } catch (NumberFormatException e) {
            throw new IllegalStateException("Value for key '" + key + "' is not epoch millis: " + raw, e);
        }
    }

    @Override
    public CompletableFuture<Boolean> write(KeyValueStore store, String key, Instant value) {
        return store.setString(key, Long.toString(value.toEpochMilli()));
    }

    @Override
    public Class<?> valueType() {
        return Instant.class;
    }

    @Override
    public String toString() {
        return "DateTimeAdapter";
    }
}
