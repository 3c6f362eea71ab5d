package com.ryuqq.kvstream.core.adapter;

import com.ryuqq.kvstream.core.spi.KeyValueStore;

import java.util.concurrent.CompletableFuture;

/**
 * 타입 값과 저장소 원시 표현 간의 변환기.
 *
 * <p>ValueAdapter는 {@link KeyValueStore}의 원시 getter/setter를 사용해
 * 타입 {@code T} 값을 읽고 씁니다. 타입 결정은 컴파일 타임 제네릭으로 이루어지며,
 * 런타임 타입 검사에 의존하지 않습니다.</p>
 *
 * <p><strong>동등성:</strong> 같은 {@code T}라도 원시 표현이 다르면 서로 다른 어댑터입니다.
 * {@code ObservableValue} 동등성 (key, adapter) 판정에 사용되므로
 * 상태를 가진 어댑터는 {@code equals/hashCode}를 구현해야 합니다.</p>
 *
 * <p><strong>구현 예시:</strong></p>
 * <pre>{@code
 * public final class UpperCaseAdapter implements ValueAdapter<String> {
 *     public String read(KeyValueStore store, String key) {
 *         String raw = store.getString(key);
 *         return raw == null ? null : raw.toUpperCase();
 *     }
 *
 *     public CompletableFuture<Boolean> write(KeyValueStore store, String key, String value) {
 *         return store.setString(key, value);
 *     }
 *
 *     public Class<?> valueType() {
 *         return String.class;
 *     }
 * }
 * }</pre>
 *
 * @param <T> 값 타입
 * @author KvStream Team
 * @since 1.0.0
 */
public interface ValueAdapter<T> {

    /**
     * 저장소에서 값 읽기.
     *
     * @param store 저장소
     * @param key 키 (집계 뷰 어댑터의 경우 null 가능)
     * @return 저장된 값, 없으면 null
     */
    T read(KeyValueStore store, String key);

    /**
     * 저장소에 값 쓰기.
     *
     * @param store 저장소
     * @param key 키
     * @param value 저장할 값 (non-null)
     * @return 저장 성공 여부를 담은 future
     */
    CompletableFuture<Boolean> write(KeyValueStore store, String key, T value);

    /**
     * 어댑터가 다루는 값 타입 (진단 및 toString 용).
     *
     * @return 값 타입
     */
    Class<?> valueType();
}
