package com.ryuqq.kvstream.core.adapter;

import com.ryuqq.kvstream.core.spi.KeyValueStore;

import java.util.concurrent.CompletableFuture;

/**
 * Enum 값 어댑터.
 *
 * <p>상수 이름({@link Enum#name()})을 문자열로 저장합니다.
 * 저장된 이름이 현재 enum에 없으면 (상수 삭제/이름 변경) 값이 없는 것으로 취급하여
 * 기본값이 사용되도록 합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * ObservableValue<Theme> theme = store.getCustomValue(
 *     "theme", Theme.LIGHT, EnumAdapter.of(Theme.class));
 * }</pre>
 *
 * @param <E> enum 타입
 * @author KvStream Team
 * @since 1.0.0
 */
public final class EnumAdapter<E extends Enum<E>> implements ValueAdapter<E> {

    private final Class<E> enumType;

    private EnumAdapter(Class<E> enumType) {
        if (enumType == null) {
            throw new IllegalArgumentException("enumType cannot be null");
        }
        this.enumType = enumType;
    }

    /**
     * EnumAdapter 생성.
     *
     * @param enumType enum 클래스
     * @param <E> enum 타입
     * @return EnumAdapter 인스턴스
     * @throws IllegalArgumentException enumType이 null인 경우
     */
    public static <E extends Enum<E>> EnumAdapter<E> of(Class<E> enumType) {
        return new EnumAdapter<>(enumType);
    }

    @Override
    public E read(KeyValueStore store, String key) {
        String name = store.getString(key);
        if (name == null) {
            return null;
        }
        for (E constant : enumType.getEnumConstants()) {
            if (constant.name().equals(name)) {
                return constant;
            }
        }
        return null;
    }

    @Override
    public CompletableFuture<Boolean> write(KeyValueStore store, String key, E value) {
        return store.setString(key, value.name());
    }

    @Override
    public Class<?> valueType() {
        return enumType;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        EnumAdapter<?> that = (EnumAdapter<?>) o;
        return enumType.equals(that.enumType);
    }

    @Override
    public int hashCode() {
        return enumType.hashCode();
    }

    @Override
    public String toString() {
        return "EnumAdapter{" + enumType.getSimpleName() + '}';
    }
}
