package com.ryuqq.kvstream.core.observable;

import com.ryuqq.kvstream.core.adapter.ValueAdapter;
import com.ryuqq.kvstream.core.bus.WriteNotifications;
import com.ryuqq.kvstream.core.guard.RateGuard;
import com.ryuqq.kvstream.core.spi.ChangeBus;
import com.ryuqq.kvstream.core.spi.KeyValueStore;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * 저장소 키 하나에 대한 관찰 가능한 값.
 *
 * <p>구독 시 현재 값을 즉시 재생(replay)한 뒤, 해당 키의 변경이 버스에 발행될 때마다
 * 어댑터로 값을 다시 읽어 전달합니다. 저장된 값이 없으면 기본값을 전달합니다.</p>
 *
 * <p><strong>핵심 특징:</strong></p>
 * <ul>
 *   <li>동기 조회: {@link #currentValue()}는 버스와 무관하게 저장소를 직접 읽음</li>
 *   <li>Fan-out: 구독마다 독립 파이프라인, 한 구독의 취소는 다른 구독에 영향 없음</li>
 *   <li>쓰기 후 알림: {@link #set(Object)}는 저장소 쓰기가 성공한 뒤에만 키를 발행</li>
 *   <li>집계 뷰: key가 null이면 모든 변경에 반응하며 쓰기를 지원하지 않음</li>
 * </ul>
 *
 * <p><strong>동등성:</strong> (key, adapter) 값 동등성. 기본값과 저장소는 비교하지 않습니다.
 * 매 요청마다 새로 생성된 인스턴스를 재사용 판단에 쓸 수 있도록 하기 위함입니다.</p>
 *
 * <p>구독 전까지는 상태가 없으므로 생성 비용이 작습니다.</p>
 *
 * @param <T> 값 타입
 * @author KvStream Team
 * @since 1.0.0
 */
public final class ObservableValue<T> implements ValueStream<T> {

    private final KeyValueStore store;
    private final String key;
    private final T defaultValue;
    private final ValueAdapter<T> adapter;
    private final ChangeBus changeBus;
    private final RateGuard rateGuard;

    private ObservableValue(StoreBinding binding, String key, T defaultValue, ValueAdapter<T> adapter) {
        if (binding == null) {
            throw new IllegalArgumentException("binding cannot be null");
        }
        if (defaultValue == null) {
            throw new IllegalArgumentException("defaultValue cannot be null");
        }
        if (adapter == null) {
            throw new IllegalArgumentException("adapter cannot be null");
        }
        this.store = binding.store();
        this.key = key;
        this.defaultValue = defaultValue;
        this.adapter = adapter;
        this.changeBus = binding.changeBus();
        this.rateGuard = binding.rateGuard();
    }

    /**
     * 키 단위 ObservableValue 생성.
     *
     * @param binding 저장소 세션
     * @param key 키 (non-null)
     * @param defaultValue 값이 없을 때 전달할 기본값 (non-null)
     * @param adapter 값 어댑터
     * @param <T> 값 타입
     * @return ObservableValue
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public static <T> ObservableValue<T> of(StoreBinding binding, String key, T defaultValue,
                                            ValueAdapter<T> adapter) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        return new ObservableValue<>(binding, key, defaultValue, adapter);
    }

    /**
     * 집계 뷰 ObservableValue 생성 (모든 변경에 반응).
     *
     * @param binding 저장소 세션
     * @param defaultValue 기본값 (non-null)
     * @param adapter 키 인자를 무시하는 어댑터
     * @param <T> 값 타입
     * @return 집계 뷰
     */
    public static <T> ObservableValue<T> aggregate(StoreBinding binding, T defaultValue,
                                                   ValueAdapter<T> adapter) {
        return new ObservableValue<>(binding, null, defaultValue, adapter);
    }

    /**
     * 현재 값 동기 조회.
     *
     * <p>부작용이 없으며 버스를 사용하지 않습니다.</p>
     *
     * @return 저장된 값, 없으면 기본값
     */
    public T currentValue() {
        T value = adapter.read(store, key);
        return value != null ? value : defaultValue;
    }

    @Override
    public Subscription subscribe(ValueObserver<? super T> observer) {
        if (observer == null) {
            throw new IllegalArgumentException("observer cannot be null");
        }
        rateGuard.track(key);
        ValueSubscription<T> subscription = new ValueSubscription<>(this, observer);
        subscription.start();
        return subscription;
    }

    /**
     * 값 저장.
     *
     * <p>저장 성공 시 키를 정확히 한 번 발행합니다. 저장 실패(예외 완료 포함)는
     * false로 보고되며 발행하지 않습니다.</p>
     *
     * @param value 저장할 값 (non-null)
     * @return 저장 성공 여부
     * @throws UnsupportedOperationException 집계 뷰인 경우
     * @throws IllegalArgumentException value가 null인 경우
     */
    public CompletableFuture<Boolean> set(T value) {
        requireKeyed("set");
        if (value == null) {
            throw new IllegalArgumentException("value cannot be null");
        }
        return WriteNotifications.publishOnSuccess(adapter.write(store, key, value), changeBus, key);
    }

    /**
     * 값 삭제. 이후 구독자는 기본값을 받습니다.
     *
     * @return 삭제 성공 여부
     * @throws UnsupportedOperationException 집계 뷰인 경우
     */
    public CompletableFuture<Boolean> clear() {
        requireKeyed("clear");
        return WriteNotifications.publishOnSuccess(store.remove(key), changeBus, key);
    }

    /**
     * 중복 제거 뷰.
     *
     * @return 직전 전달 값과 같은 값을 건너뛰는 스트림
     */
    public ValueStream<T> distinct() {
        return new DistinctValueStream<>(this);
    }

    private void requireKeyed(String operation) {
        if (key == null) {
            throw new UnsupportedOperationException(
                operation + " is not supported on the aggregate key-listing view"
            );
        }
    }

    /**
     * @return 키 (집계 뷰는 null)
     */
    public String key() {
        return key;
    }

    /**
     * @return 기본값
     */
    public T defaultValue() {
        return defaultValue;
    }

    /**
     * @return 값 어댑터
     */
    public ValueAdapter<T> adapter() {
        return adapter;
    }

    /**
     * @return 집계 뷰 여부
     */
    public boolean isAggregate() {
        return key == null;
    }

    ChangeBus changeBus() {
        return changeBus;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ObservableValue)) {
            return false;
        }
        ObservableValue<?> that = (ObservableValue<?>) o;
        return Objects.equals(key, that.key) && adapter.equals(that.adapter);
    }

    @Override
    public int hashCode() {
        return Objects.hash(key, adapter);
    }

    @Override
    public String toString() {
        return "ObservableValue{key=" + (key != null ? "'" + key + "'" : RateGuard.AGGREGATE_LABEL)
            + ", adapter=" + adapter + "}";
    }
}
