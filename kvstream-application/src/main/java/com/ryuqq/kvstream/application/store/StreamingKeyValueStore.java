package com.ryuqq.kvstream.application.store;

import com.ryuqq.kvstream.core.adapter.BoolAdapter;
import com.ryuqq.kvstream.core.adapter.DoubleAdapter;
import com.ryuqq.kvstream.core.adapter.IntAdapter;
import com.ryuqq.kvstream.core.adapter.KeySetAdapter;
import com.ryuqq.kvstream.core.adapter.StringAdapter;
import com.ryuqq.kvstream.core.adapter.StringListAdapter;
import com.ryuqq.kvstream.core.adapter.ValueAdapter;
import com.ryuqq.kvstream.core.bus.BroadcastChangeBus;
import com.ryuqq.kvstream.core.bus.WriteNotifications;
import com.ryuqq.kvstream.core.guard.RateGuard;
import com.ryuqq.kvstream.core.observable.ObservableValue;
import com.ryuqq.kvstream.core.observable.StoreBinding;
import com.ryuqq.kvstream.core.spi.ChangeBus;
import com.ryuqq.kvstream.core.spi.KeyValueStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * 변경 알림이 붙은 키-값 저장소 façade.
 *
 * <p>하나의 {@link KeyValueStore} 세션을 감싸고, 세션 전체가 공유하는 {@link ChangeBus}와
 * {@link RateGuard}를 소유합니다. getter는 {@link ObservableValue}를 반환하며,
 * setter/remove/clear는 저장 성공 후 변경된 키를 발행합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * StreamingKeyValueStore kv = StreamingKeyValueStores.instance(provider).join();
 *
 * ObservableValue&lt;Integer&gt; counter = kv.getInt("counter", 0);
 * counter.subscribe(value -&gt; render(value));   // 0 즉시 전달
 *
 * kv.setInt("counter", 1);                      // 저장 성공 후 1 전달
 * </pre>
 *
 * <p><strong>규칙:</strong></p>
 * <ul>
 *   <li>null 키, null 기본값, null 어댑터: {@link IllegalArgumentException} (I/O 전)</li>
 *   <li>저장 실패: 예외 대신 false로 보고, 발행 없음</li>
 *   <li>clear: 기존 키를 모두 발행하여 각 키의 구독자가 기본값을 받음</li>
 * </ul>
 *
 * @author KvStream Team
 * @since 1.0.0
 */
public final class StreamingKeyValueStore implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(StreamingKeyValueStore.class);

    private final KeyValueStore store;
    private final ChangeBus changeBus;
    private final RateGuard rateGuard;
    private final StoreBinding binding;

    /**
     * 기본 설정으로 생성.
     *
     * @param store 백엔드 저장소
     */
    public StreamingKeyValueStore(KeyValueStore store) {
        this(store, new StreamingStoreConfig());
    }

    /**
     * 생성자.
     *
     * @param store 백엔드 저장소
     * @param config 세션 설정
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public StreamingKeyValueStore(KeyValueStore store, StreamingStoreConfig config) {
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.store = store;
        this.changeBus = new BroadcastChangeBus();
        this.rateGuard = new RateGuard(config.rateGuard(), config.clock(), config.rateGuardListener());
        this.binding = new StoreBinding(store, changeBus, rateGuard);
    }

    /**
     * boolean 값의 ObservableValue. 값이 없으면 defaultValue를 전달합니다.
     *
     * @param key 키
     * @param defaultValue 값이 없을 때 대체 값
     * @return ObservableValue
     * @throws IllegalArgumentException key가 null인 경우
     */
    public ObservableValue<Boolean> getBool(String key, boolean defaultValue) {
        return ObservableValue.of(binding, key, defaultValue, BoolAdapter.INSTANCE);
    }

    /**
     * int 값의 ObservableValue. 값이 없으면 defaultValue를 전달합니다.
     *
     * @param key 키
     * @param defaultValue 값이 없을 때 대체 값
     * @return ObservableValue
     * @throws IllegalArgumentException key가 null인 경우
     */
    public ObservableValue<Integer> getInt(String key, int defaultValue) {
        return ObservableValue.of(binding, key, defaultValue, IntAdapter.INSTANCE);
    }

    /**
     * double 값의 ObservableValue. 값이 없으면 defaultValue를 전달합니다.
     *
     * @param key 키
     * @param defaultValue 값이 없을 때 대체 값
     * @return ObservableValue
     * @throws IllegalArgumentException key가 null인 경우
     */
    public ObservableValue<Double> getDouble(String key, double defaultValue) {
        return ObservableValue.of(binding, key, defaultValue, DoubleAdapter.INSTANCE);
    }

    /**
     * 문자열 값의 ObservableValue. 값이 없으면 defaultValue를 전달합니다.
     *
     * @param key 키
     * @param defaultValue 값이 없을 때 대체 값
     * @return ObservableValue
     * @throws IllegalArgumentException key 또는 defaultValue가 null인 경우
     */
    public ObservableValue<String> getString(String key, String defaultValue) {
        return ObservableValue.of(binding, key, defaultValue, StringAdapter.INSTANCE);
    }

    /**
     * 문자열 목록 값의 ObservableValue. 값이 없으면 defaultValue를 전달합니다.
     *
     * @param key 키
     * @param defaultValue 값이 없을 때 대체 값
     * @return ObservableValue
     * @throws IllegalArgumentException key 또는 defaultValue가 null인 경우
     */
    public ObservableValue<List<String>> getStringList(String key, List<String> defaultValue) {
        return ObservableValue.of(binding, key, defaultValue, StringListAdapter.INSTANCE);
    }

    /**
     * 사용자 정의 어댑터로 ObservableValue 생성.
     *
     * @param key 키
     * @param defaultValue 기본값
     * @param adapter 값 어댑터
     * @param <T> 값 타입
     * @return ObservableValue
     */
    public <T> ObservableValue<T> getCustomValue(String key, T defaultValue, ValueAdapter<T> adapter) {
        return ObservableValue.of(binding, key, defaultValue, adapter);
    }

    /**
     * 현재 존재하는 모든 키의 집계 뷰.
     *
     * <p>저장소의 어떤 키가 바뀌어도 다시 평가됩니다. set/clear는 지원하지 않습니다.</p>
     *
     * @return 키 집합 ObservableValue (기본값: 빈 집합)
     */
    public ObservableValue<Set<String>> getKeys() {
        return ObservableValue.aggregate(binding, Set.of(), KeySetAdapter.INSTANCE);
    }

    /**
     * boolean 값 저장. 저장에 성공하면 키를 한 번 발행합니다.
     *
     * @param key 키
     * @param value 값
     * @return 저장 성공 여부 (실패는 false, 예외 완료 없음)
     * @throws IllegalArgumentException key가 null인 경우
     */
    public CompletableFuture<Boolean> setBool(String key, boolean value) {
        return write(key, value, BoolAdapter.INSTANCE);
    }

    /**
     * int 값 저장. 저장에 성공하면 키를 한 번 발행합니다.
     *
     * @param key 키
     * @param value 값
     * @return 저장 성공 여부 (실패는 false, 예외 완료 없음)
     * @throws IllegalArgumentException key가 null인 경우
     */
    public CompletableFuture<Boolean> setInt(String key, int value) {
        return write(key, value, IntAdapter.INSTANCE);
    }

    /**
     * double 값 저장. 저장에 성공하면 키를 한 번 발행합니다.
     *
     * @param key 키
     * @param value 값
     * @return 저장 성공 여부 (실패는 false, 예외 완료 없음)
     * @throws IllegalArgumentException key가 null인 경우
     */
    public CompletableFuture<Boolean> setDouble(String key, double value) {
        return write(key, value, DoubleAdapter.INSTANCE);
    }

    /**
     * 문자열 값 저장. 저장에 성공하면 키를 한 번 발행합니다.
     *
     * @param key 키
     * @param value 값
     * @return 저장 성공 여부 (실패는 false, 예외 완료 없음)
     * @throws IllegalArgumentException key 또는 value가 null인 경우
     */
    public CompletableFuture<Boolean> setString(String key, String value) {
        return write(key, value, StringAdapter.INSTANCE);
    }

    /**
     * 문자열 목록 값 저장. 저장에 성공하면 키를 한 번 발행합니다.
     *
     * @param key 키
     * @param value 값
     * @return 저장 성공 여부 (실패는 false, 예외 완료 없음)
     * @throws IllegalArgumentException key 또는 value가 null인 경우
     */
    public CompletableFuture<Boolean> setStringList(String key, List<String> value) {
        return write(key, value, StringListAdapter.INSTANCE);
    }

    /**
     * 사용자 정의 어댑터로 저장.
     *
     * @param key 키
     * @param value 값
     * @param adapter 값 어댑터
     * @param <T> 값 타입
     * @return 저장 성공 여부
     */
    public <T> CompletableFuture<Boolean> setCustomValue(String key, T value, ValueAdapter<T> adapter) {
        return write(key, value, adapter);
    }

    /**
     * 키 삭제. 성공 시 해당 키를 발행합니다.
     *
     * @param key 키
     * @return 삭제 성공 여부
     */
    public CompletableFuture<Boolean> remove(String key) {
        requireKey(key);
        return WriteNotifications.publishOnSuccess(store.remove(key), changeBus, key);
    }

    /**
     * 전체 삭제.
     *
     * <p>삭제 전 키 목록을 스냅샷하고, 삭제가 성공하면 그 키들을 모두 발행합니다.
     * 키가 하나도 없었다면 아무것도 발행하지 않습니다.</p>
     *
     * @return 삭제 성공 여부
     */
    public CompletableFuture<Boolean> clear() {
        Set<String> existing = Set.copyOf(store.getKeys());
        log.debug("Clearing store, {} key(s) will be notified", existing.size());
        return WriteNotifications.publishOnSuccess(store.clear(), changeBus, existing);
    }

    private <T> CompletableFuture<Boolean> write(String key, T value, ValueAdapter<T> adapter) {
        requireKey(key);
        if (value == null) {
            throw new IllegalArgumentException("value cannot be null");
        }
        if (adapter == null) {
            throw new IllegalArgumentException("adapter cannot be null");
        }
        return WriteNotifications.publishOnSuccess(adapter.write(store, key, value), changeBus, key);
    }

    private static void requireKey(String key) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
    }

    /**
     * @return 백엔드 저장소
     */
    public KeyValueStore keyValueStore() {
        return store;
    }

    /**
     * @return 세션 변경 버스
     */
    public ChangeBus changeBus() {
        return changeBus;
    }

    /**
     * @return 재구독 진단기 (런타임 토글용)
     */
    public RateGuard rateGuard() {
        return rateGuard;
    }

    /**
     * @return ObservableValue 생성에 쓰는 세션 바인딩
     */
    public StoreBinding binding() {
        return binding;
    }

    /**
     * 세션 종료. 모든 구독자가 완료 신호를 받습니다. 저장된 데이터는 그대로 둡니다.
     */
    @Override
    public void close() {
        if (!changeBus.isClosed()) {
            log.info("Closing streaming store session");
            changeBus.close();
        }
    }
}
