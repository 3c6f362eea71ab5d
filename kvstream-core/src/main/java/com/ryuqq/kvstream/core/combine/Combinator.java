package com.ryuqq.kvstream.core.combine;

import com.ryuqq.kvstream.core.observable.DistinctValueStream;
import com.ryuqq.kvstream.core.observable.ObservableValue;
import com.ryuqq.kvstream.core.observable.Subscription;
import com.ryuqq.kvstream.core.observable.ValueObserver;
import com.ryuqq.kvstream.core.observable.ValueStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.function.BiFunction;
import java.util.function.Function;

/**
 * 여러 {@link ObservableValue}를 combine-latest 스냅샷 스트림으로 결합.
 *
 * <p><strong>동작 흐름:</strong></p>
 * <pre>
 * 1. 모든 입력의 currentValue()를 먼저 읽음 (구독 전)
 * 2. 초기 스냅샷을 동기적으로 전달
 * 3. 각 입력을 DistinctValueStream(seed = 1에서 읽은 값)으로 구독
 * 4. 입력 i에서 새 값 수신 시 슬롯 i만 교체하고 전체 스냅샷 사본 전달
 * </pre>
 *
 * <p><strong>특징:</strong></p>
 * <ul>
 *   <li>스냅샷: 입력 순서와 같은 순서, 전달 후 수정 불가</li>
 *   <li>오류: {@link CombinatorConfig#errorMode()}에 따라 전체 취소 또는 계속</li>
 *   <li>완료: 모든 입력이 완료되어야 완료, 빈 입력은 빈 스냅샷 전달 후 즉시 완료</li>
 *   <li>재바인딩: 입력 목록이 바뀌면 기존 구독을 모두 해제하고 처음부터 재구성</li>
 *   <li>일시정지/재개/취소: 모든 하위 구독에 일괄 적용</li>
 * </ul>
 *
 * <p>재바인딩 이전 세대의 구독에서 늦게 도착한 신호는 세대 번호로 걸러냅니다.</p>
 *
 * @author KvStream Team
 * @since 1.0.0
 */
public final class Combinator implements Subscription {

    private static final Logger log = LoggerFactory.getLogger(Combinator.class);

    private final CombinatorConfig config;
    private final ValueObserver<? super List<Object>> observer;
    private final Object lock = new Object();

    private List<ObservableValue<?>> inputs = List.of();
    private Object[] current = new Object[0];
    private List<Subscription> subscriptions = new ArrayList<>();
    private int generation;
    private int completedCount;
    private boolean terminated;
    private boolean paused;
    private volatile boolean cancelled;

    private Combinator(CombinatorConfig config, ValueObserver<? super List<Object>> observer) {
        this.config = config;
        this.observer = observer;
    }

    /**
     * Combinator 생성 및 구독 시작.
     *
     * <p>반환 전에 초기 스냅샷이 observer에 전달됩니다.</p>
     *
     * @param inputs 입력 목록 (null 원소 불가)
     * @param config 설정
     * @param observer 스냅샷 수신자
     * @return 동작 중인 Combinator
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public static Combinator bind(List<? extends ObservableValue<?>> inputs,
                                  CombinatorConfig config,
                                  ValueObserver<? super List<Object>> observer) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (observer == null) {
            throw new IllegalArgumentException("observer cannot be null");
        }
        List<ObservableValue<?>> copy = copyInputs(inputs);
        Combinator combinator = new Combinator(config, observer);
        synchronized (combinator.lock) {
            combinator.build(copy);
        }
        return combinator;
    }

    /**
     * 입력 목록 교체.
     *
     * <p>새 목록이 현재 목록과 같으면 아무것도 하지 않습니다. 다르면 모든 구독을 해제하고
     * 초기 스냅샷부터 다시 시작합니다. 이전 구독의 일부를 이어 쓰지 않습니다.</p>
     *
     * @param newInputs 새 입력 목록
     * @return 재구성했으면 true
     * @throws IllegalArgumentException newInputs가 null이거나 null 원소를 포함하는 경우
     * @throws IllegalStateException 이미 취소된 경우
     */
    public boolean rebind(List<? extends ObservableValue<?>> newInputs) {
        List<ObservableValue<?>> copy = copyInputs(newInputs);
        synchronized (lock) {
            if (cancelled) {
                throw new IllegalStateException("Combinator is cancelled");
            }
            if (inputs.equals(copy)) {
                return false;
            }
            log.debug("Rebinding combinator from {} to {} input(s)", inputs.size(), copy.size());
            cancelSubscriptions();
            build(copy);
            return true;
        }
    }

    /**
     * 마지막 스냅샷 조회.
     *
     * @return 수정 불가 스냅샷 사본
     */
    public List<Object> snapshot() {
        synchronized (lock) {
            return freeze(current);
        }
    }

    /**
     * @return 현재 입력 목록
     */
    public List<ObservableValue<?>> inputs() {
        synchronized (lock) {
            return inputs;
        }
    }

    private void build(List<ObservableValue<?>> newInputs) {
        int gen = ++generation;
        inputs = newInputs;
        completedCount = 0;
        terminated = false;

        Object[] initial = new Object[newInputs.size()];
        for (int i = 0; i < initial.length; i++) {
            initial[i] = newInputs.get(i).currentValue();
        }
        current = initial;
        observer.onNext(freeze(initial));

        if (newInputs.isEmpty()) {
            terminated = true;
            observer.onComplete();
            return;
        }

        List<Subscription> subs = new ArrayList<>(newInputs.size());
        subscriptions = subs;
        try {
            for (int i = 0; i < newInputs.size(); i++) {
                if (cancelled || terminated || gen != generation) {
                    // observer cancelled, failed or rebound from a callback
                    return;
                }
                Subscription subscription = subscribeInput(gen, i, newInputs.get(i), initial[i]);
                if (cancelled || terminated || gen != generation) {
                    // the replay of this input reached the observer, which tore the combinator down
                    subscription.cancel();
                    return;
                }
                subs.add(subscription);
                if (paused) {
                    subscription.pause();
                }
            }
        } catch (RuntimeException e) {
            log.debug("Subscribing input failed, releasing {} subscription(s)", subs.size());
            for (Subscription subscription : subs) {
                subscription.cancel();
            }
            subs.clear();
            throw e;
        }
    }

    private <T> Subscription subscribeInput(int gen, int index, ObservableValue<T> input, Object initialValue) {
        @SuppressWarnings("unchecked")
        T seed = (T) initialValue;
        return new DistinctValueStream<>(input, () -> seed).subscribe(new BranchObserver<>(gen, index));
    }

    private void onBranchValue(int gen, int index, Object value) {
        synchronized (lock) {
            if (isStale(gen)) {
                return;
            }
            current[index] = value;
            observer.onNext(freeze(current));
        }
    }

    private void onBranchError(int gen, int index, Throwable error) {
        synchronized (lock) {
            if (isStale(gen)) {
                return;
            }
            if (config.errorMode() == ErrorMode.CANCEL_ALL) {
                log.debug("Input {} failed, cancelling {} subscription(s)", index, subscriptions.size());
                terminated = true;
                cancelSubscriptions();
            }
            observer.onError(error);
        }
    }

    private void onBranchComplete(int gen) {
        synchronized (lock) {
            if (isStale(gen)) {
                return;
            }
            completedCount++;
            if (completedCount == inputs.size()) {
                terminated = true;
                observer.onComplete();
            }
        }
    }

    private boolean isStale(int gen) {
        return gen != generation || cancelled || terminated;
    }

    private void cancelSubscriptions() {
        for (Subscription subscription : subscriptions) {
            subscription.cancel();
        }
        subscriptions = new ArrayList<>();
    }

    @Override
    public void cancel() {
        synchronized (lock) {
            if (cancelled) {
                return;
            }
            cancelled = true;
            cancelSubscriptions();
        }
    }

    @Override
    public void pause() {
        synchronized (lock) {
            paused = true;
            for (Subscription subscription : subscriptions) {
                subscription.pause();
            }
        }
    }

    @Override
    public void resume() {
        synchronized (lock) {
            paused = false;
            for (Subscription subscription : subscriptions) {
                subscription.resume();
            }
        }
    }

    @Override
    public boolean isPaused() {
        synchronized (lock) {
            return paused;
        }
    }

    @Override
    public boolean isCancelled() {
        return cancelled;
    }

    /**
     * 구독할 때마다 새 Combinator를 만드는 콜드 스트림 (기본 설정).
     *
     * @param inputs 입력 목록
     * @return 스냅샷 스트림
     */
    public static ValueStream<List<Object>> combineLatest(List<? extends ObservableValue<?>> inputs) {
        return combineLatest(inputs, new CombinatorConfig());
    }

    /**
     * 구독할 때마다 새 Combinator를 만드는 콜드 스트림.
     *
     * @param inputs 입력 목록
     * @param config 설정
     * @return 스냅샷 스트림
     */
    public static ValueStream<List<Object>> combineLatest(List<? extends ObservableValue<?>> inputs,
                                                          CombinatorConfig config) {
        List<ObservableValue<?>> copy = copyInputs(inputs);
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        return observer -> bind(copy, config, observer);
    }

    /**
     * 두 입력 결합.
     *
     * @param a 첫 번째 입력
     * @param b 두 번째 입력
     * @param combiner 결합 함수
     * @return 결합 값 스트림
     */
    @SuppressWarnings("unchecked")
    public static <A, B, R> ValueStream<R> combineLatest(ObservableValue<A> a, ObservableValue<B> b,
                                                        BiFunction<? super A, ? super B, ? extends R> combiner) {
        if (combiner == null) {
            throw new IllegalArgumentException("combiner cannot be null");
        }
        return mapped(Arrays.asList(a, b), values -> combiner.apply((A) values.get(0), (B) values.get(1)));
    }

    /**
     * 세 입력 결합.
     *
     * @param a 첫 번째 입력
     * @param b 두 번째 입력
     * @param c 세 번째 입력
     * @param combiner 결합 함수
     * @return 결합 값 스트림
     */
    @SuppressWarnings("unchecked")
    public static <A, B, C, R> ValueStream<R> combineLatest(ObservableValue<A> a, ObservableValue<B> b,
                                                           ObservableValue<C> c,
                                                           TriFunction<? super A, ? super B, ? super C, ? extends R> combiner) {
        if (combiner == null) {
            throw new IllegalArgumentException("combiner cannot be null");
        }
        return mapped(Arrays.asList(a, b, c),
            values -> combiner.apply((A) values.get(0), (B) values.get(1), (C) values.get(2)));
    }

    private static <R> ValueStream<R> mapped(List<ObservableValue<?>> inputs,
                                             Function<List<Object>, ? extends R> mapper) {
        List<ObservableValue<?>> copy = copyInputs(inputs);
        return observer -> bind(copy, new CombinatorConfig(), new MappingObserver<>(observer, mapper));
    }

    private static List<ObservableValue<?>> copyInputs(List<? extends ObservableValue<?>> inputs) {
        if (inputs == null) {
            throw new IllegalArgumentException("inputs cannot be null");
        }
        for (ObservableValue<?> input : inputs) {
            if (input == null) {
                throw new IllegalArgumentException("inputs cannot contain null");
            }
        }
        return List.copyOf(inputs);
    }

    private static List<Object> freeze(Object[] values) {
        return Collections.unmodifiableList(new ArrayList<>(Arrays.asList(values)));
    }

    private final class BranchObserver<T> implements ValueObserver<T> {

        private final int gen;
        private final int index;

        private BranchObserver(int gen, int index) {
            this.gen = gen;
            this.index = index;
        }

        @Override
        public void onNext(T value) {
            onBranchValue(gen, index, value);
        }

        @Override
        public void onError(Throwable error) {
            onBranchError(gen, index, error);
        }

        @Override
        public void onComplete() {
            onBranchComplete(gen);
        }
    }

    private static final class MappingObserver<R> implements ValueObserver<List<Object>> {

        private final ValueObserver<? super R> downstream;
        private final Function<List<Object>, ? extends R> mapper;

        private MappingObserver(ValueObserver<? super R> downstream, Function<List<Object>, ? extends R> mapper) {
            this.downstream = downstream;
            this.mapper = mapper;
        }

        @Override
        public void onNext(List<Object> values) {
            R result;
            try {
                result = mapper.apply(values);
            } catch (RuntimeException e) {
                downstream.onError(e);
                return;
            }
            downstream.onNext(result);
        }

        @Override
        public void onError(Throwable error) {
            downstream.onError(error);
        }

        @Override
        public void onComplete() {
            downstream.onComplete();
        }
    }
}
