package com.ryuqq.kvstream.core.observable;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * 중복 제거 변환 (opt-in).
 *
 * <p>구독별로 마지막 전달 값을 기억하고, 새 값이 구조적으로 같으면
 * ({@link Objects#deepEquals(Object, Object)}) 전달하지 않습니다.</p>
 *
 * <p><strong>초기 상태:</strong></p>
 * <ul>
 *   <li>seed 없음: 첫 값(구독 시 재생 값)은 항상 전달되고 이후 비교 기준이 됨</li>
 *   <li>seed 있음: 구독 시점에 seed를 읽어 비교 기준으로 사용.
 *       재생 값이 seed와 같으면 전달하지 않음 (초기값을 이미 가진 소비자용)</li>
 * </ul>
 *
 * <p>취소 시 상태를 비교 기준 없음(ABSENT)으로 초기화하므로,
 * 새 구독은 항상 깨끗한 상태에서 시작합니다. 오류와 완료 신호는 그대로 전달됩니다.</p>
 *
 * @param <T> 값 타입
 * @author KvStream Team
 * @since 1.0.0
 */
public final class DistinctValueStream<T> implements ValueStream<T> {

    private static final Object ABSENT = new Object();

    private final ValueStream<T> source;
    private final Supplier<? extends T> seed;

    /**
     * seed 없는 중복 제거 스트림.
     *
     * @param source 원본 스트림
     * @throws IllegalArgumentException source가 null인 경우
     */
    public DistinctValueStream(ValueStream<T> source) {
        this(source, null);
    }

    /**
     * seed 기반 중복 제거 스트림.
     *
     * @param source 원본 스트림
     * @param seed 구독 시점 비교 기준 공급자 (null이면 seed 없음)
     * @throws IllegalArgumentException source가 null인 경우
     */
    public DistinctValueStream(ValueStream<T> source, Supplier<? extends T> seed) {
        if (source == null) {
            throw new IllegalArgumentException("source cannot be null");
        }
        this.source = source;
        this.seed = seed;
    }

    @Override
    public Subscription subscribe(ValueObserver<? super T> observer) {
        if (observer == null) {
            throw new IllegalArgumentException("observer cannot be null");
        }
        DistinctObserver<T> distinct = new DistinctObserver<>(observer, seed != null ? seed.get() : ABSENT);
        Subscription upstream = source.subscribe(distinct);
        return new DistinctSubscription(upstream, distinct);
    }

    private static final class DistinctObserver<T> implements ValueObserver<T> {

        private final ValueObserver<? super T> downstream;
        private Object lastValue;

        private DistinctObserver(ValueObserver<? super T> downstream, Object initial) {
            this.downstream = downstream;
            this.lastValue = initial;
        }

        @Override
        public void onNext(T value) {
            synchronized (this) {
                if (lastValue != ABSENT && Objects.deepEquals(lastValue, value)) {
                    return;
                }
                lastValue = value;
            }
            downstream.onNext(value);
        }

        @Override
        public void onError(Throwable error) {
            downstream.onError(error);
        }

        @Override
        public void onComplete() {
            downstream.onComplete();
        }

        private synchronized void reset() {
            lastValue = ABSENT;
        }
    }

    private static final class DistinctSubscription implements Subscription {

        private final Subscription upstream;
        private final DistinctObserver<?> observer;

        private DistinctSubscription(Subscription upstream, DistinctObserver<?> observer) {
            this.upstream = upstream;
            this.observer = observer;
        }

        @Override
        public void cancel() {
            upstream.cancel();
            observer.reset();
        }

        @Override
        public void pause() {
            upstream.pause();
        }

        @Override
        public void resume() {
            upstream.resume();
        }

        @Override
        public boolean isPaused() {
            return upstream.isPaused();
        }

        @Override
        public boolean isCancelled() {
            return upstream.isCancelled();
        }
    }
}
