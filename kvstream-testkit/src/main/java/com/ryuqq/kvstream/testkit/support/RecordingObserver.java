package com.ryuqq.kvstream.testkit.support;

import com.ryuqq.kvstream.core.observable.ValueObserver;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * 수신한 신호를 순서대로 기록하는 observer.
 *
 * <p>비동기 쓰기 완료 후 전달을 기다려야 하는 테스트를 위해
 * {@link #awaitValues(int, Duration)}를 제공합니다.</p>
 *
 * <pre>
 * RecordingObserver&lt;Integer&gt; observer = new RecordingObserver&lt;&gt;();
 * counter.subscribe(observer);
 * counter.set(5);
 * observer.awaitValues(2, Duration.ofSeconds(1));
 * assertThat(observer.values()).containsExactly(0, 5);
 * </pre>
 *
 * @param <T> 값 타입
 * @author KvStream Team
 * @since 1.0.0
 */
public class RecordingObserver<T> implements ValueObserver<T> {

    private final List<T> values = new ArrayList<>();
    private final List<Throwable> errors = new ArrayList<>();
    private int completions;

    @Override
    public synchronized void onNext(T value) {
        values.add(value);
        notifyAll();
    }

    @Override
    public synchronized void onError(Throwable error) {
        errors.add(error);
        notifyAll();
    }

    @Override
    public synchronized void onComplete() {
        completions++;
        notifyAll();
    }

    /**
     * @return 수신 값 사본
     */
    public synchronized List<T> values() {
        return List.copyOf(values);
    }

    /**
     * @return 마지막 수신 값
     * @throws IllegalStateException 수신 값이 없는 경우
     */
    public synchronized T lastValue() {
        if (values.isEmpty()) {
            throw new IllegalStateException("No value received yet");
        }
        return values.get(values.size() - 1);
    }

    /**
     * @return 수신 오류 사본
     */
    public synchronized List<Throwable> errors() {
        return List.copyOf(errors);
    }

    /**
     * @return 완료 신호 수
     */
    public synchronized int completions() {
        return completions;
    }

    /**
     * @return 한 번 이상 완료되었으면 true
     */
    public synchronized boolean isCompleted() {
        return completions > 0;
    }

    /**
     * 기록된 값을 비움.
     */
    public synchronized void clear() {
        values.clear();
        errors.clear();
        completions = 0;
    }

    /**
     * 지정한 개수 이상의 값이 도착할 때까지 대기.
     *
     * @param count 기대 값 개수
     * @param timeout 최대 대기 시간
     * @return 기록된 값 사본
     * @throws AssertionError 시간 내에 도착하지 않은 경우
     */
    public synchronized List<T> awaitValues(int count, Duration timeout) {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (values.size() < count) {
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                throw new AssertionError("Expected " + count + " value(s) within " + timeout
                    + " but received " + values);
            }
            try {
                Duration wait = Duration.ofNanos(remaining);
                wait(Math.max(1, wait.toMillis()));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new AssertionError("Interrupted while waiting for values", e);
            }
        }
        return List.copyOf(values);
    }
}
