package com.ryuqq.kvstream.core.guard;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 과도한 재구독 감지기 (디버그 계측).
 *
 * <p>렌더링/요청 주기마다 새 {@code ObservableValue}를 만들어 구독하는 실수를 감지합니다.
 * 이 경우 매번 저장소를 다시 읽게 되어 캐싱 이점이 사라집니다.</p>
 *
 * <p><strong>알고리즘 (슬라이딩 윈도우):</strong></p>
 * <pre>
 * 1. 키별로 최근 windowSize개 구독 시각을 링 버퍼에 기록
 * 2. 버퍼가 가득 찬 상태에서 새 구독 발생 시:
 *    elapsed = now - (windowSize - 1)개 전 구독 시각
 * 3. elapsed &lt; threshold 이면 RateGuardViolation 보고
 * </pre>
 *
 * <p><strong>특징:</strong></p>
 * <ul>
 *   <li>비치명적: 진단은 {@link RateGuardListener}로만 전달되고 구독은 정상 진행</li>
 *   <li>런타임 토글: {@link #setEnabled(boolean)}</li>
 *   <li>시간 주입: {@link Clock}을 주입받아 테스트에서 경과 시간을 결정적으로 제어</li>
 *   <li>메모리: 키당 최대 windowSize개 타임스탬프</li>
 * </ul>
 *
 * @author KvStream Team
 * @since 1.0.0
 */
public final class RateGuard {

    /**
     * 집계 뷰 (null 키) 추적에 사용하는 레이블.
     */
    public static final String AGGREGATE_LABEL = "<all keys>";

    private static final Logger log = LoggerFactory.getLogger(RateGuard.class);

    private final Clock clock;
    private final RateGuardListener listener;
    private final Duration threshold;
    private final int windowSize;
    private final ConcurrentHashMap<String, Deque<Instant>> subscriptionLog = new ConcurrentHashMap<>();
    private volatile boolean enabled;

    /**
     * 생성자.
     *
     * @param config 설정
     * @param clock 시각 공급자
     * @param listener 진단 수신자
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public RateGuard(RateGuardConfig config, Clock clock, RateGuardListener listener) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        if (listener == null) {
            throw new IllegalArgumentException("listener cannot be null");
        }
        this.clock = clock;
        this.listener = listener;
        this.threshold = config.threshold();
        this.windowSize = config.windowSize();
        this.enabled = config.enabled();
    }

    /**
     * 기본 설정 (750ms / 4회, 시스템 시계, 로그 보고).
     *
     * @return RateGuard 인스턴스
     */
    public static RateGuard withDefaults() {
        return new RateGuard(new RateGuardConfig(), Clock.systemUTC(), RateGuardListener.logging());
    }

    /**
     * 비활성 RateGuard.
     *
     * @return 아무것도 기록하지 않는 RateGuard
     */
    public static RateGuard disabled() {
        return new RateGuard(RateGuardConfig.disabled(), Clock.systemUTC(), RateGuardListener.logging());
    }

    /**
     * 구독 이벤트 기록 및 위반 검사.
     *
     * @param key 구독 대상 키 (집계 뷰는 null)
     * @return 위반이 감지되면 true
     */
    public boolean track(String key) {
        if (!enabled) {
            return false;
        }
        String label = key != null ? key : AGGREGATE_LABEL;
        Instant now = clock.instant();

        Duration elapsed = null;
        Deque<Instant> timestamps = subscriptionLog.computeIfAbsent(label, ignored -> new ArrayDeque<>(windowSize));
        synchronized (timestamps) {
            timestamps.addLast(now);
            if (timestamps.size() > windowSize) {
                timestamps.removeFirst();
            }
            if (timestamps.size() == windowSize) {
                elapsed = Duration.between(timestamps.peekFirst(), now);
            }
        }

        if (elapsed == null || elapsed.compareTo(threshold) >= 0) {
            return false;
        }
        report(new RateGuardViolation(label, windowSize, elapsed, now));
        return true;
    }

    private void report(RateGuardViolation violation) {
        try {
            listener.onViolation(violation);
        } catch (RuntimeException e) {
            log.error("RateGuardListener failed for key '{}'", violation.key(), e);
        }
    }

    /**
     * 추적 활성화 여부 변경.
     *
     * @param enabled 활성화 여부
     */
    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    /**
     * 추적 활성화 여부 조회.
     *
     * @return 활성화 여부
     */
    public boolean isEnabled() {
        return enabled;
    }

    /**
     * 구독 기록 초기화 (테스트용).
     */
    public void reset() {
        subscriptionLog.clear();
    }
}
