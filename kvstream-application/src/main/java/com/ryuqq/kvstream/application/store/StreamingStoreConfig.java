package com.ryuqq.kvstream.application.store;

import com.ryuqq.kvstream.core.guard.RateGuardConfig;
import com.ryuqq.kvstream.core.guard.RateGuardListener;

import java.time.Clock;

/**
 * 스트리밍 저장소 세션 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>rateGuard: 재구독 진단 설정 (기본 {@link RateGuardConfig#RateGuardConfig()})</li>
 *   <li>clock: 진단용 시각 공급자 (기본 {@link Clock#systemUTC()})</li>
 *   <li>rateGuardListener: 진단 수신자 (기본 SLF4J warn 로그)</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * // 운영 환경: 진단 비활성화
 * StreamingStoreConfig config = new StreamingStoreConfig()
 *     .withRateGuard(RateGuardConfig.disabled());
 *
 * // 테스트: 시각 주입
 * StreamingStoreConfig config = new StreamingStoreConfig()
 *     .withClock(mutableClock)
 *     .withRateGuardListener(violations::add);
 * </pre>
 *
 * @author KvStream Team
 * @since 1.0.0
 * @param rateGuard 재구독 진단 설정
 * @param clock 시각 공급자
 * @param rateGuardListener 진단 수신자
 */
public record StreamingStoreConfig(
    RateGuardConfig rateGuard,
    Clock clock,
    RateGuardListener rateGuardListener
) {

    /**
     * 기본 설정 생성자.
     */
    public StreamingStoreConfig() {
        this(new RateGuardConfig(), Clock.systemUTC(), RateGuardListener.logging());
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public StreamingStoreConfig {
        if (rateGuard == null) {
            throw new IllegalArgumentException("rateGuard cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        if (rateGuardListener == null) {
            throw new IllegalArgumentException("rateGuardListener cannot be null");
        }
    }

    /**
     * rateGuard만 변경한 새 인스턴스 생성.
     */
    public StreamingStoreConfig withRateGuard(RateGuardConfig rateGuard) {
        return new StreamingStoreConfig(rateGuard, clock, rateGuardListener);
    }

    /**
     * clock만 변경한 새 인스턴스 생성.
     */
    public StreamingStoreConfig withClock(Clock clock) {
        return new StreamingStoreConfig(rateGuard, clock, rateGuardListener);
    }

    /**
     * rateGuardListener만 변경한 새 인스턴스 생성.
     */
    public StreamingStoreConfig withRateGuardListener(RateGuardListener rateGuardListener) {
        return new StreamingStoreConfig(rateGuard, clock, rateGuardListener);
    }
}
