package com.ryuqq.kvstream.core.guard;

import java.time.Duration;

/**
 * Rate Guard 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>enabled: 추적 활성화 여부 (기본 true, 운영 환경에서는 {@link #disabled()} 권장)</li>
 *   <li>threshold: 윈도우 첫 구독과 마지막 구독 사이 최소 허용 간격 (기본 750ms)</li>
 *   <li>windowSize: 비교할 구독 이벤트 수 (기본 4, 즉 3개 전 타임스탬프와 비교)</li>
 * </ul>
 *
 * <p>기본값은 "구독 1회당 약 250ms보다 빠른 주기가 지속되면 의심"에 해당합니다.</p>
 *
 * @author KvStream Team
 * @since 1.0.0
 * @param enabled 추적 활성화 여부
 * @param threshold 최소 허용 간격 (양수여야 함)
 * @param windowSize 윈도우 크기 (2 이상이어야 함)
 */
public record RateGuardConfig(
    boolean enabled,
    Duration threshold,
    int windowSize
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: enabled=true, threshold=750ms, windowSize=4</p>
     */
    public RateGuardConfig() {
        this(true, Duration.ofMillis(750), 4);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public RateGuardConfig {
        if (threshold == null) {
            throw new IllegalArgumentException("threshold cannot be null");
        }
        if (threshold.isZero() || threshold.isNegative()) {
            throw new IllegalArgumentException(
                "threshold must be positive (current: " + threshold + ")"
            );
        }
        if (windowSize < 2) {
            throw new IllegalArgumentException(
                "windowSize must be at least 2 (current: " + windowSize + ")"
            );
        }
    }

    /**
     * 비활성 설정.
     *
     * @return enabled=false, 나머지는 기본값
     */
    public static RateGuardConfig disabled() {
        return new RateGuardConfig().withEnabled(false);
    }

    /**
     * enabled만 변경한 새 인스턴스 생성.
     */
    public RateGuardConfig withEnabled(boolean enabled) {
        return new RateGuardConfig(enabled, threshold, windowSize);
    }

    /**
     * threshold만 변경한 새 인스턴스 생성.
     */
    public RateGuardConfig withThreshold(Duration threshold) {
        return new RateGuardConfig(enabled, threshold, windowSize);
    }

    /**
     * windowSize만 변경한 새 인스턴스 생성.
     */
    public RateGuardConfig withWindowSize(int windowSize) {
        return new RateGuardConfig(enabled, threshold, windowSize);
    }
}
