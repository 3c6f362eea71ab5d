package com.ryuqq.kvstream.core.guard;

import java.time.Duration;
import java.time.Instant;

/**
 * 과도한 재구독 진단 정보.
 *
 * @param key 대상 키 (집계 뷰는 {@link RateGuard#AGGREGATE_LABEL})
 * @param subscriptions 윈도우 내 구독 수
 * @param elapsed 윈도우 첫 구독부터 마지막 구독까지 경과 시간
 * @param detectedAt 감지 시각
 *
 * @author KvStream Team
 * @since 1.0.0
 */
public record RateGuardViolation(
    String key,
    int subscriptions,
    Duration elapsed,
    Instant detectedAt
) {

    /**
     * 사람이 읽을 수 있는 진단 메시지.
     *
     * @return 메시지
     */
    public String message() {
        return "ObservableValue for key \"" + key + "\" was subscribed " + subscriptions
            + " times within " + elapsed.toMillis() + "ms. "
            + "This usually means a new ObservableValue is created and subscribed on every render "
            + "or request cycle, which re-reads the store each time. "
            + "Create the ObservableValue once and reuse it.";
    }
}
