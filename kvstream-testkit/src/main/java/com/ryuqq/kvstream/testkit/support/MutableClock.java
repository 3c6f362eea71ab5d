package com.ryuqq.kvstream.testkit.support;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

/**
 * 테스트에서 직접 움직이는 Clock.
 *
 * <p>RateGuard처럼 {@link Clock}을 주입받는 컴포넌트의 시간 경과를 결정적으로 제어합니다.</p>
 *
 * @author KvStream Team
 * @since 1.0.0
 */
public final class MutableClock extends Clock {

    private final ZoneId zone;
    private volatile Instant now;

    public MutableClock(Instant start) {
        this(start, ZoneOffset.UTC);
    }

    private MutableClock(Instant start, ZoneId zone) {
        if (start == null) {
            throw new IllegalArgumentException("start cannot be null");
        }
        this.now = start;
        this.zone = zone;
    }

    /**
     * 시각 전진.
     *
     * @param duration 전진할 시간 (음수 불가)
     */
    public void advance(Duration duration) {
        if (duration == null || duration.isNegative()) {
            throw new IllegalArgumentException("duration must be non-negative");
        }
        now = now.plus(duration);
    }

    /**
     * 밀리초 단위 전진.
     */
    public void advanceMillis(long millis) {
        advance(Duration.ofMillis(millis));
    }

    @Override
    public ZoneId getZone() {
        return zone;
    }

    @Override
    public Clock withZone(ZoneId zone) {
        return new MutableClock(now, zone);
    }

    @Override
    public Instant instant() {
        return now;
    }
}
