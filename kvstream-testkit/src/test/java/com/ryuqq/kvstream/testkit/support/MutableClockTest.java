package com.ryuqq.kvstream.testkit.support;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MutableClockTest {

    private static final Instant START = Instant.parse("2024-01-01T00:00:00Z");

    @Test
    void advance_MovesInstantForward() {
        // Given
        MutableClock clock = new MutableClock(START);

        // When
        clock.advance(Duration.ofSeconds(1));
        clock.advanceMillis(250);

        // Then
        assertThat(clock.instant()).isEqualTo(START.plusMillis(1250));
        assertThat(clock.millis()).isEqualTo(START.toEpochMilli() + 1250);
    }

    @Test
    void advance_Negative_Throws() {
        MutableClock clock = new MutableClock(START);

        assertThatThrownBy(() -> clock.advance(Duration.ofMillis(-1)))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void withZone_KeepsInstant() {
        // Given
        MutableClock clock = new MutableClock(START);

        // When
        var zoned = clock.withZone(ZoneId.of("Asia/Seoul"));

        // Then
        assertThat(zoned.instant()).isEqualTo(START);
        assertThat(zoned.getZone()).isEqualTo(ZoneId.of("Asia/Seoul"));
    }
}
