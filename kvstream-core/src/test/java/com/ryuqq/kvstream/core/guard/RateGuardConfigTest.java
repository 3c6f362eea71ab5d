package com.ryuqq.kvstream.core.guard;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * RateGuardConfig Record 테스트.
 *
 * @author KvStream Team
 * @since 1.0.0
 */
class RateGuardConfigTest {

    @Test
    void constructor_Default_UsesDocumentedValues() {
        // When
        RateGuardConfig config = new RateGuardConfig();

        // Then
        assertTrue(config.enabled());
        assertEquals(Duration.ofMillis(750), config.threshold());
        assertEquals(4, config.windowSize());
    }

    @Test
    void disabled_KeepsDefaultsButDisables() {
        // When
        RateGuardConfig config = RateGuardConfig.disabled();

        // Then
        assertFalse(config.enabled());
        assertEquals(Duration.ofMillis(750), config.threshold());
    }

    @Test
    void constructor_NullThreshold_ThrowsException() {
        // When & Then
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> new RateGuardConfig(true, null, 4)
        );
        assertTrue(exception.getMessage().contains("threshold cannot be null"));
    }

    @Test
    void constructor_ZeroThreshold_ThrowsException() {
        // When & Then
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> new RateGuardConfig(true, Duration.ZERO, 4)
        );
        assertTrue(exception.getMessage().contains("threshold must be positive"));
    }

    @Test
    void constructor_WindowSizeBelowTwo_ThrowsException() {
        // When & Then
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> new RateGuardConfig(true, Duration.ofMillis(750), 1)
        );
        assertTrue(exception.getMessage().contains("windowSize must be at least 2"));
    }

    @Test
    void withers_ReturnModifiedCopies() {
        // Given
        RateGuardConfig config = new RateGuardConfig();

        // When
        RateGuardConfig modified = config.withThreshold(Duration.ofSeconds(1)).withWindowSize(8).withEnabled(false);

        // Then
        assertEquals(new RateGuardConfig(false, Duration.ofSeconds(1), 8), modified);
        assertEquals(new RateGuardConfig(), config);
    }
}
