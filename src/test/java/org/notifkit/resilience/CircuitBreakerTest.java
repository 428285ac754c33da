package org.notifkit.resilience;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.notifkit.support.MutableClock;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CircuitBreakerTest {

    private MutableClock clock;
    private CircuitBreaker breaker;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));
        breaker = new CircuitBreaker(5, Duration.ofSeconds(60), Duration.ofSeconds(1), clock);
    }

    @Test
    @DisplayName("Opens on the fifth consecutive error")
    void opensAtThreshold() {
        for (int i = 0; i < 4; i++) {
            breaker.recordError();
        }
        assertFalse(breaker.isOpen());

        breaker.recordError();

        assertTrue(breaker.isOpen());
        assertEquals(CircuitBreaker.State.OPEN, breaker.state());
    }

    @Test
    @DisplayName("A success in between resets the count")
    void successResetsCount() {
        for (int i = 0; i < 4; i++) {
            breaker.recordError();
        }
        breaker.recordSuccess();
        breaker.recordError();

        assertFalse(breaker.isOpen());
        assertEquals(1, breaker.consecutiveErrors());
    }

    @Test
    @DisplayName("Closes only once the cool-down has elapsed")
    void closesAfterCooldown() {
        for (int i = 0; i < 5; i++) {
            breaker.recordError();
        }

        clock.advance(Duration.ofSeconds(59));
        assertFalse(breaker.checkCooldown());
        assertTrue(breaker.isOpen());

        clock.advance(Duration.ofSeconds(1));
        assertTrue(breaker.checkCooldown());
        assertFalse(breaker.isOpen());
        assertEquals(0, breaker.consecutiveErrors());
    }

    @Test
    @DisplayName("Checks closer together than the check interval are ignored")
    void checkIsRateLimited() {
        for (int i = 0; i < 5; i++) {
            breaker.recordError();
        }
        clock.advance(Duration.ofMillis(59_500));
        assertFalse(breaker.checkCooldown());

        clock.advance(Duration.ofMillis(600));
        assertFalse(breaker.checkCooldown());
        assertTrue(breaker.isOpen());

        clock.advance(Duration.ofMillis(400));
        assertTrue(breaker.checkCooldown());
    }

    @Test
    void resetClosesImmediately() {
        for (int i = 0; i < 5; i++) {
            breaker.recordError();
        }

        breaker.reset();

        assertFalse(breaker.isOpen());
        assertEquals(0, breaker.consecutiveErrors());
    }

    @Test
    void thresholdMustBePositive() {
        assertThrows(IllegalArgumentException.class,
                () -> new CircuitBreaker(0, Duration.ofSeconds(1), Duration.ofSeconds(1), clock));
    }
}
