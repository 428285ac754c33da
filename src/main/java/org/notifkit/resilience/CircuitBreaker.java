package org.notifkit.resilience;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Consecutive-failure breaker guarding platform and persistence calls.
 * <p>
 * Closed until {@code threshold} errors arrive without a success in between, then open for
 * {@code cooldown} measured from the moment it opened. Closing happens only through
 * {@link #checkCooldown()}, which the engine tick calls at a bounded rate.
 */
public final class CircuitBreaker {

    private static final Logger log = LoggerFactory.getLogger(CircuitBreaker.class);

    public enum State { CLOSED, OPEN }

    private final Object lock = new Object();
    private final int threshold;
    private final Duration cooldown;
    private final Duration checkInterval;
    private final Clock clock;

    private int consecutiveErrors;
    private boolean open;
    private Instant openedAt = Instant.EPOCH;
    private Instant lastCheck = Instant.EPOCH;

    public CircuitBreaker(int threshold, Duration cooldown, Duration checkInterval, Clock clock) {
        if (threshold < 1) {
            throw new IllegalArgumentException("threshold must be >= 1: " + threshold);
        }
        this.threshold = threshold;
        this.cooldown = Objects.requireNonNull(cooldown, "cooldown");
        this.checkInterval = Objects.requireNonNull(checkInterval, "checkInterval");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public void recordSuccess() {
        synchronized (lock) {
            consecutiveErrors = 0;
        }
    }

    public void recordError() {
        synchronized (lock) {
            consecutiveErrors++;
            if (!open && consecutiveErrors >= threshold) {
                open = true;
                openedAt = clock.instant();
                log.warn("[CircuitBreaker] Opened after {} consecutive errors, cooling down for {}s",
                        consecutiveErrors, cooldown.toSeconds());
            }
        }
    }

    public boolean isOpen() {
        synchronized (lock) {
            return open;
        }
    }

    public State state() {
        return isOpen() ? State.OPEN : State.CLOSED;
    }

    public int consecutiveErrors() {
        synchronized (lock) {
            return consecutiveErrors;
        }
    }

    /**
     * Closes the breaker once the cool-down has elapsed. Calls closer together than the check
     * interval are ignored.
     *
     * @return true if this call closed the breaker
     */
    public boolean checkCooldown() {
        Instant now = clock.instant();
        synchronized (lock) {
            if (Duration.between(lastCheck, now).compareTo(checkInterval) < 0) {
                return false;
            }
            lastCheck = now;
            if (!open) {
                return false;
            }
            if (Duration.between(openedAt, now).compareTo(cooldown) < 0) {
                return false;
            }
            open = false;
            consecutiveErrors = 0;
        }
        log.info("[CircuitBreaker] Closed after cool-down");
        return true;
    }

    public void reset() {
        synchronized (lock) {
            open = false;
            consecutiveErrors = 0;
            lastCheck = Instant.EPOCH;
        }
    }
}
