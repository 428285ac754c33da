package org.notifkit.model;

import java.time.Duration;
import java.util.Optional;

/**
 * Repeat policy of a notification.
 */
public enum RepeatInterval {
    NONE,
    DAILY,
    WEEKLY,
    CUSTOM;

    /**
     * Fixed period of the interval, empty for {@link #NONE} and {@link #CUSTOM} whose period is
     * carried by the descriptor.
     */
    public Optional<Duration> fixedPeriod() {
        return switch (this) {
            case DAILY -> Optional.of(Duration.ofDays(1));
            case WEEKLY -> Optional.of(Duration.ofDays(7));
            default -> Optional.empty();
        };
    }
}
