package org.notifkit.platform;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * When a pending notification fires, and when it fires again after that.
 */
public interface FirePlan {

    Instant first();

    /**
     * @return the occurrence following {@code previous}, empty for one-shot plans
     */
    Optional<Instant> nextAfter(Instant previous);

    static FirePlan once(Instant at) {
        return new FirePlan() {
            @Override
            public Instant first() {
                return at;
            }

            @Override
            public Optional<Instant> nextAfter(Instant previous) {
                return Optional.empty();
            }
        };
    }

    static FirePlan every(Instant first, Duration period) {
        if (period.isZero() || period.isNegative()) {
            throw new IllegalArgumentException("period must be positive: " + period);
        }
        return new FirePlan() {
            @Override
            public Instant first() {
                return first;
            }

            @Override
            public Optional<Instant> nextAfter(Instant previous) {
                return Optional.of(previous.plus(period));
            }
        };
    }
}
