package org.notifkit.model;

import java.time.Instant;

/**
 * Point-in-time copy of the engine counters.
 */
public record PerformanceMetrics(
        long totalScheduled,
        long totalCancelled,
        long totalErrors,
        long poolHits,
        long poolMisses,
        long dispatcherDrops,
        double averageSaveTimeMs,
        Instant startTime
) {

    public double poolHitRate() {
        long total = poolHits + poolMisses;
        return total == 0 ? 0d : poolHits * 100d / total;
    }
}
