package org.notifkit.notifications;

import org.notifkit.model.PerformanceMetrics;

import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Counters updated from any thread. Pool and dispatcher counters are folded in periodically by the
 * engine tick.
 */
public final class EngineMetrics {

    private final Clock clock;
    private final AtomicLong scheduled = new AtomicLong();
    private final AtomicLong cancelled = new AtomicLong();
    private final AtomicLong errors = new AtomicLong();
    private final AtomicLong poolHits = new AtomicLong();
    private final AtomicLong poolMisses = new AtomicLong();
    private final AtomicLong dispatcherDrops = new AtomicLong();
    private final AtomicLong saves = new AtomicLong();
    private final AtomicLong saveNanos = new AtomicLong();
    private volatile Instant startTime;

    public EngineMetrics(Clock clock) {
        this.clock = clock;
        this.startTime = clock.instant();
    }

    public void recordScheduled() {
        scheduled.incrementAndGet();
    }

    public void recordCancelled(int count) {
        cancelled.addAndGet(count);
    }

    public void recordError() {
        errors.incrementAndGet();
    }

    public void recordPool(long hits, long misses) {
        poolHits.addAndGet(hits);
        poolMisses.addAndGet(misses);
    }

    public void recordDispatcherDrops(long count) {
        dispatcherDrops.addAndGet(count);
    }

    public void recordSave(long elapsedNanos) {
        saves.incrementAndGet();
        saveNanos.addAndGet(elapsedNanos);
    }

    public PerformanceMetrics snapshot() {
        long saveCount = saves.get();
        double averageMs = saveCount == 0 ? 0d : saveNanos.get() / 1_000_000d / saveCount;
        return new PerformanceMetrics(scheduled.get(), cancelled.get(), errors.get(), poolHits.get(),
                poolMisses.get(), dispatcherDrops.get(), averageMs, startTime);
    }

    public void reset() {
        scheduled.set(0);
        cancelled.set(0);
        errors.set(0);
        poolHits.set(0);
        poolMisses.set(0);
        dispatcherDrops.set(0);
        saves.set(0);
        saveNanos.set(0);
        startTime = clock.instant();
    }
}
