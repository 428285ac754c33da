package org.notifkit.model;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Properties;

/**
 * Tunables of the notification engine. The record is immutable; {@link #normalized()} clamps every
 * value into its supported range.
 */
public record EngineSettings(
        int maxTracked,
        Duration saveDebounce,
        int breakerThreshold,
        Duration breakerCooldown,
        Duration breakerCheckInterval,
        int dispatcherCapacity,
        int maxActionsPerTick,
        Duration tickBudget,
        Duration tickInterval,
        Duration asyncTimeout,
        Duration permissionTimeout,
        Duration shutdownFlushBudget,
        long maxSnapshotBytes,
        int maxBatchSize,
        int descriptorPoolSize,
        int eventPoolSize,
        Duration metricsFlushInterval,
        boolean fsyncBeforeRename
) {

    private static final Logger log = LoggerFactory.getLogger(EngineSettings.class);
    private static final String PREFIX = "notifkit.";

    public static EngineSettings defaults() {
        return new EngineSettings(
                100,
                Duration.ofMillis(500),
                5,
                Duration.ofSeconds(60),
                Duration.ofSeconds(1),
                1024,
                128,
                Duration.ofMillis(2),
                Duration.ofMillis(16),
                Duration.ofSeconds(5),
                Duration.ofSeconds(10),
                Duration.ofSeconds(2),
                5L * 1024 * 1024,
                50,
                20,
                10,
                Duration.ofSeconds(1),
                true
        );
    }

    /**
     * Reads {@code notifkit.*} keys, falling back to {@link #defaults()} for anything missing or
     * unparsable.
     */
    public static EngineSettings fromProperties(Properties props) {
        EngineSettings d = defaults();
        if (props == null) {
            return d;
        }
        return new EngineSettings(
                intProp(props, "maxTracked", d.maxTracked()),
                millisProp(props, "saveDebounceMs", d.saveDebounce()),
                intProp(props, "breaker.threshold", d.breakerThreshold()),
                Duration.ofSeconds(intProp(props, "breaker.cooldownSeconds", (int) d.breakerCooldown().toSeconds())),
                millisProp(props, "breaker.checkIntervalMs", d.breakerCheckInterval()),
                intProp(props, "dispatcher.capacity", d.dispatcherCapacity()),
                intProp(props, "dispatcher.maxPerTick", d.maxActionsPerTick()),
                millisProp(props, "dispatcher.tickBudgetMs", d.tickBudget()),
                millisProp(props, "dispatcher.tickIntervalMs", d.tickInterval()),
                Duration.ofSeconds(intProp(props, "asyncTimeoutSeconds", (int) d.asyncTimeout().toSeconds())),
                Duration.ofSeconds(intProp(props, "permissionTimeoutSeconds", (int) d.permissionTimeout().toSeconds())),
                millisProp(props, "shutdownFlushMs", d.shutdownFlushBudget()),
                longProp(props, "maxSnapshotBytes", d.maxSnapshotBytes()),
                intProp(props, "maxBatchSize", d.maxBatchSize()),
                intProp(props, "pool.descriptors", d.descriptorPoolSize()),
                intProp(props, "pool.events", d.eventPoolSize()),
                millisProp(props, "metricsFlushMs", d.metricsFlushInterval()),
                Boolean.parseBoolean(props.getProperty(PREFIX + "fsyncBeforeRename",
                        String.valueOf(d.fsyncBeforeRename())))
        ).normalized();
    }

    public EngineSettings normalized() {
        return new EngineSettings(
                clamp(maxTracked, 1, 10_000),
                clamp(saveDebounce, Duration.ZERO, Duration.ofSeconds(30)),
                clamp(breakerThreshold, 1, 1000),
                clamp(breakerCooldown, Duration.ofSeconds(1), Duration.ofHours(1)),
                clamp(breakerCheckInterval, Duration.ofMillis(10), Duration.ofMinutes(1)),
                clamp(dispatcherCapacity, 1, 1 << 20),
                clamp(maxActionsPerTick, 1, 1 << 16),
                clamp(tickBudget, Duration.ofNanos(1), Duration.ofSeconds(1)),
                clamp(tickInterval, Duration.ofMillis(1), Duration.ofSeconds(1)),
                clamp(asyncTimeout, Duration.ofMillis(10), Duration.ofMinutes(5)),
                clamp(permissionTimeout, Duration.ofMillis(10), Duration.ofMinutes(5)),
                clamp(shutdownFlushBudget, Duration.ofMillis(10), Duration.ofMinutes(1)),
                Math.max(1024L, maxSnapshotBytes),
                clamp(maxBatchSize, 1, 10_000),
                clamp(descriptorPoolSize, 0, 1024),
                clamp(eventPoolSize, 0, 1024),
                clamp(metricsFlushInterval, Duration.ofMillis(10), Duration.ofMinutes(10)),
                fsyncBeforeRename
        );
    }

    public EngineSettings withMaxTracked(int value) {
        return new EngineSettings(value, saveDebounce, breakerThreshold, breakerCooldown, breakerCheckInterval,
                dispatcherCapacity, maxActionsPerTick, tickBudget, tickInterval, asyncTimeout, permissionTimeout,
                shutdownFlushBudget, maxSnapshotBytes, maxBatchSize, descriptorPoolSize, eventPoolSize,
                metricsFlushInterval, fsyncBeforeRename);
    }

    public EngineSettings withSaveDebounce(Duration value) {
        return new EngineSettings(maxTracked, value, breakerThreshold, breakerCooldown, breakerCheckInterval,
                dispatcherCapacity, maxActionsPerTick, tickBudget, tickInterval, asyncTimeout, permissionTimeout,
                shutdownFlushBudget, maxSnapshotBytes, maxBatchSize, descriptorPoolSize, eventPoolSize,
                metricsFlushInterval, fsyncBeforeRename);
    }

    public EngineSettings withAsyncTimeout(Duration value) {
        return new EngineSettings(maxTracked, saveDebounce, breakerThreshold, breakerCooldown, breakerCheckInterval,
                dispatcherCapacity, maxActionsPerTick, tickBudget, tickInterval, value, permissionTimeout,
                shutdownFlushBudget, maxSnapshotBytes, maxBatchSize, descriptorPoolSize, eventPoolSize,
                metricsFlushInterval, fsyncBeforeRename);
    }

    private static int intProp(Properties props, String key, int fallback) {
        String raw = props.getProperty(PREFIX + key);
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            return Integer.parseInt(raw.strip());
        } catch (NumberFormatException ex) {
            log.warn("[EngineSettings] Ignoring invalid value '{}' for {}{}", raw, PREFIX, key);
            return fallback;
        }
    }

    private static long longProp(Properties props, String key, long fallback) {
        String raw = props.getProperty(PREFIX + key);
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            return Long.parseLong(raw.strip());
        } catch (NumberFormatException ex) {
            log.warn("[EngineSettings] Ignoring invalid value '{}' for {}{}", raw, PREFIX, key);
            return fallback;
        }
    }

    private static Duration millisProp(Properties props, String key, Duration fallback) {
        return Duration.ofMillis(longProp(props, key, fallback.toMillis()));
    }

    private static int clamp(int value, int min, int max) {
        return Math.min(Math.max(value, min), max);
    }

    private static Duration clamp(Duration value, Duration min, Duration max) {
        if (value == null || value.compareTo(min) < 0) {
            return min;
        }
        return value.compareTo(max) > 0 ? max : value;
    }
}
