package org.notifkit.policy;

import org.notifkit.model.NotificationDescriptor;
import org.notifkit.model.ReturnNotificationConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Schedules a "come back" notification whenever the application goes to background and, after a
 * long absence, a short-delay urgent one when it returns.
 */
public final class ReturnNotificationPolicy {

    private static final Logger log = LoggerFactory.getLogger(ReturnNotificationPolicy.class);

    private final NotificationCommands commands;
    private final Clock clock;

    private volatile ReturnNotificationConfig config = ReturnNotificationConfig.defaults();
    private volatile Instant lastForeground;

    public ReturnNotificationPolicy(NotificationCommands commands, Clock clock) {
        this.commands = Objects.requireNonNull(commands, "commands");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public ReturnNotificationConfig config() {
        return config;
    }

    /**
     * Installs persisted state without side effects.
     *
     * @param lastForegroundUnixSeconds 0 when unknown
     */
    public void restore(ReturnNotificationConfig persisted, long lastForegroundUnixSeconds) {
        if (persisted != null) {
            config = persisted.normalized();
        }
        lastForeground = lastForegroundUnixSeconds > 0 ? Instant.ofEpochSecond(lastForegroundUnixSeconds) : null;
    }

    public void configure(ReturnNotificationConfig newConfig) {
        if (newConfig == null) {
            return;
        }
        ReturnNotificationConfig previous = config;
        config = newConfig.normalized();
        if (!previous.identifier().equals(config.identifier())) {
            commands.cancel(previous.identifier());
            commands.cancel(previous.urgentIdentifier());
        }
        if (!config.enabled()) {
            cancelBoth(config);
        }
        commands.requestFlush();
        log.info("[ReturnNotificationPolicy] Configured: enabled={}, after {} h", config.enabled(),
                config.hoursBeforeNotification());
    }

    public void setEnabled(boolean enabled) {
        config = config.withEnabled(enabled);
        if (!enabled) {
            cancelBoth(config);
        }
        commands.requestFlush();
    }

    /**
     * @return 0 when the application has never been in foreground
     */
    public double hoursSinceLastForeground() {
        Instant last = lastForeground;
        if (last == null) {
            return 0d;
        }
        Duration elapsed = Duration.between(last, clock.instant());
        return elapsed.isNegative() ? 0d : elapsed.toMillis() / 3_600_000d;
    }

    public long lastForegroundUnixSeconds() {
        Instant last = lastForeground;
        return last == null ? 0L : last.getEpochSecond();
    }

    public void onBackgrounded() {
        lastForeground = clock.instant();
        ReturnNotificationConfig cfg = config;
        if (cfg.enabled()) {
            commands.cancel(cfg.identifier());
            NotificationDescriptor descriptor = new NotificationDescriptor(cfg.title(), cfg.body(),
                    cfg.hoursBeforeNotification() * 3600, cfg.identifier());
            descriptor.setRepeats(cfg.repeating());
            descriptor.setRepeatInterval(cfg.repeating() ? cfg.repeatInterval() : null);
            descriptor.setGroupKey(ReturnNotificationConfig.GROUP);
            if (!commands.schedule(descriptor)) {
                log.warn("[ReturnNotificationPolicy] Return notification could not be scheduled");
            }
        }
        commands.requestFlush();
    }

    /**
     * Order matters: the absence is measured before the timestamp is refreshed, and the urgent
     * notification is scheduled after the cancellations so it survives them.
     */
    public void onForegrounded() {
        double hours = hoursSinceLastForeground();
        ReturnNotificationConfig cfg = config;
        cancelBoth(cfg);
        commands.clearDisplayed();
        commands.refreshPermission();
        lastForeground = clock.instant();
        if (cfg.enabled() && hours >= cfg.hoursBeforeNotification()) {
            log.info("[ReturnNotificationPolicy] Back after {} h, scheduling urgent notification",
                    String.format("%.1f", hours));
            NotificationDescriptor urgent = new NotificationDescriptor(cfg.urgentTitle(), cfg.urgentBody(),
                    cfg.urgentDelaySeconds(), cfg.urgentIdentifier());
            urgent.setGroupKey(ReturnNotificationConfig.GROUP);
            if (!commands.schedule(urgent)) {
                log.warn("[ReturnNotificationPolicy] Urgent notification could not be scheduled");
            }
        }
        commands.requestFlush();
    }

    private void cancelBoth(ReturnNotificationConfig cfg) {
        commands.cancel(cfg.identifier());
        commands.cancel(cfg.urgentIdentifier());
    }
}
