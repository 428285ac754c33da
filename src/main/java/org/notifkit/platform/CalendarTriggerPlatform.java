package org.notifkit.platform;

import org.notifkit.model.NotificationDescriptor;
import org.notifkit.model.RepeatInterval;
import org.notifkit.notifications.DesktopNotifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZonedDateTime;

/**
 * Backend with a small pending limit whose repeats are wall-clock calendar triggers. One-shot
 * notifications use an interval trigger; custom repeats use a repeating interval of at least a
 * minute. Keeps an application badge counter.
 */
public final class CalendarTriggerPlatform extends AbstractTimerPlatform {

    private static final Logger log = LoggerFactory.getLogger(CalendarTriggerPlatform.class);
    static final Duration MIN_REPEAT_INTERVAL = Duration.ofSeconds(60);

    private final Object badgeLock = new Object();
    private final boolean autoIncrementBadge;
    private int badgeCount;

    public CalendarTriggerPlatform(DesktopNotifier sink, PermissionPrompt prompt, Clock clock,
                                   boolean autoIncrementBadge) {
        super(sink, prompt, clock, null);
        this.autoIncrementBadge = autoIncrementBadge;
    }

    @Override
    public PlatformKind kind() {
        return PlatformKind.CALENDAR_TRIGGER;
    }

    @Override
    protected FirePlan planFor(NotificationDescriptor descriptor, Instant now) {
        Instant target = now.plusSeconds(Math.max(0, descriptor.getFireDelaySeconds()));
        if (!descriptor.isRepeating()) {
            return FirePlan.once(target);
        }
        ZonedDateTime local = target.atZone(clock.getZone());
        RepeatInterval interval = descriptor.getRepeatInterval();
        switch (interval) {
            case DAILY:
                return CalendarTrigger.daily(local).planFrom(now);
            case WEEKLY:
                return CalendarTrigger.weekly(local).planFrom(now);
            default:
                Duration period = Duration.ofSeconds(descriptor.getCustomRepeatSeconds());
                if (period.compareTo(MIN_REPEAT_INTERVAL) < 0) {
                    log.debug("[CalendarTriggerPlatform] Raising repeat interval of {} to {}s",
                            descriptor.getIdentifier(), MIN_REPEAT_INTERVAL.toSeconds());
                    period = MIN_REPEAT_INTERVAL;
                }
                return FirePlan.every(now.plus(period), period);
        }
    }

    /**
     * An explicit override wins and, without auto-increment, becomes the new counter; otherwise the
     * counter is incremented when auto-increment is on, or reused as is.
     */
    @Override
    protected int badgeFor(NotificationDescriptor descriptor) {
        synchronized (badgeLock) {
            int override = descriptor.getBadgeOverride();
            if (override >= 0) {
                if (!autoIncrementBadge) {
                    badgeCount = override;
                }
                return override;
            }
            if (autoIncrementBadge) {
                return ++badgeCount;
            }
            return badgeCount;
        }
    }

    @Override
    public void setBadgeCount(int count) {
        synchronized (badgeLock) {
            badgeCount = Math.max(0, count);
        }
        super.setBadgeCount(count);
    }

    public int badgeCount() {
        synchronized (badgeLock) {
            return badgeCount;
        }
    }

    @Override
    public void cancelAllDisplayed() {
        super.cancelAllDisplayed();
        setBadgeCount(0);
    }
}
