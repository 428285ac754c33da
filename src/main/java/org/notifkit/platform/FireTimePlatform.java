package org.notifkit.platform;

import org.notifkit.model.ChannelConfig;
import org.notifkit.model.NotificationDescriptor;
import org.notifkit.notifications.DesktopNotifier;
import org.notifkit.notifications.error.PlatformException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Backend with a large pending limit, absolute fire times and native fixed-period repeats.
 * Nothing can be scheduled before a channel is registered.
 */
public final class FireTimePlatform extends AbstractTimerPlatform {

    private static final Logger log = LoggerFactory.getLogger(FireTimePlatform.class);

    private volatile ChannelConfig channel;

    public FireTimePlatform(DesktopNotifier sink, PermissionPrompt prompt, Clock clock) {
        super(sink, prompt, clock, Boolean.TRUE);
    }

    @Override
    public PlatformKind kind() {
        return PlatformKind.FIRE_TIME;
    }

    @Override
    public void registerChannel(ChannelConfig config) {
        ChannelConfig normalized = (config == null ? ChannelConfig.defaults() : config).normalized();
        this.channel = normalized;
        log.info("[FireTimePlatform] Channel '{}' registered (importance {}, vibration {}, lights {}, badge {}, bypassDnd {})",
                normalized.id(), normalized.importance(), normalized.enableVibration(), normalized.enableLights(),
                normalized.showBadge(), normalized.canBypassDnd());
    }

    public ChannelConfig channel() {
        return channel;
    }

    @Override
    protected void checkReady(NotificationDescriptor descriptor) {
        if (channel == null) {
            throw new PlatformException("No notification channel registered");
        }
    }

    @Override
    protected int badgeFor(NotificationDescriptor descriptor) {
        ChannelConfig current = channel;
        if (current == null || !current.showBadge()) {
            return -1;
        }
        return descriptor.getBadgeOverride();
    }

    @Override
    protected FirePlan planFor(NotificationDescriptor descriptor, Instant now) {
        Instant fireAt = now.plusSeconds(Math.max(0, descriptor.getFireDelaySeconds()));
        if (!descriptor.isRepeating()) {
            return FirePlan.once(fireAt);
        }
        Duration period = descriptor.getRepeatInterval().fixedPeriod()
                .orElseGet(() -> Duration.ofSeconds(descriptor.getCustomRepeatSeconds()));
        return FirePlan.every(fireAt, period);
    }
}
