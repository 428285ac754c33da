package org.notifkit.notifications;

import org.notifkit.dispatch.CancellationSignal;
import org.notifkit.model.NotificationDescriptor;
import org.notifkit.model.RepeatInterval;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;

/**
 * Fluent front end over a pooled {@link NotificationDescriptor}. A builder schedules once; it is
 * spent afterwards.
 */
public final class NotificationBuilder {

    private final NotificationService service;
    private NotificationDescriptor descriptor;

    NotificationBuilder(NotificationService service, NotificationDescriptor descriptor) {
        this.service = service;
        this.descriptor = descriptor;
    }

    public NotificationBuilder title(String title) {
        current().setTitle(title);
        return this;
    }

    public NotificationBuilder body(String body) {
        current().setBody(body);
        return this;
    }

    public NotificationBuilder subtitle(String subtitle) {
        current().setSubtitle(subtitle);
        return this;
    }

    public NotificationBuilder delaySeconds(int seconds) {
        current().setFireDelaySeconds(seconds);
        return this;
    }

    public NotificationBuilder delay(Duration delay) {
        long seconds = delay == null ? 0 : delay.getSeconds();
        current().setFireDelaySeconds((int) Math.min(Integer.MAX_VALUE, seconds));
        return this;
    }

    /**
     * Fire at an absolute time, rounded up to the next second. Past instants fire immediately.
     */
    public NotificationBuilder at(Instant fireAt) {
        Instant now = service.clock().instant();
        long millis = fireAt == null ? 0 : Duration.between(now, fireAt).toMillis();
        long seconds = Math.max(0, (millis + 999) / 1000);
        current().setFireDelaySeconds((int) Math.min(Integer.MAX_VALUE, seconds));
        return this;
    }

    public NotificationBuilder identifier(String identifier) {
        current().setIdentifier(identifier);
        return this;
    }

    public NotificationBuilder repeat(RepeatInterval interval) {
        current().setRepeatInterval(interval);
        current().setRepeats(interval != null && interval != RepeatInterval.NONE);
        return this;
    }

    public NotificationBuilder repeatEvery(Duration period) {
        current().setRepeatInterval(RepeatInterval.CUSTOM);
        current().setRepeats(true);
        current().setCustomRepeatSeconds(period == null ? 0 : (int) Math.min(Integer.MAX_VALUE, period.getSeconds()));
        return this;
    }

    public NotificationBuilder sound(String soundName) {
        current().setSoundName(soundName);
        return this;
    }

    public NotificationBuilder group(String groupKey) {
        current().setGroupKey(groupKey);
        return this;
    }

    public NotificationBuilder badge(int badge) {
        current().setBadgeOverride(badge);
        return this;
    }

    public boolean schedule() {
        return service.scheduleOwned(take());
    }

    public CompletableFuture<Integer> scheduleAsync(CancellationSignal signal) {
        return service.scheduleOwnedAsync(take(), signal);
    }

    /**
     * Gives the descriptor back without scheduling anything.
     */
    public void discard() {
        if (descriptor != null) {
            service.recycle(take());
        }
    }

    private NotificationDescriptor current() {
        if (descriptor == null) {
            throw new IllegalStateException("Builder already used");
        }
        return descriptor;
    }

    private NotificationDescriptor take() {
        NotificationDescriptor d = current();
        descriptor = null;
        return d;
    }
}
