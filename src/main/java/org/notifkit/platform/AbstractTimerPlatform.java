package org.notifkit.platform;

import org.notifkit.model.ChannelConfig;
import org.notifkit.model.NotificationDescriptor;
import org.notifkit.model.NotificationStatus;
import org.notifkit.notifications.DesktopNotifier;
import org.notifkit.notifications.error.CapacityExceededException;
import org.notifkit.notifications.error.PlatformException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Shared machinery of the desktop backends: pending notifications wait on a single timer thread and
 * are handed to a {@link DesktopNotifier} when they fire. Subclasses decide how a descriptor maps to
 * a {@link FirePlan}.
 */
public abstract class AbstractTimerPlatform implements PlatformAdapter {

    private static final Logger log = LoggerFactory.getLogger(AbstractTimerPlatform.class);
    private static final int HISTORY_LIMIT = 256;

    protected static final class Pending {
        final String identifier;
        final int platformId;
        final String title;
        final String body;
        final int badge;
        final FirePlan plan;
        Instant nextFire;
        ScheduledFuture<?> future;

        Pending(String identifier, int platformId, String title, String body, int badge, FirePlan plan) {
            this.identifier = identifier;
            this.platformId = platformId;
            this.title = title;
            this.body = body;
            this.badge = badge;
            this.plan = plan;
        }
    }

    protected final Clock clock;
    private final DesktopNotifier sink;
    private final PermissionPrompt prompt;
    private final ScheduledExecutorService timer;
    private final Object lock = new Object();
    private final Map<String, Pending> pending = new HashMap<>();
    private final Map<String, NotificationStatus> history = new LinkedHashMap<>(16, 0.75f, false) {
        @Override
        protected boolean removeEldestEntry(Map.Entry<String, NotificationStatus> eldest) {
            return size() > HISTORY_LIMIT;
        }
    };
    private final Map<String, Pending> shown = new HashMap<>();
    private final AtomicInteger nextId = new AtomicInteger(1);

    private volatile DeliveryListener deliveryListener;
    private volatile Boolean permission;

    protected AbstractTimerPlatform(DesktopNotifier sink, PermissionPrompt prompt, Clock clock,
                                    Boolean initialPermission) {
        this.sink = Objects.requireNonNull(sink, "sink");
        this.prompt = Objects.requireNonNull(prompt, "prompt");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.permission = initialPermission;
        String threadName = "notifkit-" + kind().name().toLowerCase().replace('_', '-');
        this.timer = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, threadName);
            t.setDaemon(true);
            return t;
        });
        sink.setActivationListener(this::handleActivation);
    }

    /**
     * Maps the descriptor to its fire times.
     */
    protected abstract FirePlan planFor(NotificationDescriptor descriptor, Instant now);

    /**
     * Hook run before anything is registered; throw {@link PlatformException} to refuse.
     */
    protected void checkReady(NotificationDescriptor descriptor) {
    }

    /**
     * Badge value shown with the notification, or -1 for none.
     */
    protected int badgeFor(NotificationDescriptor descriptor) {
        return -1;
    }

    @Override
    public int schedule(NotificationDescriptor descriptor) {
        Objects.requireNonNull(descriptor, "descriptor");
        String identifier = descriptor.getIdentifier();
        if (identifier == null || identifier.isBlank()) {
            throw new PlatformException("Notification without identifier");
        }
        checkReady(descriptor);
        Instant now = clock.instant();
        FirePlan plan = planFor(descriptor, now);
        int badge = badgeFor(descriptor);
        synchronized (lock) {
            Pending previous = pending.get(identifier);
            if (previous == null && pending.size() >= maxPending()) {
                throw new CapacityExceededException(maxPending());
            }
            if (previous != null) {
                cancelFuture(previous);
            }
            Pending entry = new Pending(identifier, nextId.getAndIncrement(),
                    descriptor.getTitle(), descriptor.getBody(), badge, plan);
            entry.nextFire = plan.first();
            try {
                arm(entry, now);
            } catch (RejectedExecutionException ex) {
                throw new PlatformException(kind() + " is shut down", ex);
            }
            pending.put(identifier, entry);
            history.remove(identifier);
            log.debug("[{}] Scheduled {} (id {}) for {}", kind(), identifier, entry.platformId, entry.nextFire);
            return entry.platformId;
        }
    }

    @Override
    public void cancel(String identifier, int platformId) {
        synchronized (lock) {
            Pending entry = pending.get(identifier);
            if (entry == null) {
                return;
            }
            if (entry.platformId != platformId) {
                log.debug("[{}] Ignoring stale cancel for {} (id {} vs {})", kind(), identifier, platformId,
                        entry.platformId);
                return;
            }
            cancelFuture(entry);
            pending.remove(identifier);
        }
    }

    @Override
    public void cancelAllScheduled() {
        synchronized (lock) {
            for (Pending entry : pending.values()) {
                cancelFuture(entry);
            }
            pending.clear();
        }
    }

    @Override
    public void cancelAllDisplayed() {
        synchronized (lock) {
            for (String identifier : shown.keySet()) {
                history.put(identifier, NotificationStatus.EXPIRED);
            }
            shown.clear();
        }
        sink.clearAll();
    }

    @Override
    public boolean hasPermission() {
        return Boolean.TRUE.equals(permission);
    }

    @Override
    public void requestPermission(Consumer<Boolean> callback) {
        Objects.requireNonNull(callback, "callback");
        Boolean decided = permission;
        if (decided != null) {
            callback.accept(decided);
            return;
        }
        prompt.request(answer -> {
            boolean granted = Boolean.TRUE.equals(answer);
            permission = granted;
            log.info("[{}] Notification permission {}", kind(), granted ? "granted" : "denied");
            callback.accept(granted);
        });
    }

    @Override
    public boolean refreshPermission() {
        Optional<Boolean> external = prompt.systemSetting();
        if (external.isPresent() && !external.get().equals(permission)) {
            log.info("[{}] Permission changed outside the application: {}", kind(), external.get());
            permission = external.get();
        }
        return hasPermission();
    }

    @Override
    public NotificationStatus queryStatus(String identifier, int platformId) {
        synchronized (lock) {
            Pending entry = pending.get(identifier);
            if (entry != null) {
                return entry.platformId == platformId ? NotificationStatus.SCHEDULED : NotificationStatus.UNKNOWN;
            }
            return history.getOrDefault(identifier, NotificationStatus.NOT_FOUND);
        }
    }

    @Override
    public int maxPending() {
        return kind().maxPending();
    }

    @Override
    public void setDeliveryListener(DeliveryListener listener) {
        this.deliveryListener = listener;
    }

    @Override
    public void setBadgeCount(int count) {
        sink.showBadge(Math.max(0, count));
    }

    @Override
    public void registerChannel(ChannelConfig channel) {
    }

    @Override
    public void shutdown() {
        cancelAllScheduled();
        timer.shutdownNow();
    }

    public int pendingCount() {
        synchronized (lock) {
            return pending.size();
        }
    }

    /**
     * Next fire time of a pending notification, used by diagnostics and tests.
     */
    public Optional<Instant> nextFireOf(String identifier) {
        synchronized (lock) {
            Pending entry = pending.get(identifier);
            return entry == null ? Optional.empty() : Optional.of(entry.nextFire);
        }
    }

    protected DesktopNotifier sink() {
        return sink;
    }

    private void arm(Pending entry, Instant now) {
        long delayMillis = Math.max(0L, Duration.between(now, entry.nextFire).toMillis());
        entry.future = timer.schedule(() -> fire(entry), delayMillis, TimeUnit.MILLISECONDS);
    }

    private void fire(Pending entry) {
        synchronized (lock) {
            if (pending.get(entry.identifier) != entry) {
                return;
            }
            Optional<Instant> next = entry.plan.nextAfter(entry.nextFire);
            if (next.isPresent()) {
                entry.nextFire = next.get();
                arm(entry, clock.instant());
            } else {
                pending.remove(entry.identifier);
            }
            shown.put(entry.identifier, entry);
            history.put(entry.identifier, NotificationStatus.DELIVERED);
        }
        if (Boolean.FALSE.equals(permission)) {
            log.debug("[{}] Permission denied, not displaying {}", kind(), entry.identifier);
            return;
        }
        try {
            if (entry.badge >= 0) {
                sink.showBadge(entry.badge);
            }
            sink.notify(entry.identifier, entry.title, entry.body);
        } catch (RuntimeException ex) {
            log.warn("[{}] Display sink failed for {}", kind(), entry.identifier, ex);
        }
        DeliveryListener listener = deliveryListener;
        if (listener != null) {
            listener.onReceived(entry.identifier, entry.title, entry.body);
        }
    }

    private void handleActivation(String identifier) {
        Pending entry;
        synchronized (lock) {
            entry = shown.get(identifier);
        }
        DeliveryListener listener = deliveryListener;
        if (entry == null || listener == null) {
            return;
        }
        listener.onTapped(entry.identifier, entry.title, entry.body);
    }

    private static void cancelFuture(Pending entry) {
        if (entry.future != null) {
            entry.future.cancel(false);
        }
    }
}
