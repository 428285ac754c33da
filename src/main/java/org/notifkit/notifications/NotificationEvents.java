package org.notifkit.notifications;

import org.notifkit.model.NotificationEvent;
import org.notifkit.pool.ObjectPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Fan-out of engine events to subscribers. Events are published from the dispatch thread; the
 * {@link NotificationEvent} instance is recycled once every listener returned.
 */
public final class NotificationEvents {

    private static final Logger log = LoggerFactory.getLogger(NotificationEvents.class);

    @FunctionalInterface
    public interface Listener {
        void onEvent(NotificationEvent event);
    }

    private record Registration(Listener listener, Set<NotificationEvent.Type> types) {
    }

    private final CopyOnWriteArrayList<Registration> registrations = new CopyOnWriteArrayList<>();
    private final ObjectPool<NotificationEvent> pool;
    private final Clock clock;

    NotificationEvents(ObjectPool<NotificationEvent> pool, Clock clock) {
        this.pool = Objects.requireNonNull(pool, "pool");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public Subscription subscribe(Listener listener) {
        return subscribe(listener, EnumSet.allOf(NotificationEvent.Type.class));
    }

    public Subscription subscribe(Listener listener, Set<NotificationEvent.Type> types) {
        Objects.requireNonNull(listener, "listener");
        Registration registration = new Registration(listener, EnumSet.copyOf(types));
        registrations.add(registration);
        return () -> registrations.remove(registration);
    }

    public int subscriberCount() {
        return registrations.size();
    }

    void publish(NotificationEvent.Type type, String identifier, String title, String body) {
        if (registrations.isEmpty()) {
            return;
        }
        NotificationEvent event = pool.acquire();
        event.fill(type, identifier, title, body, clock.instant());
        deliver(event);
    }

    void publishError(String operation, Throwable error) {
        if (registrations.isEmpty()) {
            return;
        }
        NotificationEvent event = pool.acquire();
        event.fillError(operation, error, clock.instant());
        deliver(event);
    }

    private void deliver(NotificationEvent event) {
        try {
            for (Registration registration : registrations) {
                if (!registration.types().contains(event.getType())) {
                    continue;
                }
                try {
                    registration.listener().onEvent(event);
                } catch (RuntimeException ex) {
                    log.warn("[NotificationEvents] Listener failed on {}", event.getType(), ex);
                }
            }
        } finally {
            pool.release(event);
        }
    }
}
