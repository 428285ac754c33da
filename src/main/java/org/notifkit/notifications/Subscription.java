package org.notifkit.notifications;

/**
 * Handle returned by {@link NotificationEvents#subscribe}; closing it stops delivery.
 */
@FunctionalInterface
public interface Subscription extends AutoCloseable {

    @Override
    void close();
}
