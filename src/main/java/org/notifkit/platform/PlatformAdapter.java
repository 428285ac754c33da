package org.notifkit.platform;

import org.notifkit.model.ChannelConfig;
import org.notifkit.model.NotificationDescriptor;
import org.notifkit.model.NotificationStatus;

import java.util.function.Consumer;

/**
 * Operating-system notification backend. The engine calls every method from the dispatch thread.
 */
public interface PlatformAdapter {

    /**
     * Registers a pending notification.
     *
     * @return the backend's id for it
     * @throws org.notifkit.notifications.error.PlatformException when the backend refuses
     */
    int schedule(NotificationDescriptor descriptor);

    void cancel(String identifier, int platformId);

    void cancelAllScheduled();

    void cancelAllDisplayed();

    boolean hasPermission();

    /**
     * Asks for permission if it has not been decided yet; {@code callback} receives the outcome.
     */
    void requestPermission(Consumer<Boolean> callback);

    /**
     * Re-reads a permission the user may have changed outside the application.
     *
     * @return the permission after the refresh
     */
    boolean refreshPermission();

    NotificationStatus queryStatus(String identifier, int platformId);

    int maxPending();

    PlatformKind kind();

    void setDeliveryListener(DeliveryListener listener);

    void setBadgeCount(int count);

    /**
     * Declares the channel notifications are posted to. Backends without channels ignore it.
     */
    void registerChannel(ChannelConfig channel);

    void shutdown();
}
