package org.notifkit.policy;

import org.notifkit.model.NotificationDescriptor;

/**
 * Engine operations the return-notification policy drives.
 */
public interface NotificationCommands {

    boolean schedule(NotificationDescriptor descriptor);

    boolean cancel(String identifier);

    void clearDisplayed();

    /**
     * @return the permission after re-reading it
     */
    boolean refreshPermission();

    void requestFlush();
}
