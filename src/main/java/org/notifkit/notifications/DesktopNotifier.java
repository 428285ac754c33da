package org.notifkit.notifications;

import java.util.function.Consumer;

/**
 * Abstraction representing a component able to surface desktop notifications.
 */
public interface DesktopNotifier {

    /**
     * Displays a notification payload to the user.
     *
     * @param tag     identifier of the notification, reported back on activation
     * @param title   short headline for the notification
     * @param message detailed body content
     */
    void notify(String tag, String title, String message);

    /**
     * Registers the callback invoked with the tag of a notification the user clicked. Sinks that
     * cannot detect activation ignore it.
     */
    default void setActivationListener(Consumer<String> listener) {
    }

    /**
     * Removes every notification this sink is still showing.
     */
    default void clearAll() {
    }

    default void showBadge(int count) {
    }
}
