package org.notifkit.notifications.error;

/**
 * The dispatcher queue was full and the action was not admitted.
 */
public final class DispatchRejectedException extends NotificationException {

    public DispatchRejectedException(int capacity) {
        super("Dispatcher queue full (" + capacity + "), action rejected");
    }
}
