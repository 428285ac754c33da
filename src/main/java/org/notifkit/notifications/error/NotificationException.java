package org.notifkit.notifications.error;

/**
 * Root of every failure the notification engine reports. Unchecked: synchronous callers get booleans,
 * asynchronous callers get a future completed with one of the subclasses.
 */
public class NotificationException extends RuntimeException {

    public NotificationException(String message) {
        super(message);
    }

    public NotificationException(String message, Throwable cause) {
        super(message, cause);
    }
}
