package org.notifkit.notifications.error;

public final class PlatformException extends NotificationException {

    public PlatformException(String message) {
        super(message);
    }

    public PlatformException(String message, Throwable cause) {
        super(message, cause);
    }
}
