package org.notifkit.notifications.error;

public final class PersistenceException extends NotificationException {

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
