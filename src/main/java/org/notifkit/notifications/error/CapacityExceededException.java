package org.notifkit.notifications.error;

public final class CapacityExceededException extends NotificationException {

    private final int limit;

    public CapacityExceededException(int limit) {
        super("Platform pending-notification limit reached (" + limit + ")");
        this.limit = limit;
    }

    public int limit() {
        return limit;
    }
}
