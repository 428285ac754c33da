package org.notifkit.model;

public enum NotificationStatus {
    SCHEDULED,
    DELIVERED,
    EXPIRED,
    NOT_FOUND,
    UNKNOWN,
    ERROR
}
