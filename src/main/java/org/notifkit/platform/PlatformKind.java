package org.notifkit.platform;

/**
 * The two supported scheduling backends and their pending-notification limits.
 */
public enum PlatformKind {
    CALENDAR_TRIGGER(64),
    FIRE_TIME(500);

    private final int maxPending;

    PlatformKind(int maxPending) {
        this.maxPending = maxPending;
    }

    public int maxPending() {
        return maxPending;
    }
}
