package org.notifkit.model;

public enum Importance {
    NONE,
    LOW,
    DEFAULT,
    HIGH
}
