package org.notifkit.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Settings of the "come back" notification scheduled when the application goes to background.
 * The record is immutable; use {@link #normalized()} to obtain a sanitized copy.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"enabled", "title", "body", "hoursBeforeNotification", "repeating", "repeatInterval",
        "identifier", "urgentTitle", "urgentBody", "urgentDelaySeconds"})
public record ReturnNotificationConfig(
        boolean enabled,
        String title,
        String body,
        int hoursBeforeNotification,
        boolean repeating,
        RepeatInterval repeatInterval,
        String identifier,
        String urgentTitle,
        String urgentBody,
        int urgentDelaySeconds
) {

    public static final String GROUP = "return_group";
    public static final String URGENT_SUFFIX = "_urgent";

    private static final int MIN_HOURS = 1;
    private static final int MAX_HOURS = 24 * 30;
    private static final int MAX_URGENT_DELAY = 3600;

    public static ReturnNotificationConfig defaults() {
        return new ReturnNotificationConfig(
                true,
                "We miss you!",
                "Come back and pick up where you left off.",
                24,
                false,
                RepeatInterval.DAILY,
                "return_notification",
                "Long time no see!",
                "Something new is waiting for you.",
                60
        );
    }

    public ReturnNotificationConfig normalized() {
        ReturnNotificationConfig d = defaults();
        return new ReturnNotificationConfig(
                enabled,
                textOr(title, d.title()),
                textOr(body, d.body()),
                clamp(hoursBeforeNotification, MIN_HOURS, MAX_HOURS),
                repeating,
                repeatInterval == null ? d.repeatInterval() : repeatInterval,
                textOr(identifier, d.identifier()),
                textOr(urgentTitle, d.urgentTitle()),
                textOr(urgentBody, d.urgentBody()),
                clamp(urgentDelaySeconds, 0, MAX_URGENT_DELAY)
        );
    }

    public ReturnNotificationConfig withEnabled(boolean value) {
        return new ReturnNotificationConfig(value, title, body, hoursBeforeNotification, repeating, repeatInterval,
                identifier, urgentTitle, urgentBody, urgentDelaySeconds);
    }

    public String urgentIdentifier() {
        return identifier + URGENT_SUFFIX;
    }

    private static int clamp(int value, int min, int max) {
        return Math.min(Math.max(value, min), max);
    }

    private static String textOr(String value, String fallback) {
        if (value == null) {
            return fallback;
        }
        String trimmed = value.strip();
        return trimmed.isEmpty() ? fallback : trimmed;
    }
}
