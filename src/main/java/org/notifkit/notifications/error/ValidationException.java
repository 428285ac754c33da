package org.notifkit.notifications.error;

import java.util.List;

/**
 * Descriptor rejected before any platform call.
 */
public final class ValidationException extends NotificationException {

    private final List<String> problems;

    public ValidationException(List<String> problems) {
        super("Invalid notification: " + String.join(", ", problems));
        this.problems = List.copyOf(problems);
    }

    public ValidationException(String problem) {
        this(List.of(problem));
    }

    public List<String> problems() {
        return problems;
    }
}
