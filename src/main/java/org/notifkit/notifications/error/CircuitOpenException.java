package org.notifkit.notifications.error;

/**
 * Raised when an operation is short-circuited because the circuit breaker is open.
 */
public final class CircuitOpenException extends NotificationException {

    public CircuitOpenException(String operation) {
        super("Circuit breaker open, rejected " + operation);
    }
}
