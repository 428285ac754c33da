package org.notifkit.notifications.error;

import java.time.Duration;

public final class OperationTimeoutException extends NotificationException {

    public OperationTimeoutException(String operation, Duration timeout) {
        super(operation + " did not complete within " + timeout.toMillis() + " ms");
    }
}
