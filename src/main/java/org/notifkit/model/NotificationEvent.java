package org.notifkit.model;

import org.notifkit.pool.Poolable;

import java.time.Instant;

/**
 * Event handed to subscribers. The instance is pooled and only valid for the duration of the
 * listener call.
 */
public final class NotificationEvent implements Poolable {

    public enum Type {
        RECEIVED,
        TAPPED,
        PERMISSION_GRANTED,
        PERMISSION_DENIED,
        ERROR
    }

    private Type type;
    private String identifier;
    private String title;
    private String body;
    private Instant timestamp;
    private String operation;
    private Throwable error;

    public void fill(Type type, String identifier, String title, String body, Instant timestamp) {
        this.type = type;
        this.identifier = identifier;
        this.title = title == null ? "" : title;
        this.body = body == null ? "" : body;
        this.timestamp = timestamp;
    }

    public void fillError(String operation, Throwable error, Instant timestamp) {
        fill(Type.ERROR, null, operation, error == null ? "" : String.valueOf(error.getMessage()), timestamp);
        this.operation = operation;
        this.error = error;
    }

    @Override
    public void reset() {
        type = null;
        identifier = null;
        title = null;
        body = null;
        timestamp = null;
        operation = null;
        error = null;
    }

    public Type getType() {
        return type;
    }

    public String getIdentifier() {
        return identifier;
    }

    public String getTitle() {
        return title;
    }

    public String getBody() {
        return body;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public String getOperation() {
        return operation;
    }

    public Throwable getError() {
        return error;
    }

    @Override
    public String toString() {
        return "NotificationEvent{" + type + ", identifier=" + identifier + ", title=" + title + '}';
    }
}
