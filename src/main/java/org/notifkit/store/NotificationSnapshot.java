package org.notifkit.store;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import org.notifkit.model.ReturnNotificationConfig;

import java.util.List;

/**
 * Everything the engine persists. The checksum is the CRC-32 of the serialized snapshot with
 * {@code crc32} set to zero; it comes first in the output so it can be located in the raw bytes.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"crc32", "version", "lastOpenUnixTime", "returnConfig", "notifications"})
public record NotificationSnapshot(
        long crc32,
        int version,
        long lastOpenUnixTime,
        ReturnNotificationConfig returnConfig,
        List<SnapshotEntry> notifications
) {

    public static final int CURRENT_VERSION = 1;

    public NotificationSnapshot {
        notifications = notifications == null ? List.of() : List.copyOf(notifications);
    }

    public static NotificationSnapshot of(List<SnapshotEntry> entries, ReturnNotificationConfig config,
                                          long lastOpenUnixTime) {
        return new NotificationSnapshot(0L, CURRENT_VERSION, lastOpenUnixTime, config, entries);
    }

    public static NotificationSnapshot empty() {
        return of(List.of(), null, 0L);
    }

    public NotificationSnapshot withChecksum(long value) {
        return new NotificationSnapshot(value, version, lastOpenUnixTime, returnConfig, notifications);
    }

    @JsonIgnore
    public boolean isEmpty() {
        return notifications.isEmpty() && returnConfig == null && lastOpenUnixTime == 0L;
    }
}
