package org.notifkit.model;

/**
 * Channel registered once by the fire-time backend before anything can be scheduled on it.
 */
public record ChannelConfig(
        String id,
        String name,
        String description,
        Importance importance,
        boolean enableVibration,
        boolean enableLights,
        boolean showBadge,
        boolean canBypassDnd
) {

    public static ChannelConfig defaults() {
        return new ChannelConfig(
                "default_channel",
                "Default Channel",
                "Default notification channel",
                Importance.HIGH,
                true,
                true,
                true,
                false
        );
    }

    public ChannelConfig normalized() {
        ChannelConfig d = defaults();
        return new ChannelConfig(
                blank(id) ? d.id() : id.strip(),
                blank(name) ? d.name() : name.strip(),
                description == null ? "" : description.strip(),
                importance == null ? d.importance() : importance,
                enableVibration,
                enableLights,
                showBadge,
                canBypassDnd
        );
    }

    private static boolean blank(String value) {
        return value == null || value.isBlank();
    }
}
