package org.notifkit.platform;

import org.notifkit.notifications.DesktopNotifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Locale;

/**
 * Picks the backend once at startup: {@code notifkit.platform} ({@code calendar} or
 * {@code firetime}) when set, otherwise macOS gets the calendar-trigger backend and every other
 * system the fire-time one.
 */
public final class PlatformSelector {

    private static final Logger log = LoggerFactory.getLogger(PlatformSelector.class);
    public static final String PROPERTY = "notifkit.platform";

    private PlatformSelector() {
    }

    public static PlatformKind select(String override, String osName) {
        if (override != null && !override.isBlank()) {
            String value = override.strip().toLowerCase(Locale.ROOT);
            if (value.startsWith("cal")) {
                return PlatformKind.CALENDAR_TRIGGER;
            }
            if (value.startsWith("fire")) {
                return PlatformKind.FIRE_TIME;
            }
            log.warn("[PlatformSelector] Unknown {}='{}', falling back to OS detection", PROPERTY, override);
        }
        String os = osName == null ? "" : osName.toLowerCase(Locale.ROOT);
        return os.contains("mac") ? PlatformKind.CALENDAR_TRIGGER : PlatformKind.FIRE_TIME;
    }

    public static PlatformAdapter create(DesktopNotifier sink, PermissionPrompt prompt, Clock clock) {
        PlatformKind kind = select(System.getProperty(PROPERTY), System.getProperty("os.name"));
        log.info("[PlatformSelector] Using {} backend (max {} pending)", kind, kind.maxPending());
        return create(kind, sink, prompt, clock);
    }

    public static PlatformAdapter create(PlatformKind kind, DesktopNotifier sink, PermissionPrompt prompt,
                                         Clock clock) {
        return switch (kind) {
            case CALENDAR_TRIGGER -> new CalendarTriggerPlatform(sink, prompt, clock, true);
            case FIRE_TIME -> new FireTimePlatform(sink, prompt, clock);
        };
    }
}
