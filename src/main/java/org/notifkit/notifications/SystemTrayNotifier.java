package org.notifkit.notifications;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.AWTException;
import java.awt.Image;
import java.awt.SystemTray;
import java.awt.Toolkit;
import java.awt.TrayIcon;
import java.io.IOException;
import java.io.InputStream;
import java.util.Base64;
import java.util.Objects;
import java.util.function.Consumer;
import javax.imageio.ImageIO;

/**
 * Desktop notifier backed by {@link SystemTray}. Displays operating system popups; a click on the
 * balloon is reported as an activation of the last notification shown.
 */
public final class SystemTrayNotifier implements DesktopNotifier {

    private static final Logger log = LoggerFactory.getLogger(SystemTrayNotifier.class);
    private static final String TOOLTIP = "notifkit";
    private static final String FALLBACK_ICON =
            "iVBORw0KGgoAAAANSUhEUgAAABAAAAAQCAYAAAAf8/9hAAAACklEQVR4nGNgAAIAAAUAAQ0KLbQAAAAASUVORK5CYII=";

    private final SystemTray tray;
    private final TrayIcon trayIcon;
    private volatile String lastTag;
    private volatile Consumer<String> activationListener;

    public SystemTrayNotifier() {
        if (!SystemTray.isSupported()) {
            throw new IllegalStateException("System tray not supported on this platform.");
        }
        this.tray = SystemTray.getSystemTray();
        this.trayIcon = new TrayIcon(loadIcon(), TOOLTIP);
        trayIcon.setImageAutoSize(true);
        trayIcon.addActionListener(e -> {
            Consumer<String> listener = activationListener;
            String tag = lastTag;
            if (listener != null && tag != null) {
                listener.accept(tag);
            }
        });
        installIntoTray();
    }

    private void installIntoTray() {
        for (TrayIcon existing : tray.getTrayIcons()) {
            if (Objects.equals(existing.getToolTip(), TOOLTIP)) {
                tray.remove(existing);
            }
        }
        try {
            tray.add(trayIcon);
        } catch (AWTException e) {
            throw new IllegalStateException("Unable to add application icon to the system tray.", e);
        }
    }

    public TrayIcon trayIcon() {
        return trayIcon;
    }

    public void dispose() {
        tray.remove(trayIcon);
    }

    @Override
    public void notify(String tag, String title, String message) {
        lastTag = tag;
        String safeTitle = title == null ? "Notification" : title;
        String safeMessage = message == null ? "" : message;
        trayIcon.displayMessage(safeTitle, safeMessage, TrayIcon.MessageType.INFO);
    }

    @Override
    public void setActivationListener(Consumer<String> listener) {
        this.activationListener = listener;
    }

    @Override
    public void clearAll() {
        lastTag = null;
    }

    @Override
    public void showBadge(int count) {
        trayIcon.setToolTip(count > 0 ? TOOLTIP + " (" + count + ")" : TOOLTIP);
    }

    private Image loadIcon() {
        try (InputStream in = getClass().getResourceAsStream("/tray-icon.png")) {
            if (in != null) {
                Image image = ImageIO.read(in);
                if (image != null) {
                    return image;
                }
            }
        } catch (IOException ex) {
            log.debug("[SystemTrayNotifier] Bundled icon unreadable, using fallback", ex);
        }
        return Toolkit.getDefaultToolkit().createImage(Base64.getDecoder().decode(FALLBACK_ICON));
    }
}
