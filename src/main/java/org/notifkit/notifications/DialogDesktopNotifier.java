package org.notifkit.notifications;

import javafx.application.Platform;
import javafx.scene.control.Alert;
import javafx.scene.control.ButtonType;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * Fallback notifier that surfaces notifications inside the JavaFX app when the system tray is
 * unavailable. Pressing "Open" on the dialog counts as an activation.
 */
public final class DialogDesktopNotifier implements DesktopNotifier {

    private static final ButtonType OPEN = new ButtonType("Open");

    private final List<Alert> open = new ArrayList<>();
    private volatile Consumer<String> activationListener;

    @Override
    public void notify(String tag, String title, String message) {
        Platform.runLater(() -> {
            Alert alert = new Alert(Alert.AlertType.INFORMATION, message == null ? "" : message, OPEN, ButtonType.OK);
            alert.setHeaderText(title == null ? "Notification" : title);
            alert.resultProperty().addListener((obs, old, button) -> {
                open.remove(alert);
                Consumer<String> listener = activationListener;
                if (button == OPEN && listener != null) {
                    listener.accept(tag);
                }
            });
            open.add(alert);
            alert.show();
        });
    }

    @Override
    public void setActivationListener(Consumer<String> listener) {
        this.activationListener = listener;
    }

    @Override
    public void clearAll() {
        Platform.runLater(() -> {
            for (Alert alert : new ArrayList<>(open)) {
                alert.close();
            }
            open.clear();
        });
    }
}
