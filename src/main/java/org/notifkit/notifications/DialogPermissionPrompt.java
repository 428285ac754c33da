package org.notifkit.notifications;

import javafx.application.Platform;
import javafx.scene.control.Alert;
import javafx.scene.control.ButtonType;
import org.notifkit.platform.PermissionPrompt;

import java.util.function.Consumer;

/**
 * Asks for notification permission with a JavaFX confirmation dialog.
 */
public final class DialogPermissionPrompt implements PermissionPrompt {

    @Override
    public void request(Consumer<Boolean> answer) {
        Platform.runLater(() -> {
            Alert alert = new Alert(Alert.AlertType.CONFIRMATION,
                    "Allow this application to show notifications?", ButtonType.YES, ButtonType.NO);
            alert.setHeaderText("Notifications");
            ButtonType choice = alert.showAndWait().orElse(ButtonType.NO);
            answer.accept(choice == ButtonType.YES);
        });
    }
}
