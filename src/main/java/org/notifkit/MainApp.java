package org.notifkit;

import com.fasterxml.jackson.databind.ObjectMapper;
import javafx.application.Application;
import javafx.application.Platform;
import javafx.collections.FXCollections;
import javafx.collections.ObservableList;
import javafx.geometry.Insets;
import javafx.scene.Scene;
import javafx.scene.control.Button;
import javafx.scene.control.Label;
import javafx.scene.control.ListView;
import javafx.scene.control.Spinner;
import javafx.scene.control.TextField;
import javafx.scene.layout.HBox;
import javafx.scene.layout.VBox;
import javafx.stage.Stage;
import org.notifkit.model.EngineSettings;
import org.notifkit.model.NotificationEvent;
import org.notifkit.notifications.DesktopNotifier;
import org.notifkit.notifications.DialogDesktopNotifier;
import org.notifkit.notifications.DialogPermissionPrompt;
import org.notifkit.notifications.NotificationService;
import org.notifkit.notifications.Subscription;
import org.notifkit.notifications.SystemTrayNotifier;
import org.notifkit.platform.PlatformAdapter;
import org.notifkit.platform.PlatformSelector;
import org.notifkit.store.SnapshotStore;
import org.notifkit.util.AppPaths;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;

/**
 * Desktop shell around the engine: minimizing or leaving the window counts as going to background,
 * restoring it as coming back.
 */
public final class MainApp extends Application {
    private static final Logger log = LoggerFactory.getLogger(MainApp.class);

    private NotificationService notificationService;
    private SystemTrayNotifier trayNotifier;
    private Subscription subscription;
    private Thread shutdownHook;
    private final ObservableList<String> tracked = FXCollections.observableArrayList();
    private final Label status = new Label();

    public static void main(String[] args) {
        launch(args);
    }

    @Override
    public void start(Stage stage) {
        Thread.setDefaultUncaughtExceptionHandler((t, e) -> log.error("Uncaught exception on {}", t.getName(), e));
        EngineSettings settings = EngineSettings.fromProperties(System.getProperties());
        Clock clock = Clock.systemDefaultZone();
        DesktopNotifier notifier = initDesktopNotifier();
        PlatformAdapter platform = PlatformSelector.create(notifier, new DialogPermissionPrompt(), clock);
        SnapshotStore store = new SnapshotStore(AppPaths.snapshotFile(), AppPaths.legacyPrefsFile(),
                new ObjectMapper(), settings.maxSnapshotBytes(), settings.fsyncBeforeRename());
        notificationService = new NotificationService(settings, platform, store, clock);
        notificationService.start();
        subscription = notificationService.events().subscribe(this::onEvent);
        shutdownHook = new Thread(notificationService::close, "notifkit-shutdown");
        Runtime.getRuntime().addShutdownHook(shutdownHook);

        stage.setScene(new Scene(buildView(), 520, 420));
        stage.setTitle("notifkit");
        stage.iconifiedProperty().addListener((obs, was, iconified) -> {
            if (iconified) {
                notificationService.onBackgrounded();
            } else {
                notificationService.onForegrounded();
            }
            refresh();
        });
        stage.show();
        notificationService.onForegrounded();
        notificationService.requestPermissionAsync(null).whenComplete((granted, error) -> {
            if (error != null) {
                log.warn("[MainApp] Permission request did not complete: {}", error.getMessage());
            }
            Platform.runLater(this::refresh);
        });
        refresh();
    }

    private DesktopNotifier initDesktopNotifier() {
        try {
            trayNotifier = new SystemTrayNotifier();
            return trayNotifier;
        } catch (Throwable ex) {
            log.info("[MainApp] System tray unavailable, falling back to dialogs: {}", ex.getMessage());
            trayNotifier = null;
            return new DialogDesktopNotifier();
        }
    }

    private VBox buildView() {
        TextField title = new TextField("Reminder");
        TextField body = new TextField("Time to take a break.");
        TextField group = new TextField("default_group");
        Spinner<Integer> delay = new Spinner<>(0, 86_400, 10);
        delay.setEditable(true);

        Button schedule = new Button("Schedule");
        schedule.setOnAction(e -> {
            boolean ok = notificationService.create()
                    .title(title.getText())
                    .body(body.getText())
                    .delaySeconds(delay.getValue())
                    .group(group.getText())
                    .schedule();
            if (!ok) {
                status.setText("Scheduling failed, see log");
            }
            refresh();
        });
        Button cancelGroup = new Button("Cancel group");
        cancelGroup.setOnAction(e -> {
            notificationService.cancelGroup(group.getText());
            refresh();
        });
        Button cancelAll = new Button("Cancel all");
        cancelAll.setOnAction(e -> {
            notificationService.cancelAll();
            refresh();
        });

        ListView<String> list = new ListView<>(tracked);
        VBox root = new VBox(8,
                new HBox(8, new Label("Title"), title),
                new HBox(8, new Label("Body"), body),
                new HBox(8, new Label("Group"), group, new Label("Delay (s)"), delay),
                new HBox(8, schedule, cancelGroup, cancelAll),
                list,
                status);
        root.setPadding(new Insets(12));
        return root;
    }

    private void onEvent(NotificationEvent event) {
        String line = event.getType() + (event.getIdentifier() == null ? "" : " " + event.getIdentifier());
        Platform.runLater(() -> {
            status.setText(line);
            refresh();
        });
    }

    private void refresh() {
        if (notificationService == null) {
            return;
        }
        tracked.setAll(notificationService.allIdentifiers());
        log.debug("[MainApp] {}", notificationService.debugInfo());
    }

    @Override
    public void stop() {
        if (subscription != null) {
            subscription.close();
        }
        if (notificationService != null) {
            notificationService.close();
            notificationService = null;
        }
        if (shutdownHook != null) {
            try {
                Runtime.getRuntime().removeShutdownHook(shutdownHook);
            } catch (IllegalStateException ex) {
                log.debug("[MainApp] JVM already shutting down");
            }
        }
        if (trayNotifier != null) {
            trayNotifier.dispose();
            trayNotifier = null;
        }
    }
}
