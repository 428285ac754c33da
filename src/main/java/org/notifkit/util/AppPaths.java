package org.notifkit.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

public final class AppPaths {
    private static final Logger log = LoggerFactory.getLogger(AppPaths.class);
    private static final String ENV_HOME = "NOTIFKIT_HOME";
    public static final String SNAPSHOT_FILE = "notification_store.json";
    public static final String LEGACY_FILE = "notification_prefs.properties";
    private static volatile Path cachedRoot;

    private AppPaths() {
    }

    public static Path dataRoot() {
        Path root = cachedRoot;
        if (root != null) {
            return root;
        }
        synchronized (AppPaths.class) {
            if (cachedRoot == null) {
                cachedRoot = computeRoot(System.getenv(ENV_HOME), System.getProperty("user.home"));
            }
            return cachedRoot;
        }
    }

    public static Path snapshotFile() {
        return dataRoot().resolve(SNAPSHOT_FILE);
    }

    public static Path legacyPrefsFile() {
        return dataRoot().resolve(LEGACY_FILE);
    }

    static Path computeRoot(String envHome, String userHome) {
        Path base = (envHome != null && !envHome.isBlank())
                ? Path.of(envHome)
                : Path.of(userHome, ".notifkit");
        try {
            Files.createDirectories(base);
        } catch (IOException e) {
            throw new IllegalStateException("Unable to create data directory: " + base, e);
        }
        log.debug("[AppPaths] dataRoot={}", base.toAbsolutePath());
        return base;
    }
}
