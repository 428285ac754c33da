package org.notifkit.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.notifkit.model.RepeatInterval;
import org.notifkit.model.ReturnNotificationConfig;

import java.io.ByteArrayOutputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Base64;
import java.util.List;
import java.util.Optional;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LegacyPrefsMigratorTest {

    @TempDir
    Path tempDir;

    private final LegacyPrefsMigrator migrator = new LegacyPrefsMigrator(new ObjectMapper());

    private static String binaryIds(int version, String... identifiers) throws IOException {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (DataOutputStream out = new DataOutputStream(bytes)) {
            out.writeInt(version);
            out.writeInt(identifiers.length);
            for (int i = 0; i < identifiers.length; i++) {
                out.writeUTF(identifiers[i]);
                out.writeInt(100 + i);
            }
        }
        return Base64.getEncoder().encodeToString(bytes.toByteArray());
    }

    private Path write(Properties props) throws IOException {
        Path path = tempDir.resolve("prefs.properties");
        try (Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            props.store(writer, null);
        }
        return path;
    }

    @Test
    @DisplayName("The binary identifier list is decoded in order")
    void binaryIds() throws IOException {
        List<SnapshotEntry> entries = migrator.parseIds(binaryIds(LegacyPrefsMigrator.BINARY_VERSION, "a", "é-b"));

        assertEquals(List.of(new SnapshotEntry("a", 100, null), new SnapshotEntry("é-b", 101, null)), entries);
    }

    @Test
    void unknownBinaryVersionYieldsNothing() throws IOException {
        assertTrue(migrator.parseIds(binaryIds(9, "a")).isEmpty());
        assertTrue(migrator.parseIds("%%%not-base64").isEmpty());
        assertTrue(migrator.parseIds(null).isEmpty());
    }

    @Test
    @DisplayName("JSON lists of different length keep their common prefix")
    void jsonIdsCommonPrefix() {
        List<SnapshotEntry> entries = migrator.parseIds("{\"identifiers\":[\"x\",\"y\",\"z\"],\"ids\":[1,2]}");

        assertEquals(List.of(new SnapshotEntry("x", 1, null), new SnapshotEntry("y", 2, null)), entries);
    }

    @Test
    @DisplayName("A config saved before the urgent delay existed gets the default delay")
    void configWithoutUrgentDelay() throws IOException {
        Properties props = new Properties();
        props.setProperty(LegacyPrefsMigrator.KEY_RETURN_CONFIG, "{\"enabled\":true,\"title\":\"Hi\",\"body\":\"B\","
                + "\"hoursBeforeNotification\":12,\"repeating\":true,\"repeatInterval\":\"WEEKLY\","
                + "\"identifier\":\"ret\",\"somethingElse\":1}");
        props.setProperty(LegacyPrefsMigrator.KEY_LAST_OPEN, "garbage");

        Optional<NotificationSnapshot> snapshot = migrator.read(write(props));

        ReturnNotificationConfig config = snapshot.orElseThrow().returnConfig();
        assertEquals("Hi", config.title());
        assertEquals(12, config.hoursBeforeNotification());
        assertEquals(RepeatInterval.WEEKLY, config.repeatInterval());
        assertEquals(60, config.urgentDelaySeconds());
        assertEquals(ReturnNotificationConfig.defaults().urgentTitle(), config.urgentTitle());
        assertEquals(0L, snapshot.get().lastOpenUnixTime());
        assertTrue(snapshot.get().notifications().isEmpty());
    }

    @Test
    void fileWithoutKnownKeysIsIgnored() throws IOException {
        Properties props = new Properties();
        props.setProperty("unrelated", "1");

        assertTrue(migrator.read(write(props)).isEmpty());
        assertTrue(migrator.read(tempDir.resolve("missing.properties")).isEmpty());
    }

    @Test
    void unreadableConfigIsDropped() throws IOException {
        Properties props = new Properties();
        props.setProperty(LegacyPrefsMigrator.KEY_RETURN_CONFIG, "{broken");
        props.setProperty(LegacyPrefsMigrator.KEY_IDS, binaryIds(LegacyPrefsMigrator.BINARY_VERSION, "kept"));

        NotificationSnapshot snapshot = migrator.read(write(props)).orElseThrow();

        assertNull(snapshot.returnConfig());
        assertEquals(1, snapshot.notifications().size());
    }
}
