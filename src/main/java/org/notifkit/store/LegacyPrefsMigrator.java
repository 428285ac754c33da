package org.notifkit.store;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.notifkit.model.ReturnNotificationConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayInputStream;
import java.io.DataInputStream;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Properties;

/**
 * Reads the key-value file older releases stored their state in. The file is only ever read; it
 * is removed by {@link SnapshotStore} after the first successful snapshot write.
 * <p>
 * Keys:
 * <ul>
 *   <li>{@code ScheduledNotificationIds}: Base64 of {@code int version, int count, (UTF identifier,
 *   int platformId) * count}, or the older JSON form {@code {"identifiers":[...],"ids":[...]}}</li>
 *   <li>{@code LastAppOpenTime}: Unix seconds</li>
 *   <li>{@code ReturnNotificationConfig}: JSON</li>
 * </ul>
 */
public final class LegacyPrefsMigrator {

    private static final Logger log = LoggerFactory.getLogger(LegacyPrefsMigrator.class);

    public static final String KEY_IDS = "ScheduledNotificationIds";
    public static final String KEY_LAST_OPEN = "LastAppOpenTime";
    public static final String KEY_RETURN_CONFIG = "ReturnNotificationConfig";
    static final int BINARY_VERSION = 1;

    @JsonIgnoreProperties(ignoreUnknown = true)
    record LegacyIdList(List<String> identifiers, List<Integer> ids) {
    }

    private final ObjectMapper mapper;

    public LegacyPrefsMigrator(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    /**
     * @return the legacy state, empty if the file is missing, unreadable or holds none of the keys
     */
    public Optional<NotificationSnapshot> read(Path path) {
        Properties props = new Properties();
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            props.load(reader);
        } catch (IOException | IllegalArgumentException ex) {
            log.warn("[LegacyPrefsMigrator] Unable to read {}", path, ex);
            return Optional.empty();
        }
        if (!props.containsKey(KEY_IDS) && !props.containsKey(KEY_LAST_OPEN) && !props.containsKey(KEY_RETURN_CONFIG)) {
            return Optional.empty();
        }
        List<SnapshotEntry> entries = parseIds(props.getProperty(KEY_IDS));
        long lastOpen = parseLastOpen(props.getProperty(KEY_LAST_OPEN));
        ReturnNotificationConfig config = parseConfig(props.getProperty(KEY_RETURN_CONFIG));
        return Optional.of(NotificationSnapshot.of(entries, config, lastOpen));
    }

    List<SnapshotEntry> parseIds(String raw) {
        if (raw == null || raw.isBlank()) {
            return List.of();
        }
        String value = raw.strip();
        try {
            return value.startsWith("{") ? parseJsonIds(value) : parseBinaryIds(value);
        } catch (IOException | IllegalArgumentException ex) {
            log.warn("[LegacyPrefsMigrator] Ignoring unreadable {}: {}", KEY_IDS, ex.getMessage());
            return List.of();
        }
    }

    private List<SnapshotEntry> parseJsonIds(String json) throws IOException {
        LegacyIdList list = mapper.readValue(json, LegacyIdList.class);
        List<String> identifiers = list.identifiers() == null ? List.of() : list.identifiers();
        List<Integer> ids = list.ids() == null ? List.of() : list.ids();
        if (identifiers.size() != ids.size()) {
            log.warn("[LegacyPrefsMigrator] {} identifiers for {} ids, keeping the common prefix",
                    identifiers.size(), ids.size());
        }
        int n = Math.min(identifiers.size(), ids.size());
        List<SnapshotEntry> out = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            String identifier = identifiers.get(i);
            Integer id = ids.get(i);
            if (identifier != null && !identifier.isBlank() && id != null) {
                out.add(new SnapshotEntry(identifier, id, null));
            }
        }
        return out;
    }

    private static List<SnapshotEntry> parseBinaryIds(String base64) throws IOException {
        byte[] bytes = Base64.getDecoder().decode(base64);
        try (DataInputStream in = new DataInputStream(new ByteArrayInputStream(bytes))) {
            int version = in.readInt();
            if (version != BINARY_VERSION) {
                throw new IOException("unsupported binary version " + version);
            }
            int count = in.readInt();
            if (count < 0 || count > bytes.length) {
                throw new IOException("implausible entry count " + count);
            }
            List<SnapshotEntry> out = new ArrayList<>(count);
            for (int i = 0; i < count; i++) {
                String identifier = in.readUTF();
                int id = in.readInt();
                out.add(new SnapshotEntry(identifier, id, null));
            }
            return out;
        }
    }

    private static long parseLastOpen(String raw) {
        if (raw == null || raw.isBlank()) {
            return 0L;
        }
        try {
            return Math.max(0L, Long.parseLong(raw.strip()));
        } catch (NumberFormatException ex) {
            log.warn("[LegacyPrefsMigrator] Ignoring invalid {}='{}'", KEY_LAST_OPEN, raw);
            return 0L;
        }
    }

    private ReturnNotificationConfig parseConfig(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            JsonNode node = mapper.readTree(raw);
            if (node instanceof ObjectNode object && !object.has("urgentDelaySeconds")) {
                object.put("urgentDelaySeconds", ReturnNotificationConfig.defaults().urgentDelaySeconds());
            }
            return mapper.treeToValue(node, ReturnNotificationConfig.class).normalized();
        } catch (IOException ex) {
            log.warn("[LegacyPrefsMigrator] Ignoring unreadable {}: {}", KEY_RETURN_CONFIG, ex.getMessage());
            return null;
        }
    }
}
