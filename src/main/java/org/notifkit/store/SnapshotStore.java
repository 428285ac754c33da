package org.notifkit.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.notifkit.notifications.error.PersistenceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.Objects;
import java.util.Optional;
import java.util.zip.CRC32;

/**
 * Reads and writes the snapshot file. Writes go to a sibling temp file that is flushed to disk and
 * then renamed over the previous snapshot, so a reader sees either the old or the new content.
 * Loading never throws: a file that is too large, unparsable or fails its checksum is deleted and
 * the engine starts empty.
 */
public final class SnapshotStore {

    private static final Logger log = LoggerFactory.getLogger(SnapshotStore.class);
    private static final byte[] CRC_KEY = "\"crc32\":".getBytes(StandardCharsets.US_ASCII);

    public enum Source { SNAPSHOT, TEMP_FILE, LEGACY, EMPTY, DISCARDED }

    public record LoadResult(NotificationSnapshot snapshot, Source source) {
        public boolean needsRewrite() {
            return source == Source.LEGACY || source == Source.TEMP_FILE;
        }
    }

    private final Path file;
    private final Path tempFile;
    private final Path legacyFile;
    private final ObjectMapper mapper;
    private final LegacyPrefsMigrator migrator;
    private final long maxBytes;
    private final boolean fsync;

    public SnapshotStore(Path file, Path legacyFile, ObjectMapper mapper, long maxBytes, boolean fsync) {
        this.file = Objects.requireNonNull(file, "file");
        this.tempFile = file.resolveSibling(file.getFileName() + ".tmp");
        this.legacyFile = legacyFile;
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.migrator = new LegacyPrefsMigrator(mapper);
        this.maxBytes = maxBytes;
        this.fsync = fsync;
    }

    public Path file() {
        return file;
    }

    /**
     * Writes {@code snapshot} atomically and retires the legacy file once that succeeded.
     *
     * @throws PersistenceException on any I/O or serialization failure
     */
    public void save(NotificationSnapshot snapshot) {
        Objects.requireNonNull(snapshot, "snapshot");
        byte[] bytes;
        try {
            long crc = crc32(mapper.writeValueAsBytes(snapshot.withChecksum(0L)));
            bytes = mapper.writeValueAsBytes(snapshot.withChecksum(crc));
        } catch (JsonProcessingException ex) {
            throw new PersistenceException("Unable to serialize snapshot", ex);
        }
        if (bytes.length > maxBytes) {
            throw new PersistenceException("Snapshot of " + bytes.length + " bytes exceeds limit " + maxBytes, null);
        }
        try {
            Path parent = file.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (FileChannel channel = FileChannel.open(tempFile, StandardOpenOption.CREATE,
                    StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE)) {
                ByteBuffer buffer = ByteBuffer.wrap(bytes);
                while (buffer.hasRemaining()) {
                    channel.write(buffer);
                }
                if (fsync) {
                    channel.force(true);
                }
            }
            replace(tempFile, file);
        } catch (IOException ex) {
            throw new PersistenceException("Unable to write snapshot to " + file, ex);
        }
        log.debug("[SnapshotStore] Saved {} notifications ({} bytes)", snapshot.notifications().size(), bytes.length);
        retireLegacy();
    }

    /**
     * Loads the snapshot, falling back to an intact temp file left by an interrupted save and then
     * to the legacy key-value file when no snapshot exists.
     */
    public LoadResult load() {
        if (Files.exists(file)) {
            return readVerified(file)
                    .map(s -> new LoadResult(s, Source.SNAPSHOT))
                    .orElseGet(() -> new LoadResult(NotificationSnapshot.empty(), Source.DISCARDED));
        }
        if (Files.exists(tempFile)) {
            Optional<NotificationSnapshot> recovered = readVerified(tempFile);
            if (recovered.isPresent()) {
                log.info("[SnapshotStore] Recovered snapshot from interrupted save {}", tempFile);
                return new LoadResult(recovered.get(), Source.TEMP_FILE);
            }
        }
        if (legacyFile != null && Files.exists(legacyFile)) {
            Optional<NotificationSnapshot> migrated = migrator.read(legacyFile);
            if (migrated.isPresent()) {
                log.info("[SnapshotStore] Migrated {} notifications from legacy storage",
                        migrated.get().notifications().size());
                return new LoadResult(migrated.get(), Source.LEGACY);
            }
        }
        return new LoadResult(NotificationSnapshot.empty(), Source.EMPTY);
    }

    public void delete() {
        deleteQuietly(file);
        deleteQuietly(tempFile);
    }

    private Optional<NotificationSnapshot> readVerified(Path path) {
        try {
            long size = Files.size(path);
            if (size > maxBytes) {
                log.warn("[SnapshotStore] {} is {} bytes, above the {} byte limit; deleting", path, size, maxBytes);
                deleteQuietly(path);
                return Optional.empty();
            }
            byte[] bytes = Files.readAllBytes(path);
            StoredChecksum stored = locateChecksum(bytes);
            if (stored == null) {
                log.warn("[SnapshotStore] {} has no checksum; deleting", path);
                deleteQuietly(path);
                return Optional.empty();
            }
            long actual = crc32(stored.zeroed());
            if (actual != stored.value()) {
                log.warn("[SnapshotStore] Checksum mismatch in {} (stored {}, computed {}); deleting",
                        path, stored.value(), actual);
                deleteQuietly(path);
                return Optional.empty();
            }
            NotificationSnapshot snapshot = mapper.readValue(bytes, NotificationSnapshot.class);
            return Optional.of(snapshot);
        } catch (IOException ex) {
            log.warn("[SnapshotStore] Unable to read {}; deleting", path, ex);
            deleteQuietly(path);
            return Optional.empty();
        }
    }

    private record StoredChecksum(long value, byte[] zeroed) {
    }

    /**
     * Finds the checksum field in the raw bytes and returns its value together with a copy of the
     * bytes where the digits are replaced by a single {@code 0}, which is what was checksummed.
     */
    private static StoredChecksum locateChecksum(byte[] bytes) {
        int keyAt = indexOf(bytes, CRC_KEY);
        if (keyAt < 0) {
            return null;
        }
        int start = keyAt + CRC_KEY.length;
        int end = start;
        while (end < bytes.length && bytes[end] >= '0' && bytes[end] <= '9') {
            end++;
        }
        if (end == start || end - start > 10) {
            return null;
        }
        long value = Long.parseLong(new String(bytes, start, end - start, StandardCharsets.US_ASCII));
        byte[] zeroed = new byte[bytes.length - (end - start) + 1];
        System.arraycopy(bytes, 0, zeroed, 0, start);
        zeroed[start] = '0';
        System.arraycopy(bytes, end, zeroed, start + 1, bytes.length - end);
        return new StoredChecksum(value, zeroed);
    }

    private static int indexOf(byte[] haystack, byte[] needle) {
        outer:
        for (int i = 0; i <= haystack.length - needle.length; i++) {
            for (int j = 0; j < needle.length; j++) {
                if (haystack[i + j] != needle[j]) {
                    continue outer;
                }
            }
            return i;
        }
        return -1;
    }

    static long crc32(byte[] bytes) {
        CRC32 crc = new CRC32();
        crc.update(bytes, 0, bytes.length);
        return crc.getValue();
    }

    private static void replace(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException ex) {
            Files.deleteIfExists(target);
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private void retireLegacy() {
        if (legacyFile == null) {
            return;
        }
        try {
            if (Files.deleteIfExists(legacyFile)) {
                log.info("[SnapshotStore] Legacy storage {} retired", legacyFile);
            }
        } catch (IOException ex) {
            log.warn("[SnapshotStore] Unable to delete legacy storage {}", legacyFile, ex);
        }
    }

    private static void deleteQuietly(Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException ex) {
            log.warn("[SnapshotStore] Unable to delete {}", path, ex);
        }
    }
}
