package org.simpleweather.persistence;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import org.simpleweather.exceptions.StoreReadException;
import org.simpleweather.exceptions.StoreWriteException;
import org.simpleweather.interfaces.SettingsListener;
import org.simpleweather.interfaces.SettingsStore;
import org.simpleweather.settings.SettingKey;
import org.simpleweather.util.Json;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * File-backed settings store: every key lives in one JSON document,
 * {@code <dir>/settings.json}, which several processes may share.
 * <p>
 * Notes:
 * <ul>
 *     <li>Writes go to a temporary file of their own which is fsynced and then moved
 *     over the document atomically, so readers see either the old or the new document.</li>
 *     <li>Each read-modify-write of a key holds an exclusive lock on
 *     {@code <dir>/settings.lock}, so writers in other processes cannot put back
 *     a key they read before this write.</li>
 *     <li>A missing document or key means "not found". An unreadable or corrupt
 *     document is reported as {@link StoreReadException}.</li>
 * </ul>
 */
public final class FileSettingsStore implements SettingsStore {

    private static final Logger log = LoggerFactory.getLogger(FileSettingsStore.class);

    static final String FILE_NAME = "settings.json";
    static final String LOCK_FILE_NAME = "settings.lock";

    // One monitor per lock file; FileLock alone does not exclude threads of this JVM
    private static final ConcurrentHashMap<Path, Object> MONITORS = new ConcurrentHashMap<>();

    // Directory holding settings.json, e.g. ./weather-store
    private final Path dir;

    private final List<SettingsListener> listeners = new CopyOnWriteArrayList<>();

    public FileSettingsStore(Path dir) {
        this.dir = dir;
    }

    /** @return path of the shared settings document. */
    public Path documentPath() {
        return dir.resolve(FILE_NAME);
    }

    @Override
    public <T> Optional<T> find(SettingKey<T> key) throws StoreReadException {
        JsonObject doc = readDocument();
        JsonElement element = doc.get(key.name());
        if (element == null || element.isJsonNull()) {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(Json.gson().fromJson(element, key.type()));
        } catch (JsonParseException e) {
            throw new StoreReadException("cannot decode setting '" + key + "' in " + documentPath(), e);
        }
    }

    @Override
    public <T> void set(SettingKey<T> key, T value) throws StoreWriteException {
        Path lockPath = dir.resolve(LOCK_FILE_NAME).toAbsolutePath().normalize();
        synchronized (MONITORS.computeIfAbsent(lockPath, p -> new Object())) {
            try {
                Files.createDirectories(dir);
            } catch (IOException e) {
                throw new StoreWriteException("cannot create " + dir, e);
            }
            try (FileChannel lockChannel = FileChannel.open(lockPath,
                    StandardOpenOption.CREATE, StandardOpenOption.WRITE);
                 FileLock ignored = lockChannel.lock()) {
                JsonObject doc;
                try {
                    doc = readDocument();
                } catch (StoreReadException e) {
                    // Refuse to overwrite a document we could not understand
                    throw new StoreWriteException("cannot update " + documentPath(), e);
                }
                if (value == null) {
                    doc.remove(key.name());
                } else {
                    doc.add(key.name(), Json.gson().toJsonTree(value, key.type()));
                }
                writeAtomically(doc);
            } catch (IOException e) {
                throw new StoreWriteException("cannot lock " + lockPath, e);
            }
        }
        log.debug("[Store] {} written to {}", key, documentPath());
        for (SettingsListener l : listeners) {
            l.onSettingChanged(key);
        }
    }

    @Override
    public void addListener(SettingsListener listener) {
        listeners.add(listener);
    }

    @Override
    public void removeListener(SettingsListener listener) {
        listeners.remove(listener);
    }

    private JsonObject readDocument() throws StoreReadException {
        String text;
        try {
            text = Files.readString(documentPath(), StandardCharsets.UTF_8);
        } catch (NoSuchFileException e) {
            return new JsonObject();
        } catch (IOException e) {
            throw new StoreReadException("cannot read " + documentPath(), e);
        }
        if (text.isBlank()) {
            return new JsonObject();
        }
        try {
            JsonElement root = JsonParser.parseString(text);
            if (!root.isJsonObject()) {
                throw new StoreReadException(documentPath() + " is not a JSON object");
            }
            return root.getAsJsonObject();
        } catch (JsonParseException e) {
            throw new StoreReadException("corrupt settings document " + documentPath(), e);
        }
    }

    private void writeAtomically(JsonObject doc) throws StoreWriteException {
        Path target = documentPath();
        Path tmp = null;
        try {
            tmp = Files.createTempFile(dir, FILE_NAME, ".tmp");
            try (FileChannel channel = FileChannel.open(tmp, StandardOpenOption.WRITE)) {
                ByteBuffer bytes = ByteBuffer.wrap(Json.gson().toJson(doc).getBytes(StandardCharsets.UTF_8));
                while (bytes.hasRemaining()) {
                    channel.write(bytes);
                }
                channel.force(true);
            }
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            deleteQuietly(tmp);
            throw new StoreWriteException("cannot write " + target, e);
        }
    }

    private static void deleteQuietly(Path tmp) {
        if (tmp == null) {
            return;
        }
        try {
            Files.deleteIfExists(tmp);
        } catch (IOException e) {
            log.warn("[Store] could not remove temporary file {}", tmp, e);
        }
    }
}
