package org.simpleweather.persistence;

import com.google.gson.JsonParseException;
import org.simpleweather.exceptions.StoreReadException;
import org.simpleweather.interfaces.SettingsListener;
import org.simpleweather.interfaces.SettingsStore;
import org.simpleweather.settings.SettingKey;
import org.simpleweather.util.Json;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Settings store held in memory and shared by every engine in the JVM.
 * <p>
 * Values are kept as JSON so readers never share a mutable object with the
 * writer, the same as a real persisted store. Listeners run on the writer's
 * thread after the value is visible.
 */
public final class InMemorySettingsStore implements SettingsStore {

    private static final Logger log = LoggerFactory.getLogger(InMemorySettingsStore.class);

    private final ConcurrentHashMap<String, String> values = new ConcurrentHashMap<>();
    private final List<SettingsListener> listeners = new CopyOnWriteArrayList<>();

    @Override
    public <T> Optional<T> find(SettingKey<T> key) throws StoreReadException {
        String json = values.get(key.name());
        if (json == null) {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(Json.gson().fromJson(json, key.type()));
        } catch (JsonParseException e) {
            throw new StoreReadException("cannot decode setting '" + key + "'", e);
        }
    }

    @Override
    public <T> void set(SettingKey<T> key, T value) {
        if (value == null) {
            values.remove(key.name());
        } else {
            values.put(key.name(), Json.gson().toJson(value, key.type()));
        }
        log.debug("[Store] {} updated", key);
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

    /** Number of keys currently stored. */
    public int size() {
        return values.size();
    }
}
