package org.simpleweather.interfaces;

import org.simpleweather.exceptions.StoreReadException;
import org.simpleweather.exceptions.StoreWriteException;
import org.simpleweather.settings.SettingKey;

import java.util.Optional;

/**
 * Key-addressed persisted store shared by every instance.
 * Values are typed by their {@link SettingKey}.
 */
public interface SettingsStore {

    /**
     * @return the stored value, or empty if the key was never written (or was cleared)
     * @throws StoreReadException when the store exists but cannot be read or decoded
     */
    <T> Optional<T> find(SettingKey<T> key) throws StoreReadException;

    /** Stored value or the key's registered default. */
    default <T> T get(SettingKey<T> key) throws StoreReadException {
        return find(key).orElse(key.defaultValue());
    }

    /** Stores {@code value}; {@code null} clears the key. */
    <T> void set(SettingKey<T> key, T value) throws StoreWriteException;

    void addListener(SettingsListener listener);

    void removeListener(SettingsListener listener);
}
