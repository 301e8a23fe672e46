package org.simpleweather.persistence;

import org.simpleweather.exceptions.StoreReadException;
import org.simpleweather.exceptions.StoreWriteException;
import org.simpleweather.interfaces.SettingsStore;
import org.simpleweather.interfaces.WeatherStore;
import org.simpleweather.model.WeatherRecord;
import org.simpleweather.settings.SettingKey;

import java.util.Objects;
import java.util.Optional;

/** {@link WeatherStore} kept under the {@code lastWeatherData} key of a settings store. */
public final class SettingsWeatherStore implements WeatherStore {

    private final SettingsStore settings;

    public SettingsWeatherStore(SettingsStore settings) {
        this.settings = Objects.requireNonNull(settings, "settings");
    }

    @Override
    public Optional<WeatherRecord> read() throws StoreReadException {
        Optional<WeatherRecord> stored = settings.find(SettingKey.LAST_WEATHER_DATA);
        // Decoded without the constructor, so a record missing its content gets here
        if (stored.isPresent() && stored.get().getContent() == null) {
            throw new StoreReadException("stored " + SettingKey.LAST_WEATHER_DATA + " has no content");
        }
        return stored;
    }

    @Override
    public void write(WeatherRecord record) throws StoreWriteException {
        settings.set(SettingKey.LAST_WEATHER_DATA, Objects.requireNonNull(record, "record"));
    }
}
