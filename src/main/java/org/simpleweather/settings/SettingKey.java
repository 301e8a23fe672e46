package org.simpleweather.settings;

import org.simpleweather.model.Biome;
import org.simpleweather.model.Climate;
import org.simpleweather.model.Humidity;
import org.simpleweather.model.Season;
import org.simpleweather.model.WeatherRecord;
import org.simpleweather.model.WindowPosition;

import java.util.Objects;

/**
 * Typed key into the shared settings store, with the value returned when
 * nothing has been stored yet.
 *
 * @param <T> value type, also used to decode persisted JSON
 */
public final class SettingKey<T> {

    public static final SettingKey<Climate> CLIMATE =
            new SettingKey<>("climate", Climate.class, Climate.COLD);
    public static final SettingKey<Humidity> HUMIDITY =
            new SettingKey<>("humidity", Humidity.class, Humidity.MODEST);
    public static final SettingKey<Season> SEASON =
            new SettingKey<>("season", Season.class, Season.SPRING);
    public static final SettingKey<Biome> BIOME =
            new SettingKey<>("biome", Biome.class, null);
    public static final SettingKey<Boolean> USE_CELSIUS =
            new SettingKey<>("useCelsius", Boolean.class, Boolean.FALSE);
    public static final SettingKey<Boolean> DIALOG_DISPLAY =
            new SettingKey<>("dialogDisplay", Boolean.class, Boolean.TRUE);
    public static final SettingKey<WindowPosition> WINDOW_POSITION =
            new SettingKey<>("windowPosition", WindowPosition.class, null);
    public static final SettingKey<WeatherRecord> LAST_WEATHER_DATA =
            new SettingKey<>("lastWeatherData", WeatherRecord.class, null);

    private final String name;
    private final Class<T> type;
    private final T defaultValue;

    private SettingKey(String name, Class<T> type, T defaultValue) {
        this.name = name;
        this.type = type;
        this.defaultValue = defaultValue;
    }

    public String name() { return name; }
    public Class<T> type() { return type; }
    public T defaultValue() { return defaultValue; }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SettingKey)) {
            return false;
        }
        return name.equals(((SettingKey<?>) o).name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name);
    }

    @Override
    public String toString() {
        return name;
    }
}
