package org.simpleweather.settings;

import org.simpleweather.exceptions.StoreReadException;
import org.simpleweather.exceptions.StoreWriteException;
import org.simpleweather.interfaces.ClimateSource;
import org.simpleweather.interfaces.SettingsStore;
import org.simpleweather.model.Biome;
import org.simpleweather.model.Climate;
import org.simpleweather.model.ClimateParameters;
import org.simpleweather.model.Humidity;
import org.simpleweather.model.Season;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Operator selections for climate, humidity, season and biome, kept in the
 * shared settings store.
 * <p>
 * Changing a selection only saves it. Nothing is regenerated here, so several
 * selections can be adjusted before the next regeneration picks them up.
 */
public final class ClimateSettings implements ClimateSource {

    private static final Logger log = LoggerFactory.getLogger(ClimateSettings.class);

    private final SettingsStore settings;

    public ClimateSettings(SettingsStore settings) {
        this.settings = Objects.requireNonNull(settings, "settings");
    }

    @Override
    public ClimateParameters current() throws StoreReadException {
        return new ClimateParameters(
                settings.get(SettingKey.CLIMATE),
                settings.get(SettingKey.HUMIDITY),
                settings.get(SettingKey.SEASON));
    }

    public Biome biome() throws StoreReadException {
        return settings.get(SettingKey.BIOME);
    }

    public void selectClimate(Climate climate) throws StoreWriteException {
        settings.set(SettingKey.CLIMATE, climate);
    }

    public void selectHumidity(Humidity humidity) throws StoreWriteException {
        settings.set(SettingKey.HUMIDITY, humidity);
    }

    public void selectSeason(Season season) throws StoreWriteException {
        settings.set(SettingKey.SEASON, season);
    }

    /**
     * Saves the biome and resets climate and humidity to its mapping.
     * Season is untouched.
     */
    public void selectBiome(Biome biome) throws StoreWriteException {
        Objects.requireNonNull(biome, "biome");
        settings.set(SettingKey.BIOME, biome);
        settings.set(SettingKey.CLIMATE, biome.climate());
        settings.set(SettingKey.HUMIDITY, biome.humidity());
        log.debug("Biome {} selected: climate={}, humidity={}", biome, biome.climate(), biome.humidity());
    }
}
