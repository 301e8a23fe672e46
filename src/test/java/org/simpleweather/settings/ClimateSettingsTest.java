package org.simpleweather.settings;

import org.junit.jupiter.api.Test;
import org.simpleweather.model.Biome;
import org.simpleweather.model.Climate;
import org.simpleweather.model.ClimateParameters;
import org.simpleweather.model.Humidity;
import org.simpleweather.model.Season;
import org.simpleweather.model.WindowPosition;
import org.simpleweather.persistence.InMemorySettingsStore;

import static org.junit.jupiter.api.Assertions.*;

class ClimateSettingsTest {

    private final InMemorySettingsStore store = new InMemorySettingsStore();
    private final ClimateSettings settings = new ClimateSettings(store);

    @Test
    void unsetSelectionsFallBackToDefaults() throws Exception {
        assertEquals(ClimateParameters.defaults(), settings.current());
        assertTrue(settings.current().isComplete());
    }

    @Test
    void individualSelectionsArePersisted() throws Exception {
        settings.selectClimate(Climate.HOT);
        settings.selectHumidity(Humidity.LAVISH);
        settings.selectSeason(Season.WINTER);

        assertEquals(new ClimateParameters(Climate.HOT, Humidity.LAVISH, Season.WINTER),
                new ClimateSettings(store).current());
    }

    @Test
    void biomeResetsClimateAndHumidityButNotSeason() throws Exception {
        settings.selectSeason(Season.FALL);

        settings.selectBiome(Biome.DESERT);

        assertEquals(Biome.DESERT, settings.biome());
        assertEquals(new ClimateParameters(Climate.HOT, Humidity.BARREN, Season.FALL), settings.current());
    }

    @Test
    void biomeLookupAcceptsNamesAndLabels() {
        assertEquals(Biome.JUNGLE, Biome.fromName("jungle"));
        assertEquals(Biome.TAIGA, Biome.fromName(" Taiga "));
        assertNull(Biome.fromName("moon"));
        assertNull(Biome.fromName(null));
    }

    @Test
    void windowPositionDefaultsUntilSaved() throws Exception {
        WindowPositions positions = new WindowPositions(store);
        assertEquals(new WindowPosition(100, 100), positions.load());

        positions.save(new WindowPosition(340, 20));

        assertEquals(new WindowPosition(340, 20), new WindowPositions(store).load());
    }
}
