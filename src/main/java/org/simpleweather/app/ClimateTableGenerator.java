package org.simpleweather.app;

import org.simpleweather.interfaces.WeatherGenerator;
import org.simpleweather.model.Climate;
import org.simpleweather.model.Humidity;
import org.simpleweather.model.Season;
import org.simpleweather.model.WeatherContent;
import org.simpleweather.model.WeatherRecord;

import java.util.Random;

/**
 * Lookup-table generator used by the command-line node so it has something to
 * commit. Picks a temperature around the climate/season average, drifting at
 * most {@value #MAX_DRIFT}°F from the seed record.
 */
public final class ClimateTableGenerator implements WeatherGenerator {

    static final int MAX_DRIFT = 10;

    // Average °F by climate (rows) and season (columns: spring, summer, fall, winter)
    private static final int[][] AVERAGE = {
            {35, 55, 30, 5},
            {55, 75, 55, 35},
            {80, 100, 80, 65},
    };

    private final Random random;

    public ClimateTableGenerator(Random random) {
        this.random = random;
    }

    @Override
    public WeatherContent generate(Climate climate, Humidity humidity, Season season, WeatherRecord seed) {
        int average = AVERAGE[climate.ordinal()][season.ordinal()];
        int temperature = average + random.nextInt(2 * MAX_DRIFT + 1) - MAX_DRIFT;
        if (seed != null) {
            int previous = seed.getContent().getTemperature();
            temperature = Math.max(previous - MAX_DRIFT, Math.min(previous + MAX_DRIFT, temperature));
        }
        return new WeatherContent(climate, humidity, season, temperature, describe(humidity, temperature));
    }

    private static String describe(Humidity humidity, int temperature) {
        String feel = temperature < 32 ? "Freezing" : temperature < 60 ? "Cool" : temperature < 85 ? "Warm" : "Hot";
        switch (humidity) {
            case BARREN:
                return feel + " and dry";
            case LAVISH:
                return temperature < 32 ? feel + " with snow" : feel + " with rain";
            case MODEST:
            default:
                return feel + " with scattered clouds";
        }
    }
}
