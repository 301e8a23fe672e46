package org.simpleweather.interfaces;

import org.simpleweather.model.Climate;
import org.simpleweather.model.Humidity;
import org.simpleweather.model.Season;
import org.simpleweather.model.WeatherContent;
import org.simpleweather.model.WeatherRecord;

/** Turns climate selections into concrete weather. May be expensive; assumed side-effect free. */
@FunctionalInterface
public interface WeatherGenerator {

    /**
     * @param seed the previous record for continuity, or {@code null} for the first one
     */
    WeatherContent generate(Climate climate, Humidity humidity, Season season, WeatherRecord seed);
}
