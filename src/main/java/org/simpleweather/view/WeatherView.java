package org.simpleweather.view;

import org.simpleweather.model.WindowPosition;

/**
 * Everything the presentation needs to draw the weather panel, already
 * formatted. Empty strings stand for "nothing known yet".
 */
public record WeatherView(
        boolean authoritative,
        String displayDate,
        String formattedDate,
        String formattedTime,
        String weekday,
        String currentTemperature,
        String currentDescription,
        boolean hideWeather,
        WindowPosition windowPosition
) {
}
