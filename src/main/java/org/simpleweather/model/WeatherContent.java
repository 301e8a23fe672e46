package org.simpleweather.model;

import java.util.Objects;

/**
 * Payload produced by a {@link org.simpleweather.interfaces.WeatherGenerator}.
 * The engine never looks inside; the view reads the temperature and description.
 */
public final class WeatherContent {
    private final Climate climate;
    private final Humidity humidity;
    private final Season season;
    private final int temperature;       // degrees Fahrenheit
    private final String description;

    public WeatherContent(Climate climate, Humidity humidity, Season season, int temperature, String description) {
        this.climate = climate;
        this.humidity = humidity;
        this.season = season;
        this.temperature = temperature;
        this.description = description;
    }

    public Climate getClimate() { return climate; }
    public Humidity getHumidity() { return humidity; }
    public Season getSeason() { return season; }
    public int getTemperature() { return temperature; }
    public String getDescription() { return description == null ? "" : description; }

    /** Formats the temperature for display, e.g. {@code 72°F} or {@code 22°C}. */
    public String temperature(boolean useCelsius) {
        if (useCelsius) {
            long c = Math.round((temperature - 32) * 5 / 9.0);
            return c + "°C";
        }
        return temperature + "°F";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof WeatherContent)) {
            return false;
        }
        WeatherContent that = (WeatherContent) o;
        return temperature == that.temperature
                && climate == that.climate
                && humidity == that.humidity
                && season == that.season
                && Objects.equals(description, that.description);
    }

    @Override
    public int hashCode() {
        return Objects.hash(climate, humidity, season, temperature, description);
    }

    @Override
    public String toString() {
        return "WeatherContent{" +
                "climate=" + climate +
                ", humidity=" + humidity +
                ", season=" + season +
                ", temperature=" + temperature +
                ", description='" + description + '\'' +
                '}';
    }
}
