package org.simpleweather.model;

import java.util.Objects;

/**
 * The three selections fed into weather generation. Any of them may be
 * {@code null} when the caller has not picked a value yet; generation requires
 * {@link #isComplete()}.
 */
public final class ClimateParameters {

    private static final ClimateParameters DEFAULTS =
            new ClimateParameters(Climate.COLD, Humidity.MODEST, Season.SPRING);

    private final Climate climate;
    private final Humidity humidity;
    private final Season season;

    public ClimateParameters(Climate climate, Humidity humidity, Season season) {
        this.climate = climate;
        this.humidity = humidity;
        this.season = season;
    }

    /** Parameters used to seed the very first record. */
    public static ClimateParameters defaults() {
        return DEFAULTS;
    }

    public Climate getClimate() { return climate; }
    public Humidity getHumidity() { return humidity; }
    public Season getSeason() { return season; }

    public boolean isComplete() {
        return climate != null && humidity != null && season != null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ClimateParameters)) {
            return false;
        }
        ClimateParameters that = (ClimateParameters) o;
        return climate == that.climate && humidity == that.humidity && season == that.season;
    }

    @Override
    public int hashCode() {
        return Objects.hash(climate, humidity, season);
    }

    @Override
    public String toString() {
        return "ClimateParameters{climate=" + climate + ", humidity=" + humidity + ", season=" + season + '}';
    }
}
