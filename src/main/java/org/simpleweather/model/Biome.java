package org.simpleweather.model;

import java.util.Locale;

/**
 * Named presets that pick a climate and humidity together.
 * Selecting a biome resets both selections; season is left alone.
 */
public enum Biome {
    TUNDRA("Tundra", Climate.COLD, Humidity.BARREN),
    TAIGA("Taiga", Climate.COLD, Humidity.MODEST),
    GLACIER("Glacier", Climate.COLD, Humidity.LAVISH),
    PLAINS("Plains", Climate.TEMPERATE, Humidity.BARREN),
    FOREST("Forest", Climate.TEMPERATE, Humidity.MODEST),
    SWAMP("Swamp", Climate.TEMPERATE, Humidity.LAVISH),
    DESERT("Desert", Climate.HOT, Humidity.BARREN),
    SAVANNA("Savanna", Climate.HOT, Humidity.MODEST),
    JUNGLE("Jungle", Climate.HOT, Humidity.LAVISH);

    private final String label;
    private final Climate climate;
    private final Humidity humidity;

    Biome(String label, Climate climate, Humidity humidity) {
        this.label = label;
        this.climate = climate;
        this.humidity = humidity;
    }

    public String label() { return label; }
    public Climate climate() { return climate; }
    public Humidity humidity() { return humidity; }

    /** Case-insensitive lookup by constant name or label; {@code null} when unknown. */
    public static Biome fromName(String name) {
        if (name == null || name.isBlank()) {
            return null;
        }
        String wanted = name.trim().toUpperCase(Locale.ROOT);
        for (Biome b : values()) {
            if (b.name().equals(wanted) || b.label.toUpperCase(Locale.ROOT).equals(wanted)) {
                return b;
            }
        }
        return null;
    }
}
