package org.simpleweather.model;

/** Persisted by ordinal, so keep the declaration order. */
public enum Humidity {
    BARREN("Barren"),
    MODEST("Modest"),
    LAVISH("Lavish");

    private final String label;

    Humidity(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
