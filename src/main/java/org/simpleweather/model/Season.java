package org.simpleweather.model;

/** Persisted by ordinal, so keep the declaration order. */
public enum Season {
    SPRING("Spring"),
    SUMMER("Summer"),
    FALL("Fall"),
    WINTER("Winter");

    private final String label;

    Season(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
