package org.simpleweather.model;

/** Broad temperature band. Persisted by ordinal, so keep the declaration order. */
public enum Climate {
    COLD("Cold"),
    TEMPERATE("Temperate"),
    HOT("Hot");

    private final String label;

    Climate(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
