package org.simpleweather.model;

/** Screen offset of the weather panel, in pixels. */
public record WindowPosition(int left, int top) {

    public static WindowPosition defaultPosition() {
        return new WindowPosition(100, 100);
    }
}
