package org.simpleweather.model;

/** Result of comparing two calendar readings. */
public enum Transition {
    /** Nothing to react to, or only the time of day moved. */
    NONE,
    /** Day, month or year changed, or this is the first usable reading. */
    MATERIAL
}
