package org.simpleweather.interfaces;

/** Told that the presentation should re-read the engine's current state. */
@FunctionalInterface
public interface RefreshListener {

    void refreshRequested();
}
