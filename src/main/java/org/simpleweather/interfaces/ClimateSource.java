package org.simpleweather.interfaces;

import org.simpleweather.exceptions.StoreReadException;
import org.simpleweather.model.ClimateParameters;

/** Supplies the currently selected climate parameters for time-driven regeneration. */
@FunctionalInterface
public interface ClimateSource {

    ClimateParameters current() throws StoreReadException;
}
