package org.simpleweather.exceptions;

import org.simpleweather.model.ClimateParameters;

/** A regeneration was requested without climate, humidity and season all selected. */
public class IncompleteParametersException extends WeatherException {

    private final transient ClimateParameters parameters;

    public IncompleteParametersException(ClimateParameters parameters) {
        super("climate, humidity and season must all be selected: " + parameters);
        this.parameters = parameters;
    }

    public ClimateParameters getParameters() {
        return parameters;
    }
}
