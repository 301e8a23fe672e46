package org.simpleweather.exceptions;

/**
 * Base type for every failure the weather engine reports to its caller.
 * None of them is fatal: the last committed record stays in place.
 */
public class WeatherException extends Exception {

    public WeatherException(String message) {
        super(message);
    }

    public WeatherException(String message, Throwable cause) {
        super(message, cause);
    }
}
