package org.simpleweather.exceptions;

/** The shared store could not be read for a reason other than "no such value". */
public class StoreReadException extends WeatherException {

    public StoreReadException(String message) {
        super(message);
    }

    public StoreReadException(String message, Throwable cause) {
        super(message, cause);
    }
}
