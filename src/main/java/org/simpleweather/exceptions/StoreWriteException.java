package org.simpleweather.exceptions;

/** The shared store rejected a write. Nothing was committed. */
public class StoreWriteException extends WeatherException {

    public StoreWriteException(String message) {
        super(message);
    }

    public StoreWriteException(String message, Throwable cause) {
        super(message, cause);
    }
}
