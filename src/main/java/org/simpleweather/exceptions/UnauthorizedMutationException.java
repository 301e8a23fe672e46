package org.simpleweather.exceptions;

/** A non-authoritative instance asked to change the shared record. */
public class UnauthorizedMutationException extends WeatherException {

    public UnauthorizedMutationException(String operation) {
        super(operation + " requires the authoritative instance");
    }
}
