package com.energyadvisor.anomaly.weather;

/**
 * The weather source could not deliver heating degree days.
 */
public class HddFetchException extends Exception {

    public HddFetchException(String message) {
        super(message);
    }

    public HddFetchException(String message, Throwable cause) {
        super(message, cause);
    }
}
