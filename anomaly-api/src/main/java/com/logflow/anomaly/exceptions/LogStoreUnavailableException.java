package com.logflow.anomaly.exceptions;

/**
 * The log store backing a time series could not be queried. Distinct from an empty series:
 * callers must be able to tell "checked, found nothing" from "could not check".
 */
public class LogStoreUnavailableException extends RuntimeException {

    public LogStoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
