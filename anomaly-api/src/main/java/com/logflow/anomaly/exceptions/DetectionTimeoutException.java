package com.logflow.anomaly.exceptions;

public class DetectionTimeoutException extends RuntimeException {

    public DetectionTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }
}
