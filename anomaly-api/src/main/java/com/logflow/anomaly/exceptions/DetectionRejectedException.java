package com.logflow.anomaly.exceptions;

/** No request worker was free to take the detection, so it was refused instead of queued. */
public class DetectionRejectedException extends RuntimeException {

    public DetectionRejectedException(String message, Throwable cause) {
        super(message, cause);
    }
}
