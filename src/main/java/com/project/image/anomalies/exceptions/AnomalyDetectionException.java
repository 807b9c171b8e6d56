package com.project.image.anomalies.exceptions;

/** Domain-specific exception for detection pipeline errors. */
public class AnomalyDetectionException extends RuntimeException {
    public AnomalyDetectionException(String message) { super(message); }
    public AnomalyDetectionException(String message, Throwable cause) { super(message, cause); }
}
