package com.project.image.anomalies.exceptions;

/** Images taking part in one comparison differ in size or channel count. Fatal for a run. */
public class DimensionMismatchException extends AnomalyDetectionException {
    public DimensionMismatchException(String message) { super(message); }
}
