package com.project.image.anomalies.exceptions;

/** The run was cancelled between frames. */
public class DetectionCancelledException extends AnomalyDetectionException {
    public DetectionCancelledException(String message) { super(message); }
}
