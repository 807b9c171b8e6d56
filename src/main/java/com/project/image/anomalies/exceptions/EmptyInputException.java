package com.project.image.anomalies.exceptions;

/** No frames to work on. Fatal for a run. See {@link NoUsableFramesException} for input that preprocessing emptied. */
public class EmptyInputException extends AnomalyDetectionException {
    public EmptyInputException(String message) { super(message); }
}
