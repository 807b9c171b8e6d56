package com.project.image.anomalies.exceptions;

/** Auto-contrast requested on an image whose minimum equals its maximum. */
public class DegenerateImageException extends AnomalyDetectionException {
    private final double value;

    public DegenerateImageException(double value) {
        super("Image is flat (every sample is " + value + "), contrast cannot be stretched");
        this.value = value;
    }

    public double getValue() { return value; }
}
