package com.project.image.anomalies.exceptions;

/** Golden image sample count outside 1..number of available frames. Fatal for a run. */
public class InvalidSampleCountException extends AnomalyDetectionException {
    public InvalidSampleCountException(int requested, int available) {
        super("Golden image sample count " + requested + " is out of range, expected 1.." + available
                + " or a negative value for all frames");
    }
}
