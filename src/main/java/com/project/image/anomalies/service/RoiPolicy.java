package com.project.image.anomalies.service;

import org.opencv.imgproc.Imgproc;

/**
 * Which side of the ROI threshold is eligible for anomaly reporting.
 */
public enum RoiPolicy {
    /** The detected grid/spacer footprint is a fixture: exclude it, keep the cells between the lines. */
    EXCLUDE_STRUCTURE(Imgproc.THRESH_BINARY_INV),
    /** Only the detected line footprint is inspected. */
    INCLUDE_STRUCTURE(Imgproc.THRESH_BINARY);

    private final int thresholdType;

    RoiPolicy(int thresholdType) {
        this.thresholdType = thresholdType;
    }

    int thresholdType() {
        return thresholdType;
    }
}
