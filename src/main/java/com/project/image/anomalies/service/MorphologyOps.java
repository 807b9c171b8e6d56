package com.project.image.anomalies.service;

import com.project.image.anomalies.config.OpenCvNative;
import org.opencv.core.Mat;
import org.opencv.core.Point;
import org.opencv.imgproc.Imgproc;

/**
 * Repeated 3x3 dilate/erode combinations used to clean up binary masks.
 */
public final class MorphologyOps {

    static {
        OpenCvNative.load();
    }

    private static final Point ANCHOR = new Point(-1, -1);

    private MorphologyOps() {}

    /**
     * Dilates {@code iterations} times then erodes {@code iterations - 1} times. Nearby white fragments
     * merge and small black gaps close, while the region stays one step wider than it started.
     */
    public static Mat closeGaps(Mat mask, int iterations) {
        if (iterations < 1) {
            throw new IllegalArgumentException("closeGaps needs at least one iteration, got " + iterations);
        }
        Mat out = new Mat();
        Imgproc.dilate(mask, out, new Mat(), ANCHOR, iterations);
        if (iterations > 1) {
            Imgproc.erode(out, out, new Mat(), ANCHOR, iterations - 1);
        }
        return out;
    }

    /**
     * Erodes then dilates the same number of times, dropping white specks smaller than the erosion reach.
     */
    public static Mat removeSpeckles(Mat mask, int iterations) {
        if (iterations < 1) {
            throw new IllegalArgumentException("removeSpeckles needs at least one iteration, got " + iterations);
        }
        Mat out = new Mat();
        Imgproc.erode(mask, out, new Mat(), ANCHOR, iterations);
        Imgproc.dilate(out, out, new Mat(), ANCHOR, iterations);
        return out;
    }
}
