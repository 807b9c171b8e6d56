package com.project.image.anomalies.service;

import com.project.image.anomalies.config.AnomalyProperties;
import com.project.image.anomalies.config.OpenCvNative;
import org.opencv.core.Core;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.imgproc.Imgproc;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Thresholds each frame's absolute difference from the golden image into a binary anomaly mask.
 */
@Service
public class AnomalyMasker {

    static {
        OpenCvNative.load();
    }

    private final int diffThreshold;

    public AnomalyMasker(AnomalyProperties properties) {
        this.diffThreshold = properties.getAnomaly().getDiffThreshold();
    }

    public List<Mat> computeMasks(List<Mat> images, Mat goldenImage) {
        ImageChecks.requireNonEmpty(images);
        Mat golden = to8Bit(goldenImage);
        try {
            List<Mat> masks = new ArrayList<>(images.size());
            for (Mat image : images) {
                masks.add(diffAgainst(image, golden));
            }
            return masks;
        } finally {
            if (golden != goldenImage) {
                golden.release();
            }
        }
    }

    /**
     * 255 where |image - golden| reaches the difference threshold, 0 elsewhere. Multi-channel inputs use the
     * largest per-channel difference, so the mask is always single-channel.
     */
    public Mat computeMask(Mat image, Mat goldenImage) {
        Mat golden = to8Bit(goldenImage);
        try {
            return diffAgainst(image, golden);
        } finally {
            if (golden != goldenImage) {
                golden.release();
            }
        }
    }

    private Mat diffAgainst(Mat image, Mat golden) {
        ImageChecks.requireSameShape(golden, image, "golden image", "frame");
        Mat frame = to8Bit(image);
        Mat diff = new Mat();
        Core.absdiff(frame, golden, diff);
        if (frame != image) {
            frame.release();
        }
        if (diff.channels() > 1) {
            Mat perChannel = diff;
            diff = maxOverChannels(perChannel);
            perChannel.release();
        }
        Mat mask = new Mat();
        Imgproc.threshold(diff, mask, diffThreshold - 1, 255, Imgproc.THRESH_BINARY);
        diff.release();
        return mask;
    }

    private static Mat maxOverChannels(Mat diff) {
        List<Mat> planes = new ArrayList<>();
        Core.split(diff, planes);
        Mat max = planes.get(0).clone();
        for (int c = 1; c < planes.size(); c++) {
            Core.max(max, planes.get(c), max);
        }
        planes.forEach(Mat::release);
        return max;
    }

    private static Mat to8Bit(Mat image) {
        if (image.depth() == CvType.CV_8U) {
            return image;
        }
        Mat converted = new Mat();
        image.convertTo(converted, CvType.CV_8U);
        return converted;
    }
}
