package com.project.image.anomalies.service;

import com.project.image.anomalies.config.OpenCvNative;
import com.project.image.anomalies.exceptions.InvalidSampleCountException;
import org.opencv.core.Core;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Averages the leading frames of a set into the golden (reference) image.
 */
@Service
public class GoldenImageSynthesizer {
    private static final Logger log = LoggerFactory.getLogger(GoldenImageSynthesizer.class);

    static {
        OpenCvNative.load();
    }

    public Mat synthesize(List<Mat> images) {
        return synthesize(images, -1);
    }

    /**
     * Per-pixel mean of the first {@code count} images, accumulated in double precision and rounded
     * to 8 bits once at the end.
     *
     * @param count number of leading images to average; negative means all
     * @throws InvalidSampleCountException if {@code count} is 0 or larger than the set
     */
    public Mat synthesize(List<Mat> images, int count) {
        ImageChecks.requireUniform(images);
        int used = resolveCount(count, images.size());

        Mat first = images.get(0);
        Mat sum = Mat.zeros(first.size(), CvType.CV_64FC(first.channels()));
        Mat sample = new Mat();
        double weight = 1.0 / used;
        for (int i = 0; i < used; i++) {
            images.get(i).convertTo(sample, sum.type());
            Core.scaleAdd(sample, weight, sum, sum);
        }

        Mat golden = new Mat();
        sum.convertTo(golden, CvType.CV_8UC(first.channels()));
        log.debug("Golden image synthesized from {} of {} frames ({})", used, images.size(), ImageChecks.describe(golden));
        return golden;
    }

    static int resolveCount(int count, int available) {
        if (count < 0) {
            return available;
        }
        if (count == 0 || count > available) {
            throw new InvalidSampleCountException(count, available);
        }
        return count;
    }
}
