package com.project.image.anomalies.service;

import com.project.image.anomalies.config.OpenCvNative;
import com.project.image.anomalies.exceptions.DegenerateImageException;
import org.opencv.core.Core;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.Size;
import org.opencv.imgproc.Imgproc;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Grayscale reduction, resizing and contrast stretching. Every call returns new Mats.
 */
@Service
public class Preprocessor {
    private static final Logger log = LoggerFactory.getLogger(Preprocessor.class);

    static {
        OpenCvNative.load();
    }

    public List<Mat> toGrayscale(List<Mat> images) {
        return images.stream().map(this::toGrayscale).toList();
    }

    public Mat toGrayscale(Mat image) {
        Mat gray = new Mat();
        switch (image.channels()) {
            case 1 -> image.copyTo(gray);
            case 3 -> Imgproc.cvtColor(image, gray, Imgproc.COLOR_BGR2GRAY);
            case 4 -> Imgproc.cvtColor(image, gray, Imgproc.COLOR_BGRA2GRAY);
            default -> throw new IllegalArgumentException("Unsupported channel count: " + image.channels());
        }
        return gray;
    }

    public List<Mat> resize(List<Mat> images, double scale) {
        return resize(images, new Size(0, 0), scale);
    }

    public List<Mat> resize(List<Mat> images, Size targetSize) {
        return resize(images, targetSize, 0);
    }

    public List<Mat> resize(List<Mat> images, Size targetSize, double scale) {
        return images.stream().map(img -> resize(img, targetSize, scale)).toList();
    }

    /**
     * Cubic resize either to {@code targetSize} or by {@code scale}. A scale of 0 selects the target size,
     * a (0,0) target selects the scale; exactly one of them must be set.
     */
    public Mat resize(Mat image, Size targetSize, double scale) {
        boolean useTarget = targetSize != null && targetSize.width > 0 && targetSize.height > 0;
        boolean useScale = scale > 0;
        if (useTarget == useScale) {
            throw new IllegalArgumentException(
                    "Exactly one of target size and scale factor must be set (target=" + targetSize + ", scale=" + scale + ")");
        }
        Mat resized = new Mat();
        if (useTarget) {
            Imgproc.resize(image, resized, targetSize, 0, 0, Imgproc.INTER_CUBIC);
        } else {
            Imgproc.resize(image, resized, new Size(), scale, scale, Imgproc.INTER_CUBIC);
        }
        return resized;
    }

    public List<Mat> autoContrast(List<Mat> images) {
        return images.stream().map(this::autoContrast).toList();
    }

    /**
     * Linear stretch so that the image minimum maps to 0 and its maximum to 255.
     *
     * @throws DegenerateImageException if the image holds a single value
     */
    public Mat autoContrast(Mat image) {
        Core.MinMaxLocResult minMax = Core.minMaxLoc(image.channels() == 1 ? image : image.reshape(1));
        double min = minMax.minVal;
        double max = minMax.maxVal;
        if (max == min) {
            throw new DegenerateImageException(min);
        }
        double alpha = 255.0 / (max - min);
        Mat stretched = new Mat();
        image.convertTo(stretched, CvType.CV_8U, alpha, -min * alpha);
        log.debug("Auto-contrast: range [{}, {}] scaled by {}", min, max, alpha);
        return stretched;
    }

    /** The per-frame chain run before golden synthesis: grayscale, resize by {@code scale}, optional stretch. */
    public Mat preprocess(Mat image, double scale, boolean autoContrast) {
        Mat gray = toGrayscale(image);
        if (scale == 1.0 && !autoContrast) {
            return gray;
        }
        Mat resized = gray;
        if (scale != 1.0) {
            resized = resize(gray, new Size(0, 0), scale);
            gray.release();
        }
        if (!autoContrast) {
            return resized;
        }
        try {
            return autoContrast(resized);
        } finally {
            resized.release();
        }
    }
}
