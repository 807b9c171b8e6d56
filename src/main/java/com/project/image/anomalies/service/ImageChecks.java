package com.project.image.anomalies.service;

import com.project.image.anomalies.exceptions.DimensionMismatchException;
import com.project.image.anomalies.exceptions.EmptyInputException;
import org.opencv.core.Mat;

import java.util.List;

final class ImageChecks {

    private ImageChecks() {}

    static void requireNonEmpty(List<Mat> images) {
        if (images == null || images.isEmpty()) {
            throw new EmptyInputException("No images supplied");
        }
    }

    /** All images must share the first one's width, height and channel count. */
    static void requireUniform(List<Mat> images) {
        requireNonEmpty(images);
        Mat first = images.get(0);
        for (int i = 1; i < images.size(); i++) {
            requireSameShape(first, images.get(i), "image 0", "image " + i);
        }
    }

    static void requireSameShape(Mat a, Mat b, String nameA, String nameB) {
        if (a.cols() != b.cols() || a.rows() != b.rows() || a.channels() != b.channels()) {
            throw new DimensionMismatchException(nameB + " is " + describe(b) + " but " + nameA + " is " + describe(a));
        }
    }

    static void requireSameSize(Mat a, Mat b, String nameA, String nameB) {
        if (a.cols() != b.cols() || a.rows() != b.rows()) {
            throw new DimensionMismatchException(nameB + " is " + describe(b) + " but " + nameA + " is " + describe(a));
        }
    }

    static String describe(Mat m) {
        return m.cols() + "x" + m.rows() + "x" + m.channels();
    }
}
