package com.project.image.anomalies.service;

import com.project.image.anomalies.config.OpenCvNative;
import org.opencv.core.Mat;
import org.opencv.core.Size;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Restricts anomaly masks to the ROI and brings them back to input resolution.
 */
@Service
public class MaskCompositor {

    static {
        OpenCvNative.load();
    }

    private final Preprocessor preprocessor;

    public MaskCompositor(Preprocessor preprocessor) {
        this.preprocessor = preprocessor;
    }

    public List<Mat> applyRoi(List<Mat> masks, Mat roiMask) {
        return masks.stream().map(m -> applyRoi(m, roiMask)).toList();
    }

    /** Copy of {@code mask} with every pixel outside the ROI set to 0. */
    public Mat applyRoi(Mat mask, Mat roiMask) {
        ImageChecks.requireSameSize(roiMask, mask, "ROI mask", "anomaly mask");
        Mat out = Mat.zeros(mask.size(), mask.type());
        mask.copyTo(out, roiMask);
        return out;
    }

    public List<Mat> restoreResolution(List<Mat> masks, Size originalSize) {
        return masks.stream().map(m -> restoreResolution(m, originalSize)).toList();
    }

    /**
     * Cubic resize to {@code originalSize}. Edges come back blurred, the result is not re-thresholded.
     */
    public Mat restoreResolution(Mat mask, Size originalSize) {
        if (mask.cols() == (int) originalSize.width && mask.rows() == (int) originalSize.height) {
            return mask.clone();
        }
        return preprocessor.resize(mask, originalSize, 0);
    }
}
