package com.project.image.anomalies.DTOs;

import org.opencv.core.Mat;
import org.opencv.core.Size;

import java.util.List;

public record DetectionReport(
        Mat goldenImage,     // working resolution, CV_8U
        Mat roiMask,         // working resolution, 0 / 255
        Size originalSize,
        List<FrameResult> frames   // input order
) {
    public List<FrameResult> succeeded() {
        return frames.stream().filter(FrameResult::isSucceeded).toList();
    }

    public List<FrameResult> failed() {
        return frames.stream().filter(f -> !f.isSucceeded()).toList();
    }
}
