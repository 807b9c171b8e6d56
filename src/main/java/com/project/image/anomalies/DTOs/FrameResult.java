package com.project.image.anomalies.DTOs;

import com.project.image.anomalies.exceptions.PerImageProcessingException;
import org.opencv.core.Mat;

/**
 * Outcome for one frame: either the final mask at input resolution, or the error that stopped it.
 */
public record FrameResult(
        int index,
        String frameId,
        Mat finalMask,                       // null when failed
        PerImageProcessingException error    // null when succeeded
) {
    public static FrameResult succeeded(int index, String frameId, Mat finalMask) {
        return new FrameResult(index, frameId, finalMask, null);
    }

    public static FrameResult failed(int index, PerImageProcessingException error) {
        return new FrameResult(index, error.getFrameId(), null, error);
    }

    public boolean isSucceeded() {
        return error == null;
    }
}
