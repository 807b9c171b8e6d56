package com.project.image.anomalies.exceptions;

/**
 * Failure confined to a single frame. Recorded in the report; sibling frames keep going.
 */
public class PerImageProcessingException extends AnomalyDetectionException {
    private final String frameId;
    private final String stage;

    public PerImageProcessingException(String frameId, String stage, Throwable cause) {
        super("Frame '" + frameId + "' failed during " + stage + ": " + cause.getMessage(), cause);
        this.frameId = frameId;
        this.stage = stage;
    }

    public String getFrameId() { return frameId; }
    public String getStage() { return stage; }
}
