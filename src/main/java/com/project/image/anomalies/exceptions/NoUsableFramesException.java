package com.project.image.anomalies.exceptions;

import com.project.image.anomalies.DTOs.FrameResult;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Every frame failed preprocessing, so there is nothing to build a golden image from.
 * Carries the failure of each frame; each cause is also attached as a suppressed exception.
 */
public class NoUsableFramesException extends EmptyInputException {
    private final List<FrameResult> failures;

    public NoUsableFramesException(List<FrameResult> failures) {
        super("No frame survived preprocessing: " + failures.stream()
                .map(f -> f.frameId() + " (" + f.error().getCause().getMessage() + ")")
                .collect(Collectors.joining("; ")));
        this.failures = List.copyOf(failures);
        failures.forEach(f -> addSuppressed(f.error()));
    }

    public List<FrameResult> getFailures() { return failures; }
}
