package com.project.image.anomalies.config;

import com.project.image.anomalies.service.RoiPolicy;
import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Tunables of the detection pipeline, bound from {@code app.anomaly.*}.
 * Defaults reproduce the constants the pipeline was originally calibrated with.
 */
@Validated
@ConfigurationProperties(prefix = "app.anomaly")
public class AnomalyProperties {

    @Min(1)
    @Max(64)
    private int parallelism = 4;

    @Valid
    private final Preprocess preprocess = new Preprocess();

    @Valid
    private final Golden golden = new Golden();

    @Valid
    private final Roi roi = new Roi();

    @Valid
    private final Anomaly anomaly = new Anomaly();

    public int getParallelism() { return parallelism; }
    public void setParallelism(int parallelism) { this.parallelism = parallelism; }
    public Preprocess getPreprocess() { return preprocess; }
    public Golden getGolden() { return golden; }
    public Roi getRoi() { return roi; }
    public Anomaly getAnomaly() { return anomaly; }

    public static class Preprocess {
        /** Uniform resize factor applied before any analysis; 1.0 keeps the input resolution. */
        @DecimalMin(value = "0.01")
        @DecimalMax(value = "4.0")
        private double scaleFactor = 0.125;

        private boolean autoContrast = true;

        public double getScaleFactor() { return scaleFactor; }
        public void setScaleFactor(double scaleFactor) { this.scaleFactor = scaleFactor; }
        public boolean isAutoContrast() { return autoContrast; }
        public void setAutoContrast(boolean autoContrast) { this.autoContrast = autoContrast; }
    }

    public static class Golden {
        /** Number of leading frames averaged into the golden image; negative means all of them. */
        @Min(-1)
        private int sampleCount = -1;

        public int getSampleCount() { return sampleCount; }
        public void setSampleCount(int sampleCount) { this.sampleCount = sampleCount; }
    }

    public static class Roi {
        @Min(1)
        @Max(101)
        private int blurKernelSize = 15;

        @DecimalMin(value = "0")
        @DecimalMax(value = "1000")
        private double cannyLow = 12;

        @DecimalMin(value = "0")
        @DecimalMax(value = "1000")
        private double cannyHigh = 24;

        @DecimalMin(value = "0.1")
        private double houghRho = 1;

        @DecimalMin(value = "0.1")
        @DecimalMax(value = "90")
        private double houghThetaDegrees = 1;

        @Min(1)
        private int houghThreshold = 50;

        @DecimalMin(value = "0")
        private double houghMinLineLength = 5;

        @DecimalMin(value = "0")
        private double houghMaxLineGap = 50;

        @Min(1)
        @Max(100)
        private int closeIterations = 7;

        @Min(0)
        @Max(100)
        private int speckleIterations = 0;

        @Min(1)
        @Max(255)
        private int threshold = 125;

        @NotNull
        private RoiPolicy policy = RoiPolicy.EXCLUDE_STRUCTURE;

        @AssertTrue(message = "canny-low must not exceed canny-high")
        public boolean isCannyThresholdOrdered() {
            return cannyLow <= cannyHigh;
        }

        public double houghThetaRadians() {
            return Math.toRadians(houghThetaDegrees);
        }

        public int getBlurKernelSize() { return blurKernelSize; }
        public void setBlurKernelSize(int blurKernelSize) { this.blurKernelSize = blurKernelSize; }
        public double getCannyLow() { return cannyLow; }
        public void setCannyLow(double cannyLow) { this.cannyLow = cannyLow; }
        public double getCannyHigh() { return cannyHigh; }
        public void setCannyHigh(double cannyHigh) { this.cannyHigh = cannyHigh; }
        public double getHoughRho() { return houghRho; }
        public void setHoughRho(double houghRho) { this.houghRho = houghRho; }
        public double getHoughThetaDegrees() { return houghThetaDegrees; }
        public void setHoughThetaDegrees(double houghThetaDegrees) { this.houghThetaDegrees = houghThetaDegrees; }
        public int getHoughThreshold() { return houghThreshold; }
        public void setHoughThreshold(int houghThreshold) { this.houghThreshold = houghThreshold; }
        public double getHoughMinLineLength() { return houghMinLineLength; }
        public void setHoughMinLineLength(double houghMinLineLength) { this.houghMinLineLength = houghMinLineLength; }
        public double getHoughMaxLineGap() { return houghMaxLineGap; }
        public void setHoughMaxLineGap(double houghMaxLineGap) { this.houghMaxLineGap = houghMaxLineGap; }
        public int getCloseIterations() { return closeIterations; }
        public void setCloseIterations(int closeIterations) { this.closeIterations = closeIterations; }
        public int getSpeckleIterations() { return speckleIterations; }
        public void setSpeckleIterations(int speckleIterations) { this.speckleIterations = speckleIterations; }
        public int getThreshold() { return threshold; }
        public void setThreshold(int threshold) { this.threshold = threshold; }
        public RoiPolicy getPolicy() { return policy; }
        public void setPolicy(RoiPolicy policy) { this.policy = policy; }
    }

    public static class Anomaly {
        /** Absolute difference from the golden image at which a pixel counts as anomalous. */
        @Min(1)
        @Max(255)
        private int diffThreshold = 32;

        public int getDiffThreshold() { return diffThreshold; }
        public void setDiffThreshold(int diffThreshold) { this.diffThreshold = diffThreshold; }
    }
}
