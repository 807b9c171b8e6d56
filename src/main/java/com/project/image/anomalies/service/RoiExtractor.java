package com.project.image.anomalies.service;

import com.project.image.anomalies.DTOs.LineSegment;
import com.project.image.anomalies.config.AnomalyProperties;
import com.project.image.anomalies.config.OpenCvNative;
import org.opencv.core.Core;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.Scalar;
import org.opencv.core.Size;
import org.opencv.imgproc.Imgproc;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds the region-of-interest mask from the straight-line structure (grid, spacers) visible in the
 * golden image: blur, Canny, probabilistic Hough, rasterize, close gaps, then binarize per {@link RoiPolicy}.
 */
@Service
public class RoiExtractor {
    private static final Logger log = LoggerFactory.getLogger(RoiExtractor.class);

    static {
        OpenCvNative.load();
    }

    private static final Scalar WHITE = new Scalar(255);

    private final AnomalyProperties.Roi settings;

    public RoiExtractor(AnomalyProperties properties) {
        this.settings = properties.getRoi();
    }

    public Mat extract(Mat goldenImage) {
        Mat gray = new Mat();
        if (goldenImage.channels() > 1) {
            Imgproc.cvtColor(goldenImage, gray, Imgproc.COLOR_BGR2GRAY);
        } else {
            goldenImage.convertTo(gray, CvType.CV_8U);
        }

        Mat edges = detectEdges(gray);
        List<LineSegment> segments = detectLines(edges);
        edges.release();
        log.debug("Hough transform found {} line segments", segments.size());

        Mat lines = rasterize(segments, gray.size());
        gray.release();
        Mat structure = MorphologyOps.closeGaps(lines, settings.getCloseIterations());
        lines.release();
        if (settings.getSpeckleIterations() > 0) {
            Mat closed = structure;
            structure = MorphologyOps.removeSpeckles(closed, settings.getSpeckleIterations());
            closed.release();
        }

        Mat roi = binarize(structure);
        structure.release();
        int included = Core.countNonZero(roi);
        log.info("ROI mask covers {} of {} pixels ({} policy)", included, roi.total(), settings.getPolicy());
        return roi;
    }

    Mat detectEdges(Mat gray) {
        Mat blurred = new Mat();
        int k = settings.getBlurKernelSize();
        Imgproc.blur(gray, blurred, new Size(k, k));
        Mat edges = new Mat();
        Imgproc.Canny(blurred, edges, settings.getCannyLow(), settings.getCannyHigh());
        blurred.release();
        return edges;
    }

    public List<LineSegment> detectLines(Mat edges) {
        Mat lines = new Mat();
        Imgproc.HoughLinesP(edges, lines,
                settings.getHoughRho(), settings.houghThetaRadians(), settings.getHoughThreshold(),
                settings.getHoughMinLineLength(), settings.getHoughMaxLineGap());

        List<LineSegment> segments = new ArrayList<>(lines.rows());
        for (int i = 0; i < lines.rows(); i++) {
            double[] l = lines.get(i, 0);
            if (l != null && l.length >= 4) {
                segments.add(new LineSegment((int) l[0], (int) l[1], (int) l[2], (int) l[3]));
            }
        }
        lines.release();
        return segments;
    }

    /** Draws each segment 1 px wide, anti-aliased, white on black. */
    public Mat rasterize(List<LineSegment> segments, Size size) {
        Mat canvas = Mat.zeros(size, CvType.CV_8UC1);
        for (LineSegment s : segments) {
            Imgproc.line(canvas, s.start(), s.end(), WHITE, 1, Imgproc.LINE_AA, 0);
        }
        return canvas;
    }

    /** Values at or above the ROI threshold count as structure. */
    Mat binarize(Mat structure) {
        Mat roi = new Mat();
        Imgproc.threshold(structure, roi, settings.getThreshold() - 1, 255, settings.getPolicy().thresholdType());
        return roi;
    }
}
