package com.project.image.anomalies.service;

import com.project.image.anomalies.DTOs.LineSegment;
import com.project.image.anomalies.config.AnomalyProperties;
import com.project.image.anomalies.config.OpenCvNative;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.opencv.core.Core;
import org.opencv.core.Mat;
import org.opencv.core.Point;
import org.opencv.core.Rect;
import org.opencv.core.Scalar;
import org.opencv.core.Size;
import org.opencv.imgproc.Imgproc;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class RoiExtractorTest {
    private final AnomalyProperties properties = new AnomalyProperties();
    private final RoiExtractor extractor = new RoiExtractor(properties);

    @BeforeAll
    static void loadOpenCv() {
        OpenCvNative.load();
    }

    /** Black 200x200 scene crossed by two vertical and two horizontal 20 px bright bars. */
    private static Mat gridScene() {
        Mat scene = TestImages.uniform(200, 200, 0);
        for (int start : new int[]{40, 140}) {
            scene.submat(new Rect(start, 0, 20, 200)).setTo(new Scalar(255));
            scene.submat(new Rect(0, start, 200, 20)).setTo(new Scalar(255));
        }
        return scene;
    }

    private static boolean isBinary(Mat mask) {
        Mat between = new Mat();
        Core.inRange(mask, new Scalar(1), new Scalar(254), between);
        return Core.countNonZero(between) == 0;
    }

    @Test
    void featurelessScene_keepsEverything() {
        Mat roi = extractor.extract(TestImages.uniform(100, 100, 128));

        assertThat(roi.size()).isEqualTo(new Size(100, 100));
        assertThat(Core.countNonZero(roi)).isEqualTo(100 * 100);
    }

    @Test
    void gridLines_areExcludedAndCellsKept() {
        Mat roi = extractor.extract(gridScene());

        assertThat(isBinary(roi)).isTrue();
        assertThat(TestImages.at(roi, 100, 100)).isEqualTo(255);  // centre cell
        assertThat(TestImages.at(roi, 100, 5)).isEqualTo(255);
        assertThat(Core.countNonZero(roi)).isLessThan(200 * 200);

        boolean excludedNearBar = false;
        for (int col = 30; col <= 70; col++) {
            excludedNearBar |= TestImages.at(roi, 100, col) == 0;
        }
        assertThat(excludedNearBar).isTrue();
    }

    @Test
    void includeStructurePolicy_invertsTheMask() {
        properties.getRoi().setPolicy(RoiPolicy.INCLUDE_STRUCTURE);
        RoiExtractor inverted = new RoiExtractor(properties);

        Mat roi = inverted.extract(TestImages.uniform(50, 50, 90));

        assertThat(Core.countNonZero(roi)).isZero();
    }

    @Test
    void detectLines_findsALongStraightEdge() {
        Mat edges = TestImages.uniform(200, 200, 0);
        Imgproc.line(edges, new Point(10, 50), new Point(190, 50), new Scalar(255), 1, Imgproc.LINE_8, 0);

        List<LineSegment> segments = extractor.detectLines(edges);

        assertThat(segments).isNotEmpty();
        assertThat(segments).anySatisfy(s -> {
            assertThat(Math.abs(s.y1() - s.y2())).isLessThanOrEqualTo(1);
            assertThat(s.length()).isGreaterThan(100);
        });
    }

    @Test
    void detectLines_ignoresEmptyEdgeMap() {
        assertThat(extractor.detectLines(TestImages.uniform(50, 50, 0))).isEmpty();
    }

    @Test
    void rasterize_drawsWhiteSegmentsOnBlack() {
        Mat canvas = extractor.rasterize(List.of(new LineSegment(0, 5, 19, 5)), new Size(20, 20));

        assertThat(TestImages.at(canvas, 5, 10)).isGreaterThan(125);
        assertThat(TestImages.at(canvas, 15, 10)).isZero();
    }

    @Test
    void extract_leavesTheGoldenImageUsable() {
        Mat golden = gridScene();

        extractor.extract(golden);

        assertThat(golden.empty()).isFalse();
        assertThat(TestImages.at(golden, 100, 50)).isEqualTo(255);
        assertThat(TestImages.at(golden, 100, 100)).isZero();
    }
}
