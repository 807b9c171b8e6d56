package com.project.image.anomalies.service;

import com.project.image.anomalies.config.OpenCvNative;
import com.project.image.anomalies.exceptions.DimensionMismatchException;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.opencv.core.Core;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.Rect;
import org.opencv.core.Scalar;
import org.opencv.core.Size;
import org.opencv.imgproc.Imgproc;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MaskCompositorTest {
    private final Preprocessor preprocessor = new Preprocessor();
    private final MaskCompositor compositor = new MaskCompositor(preprocessor);

    @BeforeAll
    static void loadOpenCv() {
        OpenCvNative.load();
    }

    @Test
    void applyRoi_zeroesOutsideAndKeepsInside() {
        Mat mask = TestImages.uniform(20, 20, 0);
        mask.submat(new Rect(0, 0, 20, 10)).setTo(new Scalar(255));
        Mat roi = TestImages.uniform(20, 20, 0);
        roi.submat(new Rect(0, 0, 10, 20)).setTo(new Scalar(255));

        Mat out = compositor.applyRoi(mask, roi);

        for (int row = 0; row < 20; row++) {
            for (int col = 0; col < 20; col++) {
                int expected = col < 10 ? TestImages.at(mask, row, col) : 0;
                assertThat(TestImages.at(out, row, col)).as("pixel %d,%d", row, col).isEqualTo(expected);
            }
        }
    }

    @Test
    void applyRoi_isIdempotent() {
        Mat mask = TestImages.withBlock(TestImages.uniform(30, 30, 0), 5, 5, 20, 255);
        Mat roi = TestImages.withBlock(TestImages.uniform(30, 30, 0), 10, 10, 15, 255);

        Mat once = compositor.applyRoi(List.of(mask), roi).get(0);
        Mat twice = compositor.applyRoi(once, roi);

        Mat diff = new Mat();
        Core.absdiff(once, twice, diff);
        assertThat(Core.countNonZero(diff)).isZero();
        assertThat(Core.countNonZero(once)).isEqualTo(15 * 15);
    }

    @Test
    void applyRoi_requiresMatchingSize() {
        assertThatThrownBy(() -> compositor.applyRoi(TestImages.uniform(10, 10, 0), TestImages.uniform(12, 10, 255)))
                .isInstanceOf(DimensionMismatchException.class);
    }

    @Test
    void resizeRoundTrip_keepsRegionCountButNotExactEdges() {
        Mat mask = TestImages.uniform(400, 400, 0);
        mask.submat(new Rect(40, 40, 80, 80)).setTo(new Scalar(255));
        mask.submat(new Rect(240, 200, 96, 120)).setTo(new Scalar(255));

        Mat small = preprocessor.resize(mask, new Size(0, 0), 0.125);
        Mat restored = compositor.restoreResolution(List.of(small), mask.size()).get(0);

        assertThat(restored.size()).isEqualTo(mask.size());
        Mat binary = new Mat();
        Imgproc.threshold(restored, binary, 127, 255, Imgproc.THRESH_BINARY);
        Mat labels = new Mat();
        int components = Imgproc.connectedComponents(binary, labels);
        assertThat(components).isEqualTo(3); // background + two blocks

        int original = Core.countNonZero(mask);
        assertThat(Core.countNonZero(binary)).isCloseTo(original, org.assertj.core.data.Percentage.withPercentage(10));
    }

    @Test
    void restoreResolution_atSameSizeIsACopy() {
        Mat mask = TestImages.uniform(8, 8, 255);

        Mat out = compositor.restoreResolution(mask, new Size(8, 8));

        assertThat(out.type()).isEqualTo(CvType.CV_8UC1);
        assertThat(out.nativeObj).isNotEqualTo(mask.nativeObj);
    }
}
