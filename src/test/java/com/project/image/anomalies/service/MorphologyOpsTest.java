package com.project.image.anomalies.service;

import com.project.image.anomalies.config.OpenCvNative;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.opencv.core.Core;
import org.opencv.core.Mat;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MorphologyOpsTest {

    @BeforeAll
    static void loadOpenCv() {
        OpenCvNative.load();
    }

    @Test
    void closeGaps_mergesNearbyDotsAndKeepsOneStepOfGrowth() {
        Mat mask = TestImages.uniform(50, 50, 0);
        mask.put(20, 20, new byte[]{(byte) 255});
        mask.put(20, 24, new byte[]{(byte) 255});

        Mat closed = MorphologyOps.closeGaps(mask, 7);

        assertThat(TestImages.at(closed, 20, 22)).isEqualTo(255);   // gap filled
        assertThat(TestImages.at(closed, 19, 19)).isEqualTo(255);   // one step wider than the dots
        assertThat(TestImages.at(closed, 21, 25)).isEqualTo(255);
        assertThat(TestImages.at(closed, 20, 17)).isZero();
        assertThat(Core.countNonZero(closed)).isEqualTo(3 * 7);
        assertThat(Core.countNonZero(mask)).isEqualTo(2);
    }

    @Test
    void removeSpeckles_dropsSmallSpotsAndKeepsBlocks() {
        Mat mask = TestImages.withBlock(TestImages.uniform(40, 40, 0), 20, 20, 10, 255);
        mask.put(5, 5, new byte[]{(byte) 255});

        Mat cleaned = MorphologyOps.removeSpeckles(mask, 2);

        assertThat(TestImages.at(cleaned, 5, 5)).isZero();
        assertThat(TestImages.at(cleaned, 25, 25)).isEqualTo(255);
        assertThat(Core.countNonZero(cleaned)).isEqualTo(100);
    }

    @Test
    void iterationCountMustBePositive() {
        Mat mask = TestImages.uniform(4, 4, 0);

        assertThatThrownBy(() -> MorphologyOps.closeGaps(mask, 0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> MorphologyOps.removeSpeckles(mask, 0)).isInstanceOf(IllegalArgumentException.class);
    }
}
