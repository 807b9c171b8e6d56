package com.project.image.anomalies.service;

import com.project.image.anomalies.DTOs.DetectionReport;
import com.project.image.anomalies.DTOs.FrameResult;
import com.project.image.anomalies.config.OpenCvNative;
import com.project.image.anomalies.exceptions.PerImageProcessingException;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.opencv.core.Size;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class StorageServiceTest {

    @TempDir
    Path tmp;

    @BeforeAll
    static void loadOpenCv() {
        OpenCvNative.load();
    }

    private static DetectionReport report() {
        return new DetectionReport(
                TestImages.uniform(8, 8, 120),
                TestImages.uniform(8, 8, 255),
                new Size(8, 8),
                List.of(
                        FrameResult.succeeded(0, "first.bmp", TestImages.uniform(8, 8, 0)),
                        FrameResult.failed(1, new PerImageProcessingException("second.bmp", "preprocessing",
                                new IllegalStateException("boom"))),
                        FrameResult.succeeded(2, "third.bmp", TestImages.uniform(8, 8, 255))));
    }

    @Test
    void writeReport_usesArtifactNamesAndFramePositions() throws Exception {
        StorageService storage = new StorageService(tmp.resolve("uploads").toString(), new ImageCodec());
        Path run = storage.newRunDirectory();

        StorageService.StoredReport stored = storage.writeReport(run, report());

        assertThat(run.resolve("golden_image.png")).exists();
        assertThat(run.resolve("ROI_mask.png")).exists();
        assertThat(run.resolve("Masks").resolve("mask1.png")).exists();
        assertThat(run.resolve("Masks").resolve("mask2.png")).doesNotExist();
        assertThat(run.resolve("Masks").resolve("mask3.png")).exists();
        assertThat(stored.masks()).extracting(StorageService.StoredMask::frameNumber).containsExactly(1, 3);
        assertThat(stored.goldenImage().relativeWebPath())
                .startsWith("uploads/run_")
                .endsWith("/golden_image.png");
        assertThat(Files.size(stored.roiMask().path())).isPositive();
    }

    @Test
    void writeReport_outsideUploadRoot_hasNoWebPath() {
        StorageService storage = new StorageService(tmp.resolve("uploads").toString(), new ImageCodec());
        Path elsewhere = tmp.resolve("batch-output");

        StorageService.StoredReport stored = storage.writeReport(elsewhere, report());

        assertThat(stored.goldenImage().relativeWebPath()).isNull();
        assertThat(elsewhere.resolve("Masks").resolve("mask3.png")).exists();
    }
}
