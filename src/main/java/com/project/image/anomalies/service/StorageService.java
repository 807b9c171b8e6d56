package com.project.image.anomalies.service;

import com.project.image.anomalies.DTOs.DetectionReport;
import com.project.image.anomalies.DTOs.FrameResult;
import com.project.image.anomalies.exceptions.StorageException;
import org.opencv.core.Mat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;

/**
 * Writes run artifacts as PNG files: {@code golden_image.png}, {@code ROI_mask.png} and
 * {@code Masks/mask<n>.png}, n being the 1-based position of the frame in the input.
 */
@Service
public class StorageService {
    private static final Logger log = LoggerFactory.getLogger(StorageService.class);

    public static final String GOLDEN_IMAGE_FILE = "golden_image.png";
    public static final String ROI_MASK_FILE = "ROI_mask.png";
    public static final String MASK_DIR = "Masks";

    private static final DateTimeFormatter RUN_NAME = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss_SSS");

    private final Path rootDir;
    private final ImageCodec codec;

    public StorageService(@Value("${app.upload.dir:uploads}") String root, ImageCodec codec) {
        this.rootDir = Paths.get(root).toAbsolutePath().normalize();
        this.codec = codec;
        try {
            Files.createDirectories(this.rootDir);
            log.info("Using upload directory: {}", this.rootDir);
        } catch (IOException e) {
            throw new StorageException("Cannot create upload directory: " + rootDir, e);
        }
    }

    /** relativeWebPath is null for files outside the upload directory. */
    public record StoredFile(Path path, String filename, String relativeWebPath) {}

    public record StoredMask(int frameNumber, String frameId, StoredFile file) {}

    public record StoredReport(Path directory, StoredFile goldenImage, StoredFile roiMask, List<StoredMask> masks) {}

    /** Fresh, timestamped directory under the upload root for one web run. */
    public Path newRunDirectory() {
        Path dir = rootDir.resolve("run_" + RUN_NAME.format(LocalDateTime.now()));
        try {
            return Files.createDirectories(dir);
        } catch (IOException e) {
            throw new StorageException("Cannot create run directory: " + dir, e);
        }
    }

    public StoredReport writeReport(Path directory, DetectionReport report) {
        Path maskDir = directory.resolve(MASK_DIR);
        try {
            Files.createDirectories(maskDir);
        } catch (IOException e) {
            throw new StorageException("Cannot create mask directory: " + maskDir, e);
        }

        StoredFile golden = writePng(directory.resolve(GOLDEN_IMAGE_FILE), report.goldenImage());
        StoredFile roi = writePng(directory.resolve(ROI_MASK_FILE), report.roiMask());

        List<StoredMask> masks = new ArrayList<>();
        for (FrameResult result : report.succeeded()) {
            int frameNumber = result.index() + 1;
            StoredFile file = writePng(maskDir.resolve("mask" + frameNumber + ".png"), result.finalMask());
            masks.add(new StoredMask(frameNumber, result.frameId(), file));
        }
        log.info("Stored golden image, ROI mask and {} frame masks in {}", masks.size(), directory);
        return new StoredReport(directory, golden, roi, masks);
    }

    private StoredFile writePng(Path target, Mat image) {
        try {
            Files.write(target, codec.encodePng(image));
        } catch (IOException e) {
            throw new StorageException("Failed to store " + target.getFileName(), e);
        }
        return new StoredFile(target, target.getFileName().toString(), webPath(target));
    }

    private String webPath(Path target) {
        Path abs = target.toAbsolutePath().normalize();
        if (!abs.startsWith(rootDir)) {
            return null;
        }
        return "uploads/" + rootDir.relativize(abs).toString().replace('\\', '/');
    }
}
