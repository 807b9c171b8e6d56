package com.project.image.anomalies.service;

import com.project.image.anomalies.DTOs.DetectionReport;
import com.project.image.anomalies.DTOs.Frame;
import com.project.image.anomalies.DTOs.FrameResult;
import com.project.image.anomalies.exceptions.StorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * Processes a whole input directory at startup and writes the artifacts to the output directory.
 * Enabled with {@code app.batch.enabled=true}.
 */
@Component
@ConditionalOnProperty(prefix = "app.batch", name = "enabled", havingValue = "true")
public class DirectoryBatchRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(DirectoryBatchRunner.class);

    private final AnomalyDetectionService detectionService;
    private final StorageService storageService;
    private final ImageCodec codec;
    private final Path inputDir;
    private final Path outputDir;
    private final String pattern;

    public DirectoryBatchRunner(AnomalyDetectionService detectionService,
                                StorageService storageService,
                                ImageCodec codec,
                                @Value("${app.batch.input-dir:Images/Input}") String inputDir,
                                @Value("${app.batch.output-dir:Images/Output}") String outputDir,
                                @Value("${app.batch.pattern:*hr.bmp}") String pattern) {
        this.detectionService = detectionService;
        this.storageService = storageService;
        this.codec = codec;
        this.inputDir = Paths.get(inputDir).toAbsolutePath().normalize();
        this.outputDir = Paths.get(outputDir).toAbsolutePath().normalize();
        this.pattern = pattern;
    }

    @Override
    public void run(ApplicationArguments args) {
        runBatch();
    }

    public DetectionReport runBatch() {
        checkDirectories();
        List<Frame> frames = readFrames();
        log.info("Batch run: {} files matching '{}' in {}", frames.size(), pattern, inputDir);

        DetectionReport report = detectionService.detect(frames);
        storageService.writeReport(outputDir, report);
        for (FrameResult failed : report.failed()) {
            log.warn("No mask written for {}: {}", failed.frameId(), failed.error().getMessage());
        }
        return report;
    }

    private void checkDirectories() {
        StringBuilder problems = new StringBuilder();
        if (!Files.isDirectory(inputDir)) {
            problems.append("Input directory: ").append(inputDir).append(" does not exist. ");
        }
        if (!Files.isDirectory(outputDir)) {
            problems.append("Output directory: ").append(outputDir).append(" does not exist. ");
        }
        if (problems.length() > 0) {
            throw new StorageException(problems.toString().trim());
        }
    }

    private List<Frame> readFrames() {
        List<Path> files = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(inputDir, pattern)) {
            stream.forEach(files::add);
        } catch (IOException e) {
            throw new StorageException("Cannot list " + inputDir, e);
        }
        files.sort(null);

        List<Frame> frames = new ArrayList<>(files.size());
        for (Path file : files) {
            try (InputStream in = Files.newInputStream(file)) {
                frames.add(new Frame(file.getFileName().toString(), codec.decode(in)));
            } catch (IOException e) {
                throw new StorageException("Failed to read " + file, e);
            }
        }
        return frames;
    }
}
