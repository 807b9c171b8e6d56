package com.project.image.anomalies.controller;

import com.project.image.anomalies.DTOs.DetectionReport;
import com.project.image.anomalies.DTOs.Frame;
import com.project.image.anomalies.DTOs.FrameResult;
import com.project.image.anomalies.config.AnomalyProperties;
import com.project.image.anomalies.exceptions.AnomalyDetectionException;
import com.project.image.anomalies.service.AnomalyDetectionService;
import com.project.image.anomalies.service.CancellationToken;
import com.project.image.anomalies.service.ImageCodec;
import com.project.image.anomalies.service.StorageService;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Controller;
import org.springframework.ui.Model;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

@Controller
@Validated
public class DetectionController {
    private static final Logger log = LoggerFactory.getLogger(DetectionController.class);

    // Поддържани формати на изображения
    private static final List<String> SUPPORTED_FORMATS = Arrays.asList(
            "image/png", "image/bmp", "image/x-ms-bmp", "image/jpeg", "image/jpg", "image/gif"
    );
    private static final long MAX_FILE_SIZE = 20L * 1024 * 1024;

    private final AnomalyDetectionService detectionService;
    private final StorageService storageService;
    private final ImageCodec codec;
    private final AnomalyProperties properties;

    public DetectionController(AnomalyDetectionService detectionService, StorageService storageService,
                               ImageCodec codec, AnomalyProperties properties) {
        this.detectionService = detectionService;
        this.storageService = storageService;
        this.codec = codec;
        this.properties = properties;
    }

    @GetMapping("/detect")
    public String showForm(Model model) {
        model.addAttribute("defaultSampleCount", properties.getGolden().getSampleCount());
        model.addAttribute("supportedFormats", String.join(", ", SUPPORTED_FORMATS));
        return "detect";
    }

    @PostMapping(value = "/detect", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public String handleUpload(
            @RequestParam("files") List<MultipartFile> files,
            @RequestParam(name = "sampleCount", defaultValue = "-1")
            @Min(value = -1, message = "Броят кадри за еталона трябва да е -1 (всички) или положително число")
            @Max(value = 1000, message = "Броят кадри за еталона не може да надвишава 1000")
            int sampleCount,
            Model model
    ) throws IOException {

        validateUploadedFiles(files);
        log.info("Processing {} uploaded frames, sampleCount: {}", files.size(), sampleCount);

        List<Frame> frames = new ArrayList<>(files.size());
        for (MultipartFile file : files) {
            try (InputStream in = file.getInputStream()) {
                frames.add(new Frame(file.getOriginalFilename(), codec.decode(in)));
            }
        }

        try {
            DetectionReport report = detectionService.detect(frames, sampleCount, CancellationToken.NONE);

            Path runDir = storageService.newRunDirectory();
            StorageService.StoredReport stored = storageService.writeReport(runDir, report);

            populateResultModel(model, report, stored);
            log.info("Detection completed: {} masks stored in {}", stored.masks().size(), runDir);
            return "result";

        } catch (AnomalyDetectionException e) {
            log.warn("Detection failed: {}", e.getMessage());
            model.addAttribute("error", e.getMessage());
            model.addAttribute("defaultSampleCount", sampleCount);
            return "detect";
        }
    }

    private void validateUploadedFiles(List<MultipartFile> files) {
        if (files == null || files.isEmpty() || files.stream().allMatch(MultipartFile::isEmpty)) {
            throw new IllegalArgumentException("Моля изберете поне едно изображение");
        }
        for (MultipartFile file : files) {
            String contentType = file.getContentType();
            if (contentType == null || !SUPPORTED_FORMATS.contains(contentType.toLowerCase())) {
                throw new IllegalArgumentException("Неподдържан формат на файла " + file.getOriginalFilename()
                        + ": " + contentType + ". Поддържани формати: " + String.join(", ", SUPPORTED_FORMATS));
            }
            if (file.getSize() > MAX_FILE_SIZE) {
                throw new IllegalArgumentException("Файлът " + file.getOriginalFilename() + " е твърде голям. Максимален размер: 20MB");
            }
        }
    }

    private void populateResultModel(Model model, DetectionReport report, StorageService.StoredReport stored) {
        model.addAttribute("goldenPath", "/" + stored.goldenImage().relativeWebPath());
        model.addAttribute("roiPath", "/" + stored.roiMask().relativeWebPath());
        model.addAttribute("width", (int) report.originalSize().width);
        model.addAttribute("height", (int) report.originalSize().height);
        model.addAttribute("frameCount", report.frames().size());
        model.addAttribute("succeeded", report.succeeded().size());

        List<MaskRow> masks = stored.masks().stream()
                .map(m -> new MaskRow(m.frameNumber(), m.frameId(), "/" + m.file().relativeWebPath()))
                .toList();
        model.addAttribute("masks", masks);

        List<FailureRow> failures = new ArrayList<>();
        for (FrameResult f : report.failed()) {
            failures.add(new FailureRow(f.index() + 1, f.frameId(), f.error().getStage(), f.error().getCause().getMessage()));
        }
        model.addAttribute("failures", failures);
    }

    // Редове за таблиците в шаблона
    public record MaskRow(int frameNumber, String frameId, String path) {}

    public record FailureRow(int frameNumber, String frameId, String stage, String reason) {}
}
