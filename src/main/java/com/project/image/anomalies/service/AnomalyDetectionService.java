package com.project.image.anomalies.service;

import com.project.image.anomalies.DTOs.DetectionReport;
import com.project.image.anomalies.DTOs.Frame;
import com.project.image.anomalies.DTOs.FrameResult;
import com.project.image.anomalies.config.AnomalyProperties;
import com.project.image.anomalies.exceptions.DetectionCancelledException;
import com.project.image.anomalies.exceptions.DimensionMismatchException;
import com.project.image.anomalies.exceptions.EmptyInputException;
import com.project.image.anomalies.exceptions.NoUsableFramesException;
import com.project.image.anomalies.exceptions.PerImageProcessingException;
import org.opencv.core.Mat;
import org.opencv.core.Size;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.function.Function;

/**
 * Runs the whole pipeline over a frame set.
 *
 * <p>Per-frame preprocessing fans out on the detection executor, then golden synthesis and ROI extraction
 * run as barriers on the calling thread, then per-frame masking fans out again. A frame that fails in either
 * fan-out is reported and skipped; everything else keeps going.
 */
@Service
public class AnomalyDetectionService {
    private static final Logger log = LoggerFactory.getLogger(AnomalyDetectionService.class);

    static final String STAGE_PREPROCESS = "preprocessing";
    static final String STAGE_MASK = "anomaly masking";

    private final Preprocessor preprocessor;
    private final GoldenImageSynthesizer goldenSynthesizer;
    private final RoiExtractor roiExtractor;
    private final AnomalyMasker anomalyMasker;
    private final MaskCompositor maskCompositor;
    private final AnomalyProperties properties;
    private final ExecutorService executor;

    public AnomalyDetectionService(Preprocessor preprocessor,
                                   GoldenImageSynthesizer goldenSynthesizer,
                                   RoiExtractor roiExtractor,
                                   AnomalyMasker anomalyMasker,
                                   MaskCompositor maskCompositor,
                                   AnomalyProperties properties,
                                   ExecutorService detectionExecutor) {
        this.preprocessor = preprocessor;
        this.goldenSynthesizer = goldenSynthesizer;
        this.roiExtractor = roiExtractor;
        this.anomalyMasker = anomalyMasker;
        this.maskCompositor = maskCompositor;
        this.properties = properties;
        this.executor = detectionExecutor;
    }

    public DetectionReport detect(List<Frame> frames) {
        return detect(frames, properties.getGolden().getSampleCount(), CancellationToken.NONE);
    }

    /**
     * @param sampleCount leading frames averaged into the golden image, negative for all
     * @throws EmptyInputException             no frames supplied
     * @throws NoUsableFramesException         every frame failed preprocessing; the exception lists why
     * @throws DimensionMismatchException      frames differ in size or channel count
     * @throws com.project.image.anomalies.exceptions.InvalidSampleCountException sample count out of range
     * @throws DetectionCancelledException     {@code token} was cancelled before the run finished
     */
    public DetectionReport detect(List<Frame> frames, int sampleCount, CancellationToken token) {
        validate(frames, sampleCount);
        Mat first = frames.get(0).pixels();
        Size originalSize = first.size();
        log.info("Starting detection over {} frames of {}, golden sample count {}",
                frames.size(), ImageChecks.describe(first), sampleCount);

        double scale = properties.getPreprocess().getScaleFactor();
        boolean stretch = properties.getPreprocess().isAutoContrast();
        List<Staged> preprocessed = fanOut(frames, STAGE_PREPROCESS, token,
                frame -> preprocessor.preprocess(frame.pixels(), scale, stretch));
        checkCancelled(token);

        List<Staged> survivors = preprocessed.stream().filter(Staged::ok).toList();
        if (survivors.isEmpty()) {
            List<FrameResult> failures = new ArrayList<>(preprocessed.size());
            for (int i = 0; i < preprocessed.size(); i++) {
                failures.add(FrameResult.failed(i, preprocessed.get(i).error()));
            }
            throw new NoUsableFramesException(failures);
        }
        int used = GoldenImageSynthesizer.resolveCount(sampleCount, survivors.size());
        Mat golden = goldenSynthesizer.synthesize(survivors.stream().map(Staged::pixels).toList(), used);
        Mat roi = roiExtractor.extract(golden);
        checkCancelled(token);

        List<Frame> working = survivors.stream().map(s -> new Frame(s.frame().id(), s.pixels())).toList();
        List<Staged> masked = fanOut(working, STAGE_MASK, token, frame -> {
            Mat mask = anomalyMasker.computeMask(frame.pixels(), golden);
            Mat inRoi = maskCompositor.applyRoi(mask, roi);
            mask.release();
            Mat restored = maskCompositor.restoreResolution(inRoi, originalSize);
            inRoi.release();
            return restored;
        });
        checkCancelled(token);

        List<FrameResult> results = collect(frames, preprocessed, survivors, masked);
        DetectionReport report = new DetectionReport(golden, roi, originalSize, results);
        log.info("Detection finished: {} frames succeeded, {} failed",
                report.succeeded().size(), report.failed().size());
        return report;
    }

    private void validate(List<Frame> frames, int sampleCount) {
        if (frames == null || frames.isEmpty()) {
            throw new EmptyInputException("No images supplied");
        }
        Mat first = frames.get(0).pixels();
        for (Frame frame : frames) {
            ImageChecks.requireSameShape(first, frame.pixels(), "frame '" + frames.get(0).id() + "'",
                    "frame '" + frame.id() + "'");
        }
        GoldenImageSynthesizer.resolveCount(sampleCount, frames.size());
    }

    private List<Staged> fanOut(List<Frame> frames, String stage, CancellationToken token, Function<Frame, Mat> work) {
        List<CompletableFuture<Staged>> futures = new ArrayList<>(frames.size());
        for (Frame frame : frames) {
            futures.add(CompletableFuture.supplyAsync(() -> runIsolated(frame, stage, token, work), executor));
        }
        return futures.stream().map(CompletableFuture::join).toList();
    }

    private Staged runIsolated(Frame frame, String stage, CancellationToken token, Function<Frame, Mat> work) {
        try {
            if (token.isCancelled()) {
                throw new CancellationException("Run cancelled before this frame started");
            }
            return new Staged(frame, work.apply(frame), null);
        } catch (RuntimeException e) {
            PerImageProcessingException failure = new PerImageProcessingException(frame.id(), stage, e);
            log.warn(failure.getMessage());
            return new Staged(frame, null, failure);
        }
    }

    private static void checkCancelled(CancellationToken token) {
        if (token.isCancelled()) {
            throw new DetectionCancelledException("Detection run was cancelled");
        }
    }

    private static List<FrameResult> collect(List<Frame> frames, List<Staged> preprocessed,
                                             List<Staged> survivors, List<Staged> masked) {
        List<FrameResult> results = new ArrayList<>(frames.size());
        int next = 0;
        for (int i = 0; i < frames.size(); i++) {
            Staged pre = preprocessed.get(i);
            if (!pre.ok()) {
                results.add(FrameResult.failed(i, pre.error()));
                continue;
            }
            // masked is aligned with survivors, which keeps input order
            Staged post = masked.get(next);
            if (survivors.get(next) != pre) {
                throw new IllegalStateException("Frame order lost between stages");
            }
            next++;
            results.add(post.ok()
                    ? FrameResult.succeeded(i, post.frame().id(), post.pixels())
                    : FrameResult.failed(i, post.error()));
        }
        return results;
    }

    private record Staged(Frame frame, Mat pixels, PerImageProcessingException error) {
        boolean ok() {
            return error == null;
        }
    }
}
