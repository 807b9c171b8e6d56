package com.project.image.anomalies.service;

import com.project.image.anomalies.config.OpenCvNative;
import com.project.image.anomalies.exceptions.AnomalyDetectionException;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.awt.image.DataBufferByte;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import javax.imageio.ImageIO;

/**
 * Converts between encoded image bytes (PNG, BMP, JPEG, ...) and OpenCV Mats.
 */
@Service
public class ImageCodec {
    private static final Logger log = LoggerFactory.getLogger(ImageCodec.class);

    static {
        OpenCvNative.load();
    }

    public Mat decode(byte[] bytes) {
        try (InputStream in = new ByteArrayInputStream(bytes)) {
            return decode(in);
        } catch (IOException e) {
            throw new AnomalyDetectionException("Failed to decode image", e);
        }
    }

    /** Reads any ImageIO-supported format into an 8-bit, 3-channel BGR Mat. */
    public Mat decode(InputStream in) throws IOException {
        BufferedImage image = ImageIO.read(in);
        if (image == null) {
            throw new AnomalyDetectionException("Not a valid image or the file is corrupted");
        }
        log.debug("Decoded image {}x{}", image.getWidth(), image.getHeight());
        return bufferedImageToMat(image);
    }

    public byte[] encodePng(Mat mat) {
        BufferedImage img = matToBufferedImage(mat);
        try (ByteArrayOutputStream baos = new ByteArrayOutputStream()) {
            ImageIO.write(img, "png", baos);
            return baos.toByteArray();
        } catch (IOException e) {
            throw new AnomalyDetectionException("Failed to encode image", e);
        }
    }

    private Mat bufferedImageToMat(BufferedImage image) {
        BufferedImage bgrImage = new BufferedImage(image.getWidth(), image.getHeight(), BufferedImage.TYPE_3BYTE_BGR);
        Graphics2D graphics = bgrImage.createGraphics();
        graphics.drawImage(image, 0, 0, null);
        graphics.dispose();
        byte[] pixels = ((DataBufferByte) bgrImage.getRaster().getDataBuffer()).getData();
        Mat mat = new Mat(image.getHeight(), image.getWidth(), CvType.CV_8UC3);
        mat.put(0, 0, pixels);
        return mat;
    }

    private BufferedImage matToBufferedImage(Mat mat) {
        Mat src = mat;
        if (mat.depth() != CvType.CV_8U) {
            src = new Mat();
            mat.convertTo(src, CvType.CV_8U);
        }
        int type = switch (src.channels()) {
            case 1 -> BufferedImage.TYPE_BYTE_GRAY;
            case 3 -> BufferedImage.TYPE_3BYTE_BGR;
            default -> throw new AnomalyDetectionException("Cannot encode a " + src.channels() + "-channel image");
        };
        BufferedImage img = new BufferedImage(src.cols(), src.rows(), type);
        byte[] target = ((DataBufferByte) img.getRaster().getDataBuffer()).getData();
        Mat continuous = src.isContinuous() ? src : src.clone();
        continuous.get(0, 0, target);
        return img;
    }
}
