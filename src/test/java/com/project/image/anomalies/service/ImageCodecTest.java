package com.project.image.anomalies.service;

import com.project.image.anomalies.config.OpenCvNative;
import com.project.image.anomalies.exceptions.AnomalyDetectionException;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.opencv.core.CvType;
import org.opencv.core.Mat;

import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import javax.imageio.ImageIO;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ImageCodecTest {
    private final ImageCodec codec = new ImageCodec();

    @BeforeAll
    static void loadOpenCv() {
        OpenCvNative.load();
    }

    @Test
    void decode_bmpBecomesBgrMat() throws Exception {
        BufferedImage img = new BufferedImage(12, 10, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = img.createGraphics();
        g.setColor(new Color(200, 100, 50)); g.fillRect(0, 0, 12, 10);
        g.dispose();
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        ImageIO.write(img, "bmp", out);

        Mat mat = codec.decode(out.toByteArray());

        assertThat(mat.type()).isEqualTo(CvType.CV_8UC3);
        assertThat(mat.cols()).isEqualTo(12);
        assertThat(mat.rows()).isEqualTo(10);
        assertThat(mat.get(3, 3)).containsExactly(50.0, 100.0, 200.0);
    }

    @Test
    void encodePng_keepsMaskValues() throws Exception {
        Mat mask = TestImages.withBlock(TestImages.uniform(16, 16, 0), 4, 4, 4, 255);

        byte[] png = codec.encodePng(mask);
        BufferedImage back = ImageIO.read(new java.io.ByteArrayInputStream(png));

        assertThat(back.getWidth()).isEqualTo(16);
        assertThat(back.getRaster().getSample(5, 5, 0)).isEqualTo(255);
        assertThat(back.getRaster().getSample(0, 0, 0)).isZero();
    }

    @Test
    void decode_rejectsGarbage() {
        assertThatThrownBy(() -> codec.decode(new byte[]{1, 2, 3, 4}))
                .isInstanceOf(AnomalyDetectionException.class);
    }
}
