package com.project.image.analysis.service;

import com.project.image.analysis.DTOs.AnalysisError;
import com.project.image.analysis.DTOs.AnalysisOutcome;
import com.project.image.analysis.DTOs.PatternType;
import com.project.image.analysis.DTOs.TextureProfile;
import com.project.image.analysis.DTOs.TextureType;
import com.project.image.analysis.exceptions.ImageAnalysisException;
import com.project.image.analysis.service.classification.PatternMetrics;
import com.project.image.analysis.service.classification.TextureMetrics;
import com.project.image.analysis.service.classification.TextureRules;
import org.opencv.core.Core;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.MatOfDouble;
import org.opencv.core.Point;
import org.opencv.core.Scalar;
import org.opencv.imgproc.Imgproc;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.awt.image.BufferedImage;
import java.util.ArrayList;
import java.util.List;

/**
 * Surface texture from local binary patterns, oriented gradients and
 * intensity statistics of a 256x256 grayscale copy.
 */
@Service
public class TextureAnalyzer {
    private static final Logger log = LoggerFactory.getLogger(TextureAnalyzer.class);

    static final String STAGE = "texture";
    static final int WORK_SIZE = 256;
    static final int LBP_RADIUS = 3;
    static final int LBP_POINTS = 8 * LBP_RADIUS;
    static final int HOG_ORIENTATIONS = 8;
    static final int HOG_CELL = 16;
    private static final int HOG_SUMMARY_LENGTH = 10;

    private final LocalBinaryPattern lbp = new LocalBinaryPattern(LBP_POINTS, LBP_RADIUS);
    private final OrientedGradients hog = new OrientedGradients(HOG_ORIENTATIONS, HOG_CELL);

    public AnalysisOutcome<TextureProfile> analyzeTexture(BufferedImage image) {
        try {
            return AnalysisOutcome.success(profile(image));
        } catch (RuntimeException e) {
            log.warn("Texture analysis failed: {}", e.getMessage());
            return AnalysisOutcome.failure(AnalysisError.of(STAGE, e), TextureProfile.unknown());
        }
    }

    private TextureProfile profile(BufferedImage image) {
        Mat gray = workingGray(image);
        try {
            double[] pixels = OpenCvSupport.toDoubles(gray);

            double[] histogram = LocalBinaryPattern.histogram(lbp.codes(pixels, WORK_SIZE, WORK_SIZE));
            double entropy = LocalBinaryPattern.entropy(histogram);
            OrientedGradients.Descriptor descriptor = hog.compute(pixels, WORK_SIZE, WORK_SIZE);

            double roughness = meanSobelMagnitude(gray);
            double sigma = standardDeviation(gray);
            double uniformity = 1.0 / (1.0 + sigma);
            double contrast = Math.min(1.0, sigma / 255.0);
            double directionality = descriptor.std();

            TextureType textureType = TextureRules.TEXTURE_TYPE.classify(
                    new TextureMetrics(roughness, uniformity, contrast, directionality));
            PatternType patternType = TextureRules.PATTERN_TYPE.classify(
                    new PatternMetrics(entropy, descriptor.mean(), descriptor.std()));
            log.debug("Texture roughness={} sigma={} entropy={} -> {} / {}",
                    roughness, sigma, entropy, textureType.label(), patternType.label());

            return new TextureProfile(textureType, roughness, uniformity, contrast, directionality, patternType,
                    new TextureProfile.DescriptorSummary(boxed(histogram, histogram.length),
                            boxed(descriptor.features(), HOG_SUMMARY_LENGTH),
                            entropy, descriptor.mean(), descriptor.std()));
        } finally {
            gray.release();
        }
    }

    private static Mat workingGray(BufferedImage image) {
        if (image == null) {
            throw new ImageAnalysisException("No image to analyze texture of");
        }
        OpenCvSupport.ensureLoaded();
        return OpenCvSupport.grayscale(image, WORK_SIZE, WORK_SIZE);
    }

    private static double meanSobelMagnitude(Mat gray) {
        Mat gx = new Mat();
        Mat gy = new Mat();
        Mat magnitude = new Mat();
        try {
            Imgproc.Sobel(gray, gx, CvType.CV_64F, 1, 0, 3);
            Imgproc.Sobel(gray, gy, CvType.CV_64F, 0, 1, 3);
            Core.magnitude(gx, gy, magnitude);
            return Core.mean(magnitude).val[0];
        } finally {
            gx.release();
            gy.release();
            magnitude.release();
        }
    }

    private static double standardDeviation(Mat gray) {
        MatOfDouble mean = new MatOfDouble();
        MatOfDouble std = new MatOfDouble();
        try {
            Core.meanStdDev(gray, mean, std);
            return std.toArray()[0];
        } finally {
            mean.release();
            std.release();
        }
    }

    private static List<Double> boxed(double[] values, int limit) {
        List<Double> out = new ArrayList<>(Math.min(limit, values.length));
        for (int i = 0; i < values.length && i < limit; i++) {
            out.add(values[i]);
        }
        return out;
    }

    /**
     * 2x2 panel: grayscale input, LBP code map, gradient magnitude and one
     * glyph per HOG cell with a stroke per orientation bin.
     */
    public BufferedImage renderTexturePanel(BufferedImage image) {
        Mat gray = workingGray(image);
        Mat panel = new Mat(WORK_SIZE * 2, WORK_SIZE * 2, CvType.CV_8UC1, new Scalar(0));
        try {
            double[] pixels = OpenCvSupport.toDoubles(gray);
            int[] codes = lbp.codes(pixels, WORK_SIZE, WORK_SIZE);
            OrientedGradients.Descriptor descriptor = hog.compute(pixels, WORK_SIZE, WORK_SIZE);

            gray.copyTo(panel.submat(0, WORK_SIZE, 0, WORK_SIZE));
            byte[] lbpImage = new byte[codes.length];
            for (int i = 0; i < codes.length; i++) {
                lbpImage[i] = (byte) Math.round(codes[i] * 255.0 / (LBP_POINTS + 1));
            }
            panel.submat(0, WORK_SIZE, WORK_SIZE, WORK_SIZE * 2).put(0, 0, lbpImage);
            panel.submat(WORK_SIZE, WORK_SIZE * 2, 0, WORK_SIZE).put(0, 0, scaled(descriptor.magnitude()));
            drawGlyphs(panel.submat(WORK_SIZE, WORK_SIZE * 2, WORK_SIZE, WORK_SIZE * 2), descriptor);
            return OpenCvSupport.matToBufferedImage(panel);
        } finally {
            gray.release();
            panel.release();
        }
    }

    private static byte[] scaled(double[] values) {
        double max = 0;
        for (double v : values) max = Math.max(max, v);
        byte[] out = new byte[values.length];
        if (max == 0) return out;
        for (int i = 0; i < values.length; i++) {
            out[i] = (byte) Math.round(values[i] * 255.0 / max);
        }
        return out;
    }

    private static void drawGlyphs(Mat target, OrientedGradients.Descriptor descriptor) {
        double max = 0;
        for (double[][] row : descriptor.cellHistograms()) {
            for (double[] cell : row) {
                for (double v : cell) max = Math.max(max, v);
            }
        }
        if (max == 0) return;
        double half = HOG_CELL / 2.0 - 1;
        for (int cy = 0; cy < descriptor.cellRows(); cy++) {
            for (int cx = 0; cx < descriptor.cellCols(); cx++) {
                double[] hist = descriptor.cellHistograms()[cy][cx];
                double centerX = cx * HOG_CELL + HOG_CELL / 2.0;
                double centerY = cy * HOG_CELL + HOG_CELL / 2.0;
                for (int b = 0; b < hist.length; b++) {
                    if (hist[b] == 0) continue;
                    // the stroke runs along the edge, perpendicular to the gradient
                    double angle = Math.toRadians((b + 0.5) * 180.0 / hist.length) + Math.PI / 2;
                    double dx = half * Math.cos(angle);
                    double dy = half * Math.sin(angle);
                    Imgproc.line(target, new Point(centerX - dx, centerY - dy), new Point(centerX + dx, centerY + dy),
                            new Scalar(hist[b] / max * 255), 1);
                }
            }
        }
    }
}
