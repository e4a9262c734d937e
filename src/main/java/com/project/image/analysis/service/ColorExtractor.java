package com.project.image.analysis.service;

import com.project.image.analysis.DTOs.AnalysisError;
import com.project.image.analysis.DTOs.AnalysisOutcome;
import com.project.image.analysis.DTOs.ColorPalette;
import com.project.image.analysis.DTOs.PaletteColor;
import com.project.image.analysis.exceptions.ImageAnalysisException;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.Point;
import org.opencv.core.Scalar;
import org.opencv.imgproc.Imgproc;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.awt.image.BufferedImage;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Dominant color palette via k-means over a nearest-neighbour thumbnail.
 */
@Service
public class ColorExtractor {
    private static final Logger log = LoggerFactory.getLogger(ColorExtractor.class);

    static final String STAGE = "color";
    static final int SAMPLE_SIZE = 150;
    private static final int ATTEMPTS = 10;
    private static final int MAX_ITERATIONS = 300;

    private static final int SWATCH_WIDTH = 120;
    private static final int SWATCH_HEIGHT = 100;
    private static final int LABEL_HEIGHT = 30;

    private final int paletteSize;
    private final long randomSeed;

    public ColorExtractor(@Value("${app.analysis.palette-size:5}") int paletteSize,
                          @Value("${app.analysis.random-seed:42}") long randomSeed) {
        if (paletteSize < 1) {
            throw new IllegalArgumentException("Palette size must be positive: " + paletteSize);
        }
        this.paletteSize = paletteSize;
        this.randomSeed = randomSeed;
    }

    public int paletteSize() {
        return paletteSize;
    }

    public AnalysisOutcome<ColorPalette> extractColors(BufferedImage image) {
        try {
            return AnalysisOutcome.success(palette(image));
        } catch (RuntimeException e) {
            log.warn("Color extraction failed: {}", e.getMessage());
            return AnalysisOutcome.failure(AnalysisError.of(STAGE, e), ColorPalette.empty());
        }
    }

    private ColorPalette palette(BufferedImage image) {
        if (image == null) {
            throw new ImageAnalysisException("No image to extract colors from");
        }
        boolean hasAlpha = image.getColorModel().hasAlpha();
        int w = image.getWidth();
        int h = image.getHeight();

        float[] points = new float[SAMPLE_SIZE * SAMPLE_SIZE * 3];
        int n = 0;
        for (int y = 0; y < SAMPLE_SIZE; y++) {
            int sy = (int) ((long) y * h / SAMPLE_SIZE);
            for (int x = 0; x < SAMPLE_SIZE; x++) {
                int sx = (int) ((long) x * w / SAMPLE_SIZE);
                int argb = image.getRGB(sx, sy);
                if (hasAlpha && (argb >>> 24) == 0) continue;
                points[3 * n]     = (argb >> 16) & 0xFF;
                points[3 * n + 1] = (argb >> 8) & 0xFF;
                points[3 * n + 2] = argb & 0xFF;
                n++;
            }
        }
        if (n == 0) {
            throw new ImageAnalysisException("Image has no opaque pixels");
        }
        if (n < paletteSize) {
            throw new ImageAnalysisException("Only " + n + " opaque pixels for a palette of " + paletteSize);
        }

        KMeansClusterer.Clustering clustering = new KMeansClusterer(ATTEMPTS, MAX_ITERATIONS, randomSeed)
                .cluster(points, n, paletteSize);
        int[] sizes = clustering.clusterSizes(paletteSize);
        float[] centers = clustering.centers();

        List<PaletteColor> colors = new ArrayList<>(paletteSize);
        for (int c = 0; c < paletteSize; c++) {
            colors.add(PaletteColor.of(
                    channel(centers[3 * c]),
                    channel(centers[3 * c + 1]),
                    channel(centers[3 * c + 2]),
                    sizes[c] * 100.0 / n));
        }
        // List.sort is stable, equal shares keep cluster order
        colors.sort(Comparator.comparingDouble(PaletteColor::percentage).reversed());
        log.debug("Extracted {} colors from {} sampled pixels", colors.size(), n);
        return new ColorPalette(colors);
    }

    private static int channel(float value) {
        return Math.max(0, Math.min(255, Math.round(value)));
    }

    /** Swatch strip with the share of each color printed underneath. */
    public BufferedImage renderPalette(ColorPalette palette) {
        if (palette.isEmpty()) {
            throw new ImageAnalysisException("Cannot render an empty palette");
        }
        OpenCvSupport.ensureLoaded();
        int count = palette.colors().size();
        Mat canvas = new Mat(SWATCH_HEIGHT + LABEL_HEIGHT, SWATCH_WIDTH * count, CvType.CV_8UC3,
                new Scalar(255, 255, 255));
        try {
            for (int i = 0; i < count; i++) {
                PaletteColor color = palette.colors().get(i);
                int x0 = i * SWATCH_WIDTH;
                Imgproc.rectangle(canvas, new Point(x0, 0), new Point(x0 + SWATCH_WIDTH - 1, SWATCH_HEIGHT - 1),
                        new Scalar(color.blue(), color.green(), color.red()), Imgproc.FILLED);
                Imgproc.putText(canvas, String.format("%.1f%%", color.percentage()),
                        new Point(x0 + 8, SWATCH_HEIGHT + 21), Imgproc.FONT_HERSHEY_SIMPLEX, 0.6,
                        new Scalar(0, 0, 0), 1);
            }
            return OpenCvSupport.matToBufferedImage(canvas);
        } finally {
            canvas.release();
        }
    }
}
