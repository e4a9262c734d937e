package com.project.image.analysis.service;

import com.project.image.analysis.exceptions.ImageAnalysisException;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.Size;
import org.opencv.imgproc.Imgproc;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.awt.image.DataBufferByte;

/**
 * Conversions between {@link BufferedImage} and OpenCV matrices. Loading this
 * class loads the native OpenCV library once per JVM.
 */
public final class OpenCvSupport {
    private static final Logger log = LoggerFactory.getLogger(OpenCvSupport.class);

    static {
        try {
            nu.pattern.OpenCV.loadLocally();
            log.info("OpenCV loaded successfully");
        } catch (Throwable e) {
            log.error("Failed to load OpenCV", e);
        }
    }

    private OpenCvSupport() {
    }

    /** Forces the static initializer to run. */
    public static void ensureLoaded() {
        // class initialization does the work
    }

    public static Mat bufferedImageToMat(BufferedImage image) {
        BufferedImage bgrImage = new BufferedImage(image.getWidth(), image.getHeight(), BufferedImage.TYPE_3BYTE_BGR);
        Graphics2D graphics = bgrImage.createGraphics();
        graphics.drawImage(image, 0, 0, null);
        graphics.dispose();
        byte[] pixels = ((DataBufferByte) bgrImage.getRaster().getDataBuffer()).getData();
        Mat mat = new Mat(image.getHeight(), image.getWidth(), CvType.CV_8UC3);
        mat.put(0, 0, pixels);
        return mat;
    }

    /** Grayscale copy of the image resized to {@code width x height}. */
    public static Mat grayscale(BufferedImage image, int width, int height) {
        Mat color = bufferedImageToMat(image);
        Mat gray = new Mat();
        Mat resized = new Mat();
        try {
            Imgproc.cvtColor(color, gray, Imgproc.COLOR_BGR2GRAY);
            Imgproc.resize(gray, resized, new Size(width, height), 0, 0, Imgproc.INTER_LINEAR);
            return resized;
        } finally {
            color.release();
            gray.release();
        }
    }

    /** Reads an 8-bit single channel matrix into an array of doubles, row-major. */
    public static double[] toDoubles(Mat gray) {
        if (gray.type() != CvType.CV_8UC1) {
            throw new ImageAnalysisException("Expected an 8-bit grayscale matrix, got type " + gray.type());
        }
        byte[] data = new byte[gray.rows() * gray.cols()];
        gray.get(0, 0, data);
        double[] values = new double[data.length];
        for (int i = 0; i < data.length; i++) {
            values[i] = data[i] & 0xFF;
        }
        return values;
    }

    public static BufferedImage matToBufferedImage(Mat mat) {
        int w = mat.cols();
        int h = mat.rows();
        if (mat.channels() == 1) {
            BufferedImage image = new BufferedImage(w, h, BufferedImage.TYPE_BYTE_GRAY);
            byte[] target = ((DataBufferByte) image.getRaster().getDataBuffer()).getData();
            mat.get(0, 0, target);
            return image;
        }
        if (mat.channels() == 3) {
            BufferedImage image = new BufferedImage(w, h, BufferedImage.TYPE_3BYTE_BGR);
            byte[] target = ((DataBufferByte) image.getRaster().getDataBuffer()).getData();
            mat.get(0, 0, target);
            return image;
        }
        throw new ImageAnalysisException("Unsupported channel count: " + mat.channels());
    }
}
