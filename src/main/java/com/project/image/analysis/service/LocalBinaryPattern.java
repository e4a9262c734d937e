package com.project.image.analysis.service;

/**
 * Rotation-invariant uniform local binary patterns over a grayscale raster.
 * Neighbours are sampled on a circle with bilinear interpolation; samples that
 * fall outside the raster read as 0.
 */
public final class LocalBinaryPattern {

    private final int points;
    private final double radius;
    private final double[] rowOffsets;
    private final double[] colOffsets;

    public LocalBinaryPattern(int points, double radius) {
        if (points < 1 || radius <= 0) {
            throw new IllegalArgumentException("points and radius must be positive");
        }
        this.points = points;
        this.radius = radius;
        this.rowOffsets = new double[points];
        this.colOffsets = new double[points];
        for (int p = 0; p < points; p++) {
            double angle = 2 * Math.PI * p / points;
            rowOffsets[p] = round5(-radius * Math.sin(angle));
            colOffsets[p] = round5(radius * Math.cos(angle));
        }
    }

    public int points() {
        return points;
    }

    public double radius() {
        return radius;
    }

    /**
     * Pattern code per pixel, row-major. Uniform patterns (at most two bit
     * transitions) map to their number of set bits, everything else to
     * {@code points + 1}.
     */
    public int[] codes(double[] gray, int width, int height) {
        if (gray.length != width * height) {
            throw new IllegalArgumentException("Raster size does not match " + width + "x" + height);
        }
        int[] codes = new int[gray.length];
        boolean[] signs = new boolean[points];
        for (int r = 0; r < height; r++) {
            for (int c = 0; c < width; c++) {
                double center = gray[r * width + c];
                int ones = 0;
                for (int p = 0; p < points; p++) {
                    double sample = bilinear(gray, width, height, r + rowOffsets[p], c + colOffsets[p]);
                    signs[p] = sample - center >= 0;
                    if (signs[p]) ones++;
                }
                int changes = 0;
                for (int p = 0; p < points - 1; p++) {
                    if (signs[p] != signs[p + 1]) changes++;
                }
                codes[r * width + c] = changes <= 2 ? ones : points + 1;
            }
        }
        return codes;
    }

    /** Histogram with {@code max(code) + 1} bins, normalized to sum to one. */
    public static double[] histogram(int[] codes) {
        int max = 0;
        for (int code : codes) max = Math.max(max, code);
        double[] hist = new double[max + 1];
        for (int code : codes) hist[code]++;
        if (codes.length > 0) {
            for (int i = 0; i < hist.length; i++) hist[i] /= codes.length;
        }
        return hist;
    }

    /** Shannon entropy in bits; the small offset keeps empty bins finite. */
    public static double entropy(double[] histogram) {
        double h = 0;
        for (double p : histogram) {
            h -= p * (Math.log(p + 1e-10) / Math.log(2));
        }
        return h;
    }

    private static double bilinear(double[] gray, int width, int height, double r, double c) {
        int minR = (int) Math.floor(r);
        int minC = (int) Math.floor(c);
        int maxR = (int) Math.ceil(r);
        int maxC = (int) Math.ceil(c);
        double dr = r - minR;
        double dc = c - minC;
        double top = (1 - dc) * pixel(gray, width, height, minR, minC) + dc * pixel(gray, width, height, minR, maxC);
        double bottom = (1 - dc) * pixel(gray, width, height, maxR, minC) + dc * pixel(gray, width, height, maxR, maxC);
        return (1 - dr) * top + dr * bottom;
    }

    private static double pixel(double[] gray, int width, int height, int r, int c) {
        if (r < 0 || r >= height || c < 0 || c >= width) {
            return 0;
        }
        return gray[r * width + c];
    }

    private static double round5(double v) {
        return Math.round(v * 1e5) / 1e5;
    }
}
