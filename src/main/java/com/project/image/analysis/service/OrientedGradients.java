package com.project.image.analysis.service;

/**
 * Histogram of oriented gradients with unsigned orientations and
 * single-cell blocks normalized with L2-Hys.
 */
public final class OrientedGradients {

    private static final double EPS = 1e-5;
    private static final double CLIP = 0.2;

    private final int orientations;
    private final int cellSize;

    public OrientedGradients(int orientations, int cellSize) {
        if (orientations < 1 || cellSize < 1) {
            throw new IllegalArgumentException("orientations and cellSize must be positive");
        }
        this.orientations = orientations;
        this.cellSize = cellSize;
    }

    /**
     * Feature vector laid out cell row by cell row, {@code orientations}
     * values per cell, plus the raw per-cell histograms and the gradient
     * magnitude field they were built from.
     */
    public record Descriptor(double[] features, double[][][] cellHistograms, double[] magnitude,
                             int width, int height) {

        public int cellRows() {
            return cellHistograms.length;
        }

        public int cellCols() {
            return cellHistograms.length == 0 ? 0 : cellHistograms[0].length;
        }

        public double mean() {
            if (features.length == 0) return 0;
            double sum = 0;
            for (double f : features) sum += f;
            return sum / features.length;
        }

        /** Population standard deviation of the feature vector. */
        public double std() {
            if (features.length == 0) return 0;
            double mean = mean();
            double sq = 0;
            for (double f : features) sq += (f - mean) * (f - mean);
            return Math.sqrt(sq / features.length);
        }
    }

    public Descriptor compute(double[] gray, int width, int height) {
        if (gray.length != width * height) {
            throw new IllegalArgumentException("Raster size does not match " + width + "x" + height);
        }
        double[] magnitude = new double[gray.length];
        double[] orientation = new double[gray.length];
        for (int r = 0; r < height; r++) {
            for (int c = 0; c < width; c++) {
                // central differences, zero on the border
                double gr = (r > 0 && r < height - 1) ? gray[(r + 1) * width + c] - gray[(r - 1) * width + c] : 0;
                double gc = (c > 0 && c < width - 1) ? gray[r * width + c + 1] - gray[r * width + c - 1] : 0;
                int i = r * width + c;
                magnitude[i] = Math.hypot(gr, gc);
                double deg = Math.toDegrees(Math.atan2(gr, gc)) % 180;
                orientation[i] = deg < 0 ? deg + 180 : deg;
            }
        }

        int cellRows = height / cellSize;
        int cellCols = width / cellSize;
        double binWidth = 180.0 / orientations;
        double[][][] cells = new double[cellRows][cellCols][orientations];
        for (int cy = 0; cy < cellRows; cy++) {
            for (int cx = 0; cx < cellCols; cx++) {
                double[] hist = cells[cy][cx];
                for (int r = cy * cellSize; r < (cy + 1) * cellSize; r++) {
                    for (int c = cx * cellSize; c < (cx + 1) * cellSize; c++) {
                        int i = r * width + c;
                        int bin = Math.min(orientations - 1, (int) (orientation[i] / binWidth));
                        hist[bin] += magnitude[i];
                    }
                }
                for (int b = 0; b < orientations; b++) {
                    hist[b] /= (double) cellSize * cellSize;
                }
            }
        }

        double[] features = new double[cellRows * cellCols * orientations];
        int k = 0;
        for (int cy = 0; cy < cellRows; cy++) {
            for (int cx = 0; cx < cellCols; cx++) {
                double[] block = l2Hys(cells[cy][cx]);
                System.arraycopy(block, 0, features, k, orientations);
                k += orientations;
            }
        }
        return new Descriptor(features, cells, magnitude, width, height);
    }

    private static double[] l2Hys(double[] block) {
        double[] out = new double[block.length];
        double norm = Math.sqrt(sumOfSquares(block) + EPS * EPS);
        for (int i = 0; i < block.length; i++) {
            out[i] = Math.min(block[i] / norm, CLIP);
        }
        double renorm = Math.sqrt(sumOfSquares(out) + EPS * EPS);
        for (int i = 0; i < out.length; i++) {
            out[i] /= renorm;
        }
        return out;
    }

    private static double sumOfSquares(double[] v) {
        double s = 0;
        for (double x : v) s += x * x;
        return s;
    }
}
