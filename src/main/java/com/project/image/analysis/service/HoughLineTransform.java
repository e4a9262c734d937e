package com.project.image.analysis.service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

/**
 * Straight line Hough transform over a binary edge raster. Lines are reported
 * in normal form {@code x*cos(angle) + y*sin(angle) = distance}, with angles
 * sampled uniformly in [-pi/2, pi/2).
 */
public final class HoughLineTransform {

    private final int angleCount;
    private final int maxPeaks;
    private final double relativeThreshold;
    private final int minDistance;
    private final int minAngle;

    public HoughLineTransform(int angleCount, int maxPeaks, double relativeThreshold, int minDistance, int minAngle) {
        this.angleCount = angleCount;
        this.maxPeaks = maxPeaks;
        this.relativeThreshold = relativeThreshold;
        this.minDistance = minDistance;
        this.minAngle = minAngle;
    }

    public record Line(double angle, double distance, int votes) {}

    public List<Line> detect(boolean[] edges, int width, int height) {
        if (edges.length != width * height) {
            throw new IllegalArgumentException("Raster size does not match " + width + "x" + height);
        }
        double[] angles = new double[angleCount];
        double[] cos = new double[angleCount];
        double[] sin = new double[angleCount];
        for (int j = 0; j < angleCount; j++) {
            angles[j] = -Math.PI / 2 + Math.PI * j / angleCount;
            cos[j] = Math.cos(angles[j]);
            sin[j] = Math.sin(angles[j]);
        }
        int offset = (int) Math.ceil(Math.sqrt((double) width * width + (double) height * height));
        int distanceCount = 2 * offset + 1;
        int[][] acc = new int[distanceCount][angleCount];

        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                if (!edges[y * width + x]) continue;
                for (int j = 0; j < angleCount; j++) {
                    int d = (int) Math.round(x * cos[j] + y * sin[j]) + offset;
                    acc[d][j]++;
                }
            }
        }

        int max = 0;
        for (int[] row : acc) {
            for (int v : row) max = Math.max(max, v);
        }
        int threshold = Math.max(1, (int) Math.ceil(relativeThreshold * max));

        List<int[]> candidates = new ArrayList<>();
        for (int d = 0; d < distanceCount; d++) {
            for (int j = 0; j < angleCount; j++) {
                if (acc[d][j] >= threshold) {
                    candidates.add(new int[]{acc[d][j], d, j});
                }
            }
        }
        candidates.sort(Comparator.comparingInt((int[] c) -> -c[0])
                .thenComparingInt(c -> c[1])
                .thenComparingInt(c -> c[2]));

        boolean[][] suppressed = new boolean[distanceCount][angleCount];
        List<Line> lines = new ArrayList<>();
        for (int[] candidate : candidates) {
            if (lines.size() >= maxPeaks) break;
            int d = candidate[1];
            int j = candidate[2];
            if (suppressed[d][j]) continue;
            lines.add(new Line(angles[j], d - offset, candidate[0]));
            for (int dd = Math.max(0, d - minDistance); dd <= Math.min(distanceCount - 1, d + minDistance); dd++) {
                Arrays.fill(suppressed[dd], Math.max(0, j - minAngle), Math.min(angleCount, j + minAngle + 1), true);
            }
        }
        return lines;
    }
}
