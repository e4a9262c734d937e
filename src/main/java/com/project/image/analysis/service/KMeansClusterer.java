package com.project.image.analysis.service;

import java.util.Arrays;
import java.util.Random;

/**
 * K-means over 3-component points stored flat ({@code [x0, y0, z0, x1, ...]}).
 * Each call runs several k-means++ seeded attempts from its own generator and
 * keeps the one with the lowest inertia, so results depend only on the seed.
 */
public class KMeansClusterer {

    private final int attempts;
    private final int maxIterations;
    private final long seed;

    public KMeansClusterer(int attempts, int maxIterations, long seed) {
        if (attempts < 1 || maxIterations < 1) {
            throw new IllegalArgumentException("attempts and maxIterations must be positive");
        }
        this.attempts = attempts;
        this.maxIterations = maxIterations;
        this.seed = seed;
    }

    public record Clustering(float[] centers, int[] assignments, double inertia) {

        public int[] clusterSizes(int k) {
            int[] sizes = new int[k];
            for (int a : assignments) sizes[a]++;
            return sizes;
        }
    }

    public Clustering cluster(float[] points, int n, int k) {
        if (k < 1) {
            throw new IllegalArgumentException("k must be positive");
        }
        if (n < k) {
            throw new IllegalArgumentException("Need at least " + k + " points, got " + n);
        }
        Random rnd = new Random(seed);
        Clustering best = null;
        for (int attempt = 0; attempt < attempts; attempt++) {
            Clustering candidate = lloyd(points, n, k, seedCenters(points, n, k, rnd));
            if (best == null || candidate.inertia() < best.inertia()) {
                best = candidate;
            }
        }
        return best;
    }

    private static float[] seedCenters(float[] points, int n, int k, Random rnd) {
        float[] cent = new float[k * 3];
        int first = rnd.nextInt(n);
        copyPoint(points, first, cent, 0);

        double[] nearest = new double[n];
        for (int i = 0; i < n; i++) {
            nearest[i] = dist2(points, i, cent, 0);
        }

        for (int c = 1; c < k; c++) {
            double total = 0;
            for (double d : nearest) total += d;

            int chosen;
            if (total <= 0) {
                chosen = rnd.nextInt(n);
            } else {
                double target = rnd.nextDouble() * total;
                double cumulative = 0;
                chosen = n - 1;
                for (int i = 0; i < n; i++) {
                    cumulative += nearest[i];
                    if (cumulative > target) {
                        chosen = i;
                        break;
                    }
                }
            }
            copyPoint(points, chosen, cent, c);
            for (int i = 0; i < n; i++) {
                nearest[i] = Math.min(nearest[i], dist2(points, i, cent, c));
            }
        }
        return cent;
    }

    private Clustering lloyd(float[] points, int n, int k, float[] cent) {
        int[] assign = new int[n];
        Arrays.fill(assign, -1);
        double[] sum = new double[k * 3];
        int[] cnt = new int[k];

        for (int it = 0; it < maxIterations; it++) {
            boolean changed = false;

            for (int i = 0; i < n; i++) {
                int best = nearestCenter(points, i, cent, k);
                if (assign[i] != best) {
                    assign[i] = best;
                    changed = true;
                }
            }

            if (!changed) break;

            Arrays.fill(sum, 0);
            Arrays.fill(cnt, 0);

            for (int i = 0; i < n; i++) {
                int c = assign[i];
                sum[3 * c]     += points[3 * i];
                sum[3 * c + 1] += points[3 * i + 1];
                sum[3 * c + 2] += points[3 * i + 2];
                cnt[c]++;
            }

            // an empty cluster keeps its previous center
            for (int c = 0; c < k; c++) {
                if (cnt[c] == 0) continue;
                cent[3 * c]     = (float) (sum[3 * c] / cnt[c]);
                cent[3 * c + 1] = (float) (sum[3 * c + 1] / cnt[c]);
                cent[3 * c + 2] = (float) (sum[3 * c + 2] / cnt[c]);
            }
        }

        double inertia = 0;
        for (int i = 0; i < n; i++) {
            inertia += dist2(points, i, cent, assign[i]);
        }
        return new Clustering(cent, assign, inertia);
    }

    private static int nearestCenter(float[] points, int i, float[] cent, int k) {
        int best = 0;
        double bestD = dist2(points, i, cent, 0);
        for (int c = 1; c < k; c++) {
            double d = dist2(points, i, cent, c);
            if (d < bestD) {
                bestD = d;
                best = c;
            }
        }
        return best;
    }

    private static void copyPoint(float[] points, int i, float[] cent, int c) {
        cent[3 * c]     = points[3 * i];
        cent[3 * c + 1] = points[3 * i + 1];
        cent[3 * c + 2] = points[3 * i + 2];
    }

    private static double dist2(float[] points, int i, float[] cent, int c) {
        double d0 = points[3 * i] - cent[3 * c];
        double d1 = points[3 * i + 1] - cent[3 * c + 1];
        double d2 = points[3 * i + 2] - cent[3 * c + 2];
        return d0 * d0 + d1 * d1 + d2 * d2;
    }
}
