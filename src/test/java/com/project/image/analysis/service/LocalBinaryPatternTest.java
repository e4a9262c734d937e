package com.project.image.analysis.service;

import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class LocalBinaryPatternTest {

    private final LocalBinaryPattern lbp = new LocalBinaryPattern(24, 3);

    @Test
    void codes_blackImageIsAllOnes() {
        int[] codes = lbp.codes(new double[20 * 20], 20, 20);
        assertThat(codes).containsOnly(24);

        double[] hist = LocalBinaryPattern.histogram(codes);
        assertThat(hist).hasSize(25);
        assertThat(hist[24]).isEqualTo(1.0);
        assertThat(LocalBinaryPattern.entropy(hist)).isCloseTo(0.0, within(1e-6));
    }

    @Test
    void codes_isolatedBrightPixelHasNoNeighboursAbove() {
        double[] gray = new double[9 * 9];
        gray[4 * 9 + 4] = 255;
        int[] codes = lbp.codes(gray, 9, 9);
        assertThat(codes[4 * 9 + 4]).isZero();
    }

    @Test
    void histogram_isNormalized() {
        double[] gray = new double[32 * 32];
        for (int i = 0; i < gray.length; i++) gray[i] = (i * 37) % 256;
        double[] hist = LocalBinaryPattern.histogram(lbp.codes(gray, 32, 32));

        assertThat(Arrays.stream(hist).sum()).isCloseTo(1.0, within(1e-9));
        assertThat(hist.length).isLessThanOrEqualTo(26);
    }

    @Test
    void entropy_ofUniformHistogram() {
        double[] hist = {0.25, 0.25, 0.25, 0.25};
        assertThat(LocalBinaryPattern.entropy(hist)).isCloseTo(2.0, within(1e-6));
    }
}
