package com.project.image.analysis.service;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class OrientedGradientsTest {

    private final OrientedGradients hog = new OrientedGradients(8, 16);

    @Test
    void compute_verticalEdgeFallsInFirstOrientationBin() {
        int size = 32;
        double[] gray = new double[size * size];
        for (int r = 0; r < size; r++) {
            for (int c = 8; c < size; c++) {
                gray[r * size + c] = 255;
            }
        }

        OrientedGradients.Descriptor d = hog.compute(gray, size, size);

        assertThat(d.features()).hasSize(2 * 2 * 8);
        assertThat(d.cellRows()).isEqualTo(2);
        assertThat(d.cellCols()).isEqualTo(2);
        // cell (0,0) holds the edge, only bin 0 is populated
        assertThat(d.features()[0]).isCloseTo(1.0, within(1e-6));
        for (int b = 1; b < 8; b++) {
            assertThat(d.features()[b]).isZero();
        }
        // cell (0,1) is flat
        for (int b = 8; b < 16; b++) {
            assertThat(d.features()[b]).isZero();
        }
        assertThat(d.magnitude()[5 * size + 8]).isEqualTo(255.0);
    }

    @Test
    void compute_flatImageHasNoGradient() {
        double[] gray = new double[64 * 64];
        java.util.Arrays.fill(gray, 90);

        OrientedGradients.Descriptor d = hog.compute(gray, 64, 64);

        assertThat(d.features()).containsOnly(0.0);
        assertThat(d.mean()).isZero();
        assertThat(d.std()).isZero();
    }
}
