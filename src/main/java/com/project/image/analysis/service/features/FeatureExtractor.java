package com.project.image.analysis.service.features;

import java.awt.image.BufferedImage;

/**
 * Produces a learned feature vector for an image, for example the pooled
 * activations of a pretrained classification backbone. Implementations must
 * be safe to share between concurrent analyses.
 */
public interface FeatureExtractor {

    /**
     * @param image decoded input image
     * @return feature vector; empty when no features are available
     */
    float[] extract(BufferedImage image);
}
