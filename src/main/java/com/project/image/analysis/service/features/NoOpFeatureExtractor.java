package com.project.image.analysis.service.features;

import java.awt.image.BufferedImage;

/**
 * Default extractor used when no backbone model is configured. Always returns
 * an empty vector.
 */
public class NoOpFeatureExtractor implements FeatureExtractor {

    private static final float[] EMPTY = new float[0];

    @Override
    public float[] extract(BufferedImage image) {
        return EMPTY;
    }
}
