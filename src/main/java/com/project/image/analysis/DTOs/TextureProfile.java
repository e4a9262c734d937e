package com.project.image.analysis.DTOs;

import java.util.List;

public record TextureProfile(
        TextureType textureType,
        double roughness,
        double uniformity,
        double contrast,
        double directionality,
        PatternType patternType,
        DescriptorSummary descriptorSummary
) {
    public TextureProfile {
        if (textureType == null || patternType == null) {
            throw new IllegalArgumentException("Texture and pattern types are required");
        }
        if (roughness < 0 || directionality < 0) {
            throw new IllegalArgumentException("Roughness and directionality must be non-negative");
        }
        if (uniformity < 0 || uniformity > 1 || contrast < 0 || contrast > 1) {
            throw new IllegalArgumentException("Uniformity and contrast must lie in [0,1]");
        }
    }

    public static TextureProfile unknown() {
        return new TextureProfile(TextureType.UNKNOWN, 0.0, 0.0, 0.0, 0.0, PatternType.UNKNOWN,
                DescriptorSummary.EMPTY);
    }

    /**
     * Compact view of the raw descriptors: the full LBP histogram and the first
     * HOG features, plus the statistics the pattern rules were evaluated on.
     */
    public record DescriptorSummary(
            List<Double> lbpHistogram,
            List<Double> hogFeatures,
            double lbpEntropy,
            double hogMean,
            double hogStd
    ) {
        public static final DescriptorSummary EMPTY = new DescriptorSummary(List.of(), List.of(), 0.0, 0.0, 0.0);

        public DescriptorSummary {
            lbpHistogram = List.copyOf(lbpHistogram);
            hogFeatures = List.copyOf(hogFeatures);
        }
    }
}
