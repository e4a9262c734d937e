package com.project.image.analysis.service.classification;

import com.project.image.analysis.DTOs.PatternType;
import com.project.image.analysis.DTOs.TextureType;

public final class TextureRules {

    public static final RuleChain<TextureMetrics, TextureType> TEXTURE_TYPE = RuleChain.<TextureMetrics, TextureType>builder()
            .when("roughness < 10, uniformity > 0.5", m -> m.roughness() < 10 && m.uniformity() > 0.5, TextureType.SMOOTH)
            .when("roughness < 10", m -> m.roughness() < 10, TextureType.MATTE)
            .when("roughness < 30, directionality > 0.5", m -> m.roughness() < 30 && m.directionality() > 0.5, TextureType.STRIATED)
            .when("roughness < 30", m -> m.roughness() < 30, TextureType.TEXTURED)
            .when("contrast > 0.3", m -> m.contrast() > 0.3, TextureType.ROUGH)
            .otherwise(TextureType.COARSE);

    public static final RuleChain<PatternMetrics, PatternType> PATTERN_TYPE = RuleChain.<PatternMetrics, PatternType>builder()
            .when("entropy < 3", m -> m.lbpEntropy() < 3.0, PatternType.SOLID)
            .when("entropy < 4, hog std < 0.1", m -> m.lbpEntropy() < 4.0 && m.hogStd() < 0.1, PatternType.UNIFORM)
            .when("entropy < 4", m -> m.lbpEntropy() < 4.0, PatternType.GRADIENT)
            .when("entropy < 5, hog mean > 0.2", m -> m.lbpEntropy() < 5.0 && m.hogMean() > 0.2, PatternType.GEOMETRIC)
            .when("entropy < 5", m -> m.lbpEntropy() < 5.0, PatternType.ORGANIC)
            .when("hog std > 0.2", m -> m.hogStd() > 0.2, PatternType.COMPLEX)
            .otherwise(PatternType.RANDOM);

    private TextureRules() {
    }
}
