package com.project.image.analysis.DTOs;

import java.nio.file.Path;
import java.util.List;

/** Everything one analysis produced. Built once and never modified. */
public record AnalysisResult(
        Path sourceImage,
        ColorPalette colorPalette,
        TextureProfile textureProfile,
        ShapeProfile shapeProfile,
        ModelParameters modelParameters,
        Path outputDirectory,
        List<Path> visualizationFiles
) {
    public AnalysisResult {
        if (sourceImage == null || colorPalette == null || textureProfile == null
                || shapeProfile == null || modelParameters == null) {
            throw new IllegalArgumentException("Analysis result is incomplete");
        }
        visualizationFiles = List.copyOf(visualizationFiles);
    }

    /** Placeholder carried by a failed analysis: every profile at its sentinel, nothing written. */
    public static AnalysisResult failed(Path sourceImage) {
        return new AnalysisResult(sourceImage, ColorPalette.empty(), TextureProfile.unknown(), ShapeProfile.unknown(),
                ModelParameters.defaults(), null, List.of());
    }
}
