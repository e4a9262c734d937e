package com.project.image.analysis.DTOs;

import java.util.List;

public record ShapeProfile(
        List<String> dominantShapes,
        int shapeCount,
        boolean hasStraightLines,
        boolean hasCurves,
        ShapeComplexity complexity,
        ShapeDistribution distribution,
        List<ShapeRecord> shapeDetails,
        int lineCount,
        LineOrientation dominantOrientation,
        int circleCount
) {
    public static final int MAX_DETAILS = 5;
    public static final String UNKNOWN_SHAPE = "Unknown";

    public ShapeProfile {
        dominantShapes = List.copyOf(dominantShapes);
        shapeDetails = List.copyOf(shapeDetails);
        if (shapeCount < 0 || lineCount < 0 || circleCount < 0) {
            throw new IllegalArgumentException("Counts must be non-negative");
        }
        if (shapeDetails.size() > MAX_DETAILS) {
            throw new IllegalArgumentException("At most " + MAX_DETAILS + " shape details are kept");
        }
    }

    /** Sentinel for images that could not be analyzed. */
    public static ShapeProfile unknown() {
        return new ShapeProfile(List.of(UNKNOWN_SHAPE), 0, false, false,
                ShapeComplexity.LOW, ShapeDistribution.UNKNOWN, List.of(), 0, LineOrientation.NONE, 0);
    }

    public boolean mentions(String label) {
        return dominantShapes.contains(label);
    }
}
