package com.project.image.analysis.DTOs;

public record ShapeRecord(
        ShapeType type,
        int vertexCount,
        double area,
        double perimeter,
        double compactness,
        double aspectRatio,
        Centroid centroid
) {
    public ShapeRecord {
        if (type == null) {
            throw new IllegalArgumentException("Shape type is required");
        }
        if (compactness < 0 || compactness > 1) {
            throw new IllegalArgumentException("Compactness out of [0,1]: " + compactness);
        }
        if (aspectRatio <= 0) {
            throw new IllegalArgumentException("Aspect ratio must be positive: " + aspectRatio);
        }
    }

    public record Centroid(double x, double y) {}
}
