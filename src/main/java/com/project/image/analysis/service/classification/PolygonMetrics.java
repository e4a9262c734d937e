package com.project.image.analysis.service.classification;

/** Measurements of one simplified contour that the shape rules look at. */
public record PolygonMetrics(int vertexCount, double compactness, double aspectRatio) {}
