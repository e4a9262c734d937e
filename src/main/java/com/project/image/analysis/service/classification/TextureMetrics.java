package com.project.image.analysis.service.classification;

public record TextureMetrics(double roughness, double uniformity, double contrast, double directionality) {}
