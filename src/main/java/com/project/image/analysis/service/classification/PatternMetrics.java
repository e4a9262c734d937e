package com.project.image.analysis.service.classification;

/** LBP histogram entropy (bits) together with the mean and spread of the HOG vector. */
public record PatternMetrics(double lbpEntropy, double hogMean, double hogStd) {}
