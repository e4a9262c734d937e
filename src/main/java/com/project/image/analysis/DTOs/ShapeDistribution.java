package com.project.image.analysis.DTOs;

import com.fasterxml.jackson.annotation.JsonValue;

/** How much of the working canvas the retained polygons cover. */
public enum ShapeDistribution {
    SPARSE("Sparse"),
    MODERATE("Moderate"),
    DENSE("Dense"),
    UNKNOWN("Unknown");

    private final String label;

    ShapeDistribution(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }
}
