package com.project.image.analysis.DTOs;

import com.fasterxml.jackson.annotation.JsonValue;

public enum PatternType {
    SOLID("Solid"),
    UNIFORM("Uniform"),
    GRADIENT("Gradient"),
    GEOMETRIC("Geometric"),
    ORGANIC("Organic"),
    COMPLEX("Complex"),
    RANDOM("Random"),
    UNKNOWN("unknown");

    private final String label;

    PatternType(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }
}
