package com.project.image.analysis.DTOs;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ShapeComplexity {
    LOW("Low"),
    MEDIUM("Medium"),
    HIGH("High");

    private final String label;

    ShapeComplexity(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }
}
