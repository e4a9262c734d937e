package com.project.image.analysis.DTOs;

import com.fasterxml.jackson.annotation.JsonValue;

public enum LineOrientation {
    HORIZONTAL("Horizontal"),
    VERTICAL("Vertical"),
    DIAGONAL("Diagonal"),
    NONE("None");

    private final String label;

    LineOrientation(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }
}
