package com.project.image.analysis.DTOs;

import com.fasterxml.jackson.annotation.JsonValue;

public enum TextureType {
    SMOOTH("Smooth"),
    MATTE("Matte"),
    STRIATED("Striated"),
    TEXTURED("Textured"),
    ROUGH("Rough"),
    COARSE("Coarse"),
    UNKNOWN("unknown");

    private final String label;

    TextureType(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }
}
