package com.project.image.analysis.DTOs;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ShapeType {
    CIRCLE("Circle"),
    TRIANGLE("Triangle"),
    SQUARE("Square"),
    RECTANGLE("Rectangle"),
    PENTAGON("Pentagon"),
    HEXAGON("Hexagon"),
    POLYGON("Polygon"),
    ORGANIC("Organic");

    private final String label;

    ShapeType(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }
}
