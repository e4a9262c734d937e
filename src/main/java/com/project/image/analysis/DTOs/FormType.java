package com.project.image.analysis.DTOs;

import com.fasterxml.jackson.annotation.JsonValue;

/** Mesh family a downstream modeller should start from. */
public enum FormType {
    CYLINDRICAL("cylindrical"),
    BOX("box"),
    PYRAMID("pyramid"),
    POLYHEDRON("polyhedron"),
    ORGANIC("organic"),
    GENERIC("generic");

    private final String label;

    FormType(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }
}
