package com.project.image.analysis.DTOs;

import java.util.List;

/** Declarative seed for a parametric 3D model. Not a mesh. */
public record ModelParameters(
        FormType formType,
        Dimensions dimensions,
        List<ModelColor> colors,
        List<String> materials,
        List<SurfaceDetail> details
) {
    public static final int MAX_COLORS = 3;
    public static final int MAX_MATERIALS = 3;

    public ModelParameters {
        if (formType == null || dimensions == null) {
            throw new IllegalArgumentException("Form type and dimensions are required");
        }
        colors = List.copyOf(colors);
        materials = List.copyOf(materials);
        details = List.copyOf(details);
        if (colors.size() > MAX_COLORS || materials.size() > MAX_MATERIALS) {
            throw new IllegalArgumentException("At most 3 colors and 3 materials are allowed");
        }
    }

    public static ModelParameters defaults() {
        return new ModelParameters(FormType.GENERIC, Dimensions.UNIT_CUBE,
                List.of(new ModelColor("#CCCCCC", "Gray")), List.of("Plastic"), List.of());
    }

    public record Dimensions(double width, double height, double depth) {
        public static final Dimensions UNIT_CUBE = new Dimensions(1.0, 1.0, 1.0);

        public Dimensions {
            if (width <= 0 || height <= 0 || depth <= 0) {
                throw new IllegalArgumentException("Dimensions must be positive");
            }
        }
    }

    public record ModelColor(String hex, String name) {}

    public record SurfaceDetail(String type, String description, double intensity) {
        public SurfaceDetail {
            if (intensity < 0 || intensity > 1) {
                throw new IllegalArgumentException("Intensity out of [0,1]: " + intensity);
            }
        }
    }
}
