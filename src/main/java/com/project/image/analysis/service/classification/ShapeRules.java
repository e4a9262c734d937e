package com.project.image.analysis.service.classification;

import com.project.image.analysis.DTOs.FormType;
import com.project.image.analysis.DTOs.LineOrientation;
import com.project.image.analysis.DTOs.ShapeComplexity;
import com.project.image.analysis.DTOs.ShapeDistribution;
import com.project.image.analysis.DTOs.ShapeType;

import java.util.List;

/** Threshold tables used by shape detection and form selection. */
public final class ShapeRules {

    private static final double ORIENTATION_TOLERANCE = 0.1;

    /** Compactness is checked first so a round contour is a circle whatever its vertex count. */
    public static final RuleChain<PolygonMetrics, ShapeType> SHAPE_TYPE = RuleChain.<PolygonMetrics, ShapeType>builder()
            .when("compactness > 0.8", m -> m.compactness() > 0.8, ShapeType.CIRCLE)
            .when("3 vertices", m -> m.vertexCount() == 3, ShapeType.TRIANGLE)
            .when("4 vertices, aspect in (0.9, 1.1)",
                    m -> m.vertexCount() == 4 && m.aspectRatio() > 0.9 && m.aspectRatio() < 1.1, ShapeType.SQUARE)
            .when("4 vertices", m -> m.vertexCount() == 4, ShapeType.RECTANGLE)
            .when("5 vertices", m -> m.vertexCount() == 5, ShapeType.PENTAGON)
            .when("6 vertices", m -> m.vertexCount() == 6, ShapeType.HEXAGON)
            .when("7-14 vertices", m -> m.vertexCount() > 6 && m.vertexCount() < 15, ShapeType.POLYGON)
            .otherwise(ShapeType.ORGANIC);

    public static final RuleChain<Integer, ShapeComplexity> COMPLEXITY = RuleChain.<Integer, ShapeComplexity>builder()
            .when("fewer than 3 shapes", n -> n < 3, ShapeComplexity.LOW)
            .when("fewer than 10 shapes", n -> n < 10, ShapeComplexity.MEDIUM)
            .otherwise(ShapeComplexity.HIGH);

    public static final RuleChain<Double, ShapeDistribution> DISTRIBUTION = RuleChain.<Double, ShapeDistribution>builder()
            .when("coverage < 0.2", r -> r < 0.2, ShapeDistribution.SPARSE)
            .when("coverage < 0.5", r -> r < 0.5, ShapeDistribution.MODERATE)
            .otherwise(ShapeDistribution.DENSE);

    /** Angles are Hough normal angles in [-pi/2, pi/2). */
    public static final RuleChain<Double, LineOrientation> LINE_ORIENTATION = RuleChain.<Double, LineOrientation>builder()
            .when("near 0 or pi/2",
                    a -> Math.abs(a) < ORIENTATION_TOLERANCE || Math.abs(a - Math.PI / 2) < ORIENTATION_TOLERANCE,
                    LineOrientation.VERTICAL)
            .when("near +/- pi/4",
                    a -> Math.abs(a - Math.PI / 4) < ORIENTATION_TOLERANCE || Math.abs(a + Math.PI / 4) < ORIENTATION_TOLERANCE,
                    LineOrientation.DIAGONAL)
            .otherwise(LineOrientation.HORIZONTAL);

    public static final RuleChain<List<String>, FormType> FORM_TYPE = RuleChain.<List<String>, FormType>builder()
            .when("round", s -> s.contains("Circle") || s.contains("Circular"), FormType.CYLINDRICAL)
            .when("rectangular", s -> s.contains("Rectangle") || s.contains("Square"), FormType.BOX)
            .when("triangular", s -> s.contains("Triangle"), FormType.PYRAMID)
            .when("polygonal", s -> s.contains("Polygon"), FormType.POLYHEDRON)
            .when("organic", s -> s.contains("Organic"), FormType.ORGANIC)
            .otherwise(FormType.GENERIC);

    private ShapeRules() {
    }
}
