package com.project.image.analysis.service;

import com.project.image.analysis.DTOs.AnalysisOutcome;
import com.project.image.analysis.DTOs.LineOrientation;
import com.project.image.analysis.DTOs.ShapeComplexity;
import com.project.image.analysis.DTOs.ShapeDistribution;
import com.project.image.analysis.DTOs.ShapeProfile;
import com.project.image.analysis.DTOs.ShapeRecord;
import com.project.image.analysis.DTOs.ShapeType;
import com.project.image.analysis.TestImages;
import org.junit.jupiter.api.Test;

import java.awt.Color;
import java.awt.image.BufferedImage;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ShapeDetectorTest {
    private final ShapeDetector detector = new ShapeDetector(ShapeDetector.CircleSettings.DEFAULTS);

    @Test
    void detectShapes_filledCircle_isClassifiedAsCircle() {
        ShapeProfile profile = detector.detectShapes(TestImages.circle(60)).value();

        assertThat(profile.shapeCount()).isGreaterThanOrEqualTo(1);
        assertThat(profile.shapeDetails())
                .anySatisfy(r -> {
                    assertThat(r.type()).isEqualTo(ShapeType.CIRCLE);
                    assertThat(r.compactness()).isGreaterThan(0.8);
                    assertThat(r.centroid().x()).isBetween(246.0, 266.0);
                    assertThat(r.centroid().y()).isBetween(246.0, 266.0);
                });
    }

    @Test
    void detectShapes_filledSquare_isClassifiedAsSquare() {
        ShapeProfile profile = detector.detectShapes(TestImages.rectangles(new int[]{156, 156, 200, 200})).value();

        assertThat(profile.shapeDetails())
                .anySatisfy(r -> {
                    assertThat(r.type()).isEqualTo(ShapeType.SQUARE);
                    assertThat(r.vertexCount()).isEqualTo(4);
                    assertThat(r.aspectRatio()).isStrictlyBetween(0.9, 1.1);
                });
    }

    @Test
    void detectShapes_twoRectangles_makeRectangleDominant() {
        BufferedImage img = TestImages.rectangles(new int[]{40, 60, 160, 60}, new int[]{260, 320, 180, 70});

        ShapeProfile profile = detector.detectShapes(img).value();

        assertThat(profile.dominantShapes()).contains("Rectangle");
        assertThat(profile.hasStraightLines()).isTrue();
        assertThat(profile.shapeDetails()).isSortedAccordingTo((a, b) -> Double.compare(b.area(), a.area()));
    }

    @Test
    void detectShapes_uniformImage_findsNothing() {
        AnalysisOutcome<ShapeProfile> outcome = detector.detectShapes(TestImages.solid(300, 200, Color.GRAY));

        assertThat(outcome.isSuccess()).isTrue();
        ShapeProfile profile = outcome.value();
        assertThat(profile.shapeCount()).isZero();
        assertThat(profile.dominantShapes()).containsExactly("Organic");
        assertThat(profile.complexity()).isEqualTo(ShapeComplexity.LOW);
        assertThat(profile.distribution()).isEqualTo(ShapeDistribution.SPARSE);
        assertThat(profile.lineCount()).isZero();
        assertThat(profile.dominantOrientation()).isEqualTo(LineOrientation.NONE);
        assertThat(profile.circleCount()).isZero();
        assertThat(profile.hasCurves()).isFalse();
    }

    @Test
    void detectShapes_nullImage_returnsUnknownSentinel() {
        AnalysisOutcome<ShapeProfile> outcome = detector.detectShapes(null);

        assertThat(outcome.isSuccess()).isFalse();
        assertThat(outcome.value()).isEqualTo(ShapeProfile.unknown());
        assertThat(outcome.value().dominantShapes()).containsExactly("Unknown");
        assertThat(outcome.value().distribution()).isEqualTo(ShapeDistribution.UNKNOWN);
    }

    @Test
    void dominantShapes_rankRepeatedTypesByFrequency() {
        List<ShapeRecord> records = List.of(
                record(ShapeType.TRIANGLE), record(ShapeType.TRIANGLE),
                record(ShapeType.SQUARE), record(ShapeType.SQUARE), record(ShapeType.SQUARE),
                record(ShapeType.HEXAGON));

        assertThat(ShapeDetector.dominantShapes(records, true, 0, ShapeComplexity.MEDIUM))
                .containsExactly("Square", "Triangle");
    }

    @Test
    void dominantShapes_fallbacks() {
        List<ShapeRecord> single = List.of(record(ShapeType.CIRCLE));

        assertThat(ShapeDetector.dominantShapes(single, true, 0, ShapeComplexity.LOW)).containsExactly("Geometric");
        assertThat(ShapeDetector.dominantShapes(single, true, 2, ShapeComplexity.LOW))
                .containsExactly("Geometric", "Circular");
        assertThat(ShapeDetector.dominantShapes(List.of(), false, 1, ShapeComplexity.LOW)).containsExactly("Circular");
        assertThat(ShapeDetector.dominantShapes(List.of(), false, 0, ShapeComplexity.HIGH)).containsExactly("Complex");
        assertThat(ShapeDetector.dominantShapes(List.of(), false, 0, ShapeComplexity.LOW)).containsExactly("Organic");
        assertThat(ShapeDetector.dominantShapes(
                List.of(record(ShapeType.CIRCLE), record(ShapeType.CIRCLE)), true, 3, ShapeComplexity.LOW))
                .containsExactly("Circle");
    }

    @Test
    void dominantOrientation_tiesFavourHorizontal() {
        HoughLineTransform.Line vertical = new HoughLineTransform.Line(0.0, 10, 50);
        HoughLineTransform.Line horizontal = new HoughLineTransform.Line(-Math.PI / 2, -20, 50);
        HoughLineTransform.Line diagonal = new HoughLineTransform.Line(Math.PI / 4, 5, 30);

        assertThat(ShapeDetector.dominantOrientation(List.of())).isEqualTo(LineOrientation.NONE);
        assertThat(ShapeDetector.dominantOrientation(List.of(vertical, horizontal))).isEqualTo(LineOrientation.HORIZONTAL);
        assertThat(ShapeDetector.dominantOrientation(List.of(vertical, vertical, diagonal))).isEqualTo(LineOrientation.VERTICAL);
        assertThat(ShapeDetector.dominantOrientation(List.of(diagonal, diagonal, vertical))).isEqualTo(LineOrientation.DIAGONAL);
    }

    @Test
    void renderShapePanel_isTwoByTwo() {
        BufferedImage panel = detector.renderShapePanel(TestImages.circle(60));

        assertThat(panel.getWidth()).isEqualTo(1024);
        assertThat(panel.getHeight()).isEqualTo(1024);
    }

    private static ShapeRecord record(ShapeType type) {
        return new ShapeRecord(type, 4, 500, 90, 0.5, 1.0, new ShapeRecord.Centroid(10, 10));
    }
}
