package com.project.image.analysis.service;

import com.project.image.analysis.DTOs.AnalysisError;
import com.project.image.analysis.DTOs.AnalysisOutcome;
import com.project.image.analysis.DTOs.ColorPalette;
import com.project.image.analysis.DTOs.ModelParameters;
import com.project.image.analysis.DTOs.ModelParameters.Dimensions;
import com.project.image.analysis.DTOs.ModelParameters.ModelColor;
import com.project.image.analysis.DTOs.ModelParameters.SurfaceDetail;
import com.project.image.analysis.DTOs.PaletteColor;
import com.project.image.analysis.DTOs.PatternType;
import com.project.image.analysis.DTOs.ShapeComplexity;
import com.project.image.analysis.DTOs.ShapeProfile;
import com.project.image.analysis.DTOs.ShapeRecord;
import com.project.image.analysis.DTOs.ShapeType;
import com.project.image.analysis.DTOs.TextureProfile;
import com.project.image.analysis.DTOs.TextureType;
import com.project.image.analysis.service.classification.ShapeRules;
import com.project.image.analysis.service.features.FeatureExtractor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.awt.image.BufferedImage;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns the color, shape and texture profiles into declarative model
 * parameters. The learned feature vector is computed but not yet used by any
 * rule.
 */
@Service
public class ModelGenerator {
    private static final Logger log = LoggerFactory.getLogger(ModelGenerator.class);

    static final String STAGE = "model";
    static final String CUSTOM_COLOR = "Custom";

    private static final Map<String, int[]> NAMED_COLORS = new LinkedHashMap<>();

    static {
        NAMED_COLORS.put("Red", new int[]{255, 0, 0});
        NAMED_COLORS.put("Green", new int[]{0, 255, 0});
        NAMED_COLORS.put("Blue", new int[]{0, 0, 255});
        NAMED_COLORS.put("Yellow", new int[]{255, 255, 0});
        NAMED_COLORS.put("Magenta", new int[]{255, 0, 255});
        NAMED_COLORS.put("Cyan", new int[]{0, 255, 255});
        NAMED_COLORS.put("Black", new int[]{0, 0, 0});
        NAMED_COLORS.put("White", new int[]{255, 255, 255});
        NAMED_COLORS.put("Gray", new int[]{128, 128, 128});
    }

    private final FeatureExtractor featureExtractor;

    public ModelGenerator(FeatureExtractor featureExtractor) {
        this.featureExtractor = featureExtractor;
    }

    public AnalysisOutcome<ModelParameters> generateModelParameters(BufferedImage image, ShapeProfile shapeProfile,
                                                                    ColorPalette colorPalette,
                                                                    TextureProfile textureProfile) {
        try {
            float[] features = featureExtractor.extract(image);
            log.debug("Feature extractor returned {} values", features.length);

            List<ShapeRecord> records = shapeProfile.shapeDetails();
            ModelParameters parameters = new ModelParameters(
                    ShapeRules.FORM_TYPE.classify(shapeProfile.dominantShapes()),
                    dimensions(records),
                    colors(colorPalette),
                    materials(textureProfile),
                    details(shapeProfile, textureProfile));
            log.info("Generated model parameters: {}", parameters.formType().label());
            return AnalysisOutcome.success(parameters);
        } catch (RuntimeException e) {
            log.error("Model parameter generation failed: {}", e.getMessage(), e);
            return AnalysisOutcome.failure(AnalysisError.of(STAGE, e), ModelParameters.defaults());
        }
    }

    static Dimensions dimensions(List<ShapeRecord> records) {
        if (records.isEmpty()) {
            return Dimensions.UNIT_CUBE;
        }
        ShapeRecord largest = records.stream().max(Comparator.comparingDouble(ShapeRecord::area)).get();
        double ratio = largest.aspectRatio();
        double width;
        double height;
        if (ratio > 1.0) {
            width = Math.min(2.0, ratio);
            height = 1.0;
        } else {
            width = 1.0;
            height = ratio > 0 ? Math.min(2.0, 1.0 / ratio) : 1.0;
        }
        boolean rounded = largest.type() == ShapeType.CIRCLE || largest.type() == ShapeType.SQUARE;
        return new Dimensions(width, height, rounded ? width : width * 0.5);
    }

    static List<ModelColor> colors(ColorPalette palette) {
        List<ModelColor> colors = new ArrayList<>();
        for (PaletteColor color : palette.colors()) {
            if (colors.size() == ModelParameters.MAX_COLORS) break;
            colors.add(new ModelColor(color.hex(), closestName(color.hex())));
        }
        return colors;
    }

    /** Nearest named color by Euclidean RGB distance; the first entry wins ties. */
    static String closestName(String hex) {
        if (hex == null || !hex.matches("#[0-9A-Fa-f]{6}")) {
            return CUSTOM_COLOR;
        }
        int rgb = Integer.parseInt(hex.substring(1), 16);
        int r = (rgb >> 16) & 0xFF;
        int g = (rgb >> 8) & 0xFF;
        int b = rgb & 0xFF;

        String closest = CUSTOM_COLOR;
        double best = Double.MAX_VALUE;
        for (Map.Entry<String, int[]> named : NAMED_COLORS.entrySet()) {
            int[] ref = named.getValue();
            double d = Math.sqrt(Math.pow(r - ref[0], 2) + Math.pow(g - ref[1], 2) + Math.pow(b - ref[2], 2));
            if (d < best) {
                best = d;
                closest = named.getKey();
            }
        }
        return closest;
    }

    static List<String> materials(TextureProfile texture) {
        List<String> materials = new ArrayList<>();
        switch (texture.textureType()) {
            case SMOOTH:
                materials.addAll(List.of("Glass", "Polished Metal", "Plastic"));
                break;
            case MATTE:
                materials.addAll(List.of("Matte Plastic", "Rubber", "Fabric"));
                break;
            case ROUGH:
                materials.addAll(List.of("Stone", "Concrete", "Wood"));
                break;
            case TEXTURED:
                materials.addAll(List.of("Textured Plastic", "Leather", "Canvas"));
                break;
            default:
                materials.add("Plastic");
        }
        if (texture.patternType() == PatternType.GEOMETRIC) {
            materials.add("3D Printed Polymer");
        } else if (texture.patternType() == PatternType.ORGANIC) {
            materials.add("Natural Wood");
        }
        return materials.size() > ModelParameters.MAX_MATERIALS
                ? materials.subList(0, ModelParameters.MAX_MATERIALS)
                : materials;
    }

    static List<SurfaceDetail> details(ShapeProfile shape, TextureProfile texture) {
        List<SurfaceDetail> details = new ArrayList<>();
        if (shape.complexity() == ShapeComplexity.HIGH) {
            details.add(new SurfaceDetail("surface_detail", "Complex surface patterns", 0.8));
        } else if (shape.complexity() == ShapeComplexity.MEDIUM) {
            details.add(new SurfaceDetail("surface_detail", "Moderate surface patterns", 0.5));
        }

        if (texture.textureType() == TextureType.ROUGH) {
            details.add(new SurfaceDetail("roughness", "Rough surface texture", 0.7));
        } else if (texture.textureType() == TextureType.TEXTURED) {
            details.add(new SurfaceDetail("bump_map", "Textured surface", 0.6));
        }

        if (texture.patternType() == PatternType.GEOMETRIC) {
            details.add(new SurfaceDetail("geometric_pattern", "Geometric surface pattern", 0.5));
        } else if (texture.patternType() == PatternType.ORGANIC) {
            details.add(new SurfaceDetail("organic_pattern", "Organic surface pattern", 0.6));
        }
        return details;
    }
}
