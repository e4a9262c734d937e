package com.project.image.analysis.service;

import com.project.image.analysis.DTOs.AnalysisResult;
import com.project.image.analysis.DTOs.DesignSuggestions;
import com.project.image.analysis.DTOs.DesignSuggestions.ColorSuggestions;
import com.project.image.analysis.DTOs.DesignSuggestions.FormSuggestions;
import com.project.image.analysis.DTOs.DesignSuggestions.MaterialSuggestions;
import com.project.image.analysis.DTOs.FormType;
import com.project.image.analysis.DTOs.ShapeComplexity;
import com.project.image.analysis.DTOs.ShapeProfile;
import com.project.image.analysis.DTOs.TextureType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Presentation-level design hints derived from a finished analysis. Nothing
 * here feeds back into the numeric pipeline.
 */
@Service
public class DesignSuggestionService {
    private static final Logger log = LoggerFactory.getLogger(DesignSuggestionService.class);

    static final String DEFAULT_PRIMARY = "#CCCCCC";
    static final String DEFAULT_ACCENT = "#FF5722";
    private static final int TOP_COLORS = 3;

    private static final Map<String, String> SUSTAINABLE_ALTERNATIVES = new LinkedHashMap<>();

    static {
        SUSTAINABLE_ALTERNATIVES.put("Plastic", "Recycled Plastic");
        SUSTAINABLE_ALTERNATIVES.put("Glass", "Recycled Glass");
        SUSTAINABLE_ALTERNATIVES.put("Metal", "Recycled Aluminum");
        SUSTAINABLE_ALTERNATIVES.put("Wood", "FSC-Certified Wood");
        SUSTAINABLE_ALTERNATIVES.put("Leather", "Vegan Leather");
        SUSTAINABLE_ALTERNATIVES.put("Fabric", "Organic Cotton");
    }

    public DesignSuggestions suggest(AnalysisResult result) {
        try {
            FormType formType = result.modelParameters().formType();
            DesignSuggestions suggestions = new DesignSuggestions(
                    colorSuggestions(result.colorPalette().hexColors()),
                    materialSuggestions(result.textureProfile().textureType(), result.modelParameters().materials()),
                    new FormSuggestions(formDescription(result.shapeProfile().dominantShapes()),
                            recommendedProportions(formType), ergonomicConsiderations(formType)),
                    designApproach(result.textureProfile().textureType(), result.shapeProfile()));
            log.info("Design suggestions generated: {}", suggestions.designApproach());
            return suggestions;
        } catch (RuntimeException e) {
            log.error("Error generating design suggestions: {}", e.getMessage(), e);
            return DesignSuggestions.fallback();
        }
    }

    static ColorSuggestions colorSuggestions(List<String> dominantColors) {
        List<String> primary = dominantColors.isEmpty()
                ? List.of(DEFAULT_PRIMARY)
                : dominantColors.subList(0, Math.min(TOP_COLORS, dominantColors.size()));
        List<String> complementary = new ArrayList<>();
        for (String hex : primary) {
            complementary.add(invert(hex));
        }
        String accent = complementary.isEmpty() ? DEFAULT_ACCENT : complementary.get(0);
        return new ColorSuggestions(List.copyOf(primary), complementary, accent);
    }

    static String invert(String hex) {
        int rgb = Integer.parseInt(hex.substring(1), 16);
        return String.format("#%02X%02X%02X",
                255 - ((rgb >> 16) & 0xFF), 255 - ((rgb >> 8) & 0xFF), 255 - (rgb & 0xFF));
    }

    static MaterialSuggestions materialSuggestions(TextureType textureType, List<String> materials) {
        List<String> eco = new ArrayList<>();
        for (String material : materials) {
            eco.add(SUSTAINABLE_ALTERNATIVES.entrySet().stream()
                    .filter(e -> material.contains(e.getKey()))
                    .map(Map.Entry::getValue)
                    .findFirst()
                    .orElse("Sustainable " + material));
        }
        return new MaterialSuggestions(materials, eco, textureType.label() + " finish");
    }

    static String formDescription(List<String> dominantShapes) {
        String flavour;
        if (dominantShapes.contains("Circle") || dominantShapes.contains("Circular")) {
            flavour = "curved elements and organic flow";
        } else if (dominantShapes.contains("Rectangle") || dominantShapes.contains("Square")) {
            flavour = "clean lines and structured geometry";
        } else if (dominantShapes.contains("Triangle")) {
            flavour = "dynamic angles and directional elements";
        } else if (dominantShapes.contains("Organic")) {
            flavour = "natural, flowing contours";
        } else {
            flavour = "mixed geometric elements";
        }
        return "Balanced form with " + flavour;
    }

    static String recommendedProportions(FormType formType) {
        switch (formType) {
            case CYLINDRICAL:
                return "Golden ratio (1:1.618) for height to diameter";
            case BOX:
                return "Rule of thirds for dividing surfaces";
            case PYRAMID:
                return "Balanced base-to-height ratio of 2:1";
            case ORGANIC:
                return "Asymmetrical balance with focal point";
            default:
                return "Balanced proportions with visual hierarchy";
        }
    }

    static List<String> ergonomicConsiderations(FormType formType) {
        List<String> notes = new ArrayList<>();
        notes.add("Consider user comfort and accessibility");
        switch (formType) {
            case CYLINDRICAL:
                notes.add("Ensure comfortable grip diameter");
                notes.add("Round edges for hand comfort");
                break;
            case BOX:
                notes.add("Avoid sharp corners");
                notes.add("Consider weight distribution");
                break;
            case ORGANIC:
                notes.add("Follow natural hand/body contours");
                notes.add("Test with diverse user groups");
                break;
            default:
                notes.add("Balance aesthetics with usability");
                notes.add("Consider user interaction points");
        }
        return notes;
    }

    static String designApproach(TextureType texture, ShapeProfile shape) {
        ShapeComplexity complexity = shape.complexity();
        if ((texture == TextureType.SMOOTH || texture == TextureType.MATTE) && complexity == ShapeComplexity.LOW) {
            return "Minimalist";
        }
        if ((texture == TextureType.TEXTURED || texture == TextureType.ROUGH) && complexity == ShapeComplexity.HIGH) {
            return "Organic/Natural";
        }
        if (shape.dominantShapes().stream().anyMatch(s -> s.contains("Geometric"))) {
            return "Geometric/Structured";
        }
        if (texture == TextureType.SMOOTH && complexity == ShapeComplexity.HIGH) {
            return "Modern/Sleek";
        }
        return "Balanced";
    }
}
