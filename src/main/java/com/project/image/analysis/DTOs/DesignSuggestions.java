package com.project.image.analysis.DTOs;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record DesignSuggestions(
        ColorSuggestions colorSuggestions,
        MaterialSuggestions materialSuggestions,
        FormSuggestions formSuggestions,
        String designApproach
) {
    public static DesignSuggestions fallback() {
        return new DesignSuggestions(
                new ColorSuggestions(List.of(), List.of(), null),
                new MaterialSuggestions(List.of(), List.of(), null),
                new FormSuggestions(null, null, List.of()),
                "Balanced");
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record ColorSuggestions(List<String> primaryPalette, List<String> complementaryPalette,
                                   String recommendedAccent) {}

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record MaterialSuggestions(List<String> recommendedMaterials, List<String> ecoFriendlyAlternatives,
                                      String textureRecommendation) {}

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record FormSuggestions(String formDescription, String recommendedProportions,
                                  List<String> ergonomicConsiderations) {}
}
