package com.project.image.analysis.DTOs;

/** One palette entry: a cluster center and the share of sampled pixels assigned to it. */
public record PaletteColor(String hex, int red, int green, int blue, double percentage) {

    public PaletteColor {
        if (hex == null || !hex.matches("#[0-9A-F]{6}")) {
            throw new IllegalArgumentException("Invalid hex color: " + hex);
        }
        if (percentage < 0) {
            throw new IllegalArgumentException("Percentage must be non-negative: " + percentage);
        }
    }

    public static PaletteColor of(int red, int green, int blue, double percentage) {
        return new PaletteColor(String.format("#%02X%02X%02X", red, green, blue), red, green, blue, percentage);
    }
}
