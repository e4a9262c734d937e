package com.project.image.analysis.DTOs;

import java.util.List;

/**
 * Dominant colors ordered by descending area share. An empty palette means the
 * extraction could not run, not that the image has no colors.
 */
public record ColorPalette(List<PaletteColor> colors) {

    private static final ColorPalette EMPTY = new ColorPalette(List.of());

    public ColorPalette {
        colors = List.copyOf(colors);
        for (int i = 1; i < colors.size(); i++) {
            if (colors.get(i).percentage() > colors.get(i - 1).percentage()) {
                throw new IllegalArgumentException("Palette must be sorted by descending percentage");
            }
        }
    }

    public static ColorPalette empty() {
        return EMPTY;
    }

    public boolean isEmpty() {
        return colors.isEmpty();
    }

    public List<String> hexColors() {
        return colors.stream().map(PaletteColor::hex).toList();
    }

    public List<Double> percentages() {
        return colors.stream().map(PaletteColor::percentage).toList();
    }

    public List<List<Integer>> rgbValues() {
        return colors.stream().map(c -> List.of(c.red(), c.green(), c.blue())).toList();
    }
}
