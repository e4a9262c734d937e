package com.project.image.analysis.service;

import com.project.image.analysis.DTOs.AnalysisOutcome;
import com.project.image.analysis.DTOs.ColorPalette;
import com.project.image.analysis.DTOs.PaletteColor;
import com.project.image.analysis.TestImages;
import org.junit.jupiter.api.Test;

import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class ColorExtractorTest {

    @Test
    void extractColors_twoBlocks_returnsColorsSortedByShare() {
        ColorExtractor extractor = new ColorExtractor(2, 42);

        AnalysisOutcome<ColorPalette> outcome = extractor.extractColors(TestImages.redBlueSplit());

        assertThat(outcome.isSuccess()).isTrue();
        ColorPalette palette = outcome.value();
        assertThat(palette.hexColors()).containsExactly("#0000FF", "#FF0000");
        assertThat(palette.percentages().get(0)).isCloseTo(60.0, within(3.0));
        assertThat(palette.percentages().get(1)).isCloseTo(40.0, within(3.0));
        assertThat(palette.colors().get(0).blue()).isEqualTo(255);
    }

    @Test
    void extractColors_threeBlocks_matchKnownFractions() {
        BufferedImage img = TestImages.solid(100, 100, Color.GREEN);
        Graphics2D g = img.createGraphics();
        g.setColor(Color.RED);
        g.fillRect(50, 0, 30, 100);
        g.setColor(Color.BLUE);
        g.fillRect(80, 0, 20, 100);
        g.dispose();

        ColorPalette palette = new ColorExtractor(3, 42).extractColors(img).value();

        assertThat(palette.hexColors()).containsExactly("#00FF00", "#FF0000", "#0000FF");
        assertThat(palette.percentages().get(0)).isCloseTo(50.0, within(3.0));
        assertThat(palette.percentages().get(1)).isCloseTo(30.0, within(3.0));
        assertThat(palette.percentages().get(2)).isCloseTo(20.0, within(3.0));
        assertThat(palette.percentages().stream().mapToDouble(Double::doubleValue).sum()).isCloseTo(100.0, within(1e-6));
    }

    @Test
    void extractColors_ignoresTransparentPixels() {
        BufferedImage img = new BufferedImage(100, 100, BufferedImage.TYPE_INT_ARGB);
        for (int y = 0; y < 100; y++) {
            for (int x = 50; x < 100; x++) {
                img.setRGB(x, y, x < 75 ? 0xFFFF0000 : 0xFF00FF00);
            }
        }

        ColorPalette palette = new ColorExtractor(2, 42).extractColors(img).value();

        assertThat(palette.hexColors()).containsExactlyInAnyOrder("#FF0000", "#00FF00");
        assertThat(palette.percentages()).allSatisfy(p -> assertThat(p).isCloseTo(50.0, within(3.0)));
    }

    @Test
    void extractColors_fullyTransparentImage_failsWithEmptyPalette() {
        BufferedImage img = new BufferedImage(40, 40, BufferedImage.TYPE_INT_ARGB);

        AnalysisOutcome<ColorPalette> outcome = new ColorExtractor(5, 42).extractColors(img);

        assertThat(outcome.isSuccess()).isFalse();
        assertThat(outcome.value().isEmpty()).isTrue();
        assertThat(outcome.error()).hasValueSatisfying(e -> assertThat(e.stage()).isEqualTo("color"));
    }

    @Test
    void extractColors_fewerOpaquePixelsThanPaletteSize_fails() {
        BufferedImage img = new BufferedImage(150, 150, BufferedImage.TYPE_INT_ARGB);
        img.setRGB(0, 0, 0xFFFF0000);
        img.setRGB(1, 0, 0xFF00FF00);
        img.setRGB(2, 0, 0xFF0000FF);

        AnalysisOutcome<ColorPalette> outcome = new ColorExtractor(5, 42).extractColors(img);

        assertThat(outcome.isSuccess()).isFalse();
        assertThat(outcome.value().colors()).isEmpty();
    }

    @Test
    void extractColors_nullImage_fails() {
        AnalysisOutcome<ColorPalette> outcome = new ColorExtractor(5, 42).extractColors(null);
        assertThat(outcome.isSuccess()).isFalse();
        assertThat(outcome.value().isEmpty()).isTrue();
    }

    @Test
    void extractColors_isRepeatable() {
        BufferedImage img = TestImages.redBlueSplit();
        ColorExtractor extractor = new ColorExtractor(2, 7);

        assertThat(extractor.extractColors(img).value()).isEqualTo(extractor.extractColors(img).value());
    }

    @Test
    void renderPalette_drawsOneSwatchPerColor() {
        ColorPalette palette = new ColorPalette(List.of(
                PaletteColor.of(0, 0, 255, 60), PaletteColor.of(255, 0, 0, 40)));

        BufferedImage strip = new ColorExtractor(2, 42).renderPalette(palette);

        assertThat(strip.getWidth()).isEqualTo(240);
        assertThat(strip.getHeight()).isEqualTo(130);
        assertThat(strip.getRGB(10, 10) & 0xFFFFFF).isEqualTo(0x0000FF);
        assertThat(strip.getRGB(130, 10) & 0xFFFFFF).isEqualTo(0xFF0000);
    }

    @Test
    void renderPalette_rejectsEmptyPalette() {
        ColorExtractor extractor = new ColorExtractor(2, 42);
        assertThatThrownBy(() -> extractor.renderPalette(ColorPalette.empty()))
                .hasMessageContaining("empty palette");
    }
}
