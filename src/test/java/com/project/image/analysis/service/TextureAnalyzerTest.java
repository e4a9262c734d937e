package com.project.image.analysis.service;

import com.project.image.analysis.DTOs.AnalysisOutcome;
import com.project.image.analysis.DTOs.PatternType;
import com.project.image.analysis.DTOs.TextureProfile;
import com.project.image.analysis.DTOs.TextureType;
import com.project.image.analysis.TestImages;
import org.junit.jupiter.api.Test;

import java.awt.Color;
import java.awt.image.BufferedImage;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class TextureAnalyzerTest {
    private final TextureAnalyzer analyzer = new TextureAnalyzer();

    @Test
    void analyzeTexture_flatImage_isSmooth() {
        TextureProfile profile = analyzer.analyzeTexture(TestImages.solid(120, 80, new Color(128, 128, 128))).value();

        assertThat(profile.roughness()).isCloseTo(0.0, within(1e-9));
        assertThat(profile.uniformity()).isCloseTo(1.0, within(1e-9));
        assertThat(profile.contrast()).isCloseTo(0.0, within(1e-9));
        assertThat(profile.directionality()).isCloseTo(0.0, within(1e-9));
        assertThat(profile.textureType()).isEqualTo(TextureType.SMOOTH);
    }

    @Test
    void analyzeTexture_checkerboard_isRoughOrCoarse() {
        TextureProfile profile = analyzer.analyzeTexture(TestImages.checkerboard(256, 4)).value();

        assertThat(profile.roughness()).isGreaterThan(30.0);
        assertThat(profile.contrast()).isCloseTo(0.5, within(0.01));
        assertThat(profile.textureType()).isIn(TextureType.ROUGH, TextureType.COARSE);
        assertThat(profile.patternType()).isNotEqualTo(PatternType.UNKNOWN);
    }

    @Test
    void analyzeTexture_summarizesDescriptors() {
        TextureProfile profile = analyzer.analyzeTexture(TestImages.checkerboard(256, 4)).value();
        TextureProfile.DescriptorSummary summary = profile.descriptorSummary();

        assertThat(summary.hogFeatures()).hasSize(10);
        assertThat(summary.lbpHistogram()).hasSizeLessThanOrEqualTo(26);
        assertThat(summary.lbpHistogram().stream().mapToDouble(Double::doubleValue).sum()).isCloseTo(1.0, within(1e-9));
        assertThat(summary.lbpEntropy()).isBetween(0.0, Math.log(26) / Math.log(2) + 1e-6);
        assertThat(summary.hogStd()).isEqualTo(profile.directionality());
    }

    @Test
    void analyzeTexture_isRepeatable() {
        BufferedImage img = TestImages.redBlueSplit();
        assertThat(analyzer.analyzeTexture(img).value()).isEqualTo(analyzer.analyzeTexture(img).value());
    }

    @Test
    void analyzeTexture_nullImage_returnsUnknownProfile() {
        AnalysisOutcome<TextureProfile> outcome = analyzer.analyzeTexture(null);

        assertThat(outcome.isSuccess()).isFalse();
        assertThat(outcome.value()).isEqualTo(TextureProfile.unknown());
        assertThat(outcome.value().textureType()).isEqualTo(TextureType.UNKNOWN);
        assertThat(outcome.error()).hasValueSatisfying(e -> assertThat(e.cause()).isNotNull());
    }

    @Test
    void renderTexturePanel_isTwoByTwo() {
        BufferedImage panel = analyzer.renderTexturePanel(TestImages.checkerboard(256, 4));

        assertThat(panel.getWidth()).isEqualTo(512);
        assertThat(panel.getHeight()).isEqualTo(512);
        // top-left quadrant is the grayscale input
        assertThat(panel.getRGB(1, 1) & 0xFF).isEqualTo(255);
    }
}
