package com.project.image.analysis.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.project.image.analysis.DTOs.AnalysisOutcome;
import com.project.image.analysis.DTOs.AnalysisResult;
import com.project.image.analysis.DTOs.FormType;
import com.project.image.analysis.TestImages;
import com.project.image.analysis.service.features.NoOpFeatureExtractor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class ImageAnalyzerTest {
    @TempDir
    Path tmp;

    private final ObjectMapper mapper = new ObjectMapper();
    private ImageAnalyzer analyzer;
    private Path image;

    @BeforeEach
    void setUp() {
        StorageService storage = new StorageService(tmp.resolve("uploads").toString(),
                tmp.resolve("output").toString(), mapper);
        analyzer = new ImageAnalyzer(
                new ColorExtractor(2, 42),
                new TextureAnalyzer(),
                new ShapeDetector(ShapeDetector.CircleSettings.DEFAULTS),
                new ModelGenerator(new NoOpFeatureExtractor()),
                new DesignSuggestionService(),
                storage);
        image = TestImages.writePng(tmp, "split.png", TestImages.redBlueSplit());
    }

    @Test
    @SuppressWarnings("unchecked")
    void analyzeImageSummary_redBlueSplit() {
        Map<String, Object> summary = analyzer.analyzeImageSummary(image, true);

        Map<String, Object> colors = (Map<String, Object>) summary.get("color_analysis");
        assertThat((List<String>) colors.get("dominant_colors")).containsExactly("#0000FF", "#FF0000");
        List<Double> percentages = (List<Double>) colors.get("percentages");
        assertThat(percentages.get(0)).isCloseTo(60.0, within(3.0));
        assertThat(percentages.get(1)).isCloseTo(40.0, within(3.0));

        Map<String, Object> shapes = (Map<String, Object>) summary.get("shape_analysis");
        assertThat((List<String>) shapes.get("dominant_shapes")).contains("Rectangle");

        Map<String, Object> model = (Map<String, Object>) summary.get("model_parameters");
        assertThat(model.get("type")).isEqualTo("box");
        assertThat(summary.get("image_path")).isEqualTo(image.toString());
        assertThat(summary).doesNotContainKey("status");
    }

    @Test
    void analyzeImage_writesArtifacts() throws Exception {
        AnalysisOutcome<AnalysisResult> outcome = analyzer.analyzeImage(image, true);

        assertThat(outcome.isSuccess()).isTrue();
        AnalysisResult result = outcome.value();
        Path dir = result.outputDirectory();
        assertThat(dir.getFileName().toString()).isEqualTo("split");
        assertThat(result.visualizationFiles()).extracting(p -> p.getFileName().toString())
                .containsExactly("split_palette.png", "split_texture.png", "split_shapes.png");
        for (String name : List.of("split_palette.png", "split_texture.png", "split_shapes.png",
                "split_model.json", "split_analysis.json")) {
            assertThat(dir.resolve(name)).exists();
        }

        JsonNode model = mapper.readTree(dir.resolve("split_model.json").toFile());
        assertThat(model.get("type").asText()).isEqualTo("box");
        assertThat(model.get("colors").get(0).get("name").asText()).isEqualTo("Blue");

        JsonNode summary = mapper.readTree(dir.resolve("split_analysis.json").toFile());
        assertThat(summary.get("visualization_files")).hasSize(3);
        assertThat(summary.get("output_directory").asText()).isEqualTo(dir.toString());
    }

    @Test
    void analyzeImage_withoutVisualizations_writesOnlyJson() throws Exception {
        AnalysisResult result = analyzer.analyzeImage(image, false).value();

        assertThat(result.visualizationFiles()).isEmpty();
        try (var files = Files.list(result.outputDirectory())) {
            assertThat(files.map(p -> p.getFileName().toString()))
                    .containsExactlyInAnyOrder("split_model.json", "split_analysis.json");
        }
    }

    @Test
    void analyzeImage_isRepeatable() {
        AnalysisResult first = analyzer.analyzeImage(image, true).value();
        AnalysisResult second = analyzer.analyzeImage(image, true).value();

        assertThat(second).isEqualTo(first);
        assertThat(second.modelParameters().formType()).isEqualTo(FormType.BOX);
    }

    @Test
    void analyzeImageSummary_missingFile_reportsFailure() {
        Path missing = tmp.resolve("nope.png");

        Map<String, Object> summary = analyzer.analyzeImageSummary(missing, true);

        assertThat(summary).containsEntry("status", "failed").containsEntry("image_path", missing.toString());
        assertThat((String) summary.get("error")).contains("not found");
        assertThat(tmp.resolve("output").resolve("nope")).doesNotExist();
    }

    @Test
    void analyzeImage_corruptFile_fails() throws Exception {
        Path corrupt = Files.write(tmp.resolve("broken.png"), "definitely not a png".getBytes());

        AnalysisOutcome<AnalysisResult> outcome = analyzer.analyzeImage(corrupt, true);

        assertThat(outcome.isSuccess()).isFalse();
        assertThat(outcome.value()).isEqualTo(AnalysisResult.failed(corrupt));
        assertThat(outcome.error()).hasValueSatisfying(e -> {
            assertThat(e.stage()).isEqualTo("analysis");
            assertThat(e.message()).contains("not a supported image");
        });
    }

    @Test
    void baseName_dropsLastExtension() {
        assertThat(ImageAnalyzer.baseName(Path.of("/a/b/photo.final.jpg"))).isEqualTo("photo.final");
        assertThat(ImageAnalyzer.baseName(Path.of("noext"))).isEqualTo("noext");
        assertThat(ImageAnalyzer.baseName(Path.of(".hidden"))).isEqualTo(".hidden");
    }
}
