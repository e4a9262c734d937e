package com.project.image.analysis.service;

import com.project.image.analysis.DTOs.AnalysisError;
import com.project.image.analysis.DTOs.AnalysisOutcome;
import com.project.image.analysis.DTOs.AnalysisResult;
import com.project.image.analysis.DTOs.ColorPalette;
import com.project.image.analysis.DTOs.DesignSuggestions;
import com.project.image.analysis.DTOs.ModelParameters;
import com.project.image.analysis.DTOs.ShapeProfile;
import com.project.image.analysis.DTOs.TextureProfile;
import com.project.image.analysis.exceptions.ImageAnalysisException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Runs color, texture and shape analysis on one image, derives model
 * parameters from them and writes the artifacts under
 * {@code <outputDir>/<image base name>/}.
 */
@Service
public class ImageAnalyzer {
    private static final Logger log = LoggerFactory.getLogger(ImageAnalyzer.class);

    static final String STAGE = "analysis";

    private final ColorExtractor colorExtractor;
    private final TextureAnalyzer textureAnalyzer;
    private final ShapeDetector shapeDetector;
    private final ModelGenerator modelGenerator;
    private final DesignSuggestionService designSuggestionService;
    private final StorageService storageService;

    public ImageAnalyzer(ColorExtractor colorExtractor, TextureAnalyzer textureAnalyzer, ShapeDetector shapeDetector,
                         ModelGenerator modelGenerator, DesignSuggestionService designSuggestionService,
                         StorageService storageService) {
        this.colorExtractor = colorExtractor;
        this.textureAnalyzer = textureAnalyzer;
        this.shapeDetector = shapeDetector;
        this.modelGenerator = modelGenerator;
        this.designSuggestionService = designSuggestionService;
        this.storageService = storageService;
    }

    public AnalysisOutcome<AnalysisResult> analyzeImage(Path imagePath, boolean generateVisualizations) {
        Objects.requireNonNull(imagePath, "imagePath");
        try {
            return AnalysisOutcome.success(run(imagePath, generateVisualizations));
        } catch (RuntimeException e) {
            log.error("Error analyzing image {}: {}", imagePath, e.getMessage(), e);
            return AnalysisOutcome.failure(AnalysisError.of(STAGE, e), AnalysisResult.failed(imagePath));
        }
    }

    /** JSON-ready summary of {@link #analyzeImage}, or the failure shape when it did not complete. */
    public Map<String, Object> analyzeImageSummary(Path imagePath, boolean generateVisualizations) {
        AnalysisOutcome<AnalysisResult> outcome = analyzeImage(imagePath, generateVisualizations);
        if (outcome.isSuccess()) {
            return toSummary(outcome.value());
        }
        return failureSummary(imagePath.toString(), outcome.error().map(AnalysisError::message).orElse("Unknown error"));
    }

    public DesignSuggestions generateDesignSuggestions(AnalysisResult result) {
        return designSuggestionService.suggest(result);
    }

    private AnalysisResult run(Path imagePath, boolean generateVisualizations) {
        log.info("Starting analysis of image: {}", imagePath);
        if (!Files.isRegularFile(imagePath)) {
            throw new ImageAnalysisException("Image file not found: " + imagePath);
        }
        BufferedImage image = decode(imagePath);
        String baseName = baseName(imagePath);
        Path dir = storageService.prepareOutputDirectory(baseName);

        log.info("Extracting colors");
        ColorPalette palette = valueOf(colorExtractor.extractColors(image));
        log.info("Analyzing texture");
        TextureProfile texture = valueOf(textureAnalyzer.analyzeTexture(image));
        log.info("Detecting shapes");
        ShapeProfile shape = valueOf(shapeDetector.detectShapes(image));
        log.info("Generating model parameters");
        ModelParameters parameters = valueOf(modelGenerator.generateModelParameters(image, shape, palette, texture));

        List<Path> visualizations = new ArrayList<>();
        if (generateVisualizations) {
            if (!palette.isEmpty()) {
                render(dir, baseName + "_palette.png", () -> colorExtractor.renderPalette(palette), visualizations);
            }
            render(dir, baseName + "_texture.png", () -> textureAnalyzer.renderTexturePanel(image), visualizations);
            render(dir, baseName + "_shapes.png", () -> shapeDetector.renderShapePanel(image), visualizations);
        }

        storageService.writeJson(dir, baseName + "_model.json", modelParameters(parameters));
        AnalysisResult result = new AnalysisResult(imagePath, palette, texture, shape, parameters, dir, visualizations);
        Path summary = storageService.writeJson(dir, baseName + "_analysis.json", toSummary(result));
        log.info("Analysis results saved to {}", summary);
        log.info("Image analysis completed successfully for {}", imagePath);
        return result;
    }

    private static BufferedImage decode(Path imagePath) {
        try {
            BufferedImage image = ImageIO.read(imagePath.toFile());
            if (image == null) {
                throw new ImageAnalysisException("File is not a supported image: " + imagePath.getFileName());
            }
            log.debug("Image loaded: {}x{}", image.getWidth(), image.getHeight());
            return image;
        } catch (IOException e) {
            throw new ImageAnalysisException("Cannot read image " + imagePath.getFileName(), e);
        }
    }

    static String baseName(Path imagePath) {
        String name = imagePath.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }

    private static <T> T valueOf(AnalysisOutcome<T> outcome) {
        outcome.error().ifPresent(error ->
                log.warn("Stage '{}' fell back to its default: {}", error.stage(), error.message(), error.cause()));
        return outcome.value();
    }

    /** A visualization that cannot be rendered is skipped; the analysis itself still succeeds. */
    private void render(Path dir, String filename, Supplier<BufferedImage> renderer, List<Path> written) {
        try {
            written.add(storageService.writePng(dir, filename, renderer.get()));
        } catch (RuntimeException e) {
            log.warn("Could not create visualization {}: {}", filename, e.getMessage(), e);
        }
    }

    public static Map<String, Object> toSummary(AnalysisResult result) {
        Map<String, Object> colors = new LinkedHashMap<>();
        colors.put("dominant_colors", result.colorPalette().hexColors());
        colors.put("percentages", result.colorPalette().percentages());

        Map<String, Object> texture = new LinkedHashMap<>();
        texture.put("texture_type", result.textureProfile().textureType().label());
        texture.put("roughness", result.textureProfile().roughness());
        texture.put("pattern_type", result.textureProfile().patternType().label());

        Map<String, Object> shapes = new LinkedHashMap<>();
        shapes.put("dominant_shapes", result.shapeProfile().dominantShapes());
        shapes.put("shape_complexity", result.shapeProfile().complexity().label());

        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("image_path", result.sourceImage().toString());
        summary.put("color_analysis", colors);
        summary.put("texture_analysis", texture);
        summary.put("shape_analysis", shapes);
        summary.put("model_parameters", modelParameters(result.modelParameters()));
        summary.put("output_directory", result.outputDirectory() == null ? null : result.outputDirectory().toString());
        summary.put("visualization_files", result.visualizationFiles().stream().map(Path::toString).toList());
        return summary;
    }

    static Map<String, Object> modelParameters(ModelParameters parameters) {
        Map<String, Object> model = new LinkedHashMap<>();
        model.put("type", parameters.formType().label());
        model.put("dimensions", parameters.dimensions());
        model.put("colors", parameters.colors());
        model.put("materials", parameters.materials());
        model.put("details", parameters.details());
        return model;
    }

    public static Map<String, Object> failureSummary(String imagePath, String error) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", error);
        body.put("image_path", imagePath);
        body.put("status", "failed");
        return body;
    }
}
