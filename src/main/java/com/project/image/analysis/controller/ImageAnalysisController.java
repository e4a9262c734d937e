package com.project.image.analysis.controller;

import com.project.image.analysis.DTOs.AnalysisError;
import com.project.image.analysis.DTOs.AnalysisOutcome;
import com.project.image.analysis.DTOs.AnalysisResult;
import com.project.image.analysis.service.ImageAnalyzer;
import com.project.image.analysis.service.StorageService;
import jakarta.validation.constraints.Size;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

@RestController
@RequestMapping("/api/images")
@Validated
public class ImageAnalysisController {
    private static final Logger log = LoggerFactory.getLogger(ImageAnalysisController.class);

    private static final List<String> SUPPORTED_FORMATS = List.of(
            "image/png", "image/jpeg", "image/jpg", "image/gif", "image/bmp"
    );
    private static final long MAX_SIZE = 16L * 1024 * 1024;

    private final ImageAnalyzer imageAnalyzer;
    private final StorageService storageService;
    private final ExecutorService analysisExecutor;

    @Value("${app.analysis.timeout-seconds:60}")
    private long timeoutSeconds;

    public ImageAnalysisController(ImageAnalyzer imageAnalyzer, StorageService storageService,
                                   ExecutorService analysisExecutor) {
        this.imageAnalyzer = imageAnalyzer;
        this.storageService = storageService;
        this.analysisExecutor = analysisExecutor;
    }

    @PostMapping(value = "/analyze", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<Map<String, Object>> analyze(
            @RequestParam("image") MultipartFile image,
            @RequestParam(name = "projectId", required = false)
            @Size(max = 64, message = "projectId must be at most 64 characters") String projectId,
            @RequestParam(name = "visualize", defaultValue = "true") boolean visualize,
            @RequestParam(name = "suggestions", defaultValue = "false") boolean suggestions
    ) {
        validateUploadedFile(image);
        log.info("Processing file: {} ({}KB), project: {}",
                image.getOriginalFilename(), image.getSize() / 1024, projectId);

        StorageService.StoredFile stored = storageService.store(image, projectId);
        AnalysisOutcome<AnalysisResult> outcome = analyzeWithTimeout(stored.path(), visualize);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("project_id", projectId);
        body.put("file_path", stored.path().toString());
        body.put("file_url", "/" + stored.relativeWebPath());
        if (!outcome.isSuccess()) {
            String error = outcome.error().map(AnalysisError::message).orElse("Unknown error");
            body.put("message", "Image analysis failed");
            body.put("analysis", ImageAnalyzer.failureSummary(stored.path().toString(), error));
            return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(body);
        }

        body.put("message", "Image uploaded and analyzed successfully");
        body.put("analysis", ImageAnalyzer.toSummary(outcome.value()));
        body.put("artifact_urls", outcome.value().visualizationFiles().stream()
                .map(file -> "/" + storageService.artifactWebPath(file))
                .toList());
        if (suggestions) {
            body.put("design_suggestions", imageAnalyzer.generateDesignSuggestions(outcome.value()));
        }
        log.info("Analysis completed successfully for {}", image.getOriginalFilename());
        return ResponseEntity.ok(body);
    }

    private AnalysisOutcome<AnalysisResult> analyzeWithTimeout(Path imagePath, boolean visualize) {
        Future<AnalysisOutcome<AnalysisResult>> future =
                analysisExecutor.submit(() -> imageAnalyzer.analyzeImage(imagePath, visualize));
        try {
            return future.get(timeoutSeconds, TimeUnit.SECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("Analysis of {} timed out after {}s", imagePath, timeoutSeconds);
            return failed(imagePath, AnalysisError.of("timeout", "Analysis timed out after " + timeoutSeconds + " seconds"));
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            return failed(imagePath, AnalysisError.of("timeout", e));
        } catch (ExecutionException e) {
            log.error("Analysis of {} failed", imagePath, e.getCause());
            return failed(imagePath, AnalysisError.of("analysis", e.getCause()));
        }
    }

    private static AnalysisOutcome<AnalysisResult> failed(Path imagePath, AnalysisError error) {
        return AnalysisOutcome.failure(error, AnalysisResult.failed(imagePath));
    }

    private void validateUploadedFile(MultipartFile file) {
        if (file == null || file.isEmpty()) {
            throw new IllegalArgumentException("No selected file");
        }
        String contentType = file.getContentType();
        if (contentType == null || !SUPPORTED_FORMATS.contains(contentType.toLowerCase())) {
            throw new IllegalArgumentException(
                    "Unsupported file type: " + contentType + ". Supported types: " + String.join(", ", SUPPORTED_FORMATS));
        }
        // on top of the multipart limit in application.properties
        if (file.getSize() > MAX_SIZE) {
            throw new IllegalArgumentException("File is too large. Maximum size: 16MB");
        }
    }
}
