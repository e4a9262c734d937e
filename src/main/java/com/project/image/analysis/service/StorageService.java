package com.project.image.analysis.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.project.image.analysis.exceptions.StorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import org.springframework.web.multipart.MultipartFile;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

@Service
public class StorageService {
    private static final Logger log = LoggerFactory.getLogger(StorageService.class);
    private static final DateTimeFormatter STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss_SSS");

    private final Path uploadDir;
    private final Path outputDir;
    private final ObjectMapper objectMapper;

    public StorageService(@Value("${app.upload.dir:uploads}") String uploadDir,
                          @Value("${app.analysis.output-dir:output}") String outputDir,
                          ObjectMapper objectMapper) {
        this.uploadDir = createDirectory(uploadDir, "upload");
        this.outputDir = createDirectory(outputDir, "output");
        this.objectMapper = objectMapper;
    }

    private static Path createDirectory(String dir, String kind) {
        Path path = Paths.get(dir).toAbsolutePath().normalize();
        try {
            Files.createDirectories(path);
            log.info("Using {} directory: {}", kind, path);
            return path;
        } catch (IOException e) {
            throw new StorageException("Cannot create " + kind + " directory: " + path, e);
        }
    }

    public record StoredFile(Path path, String filename, String relativeWebPath) {}

    /**
     * Copies an uploaded image into the upload directory under a timestamped
     * name, prefixed with the project identifier when one is given.
     */
    public StoredFile store(MultipartFile file, String projectId) {
        if (file == null || file.isEmpty()) {
            throw new StorageException("Empty upload");
        }
        String original = StringUtils.cleanPath(file.getOriginalFilename() == null ? "upload" : file.getOriginalFilename());
        String contentType = file.getContentType();
        if (contentType == null || !contentType.startsWith("image/")) {
            throw new StorageException("Only image uploads are allowed (received: " + contentType + ")");
        }
        String safeBase = safe(original);
        String prefix = StringUtils.hasText(projectId) ? safe(projectId) + "_" : "";
        String filename = prefix + STAMP.format(LocalDateTime.now()) + "_" + safeBase;
        Path target = uploadDir.resolve(filename);
        try {
            Files.copy(file.getInputStream(), target, StandardCopyOption.REPLACE_EXISTING);
            log.debug("Stored upload {} as {}", original, filename);
            return new StoredFile(target, filename, "uploads/" + filename);
        } catch (IOException e) {
            throw new StorageException("Failed to store file", e);
        }
    }

    /** Creates (or reuses) {@code <outputDir>/<baseName>} for one image's artifacts. */
    public Path prepareOutputDirectory(String baseName) {
        Path dir = outputDir.resolve(safe(baseName)).normalize();
        if (!dir.startsWith(outputDir)) {
            throw new StorageException("Output directory escapes the output root: " + baseName);
        }
        try {
            return Files.createDirectories(dir);
        } catch (IOException e) {
            throw new StorageException("Cannot create output directory: " + dir, e);
        }
    }

    public Path writePng(Path dir, String filename, BufferedImage image) {
        Path target = dir.resolve(filename);
        try {
            if (!ImageIO.write(image, "png", target.toFile())) {
                throw new StorageException("No PNG writer available for " + filename);
            }
            return target;
        } catch (IOException e) {
            throw new StorageException("Failed to write image " + target, e);
        }
    }

    public Path writeJson(Path dir, String filename, Object value) {
        Path target = dir.resolve(filename);
        try {
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(target.toFile(), value);
            return target;
        } catch (IOException e) {
            throw new StorageException("Failed to write " + target, e);
        }
    }

    /** Web path of an artifact below the output directory, served under {@code /artifacts/}. */
    public String artifactWebPath(Path artifact) {
        return "artifacts/" + outputDir.relativize(artifact.toAbsolutePath().normalize()).toString().replace('\\', '/');
    }

    private static String safe(String name) {
        return name.replaceAll("[^a-zA-Z0-9._-]", "_");
    }
}
