package com.project.image.analysis.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.ResourceHandlerRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Serves stored uploads under /uploads/** and analysis artifacts under
 * /artifacts/**, independent of the working directory.
 */
@Configuration
public class StaticResourceConfig implements WebMvcConfigurer {

    // same settings as StorageService
    @Value("${app.upload.dir:uploads}")
    private String uploadDir;

    @Value("${app.analysis.output-dir:output}")
    private String outputDir;

    @Override
    public void addResourceHandlers(ResourceHandlerRegistry registry) {
        registry.addResourceHandler("/uploads/**")
                .addResourceLocations(location(uploadDir));
        registry.addResourceHandler("/artifacts/**")
                .addResourceLocations(location(outputDir));
    }

    private static String location(String dir) {
        Path abs = Paths.get(dir).toAbsolutePath().normalize();
        return "file:" + abs + "/";
    }
}
