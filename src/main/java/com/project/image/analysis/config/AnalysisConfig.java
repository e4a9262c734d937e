package com.project.image.analysis.config;

import com.project.image.analysis.service.features.FeatureExtractor;
import com.project.image.analysis.service.features.NoOpFeatureExtractor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class AnalysisConfig {
    private static final Logger log = LoggerFactory.getLogger(AnalysisConfig.class);

    /** Replace with a backbone-backed extractor bean to enable learned features. */
    @Bean
    public FeatureExtractor featureExtractor() {
        log.info("No feature extractor configured, learned features disabled");
        return new NoOpFeatureExtractor();
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService analysisExecutor(@Value("${app.analysis.worker-threads:2}") int workerThreads) {
        if (workerThreads < 1) {
            throw new IllegalArgumentException("app.analysis.worker-threads must be positive: " + workerThreads);
        }
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory factory = runnable -> {
            Thread thread = new Thread(runnable, "analysis-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        log.info("Analysis worker pool size: {}", workerThreads);
        return Executors.newFixedThreadPool(workerThreads, factory);
    }
}
