package com.eyelevel.documentanalyzer;

import com.eyelevel.documentanalyzer.config.DocumentProcessingConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.core.env.Environment;
import org.springframework.retry.annotation.EnableRetry;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * The main entry point for the Document Analyzer Spring Boot application.
 * <p>
 * Besides auto-configuration it binds the "app.processing" properties to
 * {@link DocumentProcessingConfig} and enables scheduling for the stale work monitor and
 * retry support for file storage.
 */
@Slf4j
@EnableScheduling
@SpringBootApplication
@EnableConfigurationProperties(value = DocumentProcessingConfig.class)
@EnableRetry
public class DocumentAnalyzerApplication {

    public static void main(final String[] args) {
        log.info("🚀 Starting DocumentAnalyzerApplication...");

        final ConfigurableApplicationContext context = SpringApplication.run(DocumentAnalyzerApplication.class, args);
        final Environment env = context.getEnvironment();

        log.info("------------------------------------------------------------------");
        log.info("Application '{}' is now running!", env.getProperty("spring.application.name", "DocumentAnalyzer"));
        log.info("Access URLs:");
        log.info("  - Local:      http://localhost:{}", env.getProperty("server.port", "8080"));
        log.info("  - Dispatch:   {}", env.getProperty("app.processing.dispatch.mode", "local"));
        log.info("  - Profile(s): {}", String.join(", ", env.getActiveProfiles().length > 0
                ? env.getActiveProfiles()
                : new String[]{"default"}));
        log.info("------------------------------------------------------------------");
    }
}
