package com.eyelevel.documentcompressor;

import com.eyelevel.documentcompressor.config.CompressionProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.core.env.Environment;
import org.springframework.retry.annotation.EnableRetry;

/**
 * The main entry point for the Document Compressor Spring Boot application.
 * <p>
 * This class bootstraps the application context and enables key Spring features:
 * <ul>
 *     <li>{@link EnableConfigurationProperties}: Binds the "app.compression" properties to
 *     {@link CompressionProperties}.</li>
 *     <li>{@link EnableRetry}: Retries transient persistence failures around queue claims and commits.</li>
 *     <li>{@link EnableCaching}: Caches compression policies per document type.</li>
 * </ul>
 */
@Slf4j
@SpringBootApplication
@EnableConfigurationProperties(value = CompressionProperties.class)
@EnableRetry
@EnableCaching
public class DocumentCompressorApplication {

    public static void main(final String[] args) {
        log.info("🚀 Starting DocumentCompressorApplication...");

        final ConfigurableApplicationContext context = SpringApplication.run(DocumentCompressorApplication.class, args);
        final Environment env = context.getEnvironment();

        log.info("------------------------------------------------------------------");
        log.info("Application '{}' is now running!", env.getProperty("spring.application.name", "DocumentCompressor"));
        log.info("Access URLs:");
        log.info("  - Local:      http://localhost:{}", env.getProperty("server.port", "8080"));
        log.info("  - Profile(s): {}", String.join(", ", env.getActiveProfiles().length > 0
                ? env.getActiveProfiles()
                : new String[]{"default"}));
        log.info("  - Workers:    {}", env.getProperty("app.compression.worker.concurrency", "2"));
        log.info("------------------------------------------------------------------");
    }
}
