package com.eyelevel.documentcompressor.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.HashMap;
import java.util.Map;
import java.util.Set;

/**
 * Binds application properties under the "app.compression" prefix to a strongly-typed
 * configuration object for the queue, the worker pool, artifact storage and the codecs.
 */
@Data
@ConfigurationProperties(prefix = "app.compression")
public class CompressionProperties {

    private Queue queue = new Queue();
    private Worker worker = new Worker();
    private Storage storage = new Storage();
    private Ghostscript ghostscript = new Ghostscript();
    private RetryConfig persistenceRetry = new RetryConfig();

    /**
     * MIME types each compression method can handle, keyed by method code ({@code lossless}, {@code lossy}, ...).
     * Entries may use a {@code type/*} wildcard.
     */
    private Map<String, Set<String>> compressibleMimeTypes = new HashMap<>();

    @Data
    public static class RetryConfig {
        private int attempts = 3;
        private long delayMs = 100;
    }

    @Data
    public static class Queue {
        private int maxAttempts = 3;
        private int claimBatchSize = 5;
        private Backoff backoff = new Backoff();

        @Data
        public static class Backoff {
            private long initialDelayMs = 1_000;
            private double multiplier = 2.0;
            private long maxDelayMs = 60_000;
        }
    }

    @Data
    public static class Worker {
        private boolean enabled = true;
        private int concurrency = 2;
        private long pollIntervalMs = 1_000;
        private long jobTimeoutMs = 300_000;
    }

    @Data
    public static class Storage {
        private String compressedRoot = "./data/compressed";
    }

    @Data
    public static class Ghostscript {
        private String executable = "gs";
        private long optimizationTimeoutMinutes = 5;
    }
}
