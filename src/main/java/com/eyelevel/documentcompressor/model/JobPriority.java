package com.eyelevel.documentcompressor.model;

import java.util.Arrays;
import java.util.Locale;

/**
 * Priority tiers for compression jobs. The weight is what gets persisted, so the queue can order
 * by it directly (higher weight is claimed first).
 */
public enum JobPriority {
    LOW(1),
    NORMAL(5),
    HIGH(10);

    private final int weight;

    JobPriority(int weight) {
        this.weight = weight;
    }

    public int getWeight() {
        return weight;
    }

    public static JobPriority fromWeight(int weight) {
        return Arrays.stream(values())
                .filter(p -> p.weight == weight)
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown job priority weight: " + weight));
    }

    public static JobPriority fromCode(String code) {
        return JobPriority.valueOf(code.trim().toUpperCase(Locale.ROOT));
    }
}
