package com.eyelevel.documentcompressor.model;

import java.util.Arrays;
import java.util.Locale;

/**
 * The closed set of compression methods a {@link DocumentType} can be configured with.
 */
public enum CompressionMethod {
    /**
     * General purpose lossless compression (gzip/deflate). Level 0-9.
     */
    LOSSLESS("lossless", 0, 9, "gz"),
    /**
     * Lossy re-encoding of raster images. Level is a quality from 1 to 100.
     */
    LOSSY("lossy", 1, 100, "jpg"),
    /**
     * PDF optimization through Ghostscript. Level 1-100 maps onto a PDFSETTINGS preset.
     */
    PDF_OPTIMIZE("pdf_optimize", 1, 100, "pdf"),
    /**
     * Re-deflation of Office Open XML containers. Level 0-9.
     */
    OFFICE_OPTIMIZE("office_optimize", 0, 9, null),
    /**
     * Compression disabled for the type.
     */
    NONE("none", 0, 100, null);

    private final String code;
    private final int minLevel;
    private final int maxLevel;
    private final String artifactExtension;

    CompressionMethod(String code, int minLevel, int maxLevel, String artifactExtension) {
        this.code = code;
        this.minLevel = minLevel;
        this.maxLevel = maxLevel;
        this.artifactExtension = artifactExtension;
    }

    public String getCode() {
        return code;
    }

    public int getMinLevel() {
        return minLevel;
    }

    public int getMaxLevel() {
        return maxLevel;
    }

    /**
     * The extension of the derived artifact, or {@code null} when the artifact keeps the original extension.
     */
    public String getArtifactExtension() {
        return artifactExtension;
    }

    public boolean acceptsLevel(int level) {
        return level >= minLevel && level <= maxLevel;
    }

    public static CompressionMethod fromCode(String code) {
        String normalized = code == null ? "" : code.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(m -> m.code.equals(normalized))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Invalid compression method: " + code));
    }
}
