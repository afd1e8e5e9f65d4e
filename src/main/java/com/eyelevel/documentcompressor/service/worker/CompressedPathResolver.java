package com.eyelevel.documentcompressor.service.worker;

import com.eyelevel.documentcompressor.config.CompressionProperties;
import com.eyelevel.documentcompressor.model.CompressionMethod;
import com.eyelevel.documentcompressor.model.MediaDocument;
import lombok.RequiredArgsConstructor;
import org.apache.commons.io.FilenameUtils;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;

/**
 * Derives the artifact path {@code <compressed-root>/<documentId>-<method>.<ext>}. The path depends only on the
 * document and method, so a retried job overwrites its own earlier output instead of leaving orphans.
 */
@Component
@RequiredArgsConstructor
public class CompressedPathResolver {

    private static final String FALLBACK_EXTENSION = "bin";

    private final CompressionProperties properties;

    public Path resolve(MediaDocument document, CompressionMethod method) {
        String extension = method.getArtifactExtension();
        if (extension == null) {
            extension = FilenameUtils.getExtension(document.getOriginalFilename()).toLowerCase(Locale.ROOT);
        }
        if (!StringUtils.hasText(extension)) {
            extension = FALLBACK_EXTENSION;
        }
        return Paths.get(properties.getStorage().getCompressedRoot())
                .resolve(document.getId() + "-" + method.getCode() + "." + extension);
    }
}
