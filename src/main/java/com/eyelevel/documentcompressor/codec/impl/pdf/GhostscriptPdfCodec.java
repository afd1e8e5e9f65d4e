package com.eyelevel.documentcompressor.codec.impl.pdf;

import com.eyelevel.documentcompressor.codec.DocumentCodec;
import com.eyelevel.documentcompressor.common.processexec.ProcessExecutor;
import com.eyelevel.documentcompressor.common.processexec.ProcessExecutor.ProcessResult;
import com.eyelevel.documentcompressor.common.processexec.ProcessExecutor.ProcessTimeoutException;
import com.eyelevel.documentcompressor.config.CompressionProperties;
import com.eyelevel.documentcompressor.exception.CodecException;
import com.eyelevel.documentcompressor.model.CompressionMethod;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.encryption.InvalidPasswordException;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * PDF optimization through Ghostscript's {@code pdfwrite} device.
 * <p>
 * The input is first opened with PDFBox so corrupt and password-protected files are rejected without starting
 * a process. The compression level selects a {@code -dPDFSETTINGS} preset, lower levels meaning smaller output.
 */
@Slf4j
@Component
@Order(30)
@RequiredArgsConstructor
public class GhostscriptPdfCodec implements DocumentCodec {

    static final String PDF_MIME_TYPE = "application/pdf";

    private static final Pattern PASSWORD_ERROR_PATTERN = Pattern.compile("This file requires a password for access",
            Pattern.CASE_INSENSITIVE);

    private final CompressionProperties properties;
    private final ProcessExecutor processExecutor;

    @Override
    public boolean supports(CompressionMethod method, String mimeType) {
        return method == CompressionMethod.PDF_OPTIMIZE && PDF_MIME_TYPE.equals(mimeType);
    }

    @Override
    public byte[] compress(Path input, CompressionMethod method, int level) throws CodecException {
        String fileName = String.valueOf(input.getFileName());
        int pageCount = preflight(input, fileName);
        long timeout = properties.getGhostscript().getOptimizationTimeoutMinutes();
        String preset = presetFor(level);
        log.info("[{}] Optimizing {}-page PDF using Ghostscript preset {} (Timeout: {}m).", fileName, pageCount,
                preset, timeout);

        Path tempOutputFile = null;
        try {
            tempOutputFile = Files.createTempFile("gs-opt-", ".pdf");
            List<String> command = buildOptimizationCommand(input, tempOutputFile, preset);
            ProcessResult result = processExecutor.execute(command, fileName, timeout, "gs");

            if (result.exitCode() != 0) {
                if (PASSWORD_ERROR_PATTERN.matcher(result.stderr()).find()) {
                    throw new CodecException(CodecException.Kind.CORRUPT_INPUT,
                            "Ghostscript failed: file is password protected. " + fileName);
                }
                throw new CodecException(CodecException.Kind.IO_ERROR,
                        String.format("Ghostscript optimization failed for '%s' with exit code %d. Error: %s",
                                fileName, result.exitCode(), result.stderr()));
            }
            byte[] optimized = Files.readAllBytes(tempOutputFile);
            if (optimized.length == 0) {
                throw new CodecException(CodecException.Kind.IO_ERROR,
                        "Ghostscript produced an empty file for " + fileName);
            }
            return optimized;
        } catch (ProcessTimeoutException e) {
            throw new CodecException(CodecException.Kind.TIMEOUT, e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CodecException(CodecException.Kind.TIMEOUT, "Ghostscript interrupted for " + fileName, e);
        } catch (IOException e) {
            throw new CodecException(CodecException.Kind.IO_ERROR,
                    "Ghostscript optimization process failed for: " + fileName, e);
        } finally {
            if (tempOutputFile != null) {
                try {
                    Files.deleteIfExists(tempOutputFile);
                } catch (IOException e) {
                    log.warn("[{}] Failed to delete temporary optimization file: {}", fileName, tempOutputFile);
                }
            }
        }
    }

    /**
     * Maps a 1-100 level onto the Ghostscript distiller presets.
     */
    static String presetFor(int level) {
        if (level <= 25) {
            return "/screen";
        } else if (level <= 50) {
            return "/ebook";
        } else if (level <= 75) {
            return "/printer";
        }
        return "/prepress";
    }

    private int preflight(Path input, String fileName) throws CodecException {
        if (!Files.isRegularFile(input)) {
            throw new CodecException(CodecException.Kind.IO_ERROR, "Original file not found: " + input);
        }
        try (PDDocument document = Loader.loadPDF(input.toFile())) {
            return document.getNumberOfPages();
        } catch (InvalidPasswordException e) {
            throw new CodecException(CodecException.Kind.CORRUPT_INPUT, "PDF is password protected: " + fileName, e);
        } catch (IOException e) {
            throw new CodecException(CodecException.Kind.CORRUPT_INPUT,
                    "PDF could not be parsed: " + fileName + ": " + e.getMessage(), e);
        }
    }

    private List<String> buildOptimizationCommand(Path input, Path output, String preset) {
        int threads = Math.max(1, Runtime.getRuntime().availableProcessors() / 2);
        return new ArrayList<>(List.of(properties.getGhostscript().getExecutable(), "-sDEVICE=pdfwrite",
                "-dCompatibilityLevel=1.4", "-dPDFSETTINGS=" + preset, "-dNOPAUSE", "-dQUIET",
                "-dBATCH", "-dDetectDuplicateImages=true", "-dNumRenderingThreads=" + threads,
                "-sOutputFile=" + output.toAbsolutePath(), input.toAbsolutePath().toString()));
    }
}
