package com.eyelevel.documentcompressor.codec.impl;

import com.eyelevel.documentcompressor.codec.DocumentCodec;
import com.eyelevel.documentcompressor.exception.CodecException;
import com.eyelevel.documentcompressor.model.CompressionMethod;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InterruptedIOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.zip.GZIPOutputStream;

/**
 * Lossless gzip compression of any byte stream. The level is passed straight to the Deflater.
 */
@Slf4j
@Component
@Order(100)
public class GzipCodec implements DocumentCodec {

    private static final int BUFFER_SIZE = 64 * 1024;

    @Override
    public boolean supports(CompressionMethod method, String mimeType) {
        return method == CompressionMethod.LOSSLESS;
    }

    @Override
    public byte[] compress(Path input, CompressionMethod method, int level) throws CodecException {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        try (InputStream in = Files.newInputStream(input);
             LevelledGzipOutputStream gzip = new LevelledGzipOutputStream(buffer, level)) {
            byte[] chunk = new byte[BUFFER_SIZE];
            int read;
            while ((read = in.read(chunk)) != -1) {
                if (Thread.currentThread().isInterrupted()) {
                    throw new InterruptedIOException("Gzip compression interrupted for " + input.getFileName());
                }
                gzip.write(chunk, 0, read);
            }
        } catch (NoSuchFileException e) {
            throw new CodecException(CodecException.Kind.IO_ERROR, "Original file not found: " + input, e);
        } catch (IOException e) {
            throw new CodecException(CodecException.Kind.IO_ERROR,
                    "Gzip compression failed for " + input.getFileName() + ": " + e.getMessage(), e);
        }
        log.debug("Gzip level {} produced {} bytes for '{}'.", level, buffer.size(), input.getFileName());
        return buffer.toByteArray();
    }

    private static final class LevelledGzipOutputStream extends GZIPOutputStream {
        LevelledGzipOutputStream(ByteArrayOutputStream out, int level) throws IOException {
            super(out, BUFFER_SIZE);
            def.setLevel(level);
        }
    }
}
