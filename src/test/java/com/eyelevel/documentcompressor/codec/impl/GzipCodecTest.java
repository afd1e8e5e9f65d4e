package com.eyelevel.documentcompressor.codec.impl;

import com.eyelevel.documentcompressor.exception.CodecException;
import com.eyelevel.documentcompressor.model.CompressionMethod;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.zip.GZIPInputStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GzipCodecTest {

    private final GzipCodec codec = new GzipCodec();

    @TempDir
    Path tempDir;

    @Test
    void supportsOnlyLossless() {
        assertThat(codec.supports(CompressionMethod.LOSSLESS, "text/plain")).isTrue();
        assertThat(codec.supports(CompressionMethod.LOSSY, "text/plain")).isFalse();
        assertThat(codec.supports(CompressionMethod.PDF_OPTIMIZE, "application/pdf")).isFalse();
    }

    @Test
    void compressesRepetitiveTextAndStaysReadable() throws Exception {
        String text = "quarterly report line\n".repeat(5_000);
        Path input = Files.writeString(tempDir.resolve("report.txt"), text);

        byte[] compressed = codec.compress(input, CompressionMethod.LOSSLESS, 9);

        assertThat(compressed.length).isLessThan((int) Files.size(input) / 10);
        assertThat(gunzip(compressed)).isEqualTo(text);
    }

    @Test
    void levelZeroStoresWithoutShrinking() throws Exception {
        Path input = Files.writeString(tempDir.resolve("notes.txt"), "a".repeat(10_000));

        byte[] stored = codec.compress(input, CompressionMethod.LOSSLESS, 0);
        byte[] best = codec.compress(input, CompressionMethod.LOSSLESS, 9);

        assertThat(stored.length).isGreaterThan(10_000);
        assertThat(best.length).isLessThan(stored.length);
    }

    @Test
    void missingInputIsAnIoError() {
        assertThatThrownBy(() -> codec.compress(tempDir.resolve("absent.txt"), CompressionMethod.LOSSLESS, 6))
                .isInstanceOf(CodecException.class)
                .extracting(e -> ((CodecException) e).getKind())
                .isEqualTo(CodecException.Kind.IO_ERROR);
    }

    private static String gunzip(byte[] data) throws IOException {
        try (GZIPInputStream in = new GZIPInputStream(new ByteArrayInputStream(data))) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }
}
