package com.eyelevel.documentcompressor.codec.impl.pdf;

import com.eyelevel.documentcompressor.common.processexec.ProcessExecutor;
import com.eyelevel.documentcompressor.common.processexec.ProcessExecutor.ProcessResult;
import com.eyelevel.documentcompressor.common.processexec.ProcessExecutor.ProcessTimeoutException;
import com.eyelevel.documentcompressor.config.CompressionProperties;
import com.eyelevel.documentcompressor.exception.CodecException;
import com.eyelevel.documentcompressor.model.CompressionMethod;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.encryption.AccessPermission;
import org.apache.pdfbox.pdmodel.encryption.StandardProtectionPolicy;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class GhostscriptPdfCodecTest {

    @Mock
    private ProcessExecutor processExecutor;

    @TempDir
    Path tempDir;

    private GhostscriptPdfCodec codec;

    @BeforeEach
    void setUp() {
        CompressionProperties properties = new CompressionProperties();
        properties.getGhostscript().setExecutable("/usr/bin/gs");
        codec = new GhostscriptPdfCodec(properties, processExecutor);
    }

    @Test
    void supportsOnlyPdfOptimizeOnPdfs() {
        assertThat(codec.supports(CompressionMethod.PDF_OPTIMIZE, "application/pdf")).isTrue();
        assertThat(codec.supports(CompressionMethod.PDF_OPTIMIZE, "image/png")).isFalse();
        assertThat(codec.supports(CompressionMethod.LOSSLESS, "application/pdf")).isFalse();
    }

    @Test
    void returnsGhostscriptOutputAndPassesThePreset() throws Exception {
        Path input = writePdf("contract.pdf", null);
        byte[] optimized = "%PDF-1.4 optimized".getBytes();
        when(processExecutor.execute(anyList(), anyString(), anyLong(), eq("gs"))).thenAnswer(invocation -> {
            List<String> command = invocation.getArgument(0);
            Files.write(outputFileOf(command), optimized);
            return new ProcessResult(0, "", "");
        });

        byte[] result = codec.compress(input, CompressionMethod.PDF_OPTIMIZE, 40);

        assertThat(result).isEqualTo(optimized);
        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<String>> command = ArgumentCaptor.forClass(List.class);
        verify(processExecutor).execute(command.capture(), eq("contract.pdf"), eq(5L), eq("gs"));
        assertThat(command.getValue())
                .startsWith("/usr/bin/gs", "-sDEVICE=pdfwrite")
                .contains("-dPDFSETTINGS=/ebook")
                .endsWith(input.toAbsolutePath().toString());
        assertThat(Files.exists(outputFileOf(command.getValue()))).isFalse();
    }

    @Test
    void unparseablePdfIsRejectedBeforeStartingGhostscript() throws Exception {
        Path input = Files.writeString(tempDir.resolve("broken.pdf"), "%PDF-1.4 truncated garbage");

        assertKind(input, CodecException.Kind.CORRUPT_INPUT);
        verify(processExecutor, never()).execute(anyList(), anyString(), anyLong(), anyString());
    }

    @Test
    void passwordProtectedPdfIsCorruptInput() throws Exception {
        Path input = writePdf("secret.pdf", "hunter2");

        assertKind(input, CodecException.Kind.CORRUPT_INPUT);
        verify(processExecutor, never()).execute(anyList(), anyString(), anyLong(), anyString());
    }

    @Test
    void passwordMessageOnStderrIsCorruptInput() throws Exception {
        Path input = writePdf("odd.pdf", null);
        when(processExecutor.execute(anyList(), anyString(), anyLong(), anyString()))
                .thenReturn(new ProcessResult(1, "", "Error: This file requires a password for access."));

        assertKind(input, CodecException.Kind.CORRUPT_INPUT);
    }

    @Test
    void nonZeroExitIsAnIoError() throws Exception {
        Path input = writePdf("crash.pdf", null);
        when(processExecutor.execute(anyList(), anyString(), anyLong(), anyString()))
                .thenReturn(new ProcessResult(139, "", "Segmentation fault"));

        assertKind(input, CodecException.Kind.IO_ERROR);
    }

    @Test
    void emptyOutputIsAnIoError() throws Exception {
        Path input = writePdf("empty.pdf", null);
        when(processExecutor.execute(anyList(), anyString(), anyLong(), anyString()))
                .thenReturn(new ProcessResult(0, "", ""));

        assertKind(input, CodecException.Kind.IO_ERROR);
    }

    @Test
    void processTimeoutIsATimeout() throws Exception {
        Path input = writePdf("huge.pdf", null);
        when(processExecutor.execute(anyList(), anyString(), anyLong(), anyString()))
                .thenThrow(new ProcessTimeoutException("gs process timed out after 5 minutes."));

        assertKind(input, CodecException.Kind.TIMEOUT);
    }

    @ParameterizedTest
    @CsvSource({"1,/screen", "25,/screen", "26,/ebook", "50,/ebook", "75,/printer", "76,/prepress", "100,/prepress"})
    void levelMapsOntoPreset(int level, String preset) {
        assertThat(GhostscriptPdfCodec.presetFor(level)).isEqualTo(preset);
    }

    private void assertKind(Path input, CodecException.Kind kind) {
        assertThatThrownBy(() -> codec.compress(input, CompressionMethod.PDF_OPTIMIZE, 50))
                .isInstanceOf(CodecException.class)
                .extracting(e -> ((CodecException) e).getKind())
                .isEqualTo(kind);
    }

    private Path writePdf(String name, String userPassword) throws Exception {
        Path target = tempDir.resolve(name);
        try (PDDocument document = new PDDocument()) {
            document.addPage(new PDPage());
            if (userPassword != null) {
                StandardProtectionPolicy policy = new StandardProtectionPolicy("owner", userPassword,
                        new AccessPermission());
                policy.setEncryptionKeyLength(128);
                document.protect(policy);
            }
            document.save(target.toFile());
        }
        return target;
    }

    private static Path outputFileOf(List<String> command) {
        return command.stream()
                .filter(arg -> arg.startsWith("-sOutputFile="))
                .map(arg -> Path.of(arg.substring("-sOutputFile=".length())))
                .findFirst()
                .orElseThrow();
    }
}
