package com.eyelevel.documentcompressor.service.worker;

import com.eyelevel.documentcompressor.codec.CodecRegistry;
import com.eyelevel.documentcompressor.codec.DocumentCodec;
import com.eyelevel.documentcompressor.dto.stats.CompressionOverview;
import com.eyelevel.documentcompressor.exception.CodecException;
import com.eyelevel.documentcompressor.model.CompressionJob;
import com.eyelevel.documentcompressor.model.CompressionMethod;
import com.eyelevel.documentcompressor.model.CompressionStatus;
import com.eyelevel.documentcompressor.model.JobStatus;
import com.eyelevel.documentcompressor.model.MediaDocument;
import com.eyelevel.documentcompressor.service.queue.CompressionQueue;
import com.eyelevel.documentcompressor.service.stats.CompressionStatsService;
import com.eyelevel.documentcompressor.support.AbstractIntegrationTest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.boot.test.mock.mockito.SpyBean;
import org.springframework.dao.DataAccessResourceFailureException;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class CompressionWorkerTest extends AbstractIntegrationTest {

    @MockBean
    private CodecRegistry codecRegistry;

    @SpyBean
    private CompressionTransitionService transitionService;

    @Autowired
    private CompressionWorker compressionWorker;
    @Autowired
    private CompressionQueue compressionQueue;
    @Autowired
    private CompressionStatsService compressionStatsService;
    @Autowired
    private CompressedPathResolver compressedPathResolver;

    @TempDir
    Path originals;

    private StubCodec codec;

    @BeforeEach
    void setUpCodec() {
        codec = new StubCodec();
        when(codecRegistry.getCodec(any(), anyString())).thenReturn(Optional.of(codec));
        registerType("report", CompressionMethod.PDF_OPTIMIZE, 50, 1_000_000);
    }

    @Test
    void compressesDocumentAndReportsSavings() throws Exception {
        codec.outputSize = 500_000;
        MediaDocument document = enqueueDocument(2_000_000);

        assertThat(compressionWorker.processNextJob()).isTrue();

        MediaDocument stored = documentStore.getDocument(document.getId());
        assertThat(stored.getCompressionStatus()).isEqualTo(CompressionStatus.COMPLETED);
        assertThat(stored.getCompressedSizeBytes()).isEqualTo(500_000L);
        Path artifact = Path.of(stored.getCompressedPath());
        assertThat(artifact.getFileName().toString()).isEqualTo(document.getId() + "-pdf_optimize.pdf");
        assertThat(Files.size(artifact)).isEqualTo(500_000L);
        assertThat(onlyJob(document).getStatus()).isEqualTo(JobStatus.COMPLETED);

        CompressionOverview overview = compressionStatsService.overview();
        assertThat(overview.savingsPercent()).isEqualByComparingTo("75.0");
        assertThat(overview.spaceSavedBytes()).isEqualTo(1_500_000L);
    }

    @Test
    void documentBelowThresholdIsSkippedWithoutCallingTheCodec() {
        MediaDocument document = enqueueDocument(500_000);

        compressionWorker.processNextJob();

        MediaDocument stored = documentStore.getDocument(document.getId());
        assertThat(stored.getCompressionStatus()).isEqualTo(CompressionStatus.SKIPPED);
        assertThat(stored.getCompressedSizeBytes()).isNull();
        assertThat(stored.getCompressedPath()).isNull();
        assertThat(stored.getSkipReason()).startsWith("below minimum size threshold");
        assertThat(onlyJob(document).getStatus()).isEqualTo(JobStatus.COMPLETED);
        assertThat(codec.calls.get()).isZero();
    }

    @Test
    void outputThatIsNotSmallerIsSkippedAsNotEffective() {
        codec.outputSize = 2_000_000;
        MediaDocument document = enqueueDocument(2_000_000);

        compressionWorker.processNextJob();

        MediaDocument stored = documentStore.getDocument(document.getId());
        assertThat(stored.getCompressionStatus()).isEqualTo(CompressionStatus.SKIPPED);
        assertThat(stored.getSkipReason()).isEqualTo(CompressionWorker.REASON_NOT_EFFECTIVE);
        assertThat(Files.exists(compressedPathResolver.resolve(stored, CompressionMethod.PDF_OPTIMIZE))).isFalse();
    }

    @Test
    void effectivenessIsJudgedAgainstTheFileOnDisk() {
        codec.outputSize = 500_000;
        MediaDocument document = enqueueDocument(2_000_000, 400_000);

        compressionWorker.processNextJob();

        MediaDocument stored = documentStore.getDocument(document.getId());
        assertThat(stored.getCompressionStatus()).isEqualTo(CompressionStatus.SKIPPED);
        assertThat(stored.getSkipReason()).isEqualTo(CompressionWorker.REASON_NOT_EFFECTIVE);
        assertThat(stored.getCompressedPath()).isNull();
    }

    @Test
    void originalMissingAfterCompressionIsARetriedIoError() {
        codec.outputSize = 1_000;
        MediaDocument document = registerDocument("report", "gone.pdf", "application/pdf", 2_000_000,
                originals.resolve("gone.pdf").toString());
        compressionQueue.enqueue(document.getId(), null);

        compressionWorker.processNextJob();

        CompressionJob job = onlyJob(document);
        assertThat(job.getStatus()).isEqualTo(JobStatus.QUEUED);
        assertThat(job.getAttempts()).isEqualTo(1);
        assertThat(job.getErrorMessage()).startsWith("IO_ERROR");
    }

    @Test
    void codecFailureSchedulesARetryAndKeepsTheDocumentProcessing() {
        codec.failure = new CodecException(CodecException.Kind.CORRUPT_INPUT, "bad xref table");
        MediaDocument document = enqueueDocument(2_000_000);

        compressionWorker.processNextJob();

        CompressionJob job = onlyJob(document);
        assertThat(job.getStatus()).isEqualTo(JobStatus.QUEUED);
        assertThat(job.getAttempts()).isEqualTo(1);
        assertThat(job.getErrorMessage()).isEqualTo("CORRUPT_INPUT: bad xref table");
        assertThat(documentStore.getCompressionStatus(document.getId())).isEqualTo(CompressionStatus.PROCESSING);
    }

    @Test
    void threeCodecFailuresFailTheDocument() {
        codec.failure = new CodecException(CodecException.Kind.IO_ERROR, "read error");
        MediaDocument document = enqueueDocument(2_000_000);

        for (int i = 0; i < 3; i++) {
            assertThat(compressionWorker.processNextJob()).isTrue();
            clock.advance(Duration.ofMinutes(5));
        }

        assertThat(compressionWorker.processNextJob()).isFalse();
        CompressionJob job = onlyJob(document);
        assertThat(job.getStatus()).isEqualTo(JobStatus.FAILED);
        assertThat(job.getAttempts()).isEqualTo(3);
        MediaDocument stored = documentStore.getDocument(document.getId());
        assertThat(stored.getCompressionStatus()).isEqualTo(CompressionStatus.FAILED);
        assertThat(stored.isHasError()).isTrue();
    }

    @Test
    void twoFailuresThenSuccessCompletes() {
        codec.failuresBeforeSuccess = 2;
        codec.failure = new CodecException(CodecException.Kind.IO_ERROR, "flaky storage");
        codec.outputSize = 1_000;
        MediaDocument document = enqueueDocument(2_000_000);

        for (int i = 0; i < 3; i++) {
            compressionWorker.processNextJob();
            clock.advance(Duration.ofMinutes(5));
        }

        CompressionJob job = onlyJob(document);
        assertThat(job.getStatus()).isEqualTo(JobStatus.COMPLETED);
        assertThat(job.getAttempts()).isEqualTo(2);
        assertThat(documentStore.getCompressionStatus(document.getId())).isEqualTo(CompressionStatus.COMPLETED);
    }

    @Test
    void codecTimeoutCountsAsAFailedAttempt() {
        codec.sleepMillis = 10_000;
        codec.outputSize = 1_000;
        MediaDocument document = enqueueDocument(2_000_000);

        compressionWorker.processNextJob();

        CompressionJob job = onlyJob(document);
        assertThat(job.getStatus()).isEqualTo(JobStatus.QUEUED);
        assertThat(job.getAttempts()).isEqualTo(1);
        assertThat(job.getErrorMessage()).startsWith("TIMEOUT");
        assertThat(Files.exists(compressedPathResolver.resolve(documentStore.getDocument(document.getId()),
                CompressionMethod.PDF_OPTIMIZE))).isFalse();
    }

    @Test
    void failedCommitDiscardsTheArtifactAndAbandonsTheJob() {
        codec.outputSize = 1_000;
        MediaDocument document = enqueueDocument(2_000_000);
        doThrow(new DataAccessResourceFailureException("connection lost"))
                .when(transitionService).commitCompleted(any(), any(), anyString(), anyLong());

        compressionWorker.processNextJob();

        MediaDocument stored = documentStore.getDocument(document.getId());
        assertThat(stored.getCompressionStatus()).isEqualTo(CompressionStatus.PROCESSING);
        assertThat(stored.getCompressedPath()).isNull();
        assertThat(Files.exists(compressedPathResolver.resolve(stored, CompressionMethod.PDF_OPTIMIZE))).isFalse();
        assertThat(onlyJob(document).getStatus()).isEqualTo(JobStatus.RUNNING);

        // The startup sweep hands the abandoned job back to the queue.
        assertThat(compressionQueue.recoverOrphanedJobs()).isEqualTo(1);
        assertThat(onlyJob(document).getStatus()).isEqualTo(JobStatus.QUEUED);
    }

    @Test
    void emptyQueueReportsNothingClaimed() {
        assertThat(compressionWorker.processNextJob()).isFalse();
        verify(transitionService, never()).commitSkipped(any(), any(), anyString());
    }

    private MediaDocument enqueueDocument(long size) {
        return enqueueDocument(size, (int) size);
    }

    private MediaDocument enqueueDocument(long registeredSize, int actualSize) {
        Path original = originals.resolve("scan-" + UUID.randomUUID() + ".pdf");
        try {
            Files.write(original, new byte[actualSize]);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        MediaDocument document = registerDocument("report", original.getFileName().toString(), "application/pdf",
                registeredSize, original.toString());
        compressionQueue.enqueue(document.getId(), null);
        return document;
    }

    private CompressionJob onlyJob(MediaDocument document) {
        return compressionJobRepository.findByDocumentIdOrderByIdAsc(document.getId()).get(0);
    }

    /**
     * Produces {@code outputSize} bytes, optionally after sleeping or failing a number of times.
     */
    static class StubCodec implements DocumentCodec {
        final AtomicInteger calls = new AtomicInteger();
        volatile int outputSize = 1_000;
        volatile long sleepMillis;
        volatile CodecException failure;
        volatile int failuresBeforeSuccess = Integer.MAX_VALUE;

        @Override
        public boolean supports(CompressionMethod method, String mimeType) {
            return true;
        }

        @Override
        public byte[] compress(Path input, CompressionMethod method, int level) throws CodecException {
            int call = calls.incrementAndGet();
            if (sleepMillis > 0) {
                try {
                    TimeUnit.MILLISECONDS.sleep(sleepMillis);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new CodecException(CodecException.Kind.TIMEOUT, "interrupted", e);
                }
            }
            if (failure != null && call <= failuresBeforeSuccess) {
                throw failure;
            }
            return new byte[outputSize];
        }
    }
}
