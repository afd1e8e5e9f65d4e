package com.eyelevel.documentcompressor.service.worker;

import com.eyelevel.documentcompressor.codec.CodecRegistry;
import com.eyelevel.documentcompressor.codec.DocumentCodec;
import com.eyelevel.documentcompressor.exception.CodecException;
import com.eyelevel.documentcompressor.exception.DocumentCompressionException;
import com.eyelevel.documentcompressor.exception.IllegalJobTransitionException;
import com.eyelevel.documentcompressor.model.CompressionJob;
import com.eyelevel.documentcompressor.model.MediaDocument;
import com.eyelevel.documentcompressor.service.document.DocumentStore;
import com.eyelevel.documentcompressor.service.policy.CompressionDecision;
import com.eyelevel.documentcompressor.service.policy.CompressionPolicy;
import com.eyelevel.documentcompressor.service.policy.PolicyRegistry;
import com.eyelevel.documentcompressor.service.queue.CompressionQueue;
import com.eyelevel.documentcompressor.service.queue.FailureOutcome;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Optional;

/**
 * Processes one compression job at a time: policy decision, codec call, artifact write and the final commit.
 * <p>
 * The codec runs outside any transaction. Codec failures feed the job's retry accounting; persistence failures
 * abandon the job as it is, to be reclaimed by the startup recovery sweep.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CompressionWorker {

    static final String REASON_NOT_EFFECTIVE = "compression not effective";
    static final String REASON_NO_CODEC = "no codec available";

    private final CompressionQueue compressionQueue;
    private final DocumentStore documentStore;
    private final PolicyRegistry policyRegistry;
    private final CodecRegistry codecRegistry;
    private final CodecInvoker codecInvoker;
    private final ArtifactWriter artifactWriter;
    private final CompressedPathResolver compressedPathResolver;
    private final CompressionTransitionService transitionService;

    /**
     * Claims and processes the next eligible job.
     *
     * @return {@code true} if a job was claimed, {@code false} if the queue had nothing eligible.
     */
    public boolean processNextJob() {
        final Optional<CompressionJob> claimed = compressionQueue.dequeue();
        claimed.ifPresent(this::process);
        return claimed.isPresent();
    }

    public void process(final CompressionJob job) {
        final String contextInfo = String.format("Job %d/Doc %s", job.getId(), job.getDocumentId());
        try {
            final MediaDocument document = documentStore.getDocument(job.getDocumentId());
            final CompressionPolicy policy = policyRegistry.lookup(document.getTypeId());
            final CompressionDecision decision = policyRegistry.decide(document, policy);

            if (decision.isSkip()) {
                skip(job, contextInfo, decision.getReason());
                return;
            }

            final Optional<DocumentCodec> codec = codecRegistry.getCodec(decision.getMethod(), document.getMimeType());
            if (codec.isEmpty()) {
                skip(job, contextInfo, REASON_NO_CODEC + " (" + document.getMimeType() + " for "
                        + decision.getMethod().getCode() + ")");
                return;
            }

            log.info("[{}] Compressing '{}' ({} bytes) with {} level {}.", contextInfo, document.getOriginalFilename(),
                    document.getSizeBytes(), decision.getMethod(), decision.getLevel());
            final Path original = Paths.get(document.getOriginalPath());
            final byte[] output = codecInvoker.invoke(codec.get(), original, decision.getMethod(),
                    decision.getLevel(), contextInfo);

            // Measured on disk; the registered size is caller-supplied metadata.
            final long originalSize = Files.size(original);
            if (output.length >= originalSize) {
                log.info("[{}] Output of {} bytes is not smaller than the original {} bytes.", contextInfo,
                        output.length, originalSize);
                skip(job, contextInfo, REASON_NOT_EFFECTIVE);
                return;
            }

            final Path artifact = artifactWriter.write(compressedPathResolver.resolve(document, decision.getMethod()),
                    output);
            try {
                transitionService.commitCompleted(job.getId(), document.getId(), artifact.toString(), output.length);
            } catch (RuntimeException e) {
                artifactWriter.discard(artifact);
                throw e;
            }
            log.info("[{}] Compression COMPLETED. {} -> {} bytes at '{}'.", contextInfo, originalSize,
                    output.length, artifact);

        } catch (CodecException e) {
            log.warn("[{}] Codec failed with {}: {}", contextInfo, e.getKind(), e.getMessage());
            recordFailure(job, contextInfo, e.describe());
        } catch (IOException e) {
            log.warn("[{}] Reading the original or writing the compressed artifact failed: {}", contextInfo,
                    e.getMessage());
            recordFailure(job, contextInfo, CodecException.Kind.IO_ERROR + ": " + e.getMessage());
        } catch (DataAccessException e) {
            log.error("[{}] Persistence failure. Abandoning job for the recovery sweep.", contextInfo, e);
        } catch (IllegalJobTransitionException e) {
            log.warn("[{}] {}", contextInfo, e.getMessage());
        } catch (DocumentCompressionException e) {
            log.warn("[{}] Compression failed: {}", contextInfo, e.getMessage());
            recordFailure(job, contextInfo, e.getMessage());
        }
    }

    private void skip(final CompressionJob job, final String contextInfo, final String reason) {
        transitionService.commitSkipped(job.getId(), job.getDocumentId(), reason);
        log.info("[{}] Compression SKIPPED: {}.", contextInfo, reason);
    }

    private void recordFailure(final CompressionJob job, final String contextInfo, final String error) {
        try {
            final FailureOutcome outcome = compressionQueue.failRetry(job.getId(), error);
            log.info("[{}] Failure recorded: {}.", contextInfo, outcome);
        } catch (DataAccessException e) {
            log.error("[{}] Persistence failure while recording a failed attempt. Abandoning job.", contextInfo, e);
        } catch (IllegalJobTransitionException e) {
            log.warn("[{}] {}", contextInfo, e.getMessage());
        }
    }
}
