package com.eyelevel.documentcompressor.service.worker;

import com.eyelevel.documentcompressor.exception.IllegalDocumentStateException;
import com.eyelevel.documentcompressor.exception.IllegalJobTransitionException;
import com.eyelevel.documentcompressor.service.document.DocumentStore;
import com.eyelevel.documentcompressor.service.queue.CompressionQueue;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.UUID;

/**
 * Commits the terminal outcome of a job together with the document's new status.
 * <p>
 * Each method runs in its own new transaction. The job transition goes first; if either side does not apply,
 * the whole commit is rolled back and neither the job nor the document changes.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CompressionTransitionService {

    private final CompressionQueue compressionQueue;
    private final DocumentStore documentStore;

    @Retryable(retryFor = TransientDataAccessException.class,
            maxAttemptsExpression = "#{${app.compression.persistence-retry.attempts:3}}",
            backoff = @Backoff(delayExpression = "#{${app.compression.persistence-retry.delay-ms:100}}"),
            listeners = {"persistenceRetryListener"})
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void commitCompleted(final Long jobId, final UUID documentId, final String compressedPath,
                                final long compressedSize) {
        completeJob(jobId);
        if (!documentStore.markCompleted(documentId, compressedPath, compressedSize)) {
            throw new IllegalDocumentStateException(
                    "Document " + documentId + " is not PROCESSING and cannot be marked COMPLETED.");
        }
    }

    @Retryable(retryFor = TransientDataAccessException.class,
            maxAttemptsExpression = "#{${app.compression.persistence-retry.attempts:3}}",
            backoff = @Backoff(delayExpression = "#{${app.compression.persistence-retry.delay-ms:100}}"),
            listeners = {"persistenceRetryListener"})
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void commitSkipped(final Long jobId, final UUID documentId, final String reason) {
        completeJob(jobId);
        if (!documentStore.markSkipped(documentId, reason)) {
            throw new IllegalDocumentStateException(
                    "Document " + documentId + " is not PROCESSING and cannot be marked SKIPPED.");
        }
    }

    private void completeJob(final Long jobId) {
        if (!compressionQueue.complete(jobId)) {
            throw new IllegalJobTransitionException("Job ID " + jobId + " is no longer RUNNING; outcome discarded.");
        }
    }
}
