package com.eyelevel.documentcompressor.service.queue;

import com.eyelevel.documentcompressor.config.CompressionProperties;
import com.eyelevel.documentcompressor.exception.DocumentNotFoundException;
import com.eyelevel.documentcompressor.exception.DuplicateJobException;
import com.eyelevel.documentcompressor.exception.IllegalDocumentStateException;
import com.eyelevel.documentcompressor.exception.IllegalJobTransitionException;
import com.eyelevel.documentcompressor.model.CompressionJob;
import com.eyelevel.documentcompressor.model.CompressionStatus;
import com.eyelevel.documentcompressor.model.JobPriority;
import com.eyelevel.documentcompressor.model.JobStatus;
import com.eyelevel.documentcompressor.model.MediaDocument;
import com.eyelevel.documentcompressor.repository.CompressionJobRepository;
import com.eyelevel.documentcompressor.repository.JobStatusCount;
import com.eyelevel.documentcompressor.repository.MediaDocumentRepository;
import com.eyelevel.documentcompressor.service.document.DocumentStore;
import com.eyelevel.documentcompressor.service.policy.CompressionPolicy;
import com.eyelevel.documentcompressor.service.policy.PolicyRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.data.domain.PageRequest;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.CollectionUtils;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * A durable priority queue of compression jobs, one active job per document.
 * <p>
 * Every transition is a conditional update on the job's current status, so concurrent workers never claim the same
 * job and late callers cannot resurrect a finished one. Claims take the eligible job with the highest priority, then
 * the oldest {@code queuedAt}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CompressionQueue {

    static final String RECOVERY_MESSAGE = "Worker stopped while the job was running; recovered on startup.";
    private static final int MAX_ERROR_LENGTH = 4000;

    private final CompressionJobRepository compressionJobRepository;
    private final MediaDocumentRepository mediaDocumentRepository;
    private final DocumentStore documentStore;
    private final PolicyRegistry policyRegistry;
    private final CompressionProperties properties;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    /**
     * Queues a compression job for a document.
     *
     * @param documentId The document to compress.
     * @param priority   The job priority, or {@code null} for the document type's default.
     * @return The persisted job in {@link JobStatus#QUEUED}.
     * @throws DuplicateJobException          if the document already has a queued or running job.
     * @throws IllegalDocumentStateException  if the document is already completed or skipped.
     * @throws DocumentNotFoundException      if the document does not exist.
     */
    @Transactional
    public CompressionJob enqueue(final UUID documentId, final JobPriority priority) {
        final MediaDocument document = mediaDocumentRepository.findById(documentId)
                .orElseThrow(() -> new DocumentNotFoundException("Document not found with ID: " + documentId));
        if (document.getCompressionStatus() == CompressionStatus.COMPLETED
                || document.getCompressionStatus() == CompressionStatus.SKIPPED) {
            throw new IllegalDocumentStateException(String.format(
                    "Document %s is already %s and cannot be queued again.", documentId,
                    document.getCompressionStatus()));
        }
        final CompressionPolicy policy = policyRegistry.lookup(document.getTypeId());
        if (compressionJobRepository.existsByDocumentIdAndStatusIn(documentId, JobStatus.ACTIVE)) {
            throw new DuplicateJobException(documentId);
        }

        final LocalDateTime now = now();
        final JobPriority effectivePriority = priority != null ? priority : policy.defaultPriority();
        final CompressionJob job = CompressionJob.builder()
                .documentId(documentId)
                .activeDocumentId(documentId)
                .priority(effectivePriority)
                .status(JobStatus.QUEUED)
                .queuedAt(now)
                .availableAt(now)
                .attempts(0)
                .build();

        final CompressionJob saved;
        try {
            saved = compressionJobRepository.saveAndFlush(job);
        } catch (DataIntegrityViolationException e) {
            log.warn("Concurrent enqueue detected for document {}. Another job won the race.", documentId);
            throw new DuplicateJobException(documentId, e);
        }
        log.info("Queued compression Job ID {} for document {} with priority {}.", saved.getId(), documentId,
                effectivePriority);
        eventPublisher.publishEvent(new CompressionJobEnqueuedEvent(saved.getId(), documentId));
        return saved;
    }

    /**
     * Claims the best eligible job and moves its document to processing in the same transaction.
     *
     * @return The claimed job in {@link JobStatus#RUNNING}, or empty when nothing is eligible.
     */
    @Retryable(retryFor = TransientDataAccessException.class,
            maxAttemptsExpression = "#{${app.compression.persistence-retry.attempts:3}}",
            backoff = @Backoff(delayExpression = "#{${app.compression.persistence-retry.delay-ms:100}}"),
            listeners = {"persistenceRetryListener"})
    @Transactional
    public Optional<CompressionJob> dequeue() {
        final LocalDateTime now = now();
        final int batchSize = Math.max(1, properties.getQueue().getClaimBatchSize());
        // Every candidate of a batch leaves the queued state (claimed here, by another worker, or retired), so
        // fetching again until a batch comes back empty terminates.
        List<Long> candidates;
        while (!(candidates = compressionJobRepository.findClaimCandidates(now, PageRequest.of(0, batchSize)))
                .isEmpty()) {
            for (final Long candidateId : candidates) {
                if (compressionJobRepository.claim(candidateId, now) == 0) {
                    log.debug("Job ID {} was claimed by another worker. Trying the next candidate.", candidateId);
                    continue;
                }
                final CompressionJob job = compressionJobRepository.findById(candidateId)
                        .orElseThrow(() -> new IllegalStateException("Claimed job vanished: " + candidateId));
                if (!documentStore.markProcessing(job.getDocumentId())) {
                    // The document finished through another job between enqueue and claim; retire this one.
                    log.warn("Job ID {} claimed for document {} which is no longer processable. "
                            + "Completing it as a no-op.", job.getId(), job.getDocumentId());
                    compressionJobRepository.complete(job.getId(), now);
                    continue;
                }
                log.info("Claimed Job ID {} for document {} (priority {}, attempt {}).", job.getId(),
                        job.getDocumentId(), job.getPriority(), job.getAttempts() + 1);
                return Optional.of(job);
            }
            log.debug("All {} claim candidates were taken. Fetching the next batch.", candidates.size());
        }
        return Optional.empty();
    }

    /**
     * Moves a queued job to running.
     *
     * @throws IllegalJobTransitionException if the job is not queued.
     */
    @Transactional
    public void markRunning(final Long jobId) {
        if (compressionJobRepository.claim(jobId, now()) == 0) {
            throw new IllegalJobTransitionException("Job ID " + jobId + " is not QUEUED and cannot start running.");
        }
        log.debug("Job ID {} marked RUNNING.", jobId);
    }

    /**
     * Completes a running job. A job in any other state is left untouched.
     *
     * @return {@code true} if the job moved to completed.
     */
    @Transactional
    public boolean complete(final Long jobId) {
        final boolean completed = compressionJobRepository.complete(jobId, now()) == 1;
        if (!completed) {
            log.warn("Job ID {} is not RUNNING. Completion request ignored.", jobId);
        }
        return completed;
    }

    /**
     * Records a failed attempt of a running job. The job is queued again after a backoff delay, or failed together
     * with its document once {@code maxAttempts} is reached.
     *
     * @throws IllegalJobTransitionException if the job is not running.
     */
    @Retryable(retryFor = TransientDataAccessException.class,
            maxAttemptsExpression = "#{${app.compression.persistence-retry.attempts:3}}",
            backoff = @Backoff(delayExpression = "#{${app.compression.persistence-retry.delay-ms:100}}"),
            listeners = {"persistenceRetryListener"})
    @Transactional
    public FailureOutcome failRetry(final Long jobId, final String errorMessage) {
        final CompressionJob job = compressionJobRepository.findById(jobId)
                .orElseThrow(() -> new DocumentNotFoundException("Compression job not found with ID: " + jobId));
        if (job.getStatus() != JobStatus.RUNNING) {
            throw new IllegalJobTransitionException(
                    "Job ID " + jobId + " is " + job.getStatus() + " and cannot record a failed attempt.");
        }
        return recordFailedAttempt(job, errorMessage);
    }

    /**
     * Requeues every job left running by a previous process, consuming one attempt each. A job whose attempts are
     * exhausted by this is failed instead.
     *
     * @return The number of jobs recovered.
     */
    @Transactional
    public int recoverOrphanedJobs() {
        final List<CompressionJob> orphans = compressionJobRepository.findByStatus(JobStatus.RUNNING);
        if (CollectionUtils.isEmpty(orphans)) {
            log.info("No orphaned compression jobs found.");
            return 0;
        }
        log.warn("Found {} orphaned RUNNING compression jobs. Recovering them.", orphans.size());
        int recovered = 0;
        for (final CompressionJob job : orphans) {
            recordFailedAttempt(job, RECOVERY_MESSAGE);
            recovered++;
        }
        log.info("Finished orphaned job recovery. Recovered {} jobs.", recovered);
        return recovered;
    }

    /**
     * Changes the priority of the document's queued job. Running and finished jobs keep theirs.
     *
     * @return The number of jobs updated (0 or 1).
     */
    @Transactional
    public int updatePriority(final UUID documentId, final JobPriority priority) {
        return bulkUpdatePriority(List.of(documentId), priority);
    }

    @Transactional
    public int bulkUpdatePriority(final Collection<UUID> documentIds, final JobPriority priority) {
        if (CollectionUtils.isEmpty(documentIds)) {
            return 0;
        }
        if (priority == null) {
            throw new IllegalArgumentException("Priority is required.");
        }
        final int updated = compressionJobRepository.updatePriorityForQueuedJobs(documentIds, priority);
        log.info("Set priority {} on {} queued jobs ({} documents requested).", priority, updated, documentIds.size());
        return updated;
    }

    /**
     * @return The number of jobs in each status, with every status present.
     */
    @Transactional(readOnly = true)
    public Map<JobStatus, Long> queueStatus() {
        final Map<JobStatus, Long> counts = new EnumMap<>(JobStatus.class);
        for (final JobStatus status : JobStatus.values()) {
            counts.put(status, 0L);
        }
        for (final JobStatusCount row : compressionJobRepository.countByStatus()) {
            counts.put(row.getStatus(), row.getJobCount());
        }
        return counts;
    }

    /**
     * The delay before a job that has failed {@code attempts} times becomes eligible again:
     * {@code initialDelay * multiplier^(attempts - 1)}, capped at {@code maxDelay}.
     */
    public Duration backoff(final int attempts) {
        final CompressionProperties.Queue.Backoff backoff = properties.getQueue().getBackoff();
        final double delay = backoff.getInitialDelayMs() * Math.pow(backoff.getMultiplier(), Math.max(0, attempts - 1));
        return Duration.ofMillis((long) Math.min(delay, backoff.getMaxDelayMs()));
    }

    private FailureOutcome recordFailedAttempt(final CompressionJob job, final String errorMessage) {
        final LocalDateTime now = now();
        final String error = truncate(errorMessage);
        final int attempts = job.getAttempts() + 1;
        final int maxAttempts = properties.getQueue().getMaxAttempts();

        if (attempts < maxAttempts) {
            final LocalDateTime availableAt = now.plus(backoff(attempts));
            if (compressionJobRepository.requeueForRetry(job.getId(), job.getAttempts(), error, availableAt) == 0) {
                throw new IllegalJobTransitionException("Job ID " + job.getId() + " changed state concurrently.");
            }
            log.warn("Job ID {} failed attempt {}/{}. Retrying after {}. Reason: {}", job.getId(), attempts,
                    maxAttempts, availableAt, error);
            return FailureOutcome.RETRY_SCHEDULED;
        }

        if (compressionJobRepository.failTerminally(job.getId(), job.getAttempts(), error, now) == 0) {
            throw new IllegalJobTransitionException("Job ID " + job.getId() + " changed state concurrently.");
        }
        documentStore.markFailed(job.getDocumentId(), error);
        log.error("Job ID {} exhausted {} attempts. Document {} marked FAILED. Reason: {}", job.getId(), attempts,
                job.getDocumentId(), error);
        return FailureOutcome.EXHAUSTED;
    }

    private static String truncate(final String errorMessage) {
        if (errorMessage == null) {
            return "Unknown error";
        }
        return errorMessage.length() <= MAX_ERROR_LENGTH ? errorMessage : errorMessage.substring(0, MAX_ERROR_LENGTH);
    }

    /**
     * Timestamps are stored as UTC wall-clock time whatever the clock's zone, so queue order follows real time.
     */
    private LocalDateTime now() {
        return LocalDateTime.ofInstant(clock.instant(), ZoneOffset.UTC);
    }
}
