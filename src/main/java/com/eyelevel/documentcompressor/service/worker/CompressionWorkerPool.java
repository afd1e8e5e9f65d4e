package com.eyelevel.documentcompressor.service.worker;

import com.eyelevel.documentcompressor.config.CompressionProperties;
import com.eyelevel.documentcompressor.service.queue.CompressionJobEnqueuedEvent;
import com.eyelevel.documentcompressor.service.queue.CompressionQueue;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.SmartLifecycle;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionalEventListener;

import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs the configured number of worker loops on the worker pool.
 * <p>
 * On start the pool first requeues jobs orphaned by a previous process. Each loop claims and processes jobs until
 * the queue has nothing eligible, then waits for an enqueue signal or the poll interval, whichever comes first.
 */
@Slf4j
@Component
public class CompressionWorkerPool implements SmartLifecycle {

    private final CompressionWorker compressionWorker;
    private final CompressionQueue compressionQueue;
    private final ThreadPoolTaskExecutor workerExecutor;
    private final CompressionProperties properties;
    private final Semaphore wakeSignal = new Semaphore(0);
    private final AtomicInteger activeLoops = new AtomicInteger();

    private volatile boolean running;

    public CompressionWorkerPool(CompressionWorker compressionWorker, CompressionQueue compressionQueue,
                                 @Qualifier("compressionWorkerExecutor") ThreadPoolTaskExecutor workerExecutor,
                                 CompressionProperties properties) {
        this.compressionWorker = compressionWorker;
        this.compressionQueue = compressionQueue;
        this.workerExecutor = workerExecutor;
        this.properties = properties;
    }

    @Override
    public void start() {
        if (!properties.getWorker().isEnabled()) {
            log.info("Compression worker pool is disabled (app.compression.worker.enabled=false).");
            return;
        }
        try {
            compressionQueue.recoverOrphanedJobs();
        } catch (DataAccessException e) {
            log.error("Orphaned job recovery failed. Starting workers anyway.", e);
        }

        running = true;
        int concurrency = Math.max(1, properties.getWorker().getConcurrency());
        for (int i = 0; i < concurrency; i++) {
            final int workerIndex = i;
            workerExecutor.execute(() -> runLoop(workerIndex));
        }
        log.info("Started {} compression workers (poll interval {} ms, job timeout {} ms).", concurrency,
                properties.getWorker().getPollIntervalMs(), properties.getWorker().getJobTimeoutMs());
    }

    @Override
    public void stop() {
        if (!running) {
            return;
        }
        running = false;
        wakeSignal.release(Math.max(1, properties.getWorker().getConcurrency()));
        log.info("Stopping compression workers.");
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    /**
     * The number of worker loops that have not exited yet. Drops to zero some time after {@link #stop()}.
     */
    public int getActiveWorkerCount() {
        return activeLoops.get();
    }

    /**
     * Wakes one idle worker once a newly queued job is committed.
     */
    @TransactionalEventListener(fallbackExecution = true)
    public void onJobEnqueued(CompressionJobEnqueuedEvent event) {
        if (wakeSignal.availablePermits() < Math.max(1, properties.getWorker().getConcurrency())) {
            wakeSignal.release();
        }
        log.debug("Wake-up signalled for Job ID {}.", event.jobId());
    }

    private void runLoop(int workerIndex) {
        activeLoops.incrementAndGet();
        try {
            loop(workerIndex);
        } finally {
            activeLoops.decrementAndGet();
        }
    }

    private void loop(int workerIndex) {
        log.info("Compression worker {} started.", workerIndex);
        long pollIntervalMs = properties.getWorker().getPollIntervalMs();
        while (running) {
            try {
                boolean claimed = compressionWorker.processNextJob();
                if (!claimed && running) {
                    wakeSignal.tryAcquire(pollIntervalMs, TimeUnit.MILLISECONDS);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (RuntimeException e) {
                log.error("Compression worker {} hit an unexpected error. Backing off for {} ms.", workerIndex,
                        pollIntervalMs, e);
                try {
                    TimeUnit.MILLISECONDS.sleep(pollIntervalMs);
                } catch (InterruptedException interrupted) {
                    Thread.currentThread().interrupt();
                    break;
                }
            }
        }
        log.info("Compression worker {} stopped.", workerIndex);
    }
}
