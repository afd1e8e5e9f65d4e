package com.eyelevel.documentcompressor.service.worker;

import com.eyelevel.documentcompressor.codec.DocumentCodec;
import com.eyelevel.documentcompressor.config.CompressionProperties;
import com.eyelevel.documentcompressor.exception.CodecException;
import com.eyelevel.documentcompressor.model.CompressionMethod;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs a codec on the codec pool and waits at most the configured job timeout for it.
 * On expiry the codec thread is interrupted and its output, if any, is discarded.
 */
@Slf4j
@Component
public class CodecInvoker {

    private final ThreadPoolTaskExecutor codecExecutor;
    private final CompressionProperties properties;

    public CodecInvoker(@Qualifier("codecExecutor") ThreadPoolTaskExecutor codecExecutor,
                        CompressionProperties properties) {
        this.codecExecutor = codecExecutor;
        this.properties = properties;
    }

    public byte[] invoke(DocumentCodec codec, Path input, CompressionMethod method, int level, String contextInfo)
            throws CodecException {
        long timeoutMs = properties.getWorker().getJobTimeoutMs();
        Future<byte[]> future;
        try {
            future = codecExecutor.submit(() -> codec.compress(input, method, level));
        } catch (TaskRejectedException e) {
            throw new CodecException(CodecException.Kind.IO_ERROR, "Codec pool is saturated; try again later.", e);
        }

        try {
            return future.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("[{}] Codec {} exceeded the {} ms timeout and was cancelled.", contextInfo,
                    codec.getClass().getSimpleName(), timeoutMs);
            throw new CodecException(CodecException.Kind.TIMEOUT,
                    "Compression exceeded the " + timeoutMs + " ms time limit.", e);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new CodecException(CodecException.Kind.TIMEOUT, "Compression interrupted before completion.", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof CodecException codecException) {
                throw codecException;
            }
            log.error("[{}] Codec {} failed unexpectedly.", contextInfo, codec.getClass().getSimpleName(), cause);
            throw new CodecException(CodecException.Kind.IO_ERROR,
                    "Codec failed unexpectedly: " + (cause == null ? e.getMessage() : cause.getMessage()), cause);
        }
    }
}
