package com.eyelevel.documentcompressor.service.queue;

import lombok.extern.slf4j.Slf4j;
import org.springframework.retry.RetryCallback;
import org.springframework.retry.RetryContext;
import org.springframework.retry.RetryListener;
import org.springframework.stereotype.Component;

/**
 * Logs transient persistence failures that Spring Retry is about to retry.
 */
@Slf4j
@Component("persistenceRetryListener")
public class PersistenceRetryListener implements RetryListener {

    @Override
    public <T, E extends Throwable> void onError(RetryContext context, RetryCallback<T, E> callback,
                                                 Throwable throwable) {
        log.warn("Transient persistence failure on attempt {}: {}. Retrying...", context.getRetryCount(),
                throwable.getMessage());
    }
}
