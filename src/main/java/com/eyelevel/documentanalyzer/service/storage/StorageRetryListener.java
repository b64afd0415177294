package com.eyelevel.documentanalyzer.service.storage;

import lombok.extern.slf4j.Slf4j;
import org.springframework.retry.RetryCallback;
import org.springframework.retry.RetryContext;
import org.springframework.retry.RetryListener;
import org.springframework.stereotype.Component;

@Slf4j
@Component("storageRetryListener")
public class StorageRetryListener implements RetryListener {

    @Override
    public <T, E extends Throwable> void onError(RetryContext context, RetryCallback<T, E> callback, Throwable throwable) {
        log.warn("Writing uploaded file failed on attempt {}. Retrying... Error: {}",
                 context.getRetryCount(), throwable.getMessage());
    }
}
