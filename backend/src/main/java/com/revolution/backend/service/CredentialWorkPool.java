package com.revolution.backend.service;

import com.revolution.backend.config.SecurityProperties;
import com.revolution.backend.exception.ServiceBusyException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Service;

import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Runs password hashing on the bounded {@code credentialHashingExecutor} and waits for the result.
 * A saturated pool or a slow hash surfaces as {@link ServiceBusyException}.
 */
@Slf4j
@Service
public class CredentialWorkPool {

    private final ThreadPoolTaskExecutor executor;
    private final long awaitTimeoutMs;

    public CredentialWorkPool(@Qualifier("credentialHashingExecutor") ThreadPoolTaskExecutor executor,
                              SecurityProperties securityProperties) {
        this.executor = executor;
        this.awaitTimeoutMs = securityProperties.getHashingPool().getAwaitTimeoutMs();
    }

    public <T> T run(Supplier<T> work) {
        Future<T> future;
        try {
            Callable<T> task = work::get;
            future = executor.submit(task);
        } catch (TaskRejectedException e) {
            log.warn("Credential hashing pool saturated (active={}, queued={})",
                    executor.getActiveCount(), executor.getThreadPoolExecutor().getQueue().size());
            throw new ServiceBusyException("Authentication service is busy. Please retry.", e);
        }
        try {
            return future.get(awaitTimeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("Credential hashing exceeded {}ms", awaitTimeoutMs);
            throw new ServiceBusyException("Authentication service is busy. Please retry.", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            throw new ServiceBusyException("Interrupted while hashing credentials", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new IllegalStateException("Credential hashing failed", cause);
        }
    }

    public void execute(Runnable work) {
        run(() -> {
            work.run();
            return null;
        });
    }
}
