package com.syncnest.accountservice.utils;

import com.syncnest.accountservice.config.ExecutorConfig;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.function.Supplier;

/**
 * Runs hashing work on the bounded hashing pool and waits for the result, so request
 * threads never spend their time inside bcrypt.
 */
@Component
public class CpuBoundExecutor {

    private final Executor executor;

    public CpuBoundExecutor(@Qualifier(ExecutorConfig.HASHING_EXECUTOR) Executor executor) {
        this.executor = executor;
    }

    public <T> T call(Supplier<T> task) {
        try {
            return CompletableFuture.supplyAsync(task, executor).join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException re) {
                throw re;
            }
            if (cause instanceof Error err) {
                throw err;
            }
            throw new IllegalStateException("Hashing task failed", cause);
        }
    }
}
