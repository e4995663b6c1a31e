package com.xammer.spectre.service;

import com.xammer.spectre.exception.AuditCancelledException;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Consumer;

import com.xammer.spectre.util.CancellationToken;

/**
 * Fans a batch of items out over a short-lived pool of at most {@code width} threads and
 * waits for all of them, giving up as soon as the cancellation token fires.
 */
final class BoundedTaskRunner {

    private static final long POLL_MILLIS = 100L;

    private BoundedTaskRunner() {
    }

    static <T> void runAll(String threadPrefix, int width, Collection<T> items, Consumer<T> task,
                           CancellationToken token) {
        if (items.isEmpty()) {
            return;
        }
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        int poolSize = Math.max(1, Math.min(width, items.size()));
        executor.setCorePoolSize(poolSize);
        executor.setMaxPoolSize(poolSize);
        executor.setThreadNamePrefix(threadPrefix + "-");
        executor.setDaemon(true);
        executor.initialize();
        try {
            List<CompletableFuture<Void>> futures = new ArrayList<>(items.size());
            for (T item : items) {
                futures.add(CompletableFuture.runAsync(() -> task.accept(item), executor));
            }
            await(CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])), threadPrefix, token);
        } finally {
            executor.shutdown();
        }
    }

    private static void await(CompletableFuture<Void> all, String operation, CancellationToken token) {
        while (true) {
            if (token.isCancelled()) {
                all.cancel(true);
                throw new AuditCancelledException(operation + " cancelled: operation timed out or was aborted");
            }
            try {
                all.get(POLL_MILLIS, TimeUnit.MILLISECONDS);
                return;
            } catch (TimeoutException e) {
                // still running
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                token.cancel();
                throw new AuditCancelledException(operation + " cancelled: interrupted");
            } catch (ExecutionException e) {
                throw propagate(e.getCause());
            }
        }
    }

    private static RuntimeException propagate(Throwable cause) {
        Throwable current = cause;
        while (current instanceof CompletionException && current.getCause() != null) {
            current = current.getCause();
        }
        if (current instanceof RuntimeException) {
            return (RuntimeException) current;
        }
        if (current instanceof Error) {
            throw (Error) current;
        }
        return new IllegalStateException(current);
    }
}
