package com.xammer.spectre.service;

import com.xammer.spectre.exception.AuditCancelledException;
import com.xammer.spectre.exception.PermanentProviderException;
import com.xammer.spectre.exception.TransientProviderException;
import com.xammer.spectre.util.CancellationToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Runs a remote call under the {@link RetryPolicy}: transient failures are retried with
 * exponential backoff, everything else surfaces at once as {@link PermanentProviderException}.
 * Cancellation wins over any provider error.
 */
public class RetryExecutor {

    private static final Logger logger = LoggerFactory.getLogger(RetryExecutor.class);

    private final RetryPolicy policy;

    public RetryExecutor(RetryPolicy policy) {
        this.policy = policy;
    }

    public RetryPolicy getPolicy() {
        return policy;
    }

    public <T> T execute(String operation, Supplier<T> call, CancellationToken token) {
        RuntimeException lastError = null;
        for (int attempt = 0; attempt < policy.maxAttempts(); attempt++) {
            token.throwIfCancelled(operation);
            try {
                return call.get();
            } catch (AuditCancelledException e) {
                throw e;
            } catch (RuntimeException e) {
                if (token.isCancelled()) {
                    throw cancelled(operation);
                }
                if (!policy.isRetryable(e)) {
                    throw new PermanentProviderException(operation, e);
                }
                lastError = e;
                if (attempt < policy.maxAttempts() - 1) {
                    Duration delay = policy.backoff(attempt);
                    logger.debug("{} attempt {}/{} failed transiently, retrying in {} ms: {}",
                            operation, attempt + 1, policy.maxAttempts(), delay.toMillis(), e.getMessage());
                    if (!token.sleep(delay)) {
                        throw cancelled(operation);
                    }
                }
            }
        }
        logger.warn("{} gave up after {} attempts", operation, policy.maxAttempts());
        throw new TransientProviderException(operation, lastError);
    }

    public void execute(String operation, Runnable call, CancellationToken token) {
        execute(operation, () -> {
            call.run();
            return null;
        }, token);
    }

    private static AuditCancelledException cancelled(String operation) {
        return new AuditCancelledException(operation + " cancelled: operation timed out or was aborted");
    }
}
