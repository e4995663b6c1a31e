package com.xammer.spectre.service;

import java.time.Duration;
import java.util.function.Predicate;

/**
 * Attempt budget and backoff schedule for remote calls.
 *
 * @param maxAttempts total attempts including the first one
 * @param baseDelay   delay before the second attempt; doubles for every further attempt
 * @param retryable   decides whether a failure is transient
 */
public record RetryPolicy(int maxAttempts, Duration baseDelay, Predicate<Throwable> retryable) {

    public static final int DEFAULT_MAX_ATTEMPTS = 3;
    public static final Duration DEFAULT_BASE_DELAY = Duration.ofSeconds(1);

    public RetryPolicy {
        if (maxAttempts <= 0) {
            maxAttempts = DEFAULT_MAX_ATTEMPTS;
        }
        if (baseDelay == null || baseDelay.isNegative()) {
            baseDelay = DEFAULT_BASE_DELAY;
        }
        if (retryable == null) {
            retryable = new TransientErrorClassifier()::isTransient;
        }
    }

    public static RetryPolicy defaults() {
        return new RetryPolicy(DEFAULT_MAX_ATTEMPTS, DEFAULT_BASE_DELAY, new TransientErrorClassifier()::isTransient);
    }

    /** Delay after the failed attempt with the given zero-based index. */
    public Duration backoff(int attempt) {
        return baseDelay.multipliedBy(1L << Math.min(attempt, 30));
    }

    public boolean isRetryable(Throwable error) {
        return retryable.test(error);
    }
}
