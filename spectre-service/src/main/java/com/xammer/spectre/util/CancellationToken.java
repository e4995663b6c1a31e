package com.xammer.spectre.util;

import com.xammer.spectre.exception.AuditCancelledException;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Cancellation signal shared by every worker of one audit run.
 * <br>
 * Fires either when {@link #cancel()} is called or when the optional deadline passes.
 * Backoff sleeps wait on the signal so they return as soon as it fires.
 */
public final class CancellationToken {

    private final CountDownLatch cancelled = new CountDownLatch(1);
    private final long deadlineNanos;
    private final boolean hasDeadline;

    private CancellationToken(Duration timeout) {
        this.hasDeadline = timeout != null && !timeout.isZero() && !timeout.isNegative();
        this.deadlineNanos = hasDeadline ? System.nanoTime() + timeout.toNanos() : 0L;
    }

    public static CancellationToken none() {
        return new CancellationToken(null);
    }

    /** A zero or negative timeout means "no deadline". */
    public static CancellationToken withTimeout(Duration timeout) {
        return new CancellationToken(timeout);
    }

    public void cancel() {
        cancelled.countDown();
    }

    public boolean isCancelled() {
        if (cancelled.getCount() == 0) {
            return true;
        }
        if (hasDeadline && System.nanoTime() - deadlineNanos >= 0) {
            cancel();
            return true;
        }
        return false;
    }

    public void throwIfCancelled(String operation) {
        if (isCancelled()) {
            throw new AuditCancelledException(operation + " cancelled: operation timed out or was aborted");
        }
    }

    /** Time left before the deadline, empty when no deadline is set. */
    public Optional<Duration> remaining() {
        if (!hasDeadline) {
            return Optional.empty();
        }
        long left = deadlineNanos - System.nanoTime();
        return Optional.of(Duration.ofNanos(Math.max(0L, left)));
    }

    /**
     * Waits for {@code delay} unless the token fires first.
     *
     * @return true if the full delay elapsed, false if the wait was cut short by cancellation
     */
    public boolean sleep(Duration delay) {
        long waitNanos = delay.toNanos();
        Optional<Duration> left = remaining();
        if (left.isPresent() && left.get().toNanos() < waitNanos) {
            waitNanos = left.get().toNanos();
        }
        try {
            if (cancelled.await(waitNanos, TimeUnit.NANOSECONDS)) {
                return false;
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancel();
            return false;
        }
        return !isCancelled();
    }
}
