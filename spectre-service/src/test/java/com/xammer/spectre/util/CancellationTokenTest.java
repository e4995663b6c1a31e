package com.xammer.spectre.util;

import com.xammer.spectre.exception.AuditCancelledException;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class CancellationTokenTest {

    @Test
    void none_neverFiresOnItsOwn() {
        CancellationToken token = CancellationToken.none();

        assertFalse(token.isCancelled());
        assertTrue(token.remaining().isEmpty());
        assertTrue(token.sleep(Duration.ofMillis(5)));
    }

    @Test
    void cancel_firesImmediately() {
        CancellationToken token = CancellationToken.none();
        token.cancel();

        assertTrue(token.isCancelled());
        assertFalse(token.sleep(Duration.ofSeconds(30)));
        AuditCancelledException ex = assertThrows(AuditCancelledException.class,
                () -> token.throwIfCancelled("list buckets"));
        assertTrue(ex.getMessage().startsWith("list buckets cancelled"));
    }

    @Test
    void deadline_firesAfterTimeout() throws InterruptedException {
        CancellationToken token = CancellationToken.withTimeout(Duration.ofMillis(20));

        Thread.sleep(60);

        assertTrue(token.isCancelled());
        assertEquals(Duration.ZERO, token.remaining().orElseThrow());
    }

    @Test
    void sleep_isCutShortByDeadline() {
        CancellationToken token = CancellationToken.withTimeout(Duration.ofMillis(50));
        long started = System.nanoTime();

        assertFalse(token.sleep(Duration.ofSeconds(30)));
        assertTrue(Duration.ofNanos(System.nanoTime() - started).compareTo(Duration.ofSeconds(5)) < 0);
    }

    @Test
    void zeroTimeout_meansNoDeadline() {
        CancellationToken token = CancellationToken.withTimeout(Duration.ZERO);

        assertFalse(token.isCancelled());
        assertTrue(token.remaining().isEmpty());
    }
}
