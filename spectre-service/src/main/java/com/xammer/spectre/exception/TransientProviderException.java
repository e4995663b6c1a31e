package com.xammer.spectre.exception;

/**
 * Raised once a retryable error (throttling, 5xx, timeouts) survived every attempt.
 */
public class TransientProviderException extends ProviderException {

    public TransientProviderException(String operation, Throwable lastError) {
        super(operation, operation + " failed: max retries exceeded: " + messageOf(lastError), lastError);
    }

    private static String messageOf(Throwable error) {
        return error == null ? "unknown error" : error.getMessage();
    }
}
