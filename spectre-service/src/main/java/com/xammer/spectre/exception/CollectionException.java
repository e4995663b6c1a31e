package com.xammer.spectre.exception;

/**
 * Systemic inspection failure, e.g. the account-wide bucket listing could not be read.
 * Per-bucket and per-field failures never surface as this exception.
 */
public class CollectionException extends SpectreException {

    public CollectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
