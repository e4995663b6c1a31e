package com.xammer.spectre.exception;

/**
 * Base type for every failure the auditor raises on purpose.
 */
public class SpectreException extends RuntimeException {

    public SpectreException(String message) {
        super(message);
    }

    public SpectreException(String message, Throwable cause) {
        super(message, cause);
    }
}
