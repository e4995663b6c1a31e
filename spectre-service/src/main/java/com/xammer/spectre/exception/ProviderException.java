package com.xammer.spectre.exception;

/**
 * A remote S3/EC2 call failed. Carries the name of the operation so callers can
 * phrase diagnostics like "get versioning failed for my-bucket: ...".
 */
public abstract class ProviderException extends SpectreException {

    private final String operation;

    protected ProviderException(String operation, String message, Throwable cause) {
        super(message, cause);
        this.operation = operation;
    }

    public String getOperation() {
        return operation;
    }
}
