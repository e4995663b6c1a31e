package com.xammer.spectre.exception;

/**
 * The caller cancelled the audit or its total timeout elapsed. Never retried.
 */
public class AuditCancelledException extends SpectreException {

    public AuditCancelledException(String message) {
        super(message);
    }
}
