package com.xammer.spectre.exception;

public class PermanentProviderException extends ProviderException {

    public PermanentProviderException(String operation, Throwable cause) {
        super(operation, operation + " failed: " + cause.getMessage(), cause);
    }
}
