package com.xammer.spectre.exception;

public class BaselineException extends SpectreException {

    public BaselineException(String message, Throwable cause) {
        super(message, cause);
    }
}
