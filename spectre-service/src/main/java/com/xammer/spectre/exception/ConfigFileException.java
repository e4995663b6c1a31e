package com.xammer.spectre.exception;

public class ConfigFileException extends SpectreException {

    public ConfigFileException(String message, Throwable cause) {
        super(message, cause);
    }
}
