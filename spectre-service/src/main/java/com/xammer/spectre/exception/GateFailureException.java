package com.xammer.spectre.exception;

/**
 * A --fail-on-* gate tripped. The command runner maps this to exit code 1.
 */
public class GateFailureException extends SpectreException {

    public GateFailureException(String message) {
        super(message);
    }
}
