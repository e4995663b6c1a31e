package com.xammer.spectre.exception;

/**
 * The region set could not be determined. Aborts the whole audit.
 */
public class RegionResolutionException extends SpectreException {

    public RegionResolutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
