package com.xammer.spectre.service;

/**
 * Outcome of one soft-failing metadata call: the value (zero value on failure) plus an
 * optional human-readable diagnostic.
 */
public record CollectedField<T>(T value, String diagnostic) {

    public static <T> CollectedField<T> of(T value) {
        return new CollectedField<>(value, null);
    }

    public static <T> CollectedField<T> failed(T zeroValue, String diagnostic) {
        return new CollectedField<>(zeroValue, diagnostic);
    }

    public boolean isFailed() {
        return diagnostic != null;
    }
}
