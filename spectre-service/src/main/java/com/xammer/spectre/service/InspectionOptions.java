package com.xammer.spectre.service;

import com.xammer.spectre.util.CancellationToken;

import java.util.Set;

/**
 * Per-run knobs of the inspector, captured once and passed by value.
 *
 * @param concurrency         worker pool width; non-positive means {@link #DEFAULT_CONCURRENCY}
 * @param collectEncryption   fetch default encryption in discovery mode
 * @param collectPublicAccess fetch the public access block in discovery mode
 * @param excludedBuckets     buckets dropped before inspection
 */
public record InspectionOptions(
        RegionSelection regionSelection,
        int concurrency,
        boolean collectEncryption,
        boolean collectPublicAccess,
        Set<String> excludedBuckets,
        CancellationToken cancellationToken,
        ProgressListener progressListener
) {

    public static final int DEFAULT_CONCURRENCY = 10;

    public InspectionOptions {
        if (regionSelection == null) {
            regionSelection = RegionSelection.defaultOnly(null);
        }
        if (concurrency <= 0) {
            concurrency = DEFAULT_CONCURRENCY;
        }
        excludedBuckets = excludedBuckets == null ? Set.of() : Set.copyOf(excludedBuckets);
        if (cancellationToken == null) {
            cancellationToken = CancellationToken.none();
        }
        if (progressListener == null) {
            progressListener = ProgressListener.NONE;
        }
    }

    public static InspectionOptions defaults() {
        return new InspectionOptions(null, DEFAULT_CONCURRENCY, false, false, null, null, null);
    }
}
