package com.xammer.spectre.service;

import java.time.Instant;

/**
 * Statistics over the first page of a bucket listing.
 *
 * @param latestModified null when the page held no objects
 */
public record ObjectSample(int keyCount, long totalSize, Instant latestModified) {

    public static final ObjectSample EMPTY = new ObjectSample(0, 0L, null);

    public boolean isEmpty() {
        return keyCount == 0;
    }
}
