package com.xammer.spectre.service;

/**
 * @param versionCount object versions plus delete markers
 * @param totalSize    bytes held by all listed versions
 */
public record VersionTotals(int versionCount, long totalSize) {

    public static final VersionTotals NONE = new VersionTotals(0, 0L);
}
