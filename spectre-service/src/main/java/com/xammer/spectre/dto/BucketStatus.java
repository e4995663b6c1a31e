package com.xammer.spectre.dto;

public enum BucketStatus {
    OK,
    MISSING_BUCKET,
    UNUSED_BUCKET,
    MISSING_PREFIX,
    STALE_PREFIX,
    VERSION_SPRAWL,
    LIFECYCLE_MISCONFIG,
    RISKY,
    INACTIVE
}
