package com.xammer.spectre.dto;

/**
 * Scan-mode analyzer settings.
 *
 * @param staleDays            prefix age in days above which a prefix is stale
 * @param unusedThresholdDays  value of {@code --unused-threshold-days}; carried for callers, not read by classification
 * @param checkUnused          enables unused-bucket scoring
 * @param unusedScoreThreshold score at which a bucket counts as unused; non-positive means 150
 */
public record ScanThresholds(int staleDays, int unusedThresholdDays, boolean checkUnused, int unusedScoreThreshold) {

    public static final int DEFAULT_STALE_DAYS = 90;
    public static final int DEFAULT_UNUSED_THRESHOLD_DAYS = 180;
    public static final int DEFAULT_UNUSED_SCORE_THRESHOLD = 150;

    public int effectiveUnusedScoreThreshold() {
        return unusedScoreThreshold <= 0 ? DEFAULT_UNUSED_SCORE_THRESHOLD : unusedScoreThreshold;
    }

    public static ScanThresholds defaults() {
        return new ScanThresholds(DEFAULT_STALE_DAYS, DEFAULT_UNUSED_THRESHOLD_DAYS, false, DEFAULT_UNUSED_SCORE_THRESHOLD);
    }
}
