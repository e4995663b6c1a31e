package com.xammer.spectre.dto;

/**
 * Discovery-mode analyzer settings. Zero day thresholds disable the matching factor.
 */
public record DiscoveryThresholds(int ageThresholdDays, int inactivityThresholdDays, boolean checkEncryption,
                                  boolean checkPublicAccess, int riskScoreThreshold) {

    public static final int DEFAULT_AGE_THRESHOLD_DAYS = 365;
    public static final int DEFAULT_INACTIVITY_THRESHOLD_DAYS = 180;
    public static final int DEFAULT_RISK_SCORE_THRESHOLD = 100;

    public int effectiveRiskScoreThreshold() {
        return riskScoreThreshold <= 0 ? DEFAULT_RISK_SCORE_THRESHOLD : riskScoreThreshold;
    }

    public static DiscoveryThresholds defaults() {
        return new DiscoveryThresholds(DEFAULT_AGE_THRESHOLD_DAYS, DEFAULT_INACTIVITY_THRESHOLD_DAYS, false, false,
                DEFAULT_RISK_SCORE_THRESHOLD);
    }
}
