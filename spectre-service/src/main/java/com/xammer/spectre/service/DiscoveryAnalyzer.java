package com.xammer.spectre.service;

import com.xammer.spectre.dto.BucketDiscovery;
import com.xammer.spectre.dto.BucketMetadata;
import com.xammer.spectre.dto.BucketStatus;
import com.xammer.spectre.dto.DiscoveryResult;
import com.xammer.spectre.dto.DiscoverySummary;
import com.xammer.spectre.dto.DiscoveryThresholds;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Risk-scores every discovered bucket. Factors add up independently; once the total reaches
 * the threshold the status is picked in order unused, version sprawl, inactive, risky.
 */
@Service
public class DiscoveryAnalyzer {

    static final int AGE_POINTS = 20;
    static final int INACTIVITY_POINTS = 50;
    static final int EMPTY_POINTS = 30;
    static final int DEPRECATED_TAG_POINTS = 20;
    static final int VERSION_SPRAWL_POINTS = 30;
    static final int NO_ENCRYPTION_POINTS = 40;
    static final int PUBLIC_ACCESS_POINTS = 60;

    public DiscoveryResult analyze(Map<String, BucketMetadata> metadata, DiscoveryThresholds thresholds) {
        DiscoverySummary summary = new DiscoverySummary();
        TreeMap<String, BucketDiscovery> buckets = new TreeMap<>();
        Set<String> regions = new TreeSet<>();

        for (Map.Entry<String, BucketMetadata> entry : new TreeMap<>(metadata).entrySet()) {
            String name = entry.getKey();
            BucketMetadata info = entry.getValue();
            BucketDiscovery discovery = analyzeBucket(name, info, thresholds);
            buckets.put(name, discovery);
            if (info.getRegion() != null && !info.getRegion().isEmpty()) {
                regions.add(info.getRegion());
            }

            summary.setTotalBuckets(summary.getTotalBuckets() + 1);
            switch (discovery.getStatus()) {
                case OK:
                    summary.setHealthyBuckets(summary.getHealthyBuckets() + 1);
                    break;
                case UNUSED_BUCKET:
                    summary.getUnusedBuckets().add(name);
                    break;
                case RISKY:
                    summary.getRiskyBuckets().add(name);
                    break;
                case INACTIVE:
                    summary.getInactiveBuckets().add(name);
                    break;
                case VERSION_SPRAWL:
                    summary.getVersionSprawl().add(name);
                    break;
                case MISSING_BUCKET:
                    summary.getUnreachableBuckets().add(name);
                    break;
                default:
                    break;
            }
        }
        summary.setTotalRegions(regions.size());
        return new DiscoveryResult(summary, buckets);
    }

    BucketDiscovery analyzeBucket(String name, BucketMetadata info, DiscoveryThresholds thresholds) {
        BucketDiscovery discovery = new BucketDiscovery();
        discovery.setName(name);
        discovery.setRegion(info.getRegion());
        discovery.setBucketInfo(info);

        if (!info.isExists()) {
            discovery.setStatus(BucketStatus.MISSING_BUCKET);
            discovery.getRiskFactors().add(info.getError() != null ? info.getError() : "Bucket could not be inspected");
            return discovery;
        }

        int score = 0;
        int inactivityThreshold = thresholds.inactivityThresholdDays();

        if (thresholds.ageThresholdDays() > 0 && info.getAgeInDays() > thresholds.ageThresholdDays()) {
            score += AGE_POINTS;
            discovery.getRiskFactors().add(String.format("Old bucket (%d days)", info.getAgeInDays()));
        }
        if (inactivityThreshold > 0 && info.getDaysSinceActivity() > inactivityThreshold) {
            score += INACTIVITY_POINTS;
            discovery.getRiskFactors().add(String.format("No activity for %d days", info.getDaysSinceActivity()));
            discovery.getRecommendations().add("Consider archiving or deleting if not needed");
        }
        if (info.isEmpty()) {
            score += EMPTY_POINTS;
            discovery.getRiskFactors().add("Empty bucket");
            discovery.getRecommendations().add("Delete if not needed");
        }
        if (DeprecatedTagMatcher.hasDeprecatedTag(info.getTags())) {
            score += DEPRECATED_TAG_POINTS;
            discovery.getRiskFactors().add("Has deprecated tags");
            discovery.getRecommendations().add("Verify if bucket is still needed");
        }
        boolean versionSprawl = info.isVersioningEnabled() && info.getLifecycleRules() == 0;
        if (versionSprawl) {
            score += VERSION_SPRAWL_POINTS;
            discovery.getRiskFactors().add("Versioning enabled without lifecycle rules");
            discovery.getRecommendations().add("Add lifecycle policy to expire old versions");
        }
        if (thresholds.checkEncryption() && info.getEncryption() != null && !info.getEncryption().isEnabled()) {
            score += NO_ENCRYPTION_POINTS;
            discovery.getRiskFactors().add("No encryption enabled");
            discovery.getRecommendations().add("Enable default encryption (AES256 or KMS)");
        }
        if (thresholds.checkPublicAccess() && info.getPublicAccess() != null
                && info.getPublicAccess().isPubliclyAccessible()) {
            score += PUBLIC_ACCESS_POINTS;
            discovery.getRiskFactors().add("Public access enabled");
            discovery.getRecommendations().add("Review and restrict public access if not required");
        }
        discovery.setRiskScore(score);

        if (score < thresholds.effectiveRiskScoreThreshold()) {
            discovery.setStatus(BucketStatus.OK);
        } else if (info.isEmpty()
                && (info.getDaysSinceActivity() > inactivityThreshold || info.getDaysSinceActivity() == 0)) {
            discovery.setStatus(BucketStatus.UNUSED_BUCKET);
        } else if (versionSprawl) {
            discovery.setStatus(BucketStatus.VERSION_SPRAWL);
        } else if (info.getDaysSinceActivity() > inactivityThreshold) {
            discovery.setStatus(BucketStatus.INACTIVE);
        } else {
            discovery.setStatus(BucketStatus.RISKY);
        }
        return discovery;
    }
}
