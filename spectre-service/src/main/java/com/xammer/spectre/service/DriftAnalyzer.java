package com.xammer.spectre.service;

import com.xammer.spectre.dto.BucketAnalysis;
import com.xammer.spectre.dto.BucketMetadata;
import com.xammer.spectre.dto.BucketStatus;
import com.xammer.spectre.dto.PrefixAnalysis;
import com.xammer.spectre.dto.PrefixMetadata;
import com.xammer.spectre.dto.Reference;
import com.xammer.spectre.dto.ScanResult;
import com.xammer.spectre.dto.ScanSummary;
import com.xammer.spectre.dto.ScanThresholds;
import com.xammer.spectre.dto.UnusedScore;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Classifies referenced buckets and prefixes against their live metadata.
 * <br>
 * Per bucket the first matching rule wins: missing, unused (when enabled), version sprawl,
 * lifecycle misconfiguration, otherwise OK. Prefixes are classified on their own.
 * The result depends only on the inputs; summary lists are sorted.
 */
@Service
public class DriftAnalyzer {

    static final int LARGE_PREFIX_OBJECTS = 100;

    public ScanResult analyze(List<Reference> references, Map<String, BucketMetadata> metadata,
                              ScanThresholds thresholds) {
        Set<String> referenced = new HashSet<>();
        for (Reference reference : references) {
            referenced.add(reference.bucket());
        }

        ScanSummary summary = new ScanSummary();
        TreeMap<String, BucketAnalysis> buckets = new TreeMap<>();
        for (Map.Entry<String, BucketMetadata> entry : new TreeMap<>(metadata).entrySet()) {
            String bucket = entry.getKey();
            BucketAnalysis analysis = analyzeBucket(bucket, entry.getValue(), referenced.contains(bucket), thresholds);
            buckets.put(bucket, analysis);
            tally(summary, analysis);
        }
        sortSummary(summary);
        return new ScanResult(summary, buckets);
    }

    BucketAnalysis analyzeBucket(String bucket, BucketMetadata info, boolean referencedInCode,
                                 ScanThresholds thresholds) {
        BucketAnalysis analysis = new BucketAnalysis();
        analysis.setName(bucket);
        analysis.setReferencedInCode(referencedInCode);
        analysis.setExistsInAws(info.isExists());
        analysis.setVersioningEnabled(info.isVersioningEnabled());
        analysis.setLifecycleRules(info.getLifecycleRules());

        if (!info.isExists()) {
            analysis.setStatus(BucketStatus.MISSING_BUCKET);
            analysis.setMessage("Bucket referenced in code but does not exist in AWS");
            return analysis;
        }

        if (thresholds.checkUnused()) {
            UnusedScore score = unusedScore(info, referencedInCode, thresholds);
            analysis.setUnusedScore(score);
            if (score.isUnused()) {
                analysis.setStatus(BucketStatus.UNUSED_BUCKET);
                analysis.setMessage(String.format("Bucket appears unused (score: %d/%d)",
                        score.getTotal(), thresholds.effectiveUnusedScoreThreshold()));
                return analysis;
            }
        }

        if (info.isVersioningEnabled() && info.getLifecycleRules() == 0) {
            analysis.setStatus(BucketStatus.VERSION_SPRAWL);
            analysis.setMessage("Versioning enabled but no lifecycle rules to clean up old versions");
        }

        List<PrefixMetadata> prefixes = info.getPrefixes() == null ? List.of() : info.getPrefixes();
        analysis.setPrefixes(analyzePrefixes(prefixes, thresholds));

        if (analysis.getStatus() == null && info.getLifecycleRules() == 0 && hasLargePrefix(prefixes)) {
            analysis.setStatus(BucketStatus.LIFECYCLE_MISCONFIG);
            analysis.setMessage("Bucket has no lifecycle rules but contains many objects");
        }
        if (analysis.getStatus() == null) {
            analysis.setStatus(BucketStatus.OK);
            analysis.setMessage("Bucket exists and matches expected usage");
        }
        return analysis;
    }

    /** Additive: +100 not referenced, +50 empty, +20 once for a deprecated tag. */
    UnusedScore unusedScore(BucketMetadata info, boolean referencedInCode, ScanThresholds thresholds) {
        UnusedScore score = new UnusedScore();
        if (!referencedInCode) {
            score.setNotInCode(100);
            score.getReasons().add("Not referenced in code");
        }
        if (info.isEmpty()) {
            score.setEmpty(50);
            score.getReasons().add("Bucket is empty");
        }
        DeprecatedTagMatcher.firstMatch(info.getTags()).ifPresent(tag -> {
            score.setDeprecatedTag(20);
            score.getReasons().add(String.format("Has deprecated tag: %s=%s", tag.getKey(), tag.getValue()));
        });
        score.setTotal(score.getNotInCode() + score.getEmpty() + score.getDeprecatedTag());
        score.setUnused(score.getTotal() >= thresholds.effectiveUnusedScoreThreshold());
        return score;
    }

    private List<PrefixAnalysis> analyzePrefixes(List<PrefixMetadata> prefixes, ScanThresholds thresholds) {
        List<PrefixAnalysis> results = new ArrayList<>(prefixes.size());
        for (PrefixMetadata prefix : prefixes) {
            PrefixAnalysis.PrefixAnalysisBuilder analysis = PrefixAnalysis.builder()
                    .prefix(prefix.getPrefix())
                    .objectCount(prefix.getObjectCount())
                    .daysSinceModified(prefix.getDaysSinceModified());
            if (!prefix.isExists()) {
                analysis.status(BucketStatus.MISSING_PREFIX)
                        .message("Prefix referenced in code but no objects found");
            } else if (prefix.getDaysSinceModified() > thresholds.staleDays()) {
                analysis.status(BucketStatus.STALE_PREFIX)
                        .message(String.format("No modifications for %d days (threshold: %d)",
                                prefix.getDaysSinceModified(), thresholds.staleDays()));
            } else {
                analysis.status(BucketStatus.OK);
            }
            results.add(analysis.build());
        }
        return results;
    }

    private static boolean hasLargePrefix(List<PrefixMetadata> prefixes) {
        for (PrefixMetadata prefix : prefixes) {
            if (prefix.getObjectCount() > LARGE_PREFIX_OBJECTS) {
                return true;
            }
        }
        return false;
    }

    private static void tally(ScanSummary summary, BucketAnalysis analysis) {
        String bucket = analysis.getName();
        summary.setTotalBuckets(summary.getTotalBuckets() + 1);
        switch (analysis.getStatus()) {
            case OK:
                summary.setOkBuckets(summary.getOkBuckets() + 1);
                break;
            case MISSING_BUCKET:
                summary.getMissingBuckets().add(bucket);
                break;
            case UNUSED_BUCKET:
                summary.getUnusedBuckets().add(bucket);
                break;
            case VERSION_SPRAWL:
                summary.getVersionSprawl().add(bucket);
                break;
            case LIFECYCLE_MISCONFIG:
                summary.getLifecycleMisconfig().add(bucket);
                break;
            default:
                break;
        }
        for (PrefixAnalysis prefix : analysis.getPrefixes()) {
            String path = bucket + "/" + prefix.getPrefix();
            if (prefix.getStatus() == BucketStatus.MISSING_PREFIX) {
                summary.getMissingPrefixes().add(path);
            } else if (prefix.getStatus() == BucketStatus.STALE_PREFIX) {
                summary.getStalePrefixes().add(path);
            }
        }
    }

    private static void sortSummary(ScanSummary summary) {
        Collections.sort(summary.getMissingBuckets());
        Collections.sort(summary.getUnusedBuckets());
        Collections.sort(summary.getMissingPrefixes());
        Collections.sort(summary.getStalePrefixes());
        Collections.sort(summary.getVersionSprawl());
        Collections.sort(summary.getLifecycleMisconfig());
    }
}
