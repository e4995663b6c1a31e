package com.xammer.spectre.report;

import com.xammer.spectre.dto.BucketAnalysis;
import com.xammer.spectre.dto.BucketDiscovery;
import com.xammer.spectre.dto.BucketMetadata;
import com.xammer.spectre.dto.BucketStatus;
import com.xammer.spectre.dto.DiscoveryReport;
import com.xammer.spectre.dto.DiscoverySummary;
import com.xammer.spectre.dto.ScanReport;
import com.xammer.spectre.dto.ScanSummary;
import com.xammer.spectre.util.ByteSizes;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.Writer;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Human readable report: a summary block followed by one section per finding type.
 */
@Component
public class TextReportWriter implements ReportWriter {

    static final int HEALTHY_DISPLAY_LIMIT = 10;

    private static final DateTimeFormatter TIME_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss 'UTC'").withZone(ZoneOffset.UTC);

    @Override
    public String format() {
        return "text";
    }

    @Override
    public void writeScan(ScanReport report, Writer out) throws IOException {
        PrintWriter w = new PrintWriter(out);
        w.print("S3Spectre Report\n");
        w.print("================\n\n");
        if (report.getTimestamp() != null) {
            w.printf("Scan Time: %s\n", TIME_FORMAT.format(report.getTimestamp()));
        }
        if (report.getConfig() != null) {
            w.printf("Repository: %s\n", report.getConfig().getRepoPath());
            if (notEmpty(report.getConfig().getAwsProfile())) {
                w.printf("AWS Profile: %s\n", report.getConfig().getAwsProfile());
            }
            if (notEmpty(report.getConfig().getAwsRegion())) {
                w.printf("AWS Region: %s\n", report.getConfig().getAwsRegion());
            }
        }
        w.print("\n");

        ScanSummary summary = report.getSummary();
        w.print("Summary\n-------\n");
        w.printf("Total Buckets Scanned: %d\n", summary.getTotalBuckets());
        w.printf("OK: %d\n", summary.getOkBuckets());
        count(w, "Missing Buckets", summary.getMissingBuckets());
        count(w, "Unused Buckets", summary.getUnusedBuckets());
        count(w, "Missing Prefixes", summary.getMissingPrefixes());
        count(w, "Stale Prefixes", summary.getStalePrefixes());
        count(w, "Version Sprawl", summary.getVersionSprawl());
        count(w, "Lifecycle Misconfig", summary.getLifecycleMisconfig());
        w.print("\n");

        Map<String, BucketAnalysis> buckets = report.getBuckets();
        bucketSection(w, "Missing Buckets", BucketStatus.MISSING_BUCKET, summary.getMissingBuckets(), buckets);
        if (!summary.getUnusedBuckets().isEmpty()) {
            header(w, "Unused Buckets", 50);
            for (String bucket : summary.getUnusedBuckets()) {
                BucketAnalysis analysis = buckets.get(bucket);
                w.printf("  [%s]: %s\n", BucketStatus.UNUSED_BUCKET, bucket);
                message(w, analysis);
                if (analysis != null && analysis.getUnusedScore() != null) {
                    w.print("    Reasons:\n");
                    for (String reason : analysis.getUnusedScore().getReasons()) {
                        w.printf("      - %s\n", reason);
                    }
                }
            }
            w.print("\n");
        }
        pathSection(w, "Stale Prefixes", BucketStatus.STALE_PREFIX, summary.getStalePrefixes());
        pathSection(w, "Missing Prefixes", BucketStatus.MISSING_PREFIX, summary.getMissingPrefixes());
        bucketSection(w, "Version Sprawl", BucketStatus.VERSION_SPRAWL, summary.getVersionSprawl(), buckets);
        bucketSection(w, "Lifecycle Misconfigurations", BucketStatus.LIFECYCLE_MISCONFIG,
                summary.getLifecycleMisconfig(), buckets);

        if (summary.getOkBuckets() > 0) {
            header(w, "OK Buckets: " + summary.getOkBuckets(), 50);
            for (BucketAnalysis analysis : buckets.values()) {
                if (analysis.getStatus() == BucketStatus.OK) {
                    w.printf("  [OK]: %s\n", analysis.getName());
                }
            }
            w.print("\n");
        }
        w.flush();
    }

    @Override
    public void writeDiscovery(DiscoveryReport report, Writer out) throws IOException {
        PrintWriter w = new PrintWriter(out);
        w.print("S3Spectre Discovery Report\n");
        w.print("===========================\n\n");
        if (report.getTimestamp() != null) {
            w.printf("Scan Time: %s\n", TIME_FORMAT.format(report.getTimestamp()));
        }
        DiscoveryReport.DiscoveryReportConfig config = report.getConfig();
        if (config != null) {
            if (notEmpty(config.getAwsProfile())) {
                w.printf("AWS Profile: %s\n", config.getAwsProfile());
            }
            if (config.getRegions() != null && !config.getRegions().isEmpty()) {
                w.printf("Regions: %s\n", String.join(", ", config.getRegions()));
            } else if (config.isAllRegions()) {
                w.print("Scanning: All enabled AWS regions\n");
            }
        }
        DiscoverySummary summary = report.getSummary();
        w.printf("Total Regions Scanned: %d\n\n", summary.getTotalRegions());

        w.print("Summary\n-------\n");
        w.printf("Total Buckets: %d\n", summary.getTotalBuckets());
        w.printf("Healthy: %d\n", summary.getHealthyBuckets());
        count(w, "Unused", summary.getUnusedBuckets());
        count(w, "Risky", summary.getRiskyBuckets());
        count(w, "Inactive", summary.getInactiveBuckets());
        count(w, "Version Sprawl", summary.getVersionSprawl());
        count(w, "Unreachable", summary.getUnreachableBuckets());
        w.print("\n");

        Map<String, BucketDiscovery> buckets = report.getBuckets();
        discoverySection(w, "Unused Buckets", "UNUSED", summary.getUnusedBuckets(), buckets, true);
        discoverySection(w, "Risky Buckets", "RISKY", summary.getRiskyBuckets(), buckets, true);
        discoverySection(w, "Inactive Buckets", "INACTIVE", summary.getInactiveBuckets(), buckets, false);

        if (!summary.getVersionSprawl().isEmpty()) {
            header(w, "Version Sprawl", 70);
            for (String bucket : summary.getVersionSprawl()) {
                BucketDiscovery discovery = buckets.get(bucket);
                w.printf("  [VERSION_SPRAWL]: %s (%s)\n", bucket, discovery.getRegion());
                BucketMetadata info = discovery.getBucketInfo();
                if (info != null) {
                    if (info.getTotalVersionSize() > 0) {
                        w.printf("    Total Size (all versions): %s (%d versions)\n",
                                ByteSizes.format(info.getTotalVersionSize()), info.getVersionCount());
                    }
                    if (info.getTotalSize() > 0 && info.getTotalVersionSize() > info.getTotalSize()) {
                        long overhead = info.getTotalVersionSize() - info.getTotalSize();
                        w.printf(Locale.ROOT, "    Version Overhead: %s (%.1f%% of total)\n",
                                ByteSizes.format(overhead), overhead * 100.0 / info.getTotalVersionSize());
                    }
                }
                list(w, "Factors", discovery.getRiskFactors());
                w.print("\n");
            }
        }

        if (!summary.getUnreachableBuckets().isEmpty()) {
            header(w, "Unreachable Buckets", 70);
            for (String bucket : summary.getUnreachableBuckets()) {
                BucketDiscovery discovery = buckets.get(bucket);
                w.printf("  [UNREACHABLE]: %s\n", bucket);
                list(w, "Errors", discovery.getRiskFactors());
            }
            w.print("\n");
        }

        if (summary.getHealthyBuckets() > 0) {
            header(w, "Healthy Buckets: " + summary.getHealthyBuckets(), 70);
            List<BucketDiscovery> healthy = new ArrayList<>();
            for (BucketDiscovery discovery : buckets.values()) {
                if (discovery.getStatus() == BucketStatus.OK) {
                    healthy.add(discovery);
                }
            }
            for (int i = 0; i < Math.min(HEALTHY_DISPLAY_LIMIT, healthy.size()); i++) {
                w.printf("  [OK]: %s (%s)\n", healthy.get(i).getName(), healthy.get(i).getRegion());
            }
            if (healthy.size() > HEALTHY_DISPLAY_LIMIT) {
                w.printf("  ... and %d more\n", healthy.size() - HEALTHY_DISPLAY_LIMIT);
            }
            w.print("\n");
        }
        w.flush();
    }

    private static void discoverySection(PrintWriter w, String title, String tag, List<String> names,
                                         Map<String, BucketDiscovery> buckets, boolean withRecommendations) {
        if (names.isEmpty()) {
            return;
        }
        header(w, title, 70);
        for (String bucket : names) {
            BucketDiscovery discovery = buckets.get(bucket);
            w.printf("  [%s]: %s (%s)\n", tag, bucket, discovery.getRegion());
            w.printf("    Risk Score: %d\n", discovery.getRiskScore());
            list(w, "Factors", discovery.getRiskFactors());
            if (withRecommendations) {
                list(w, "Recommendations", discovery.getRecommendations());
            }
            w.print("\n");
        }
    }

    private static void bucketSection(PrintWriter w, String title, BucketStatus status, List<String> names,
                                      Map<String, BucketAnalysis> buckets) {
        if (names.isEmpty()) {
            return;
        }
        header(w, title, 50);
        for (String bucket : names) {
            w.printf("  [%s]: %s\n", status, bucket);
            message(w, buckets.get(bucket));
        }
        w.print("\n");
    }

    private static void pathSection(PrintWriter w, String title, BucketStatus status, List<String> paths) {
        if (paths.isEmpty()) {
            return;
        }
        header(w, title, 50);
        for (String path : paths) {
            w.printf("  [%s]: %s\n", status, path);
        }
        w.print("\n");
    }

    private static void header(PrintWriter w, String title, int width) {
        w.print(title + "\n");
        w.print("-".repeat(width) + "\n");
    }

    private static void count(PrintWriter w, String label, List<String> names) {
        if (!names.isEmpty()) {
            w.printf("%s: %d\n", label, names.size());
        }
    }

    private static void list(PrintWriter w, String label, List<String> items) {
        if (items == null || items.isEmpty()) {
            return;
        }
        w.printf("    %s:\n", label);
        for (String item : items) {
            w.printf("      - %s\n", item);
        }
    }

    private static void message(PrintWriter w, BucketAnalysis analysis) {
        if (analysis != null && notEmpty(analysis.getMessage())) {
            w.printf("    %s\n", analysis.getMessage());
        }
    }

    private static boolean notEmpty(String value) {
        return value != null && !value.isEmpty();
    }
}
