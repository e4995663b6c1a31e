package com.xammer.spectre.command;

import com.xammer.spectre.config.AwsSettings;
import com.xammer.spectre.config.RepoConfig;
import com.xammer.spectre.config.RepoConfigLoader;
import com.xammer.spectre.config.SpectreProperties;
import com.xammer.spectre.dto.BucketMetadata;
import com.xammer.spectre.dto.Reference;
import com.xammer.spectre.dto.ScanReport;
import com.xammer.spectre.dto.ScanResult;
import com.xammer.spectre.dto.ScanSummary;
import com.xammer.spectre.dto.ScanThresholds;
import com.xammer.spectre.report.ReportWriter;
import com.xammer.spectre.report.ReportWriterFactory;
import com.xammer.spectre.scanner.RepoScanner;
import com.xammer.spectre.service.AuditSession;
import com.xammer.spectre.service.AuditSessionFactory;
import com.xammer.spectre.service.BaselineService;
import com.xammer.spectre.service.DriftAnalyzer;
import com.xammer.spectre.service.InspectionOptions;
import com.xammer.spectre.util.CancellationToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * {@code scan}: references in a repository checked against live bucket state.
 */
@Component
public class ScanCommand extends AuditCommand {

    private static final Logger logger = LoggerFactory.getLogger(ScanCommand.class);

    private final RepoScanner repoScanner;
    private final DriftAnalyzer driftAnalyzer;

    public ScanCommand(RepoScanner repoScanner, DriftAnalyzer driftAnalyzer, RepoConfigLoader repoConfigLoader,
                       AuditSessionFactory sessionFactory, ReportWriterFactory reportWriterFactory,
                       BaselineService baselineService, SpectreProperties properties, AwsSettings awsSettings,
                       Clock clock) {
        super(repoConfigLoader, sessionFactory, reportWriterFactory, baselineService, properties, awsSettings, clock);
        this.repoScanner = repoScanner;
        this.driftAnalyzer = driftAnalyzer;
    }

    @Override
    public String name() {
        return "scan";
    }

    @Override
    public void execute(CommandOptions options) {
        Instant start = clock.instant();
        String repo = options.string("repo", ".");
        Path repoPath = Path.of(repo);
        int concurrency = concurrency(options);
        RepoConfig repoConfig = repoConfigLoader.load(repoPath);

        ReportWriter writer = reportWriter(format(options, repoConfig));
        ScanThresholds thresholds = thresholds(options, repoConfig);
        CancellationToken token = cancellationToken(options, repoConfig);

        logger.info("Scanning repository: {}", repo);
        List<Reference> references = stage("repository scan", concurrency, () -> repoScanner.scan(repoPath));
        references = applyExclusions(references, repoConfig);
        logger.info("Found {} S3 references in code", references.size());

        try (AuditSession session = stage("S3 client initialization", concurrency,
                () -> openSession(options, repoConfig))) {
            InspectionOptions inspection = new InspectionOptions(
                    regionSelection(options, session), concurrency, false, false,
                    Set.copyOf(repoConfig.getExcludeBuckets()), token, progressListener(options, "Scan"));

            List<Reference> inspected = references;
            Map<String, BucketMetadata> metadata = stage("S3 inspection", concurrency,
                    () -> session.getInspector().inspect(inspected, inspection));
            logger.info("Inspected {} buckets", metadata.size());

            ScanResult result = driftAnalyzer.analyze(references, metadata, thresholds);
            ScanReport report = ScanReport.builder()
                    .tool("s3spectre")
                    .version(properties.getVersion())
                    .timestamp(clock.instant())
                    .config(new ScanReport.ScanReportConfig(repo, options.string("aws-profile", ""),
                            session.getDefaultRegion(), thresholds.staleDays()))
                    .summary(result.getSummary())
                    .buckets(result.getBuckets())
                    .references(options.flag("include-references", false) ? references : new ArrayList<>())
                    .build();

            String output = options.string("output", null);
            writeReport(output, concurrency, w -> writer.writeScan(report, w));
            compareBaseline(options, concurrency, baselineService.flatten(report), baselineService::loadScanBaseline);
            updateBaseline(options, concurrency, w -> reportWriter("json").writeScan(report, w));

            ScanSummary summary = result.getSummary();
            logger.info("Scan complete: bucket_count={}, prefix_count={}, finding_count={}, duration={}ms",
                    summary.getTotalBuckets(), prefixCount(references), summary.findingCount(),
                    Duration.between(start, clock.instant()).toMillis());

            gate(options.flag("fail-on-missing", false), summary.getMissingBuckets().size(),
                    "found %d missing buckets");
            gate(options.flag("fail-on-stale", false), summary.getStalePrefixes().size(),
                    "found %d stale prefixes");
            gate(options.flag("fail-on-version-sprawl", false), summary.getVersionSprawl().size(),
                    "found %d buckets with version sprawl");
            gate(options.flag("fail-on-unused", false), summary.getUnusedBuckets().size(),
                    "found %d unused buckets");
        }
    }

    ScanThresholds thresholds(CommandOptions options, RepoConfig repoConfig) {
        SpectreProperties.Scan scan = properties.getScan();
        int staleDefault = repoConfig.getStaleDays() > 0 ? repoConfig.getStaleDays() : scan.getStaleDays();
        return new ScanThresholds(
                options.integer("stale-days", staleDefault),
                options.integer("unused-threshold-days", scan.getUnusedThresholdDays()),
                options.flag("check-unused", scan.isCheckUnused()),
                options.integer("unused-score-threshold", scan.getUnusedScoreThreshold()));
    }

    /** Drops references to excluded buckets and to prefixes under an excluded prefix. */
    static List<Reference> applyExclusions(List<Reference> references, RepoConfig repoConfig) {
        Set<String> buckets = new HashSet<>(repoConfig.getExcludeBuckets());
        List<String> prefixes = repoConfig.getExcludePrefixes();
        if (buckets.isEmpty() && prefixes.isEmpty()) {
            return references;
        }
        List<Reference> kept = new ArrayList<>();
        for (Reference reference : references) {
            if (buckets.contains(reference.bucket())) {
                continue;
            }
            if (reference.hasPrefix() && prefixes.stream().anyMatch(p -> reference.prefix().startsWith(p))) {
                continue;
            }
            kept.add(reference);
        }
        logger.debug("Exclusions dropped {} reference(s)", references.size() - kept.size());
        return kept;
    }

    private static int prefixCount(List<Reference> references) {
        Set<String> prefixes = new HashSet<>();
        for (Reference reference : references) {
            if (reference.hasPrefix()) {
                prefixes.add(reference.bucket() + "/" + reference.prefix());
            }
        }
        return prefixes.size();
    }
}
