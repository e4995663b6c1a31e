package com.xammer.spectre.command;

import com.xammer.spectre.config.AwsSettings;
import com.xammer.spectre.config.RepoConfig;
import com.xammer.spectre.config.RepoConfigLoader;
import com.xammer.spectre.config.SpectreProperties;
import com.xammer.spectre.dto.BucketMetadata;
import com.xammer.spectre.dto.DiscoveryReport;
import com.xammer.spectre.dto.DiscoveryResult;
import com.xammer.spectre.dto.DiscoverySummary;
import com.xammer.spectre.dto.DiscoveryThresholds;
import com.xammer.spectre.report.ReportWriter;
import com.xammer.spectre.report.ReportWriterFactory;
import com.xammer.spectre.service.AuditSession;
import com.xammer.spectre.service.AuditSessionFactory;
import com.xammer.spectre.service.BaselineService;
import com.xammer.spectre.service.DiscoveryAnalyzer;
import com.xammer.spectre.service.InspectionOptions;
import com.xammer.spectre.util.CancellationToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Set;

/**
 * {@code discover}: every bucket in the account, scored without looking at code.
 */
@Component
public class DiscoverCommand extends AuditCommand {

    private static final Logger logger = LoggerFactory.getLogger(DiscoverCommand.class);

    private final DiscoveryAnalyzer discoveryAnalyzer;

    public DiscoverCommand(DiscoveryAnalyzer discoveryAnalyzer, RepoConfigLoader repoConfigLoader,
                           AuditSessionFactory sessionFactory, ReportWriterFactory reportWriterFactory,
                           BaselineService baselineService, SpectreProperties properties, AwsSettings awsSettings,
                           Clock clock) {
        super(repoConfigLoader, sessionFactory, reportWriterFactory, baselineService, properties, awsSettings, clock);
        this.discoveryAnalyzer = discoveryAnalyzer;
    }

    @Override
    public String name() {
        return "discover";
    }

    @Override
    public void execute(CommandOptions options) {
        Instant start = clock.instant();
        int concurrency = concurrency(options);
        RepoConfig repoConfig = repoConfigLoader.load(Path.of(""));

        ReportWriter writer = reportWriter(format(options, repoConfig));
        DiscoveryThresholds thresholds = thresholds(options);
        CancellationToken token = cancellationToken(options, repoConfig);

        try (AuditSession session = stage("S3 client initialization", concurrency,
                () -> openSession(options, repoConfig))) {
            InspectionOptions inspection = new InspectionOptions(
                    regionSelection(options, session), concurrency,
                    thresholds.checkEncryption(), thresholds.checkPublicAccess(),
                    Set.copyOf(repoConfig.getExcludeBuckets()), token, progressListener(options, "Discovery"));

            logger.info("Discovering S3 buckets...");
            Map<String, BucketMetadata> metadata = stage("bucket discovery", concurrency,
                    () -> session.getInspector().discoverAll(inspection));
            logger.info("Discovered {} buckets", metadata.size());

            DiscoveryResult result = discoveryAnalyzer.analyze(metadata, thresholds);
            DiscoveryReport.DiscoveryReportConfig config = new DiscoveryReport.DiscoveryReportConfig(
                    options.string("aws-profile", ""),
                    inspection.regionSelection().allRegions(),
                    inspection.regionSelection().regions(),
                    thresholds.ageThresholdDays(),
                    thresholds.inactivityThresholdDays(),
                    thresholds.checkEncryption(),
                    thresholds.checkPublicAccess());
            DiscoveryReport report = DiscoveryReport.builder()
                    .tool("s3spectre")
                    .version(properties.getVersion())
                    .timestamp(clock.instant())
                    .config(config)
                    .summary(result.getSummary())
                    .buckets(result.getBuckets())
                    .build();

            writeReport(options.string("output", null), concurrency, w -> writer.writeDiscovery(report, w));
            compareBaseline(options, concurrency, baselineService.flatten(report),
                    baselineService::loadDiscoveryBaseline);
            updateBaseline(options, concurrency, w -> reportWriter("json").writeDiscovery(report, w));

            DiscoverySummary summary = result.getSummary();
            int findingCount = summary.getUnusedBuckets().size() + summary.getRiskyBuckets().size()
                    + summary.getInactiveBuckets().size() + summary.getVersionSprawl().size();
            logger.info("Discovery complete: bucket_count={}, finding_count={}, duration={}ms",
                    summary.getTotalBuckets(), findingCount, Duration.between(start, clock.instant()).toMillis());

            gate(options.flag("fail-on-unused", false), summary.getUnusedBuckets().size(),
                    "found %d unused buckets");
            gate(options.flag("fail-on-risky", false), summary.getRiskyBuckets().size(),
                    "found %d risky buckets");
        }
    }

    DiscoveryThresholds thresholds(CommandOptions options) {
        SpectreProperties.Discovery discovery = properties.getDiscovery();
        return new DiscoveryThresholds(
                options.integer("age-threshold-days", discovery.getAgeThresholdDays()),
                options.integer("inactive-days", discovery.getInactiveDays()),
                options.flag("check-encryption", discovery.isCheckEncryption()),
                options.flag("check-public", discovery.isCheckPublic()),
                options.integer("risk-score-threshold", discovery.getRiskScoreThreshold()));
    }
}
