package com.xammer.spectre.report;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.xammer.spectre.dto.BucketAnalysis;
import com.xammer.spectre.dto.BucketDiscovery;
import com.xammer.spectre.dto.BucketStatus;
import com.xammer.spectre.dto.DiscoveryReport;
import com.xammer.spectre.dto.PrefixAnalysis;
import com.xammer.spectre.dto.ScanReport;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * {@code spectre/v1} envelope consumed by the Spectre aggregation hub.
 */
@Component
public class SpectreHubReportWriter implements ReportWriter {

    static final String SCHEMA = "spectre/v1";

    private static final DateTimeFormatter TIMESTAMP =
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss'Z'").withZone(ZoneOffset.UTC);

    private final ObjectMapper objectMapper;

    public SpectreHubReportWriter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public String format() {
        return "spectrehub";
    }

    @Override
    public void writeScan(ScanReport report, Writer out) throws IOException {
        ScanReport.ScanReportConfig config = report.getConfig();
        String region = config == null ? "" : nullToEmpty(config.getAwsRegion());
        String profile = config == null ? "" : nullToEmpty(config.getAwsProfile());
        Envelope envelope = envelope(report.getVersion(), report.getTimestamp(), hashTarget(region, profile));

        for (BucketAnalysis bucket : report.getBuckets().values()) {
            if (bucket.getStatus() != BucketStatus.OK) {
                envelope.add(new Finding(bucket.getStatus().name(), scanSeverity(bucket.getStatus()),
                        bucket.getName(), bucket.getMessage(), null));
            }
            // prefix findings are reported even when the bucket itself is fine
            for (PrefixAnalysis prefix : bucket.getPrefixes()) {
                if (prefix.getStatus() == BucketStatus.OK) {
                    continue;
                }
                envelope.add(new Finding(prefix.getStatus().name(), scanSeverity(prefix.getStatus()),
                        bucket.getName() + "/" + prefix.getPrefix(), prefix.getMessage(), null));
            }
        }
        write(envelope, out);
    }

    @Override
    public void writeDiscovery(DiscoveryReport report, Writer out) throws IOException {
        String profile = report.getConfig() == null ? "" : nullToEmpty(report.getConfig().getAwsProfile());
        Envelope envelope = envelope(report.getVersion(), report.getTimestamp(), hashTarget("", profile));

        for (BucketDiscovery bucket : report.getBuckets().values()) {
            if (bucket.getStatus() == BucketStatus.OK) {
                continue;
            }
            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put("risk_score", bucket.getRiskScore());
            metadata.put("region", bucket.getRegion());
            metadata.put("recommendations", bucket.getRecommendations());
            String severity = discoverySeverity(bucket.getStatus(), bucket.getRiskScore());
            envelope.add(new Finding(bucket.getStatus().name(), severity, bucket.getName(),
                    String.format("risk score %d: [%s]", bucket.getRiskScore(), String.join(" ", bucket.getRiskFactors())),
                    metadata));
        }
        write(envelope, out);
    }

    /** {@code sha256:<hex>} of {@code region:profile}, so the target is identifiable without naming it. */
    static String hashTarget(String region, String profile) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest((region + ":" + profile).getBytes(StandardCharsets.UTF_8));
            return "sha256:" + HexFormat.of().formatHex(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    static String scanSeverity(BucketStatus status) {
        switch (status) {
            case MISSING_BUCKET:
                return "high";
            case UNUSED_BUCKET:
            case LIFECYCLE_MISCONFIG:
            case MISSING_PREFIX:
            case VERSION_SPRAWL:
                return "medium";
            case STALE_PREFIX:
                return "low";
            default:
                return "info";
        }
    }

    static String discoverySeverity(BucketStatus status, int riskScore) {
        switch (status) {
            case RISKY:
                return riskScore >= 80 ? "high" : "medium";
            case UNUSED_BUCKET:
                return "medium";
            case INACTIVE:
            case VERSION_SPRAWL:
                return "low";
            default:
                return "info";
        }
    }

    private static Envelope envelope(String version, Instant timestamp, String targetHash) {
        Instant at = timestamp == null ? Instant.EPOCH : timestamp.truncatedTo(ChronoUnit.SECONDS);
        return new Envelope(SCHEMA, "s3spectre", version, TIMESTAMP.format(at), new Target("s3", targetHash),
                new ArrayList<>(), new Summary());
    }

    private void write(Envelope envelope, Writer out) throws IOException {
        envelope.summary().total = envelope.findings().size();
        objectMapper.writerWithDefaultPrettyPrinter()
                .without(JsonGenerator.Feature.AUTO_CLOSE_TARGET)
                .writeValue(out, envelope);
        out.write("\n");
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }

    record Envelope(
            @JsonProperty("schema") String schema,
            @JsonProperty("tool") String tool,
            @JsonProperty("version") String version,
            @JsonProperty("timestamp") String timestamp,
            @JsonProperty("target") Target target,
            @JsonProperty("findings") List<Finding> findings,
            @JsonProperty("summary") Summary summary) {

        void add(Finding finding) {
            findings.add(finding);
            summary.count(finding.severity());
        }
    }

    record Target(@JsonProperty("type") String type, @JsonProperty("uri_hash") String uriHash) {
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record Finding(
            @JsonProperty("id") String id,
            @JsonProperty("severity") String severity,
            @JsonProperty("location") String location,
            @JsonProperty("message") String message,
            @JsonProperty("metadata") Map<String, Object> metadata) {
    }

    static final class Summary {
        @JsonProperty("total")
        int total;
        @JsonProperty("high")
        int high;
        @JsonProperty("medium")
        int medium;
        @JsonProperty("low")
        int low;
        @JsonProperty("info")
        int info;

        void count(String severity) {
            switch (severity) {
                case "high":
                    high++;
                    break;
                case "medium":
                    medium++;
                    break;
                case "low":
                    low++;
                    break;
                default:
                    info++;
                    break;
            }
        }
    }
}
