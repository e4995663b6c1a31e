package com.xammer.spectre.report;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.xammer.spectre.dto.BucketAnalysis;
import com.xammer.spectre.dto.BucketDiscovery;
import com.xammer.spectre.dto.BucketMetadata;
import com.xammer.spectre.dto.BucketStatus;
import com.xammer.spectre.dto.DiscoveryReport;
import com.xammer.spectre.dto.PrefixAnalysis;
import com.xammer.spectre.dto.Reference;
import com.xammer.spectre.dto.ScanReport;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Writer;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * SARIF 2.1.0 output for code-scanning dashboards. Scan findings point at the source lines
 * that reference the bucket; anything without a reference points at its {@code s3://} URI.
 */
@Component
public class SarifReportWriter implements ReportWriter {

    static final String SCHEMA = "https://json.schemastore.org/sarif-2.1.0.json";
    static final String VERSION = "2.1.0";

    static final String RULE_MISSING_BUCKET = "s3spectre/MISSING_BUCKET";
    static final String RULE_MISSING_PREFIX = "s3spectre/MISSING_PREFIX";
    static final String RULE_STALE_PREFIX = "s3spectre/STALE_PREFIX";
    static final String RULE_UNUSED_BUCKET = "s3spectre/UNUSED_BUCKET";
    static final String RULE_VERSION_SPRAWL = "s3spectre/VERSION_SPRAWL";
    static final String RULE_LIFECYCLE_GAP = "s3spectre/LIFECYCLE_GAP";
    static final String RULE_PUBLIC_BUCKET = "s3spectre/PUBLIC_BUCKET";
    static final String RULE_NO_ENCRYPTION = "s3spectre/NO_ENCRYPTION";
    static final String RULE_INACTIVE_BUCKET = "s3spectre/INACTIVE_BUCKET";
    static final String RULE_RISKY_BUCKET = "s3spectre/RISKY_BUCKET";

    private static final Map<String, RuleMeta> RULES = Map.of(
            RULE_MISSING_BUCKET, new RuleMeta("MissingBucket", "Bucket referenced in code but does not exist in AWS", "warning"),
            RULE_MISSING_PREFIX, new RuleMeta("MissingPrefix", "Prefix referenced in code but no objects were found", "warning"),
            RULE_STALE_PREFIX, new RuleMeta("StalePrefix", "Prefix has not been modified recently", "note"),
            RULE_UNUSED_BUCKET, new RuleMeta("UnusedBucket", "Bucket appears unused", "note"),
            RULE_VERSION_SPRAWL, new RuleMeta("VersionSprawl", "Versioning enabled without lifecycle rules", "note"),
            RULE_LIFECYCLE_GAP, new RuleMeta("LifecycleGap", "Lifecycle rules are missing for the bucket", "note"),
            RULE_PUBLIC_BUCKET, new RuleMeta("PublicBucket", "Bucket is publicly accessible", "error"),
            RULE_NO_ENCRYPTION, new RuleMeta("NoEncryption", "Bucket does not have default encryption enabled", "warning"),
            RULE_INACTIVE_BUCKET, new RuleMeta("InactiveBucket", "Bucket has been inactive for an extended period", "warning"),
            RULE_RISKY_BUCKET, new RuleMeta("RiskyBucket", "Bucket risk score exceeds the configured threshold", "warning")
    );

    private final ObjectMapper objectMapper;

    public SarifReportWriter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public String format() {
        return "sarif";
    }

    @Override
    public void writeScan(ScanReport report, Writer out) throws IOException {
        Map<String, List<Reference>> bucketRefs = new HashMap<>();
        Map<String, List<Reference>> prefixRefs = new HashMap<>();
        for (Reference reference : report.getReferences()) {
            bucketRefs.computeIfAbsent(reference.bucket(), b -> new ArrayList<>()).add(reference);
            if (reference.hasPrefix()) {
                prefixRefs.computeIfAbsent(reference.bucket() + "/" + reference.prefix(), k -> new ArrayList<>())
                        .add(reference);
            }
        }

        Results results = new Results();
        for (BucketAnalysis analysis : report.getBuckets().values()) {
            String bucket = analysis.getName();
            ArrayNode locations = locations(bucketRefs.get(bucket), s3Uri(bucket, null));
            switch (analysis.getStatus()) {
                case MISSING_BUCKET:
                    results.add(RULE_MISSING_BUCKET, analysis.getMessage(), locations);
                    break;
                case UNUSED_BUCKET:
                    results.add(RULE_UNUSED_BUCKET, analysis.getMessage(), locations);
                    break;
                case VERSION_SPRAWL:
                    results.add(RULE_VERSION_SPRAWL, analysis.getMessage(), locations);
                    break;
                case LIFECYCLE_MISCONFIG:
                    results.add(RULE_LIFECYCLE_GAP, analysis.getMessage(), locations);
                    break;
                default:
                    break;
            }

            List<PrefixAnalysis> prefixes = new ArrayList<>(analysis.getPrefixes());
            prefixes.sort(Comparator.comparing(PrefixAnalysis::getPrefix));
            for (PrefixAnalysis prefix : prefixes) {
                String rule;
                switch (prefix.getStatus()) {
                    case MISSING_PREFIX:
                        rule = RULE_MISSING_PREFIX;
                        break;
                    case STALE_PREFIX:
                        rule = RULE_STALE_PREFIX;
                        break;
                    default:
                        continue;
                }
                results.add(rule, prefix.getMessage(), locations(prefixRefs.get(bucket + "/" + prefix.getPrefix()),
                        s3Uri(bucket, prefix.getPrefix())));
            }
        }
        write(out, report.getTool(), report.getVersion(), results);
    }

    @Override
    public void writeDiscovery(DiscoveryReport report, Writer out) throws IOException {
        DiscoveryReport.DiscoveryReportConfig config = report.getConfig();
        boolean checkPublic = config != null && config.isCheckPublicAccess();
        boolean checkEncryption = config != null && config.isCheckEncryption();

        Results results = new Results();
        for (BucketDiscovery discovery : report.getBuckets().values()) {
            String uri = s3Uri(discovery.getName(), null);
            switch (discovery.getStatus()) {
                case UNUSED_BUCKET:
                    results.add(RULE_UNUSED_BUCKET, statusMessage(discovery, "Bucket appears unused"), locations(null, uri));
                    break;
                case RISKY:
                    results.add(RULE_RISKY_BUCKET, statusMessage(discovery, "Bucket risk score exceeds the threshold"),
                            locations(null, uri));
                    break;
                case INACTIVE:
                    results.add(RULE_INACTIVE_BUCKET, statusMessage(discovery, "Bucket has been inactive"),
                            locations(null, uri));
                    break;
                case VERSION_SPRAWL:
                    results.add(RULE_VERSION_SPRAWL,
                            statusMessage(discovery, "Versioning enabled without lifecycle rules"), locations(null, uri));
                    break;
                default:
                    break;
            }
            BucketMetadata info = discovery.getBucketInfo();
            if (checkPublic && info != null && info.getPublicAccess() != null
                    && info.getPublicAccess().isPubliclyAccessible()) {
                results.add(RULE_PUBLIC_BUCKET, null, locations(null, uri));
            }
            if (checkEncryption && info != null && info.getEncryption() != null && !info.getEncryption().isEnabled()) {
                results.add(RULE_NO_ENCRYPTION, null, locations(null, uri));
            }
        }
        write(out, report.getTool(), report.getVersion(), results);
    }

    static String statusMessage(BucketDiscovery discovery, String base) {
        String message = base;
        if (discovery.getRiskScore() > 0) {
            switch (discovery.getStatus()) {
                case RISKY:
                    message = String.format("Bucket risk score: %d", discovery.getRiskScore());
                    break;
                case UNUSED_BUCKET:
                    message = String.format("Bucket appears unused (risk score: %d)", discovery.getRiskScore());
                    break;
                case INACTIVE:
                    message = String.format("Bucket inactive (risk score: %d)", discovery.getRiskScore());
                    break;
                case VERSION_SPRAWL:
                    message = String.format("Versioning enabled without lifecycle rules (risk score: %d)",
                            discovery.getRiskScore());
                    break;
                default:
                    break;
            }
        }
        BucketMetadata info = discovery.getBucketInfo();
        if (info != null && discovery.getStatus() == BucketStatus.INACTIVE
                && info.getDaysSinceActivity() > 0) {
            message = String.format("No activity for %d days", info.getDaysSinceActivity());
        }
        if (!discovery.getRiskFactors().isEmpty()) {
            message = message + ". Factors: " + String.join("; ", discovery.getRiskFactors());
        }
        return message;
    }

    private void write(Writer out, String tool, String version, Results results) throws IOException {
        ObjectNode log = objectMapper.createObjectNode();
        log.put("$schema", SCHEMA);
        log.put("version", VERSION);
        ObjectNode run = log.putArray("runs").addObject();
        ObjectNode driver = run.putObject("tool").putObject("driver");
        driver.put("name", tool == null ? "s3spectre" : tool);
        if (version != null && !version.isEmpty()) {
            driver.put("version", version);
        }
        if (!results.usedRules.isEmpty()) {
            ArrayNode rules = driver.putArray("rules");
            for (String id : results.usedRules) {
                RuleMeta meta = RULES.get(id);
                ObjectNode rule = rules.addObject();
                rule.put("id", id);
                rule.put("name", meta.name());
                rule.putObject("shortDescription").put("text", meta.description());
            }
        }
        if (!results.entries.isEmpty()) {
            run.set("results", results.entries);
        }
        objectMapper.writerWithDefaultPrettyPrinter()
                .without(JsonGenerator.Feature.AUTO_CLOSE_TARGET)
                .writeValue(out, log);
        out.write("\n");
    }

    private ArrayNode locations(List<Reference> references, String fallbackUri) {
        ArrayNode locations = objectMapper.createArrayNode();
        Map<String, Set<Integer>> byFile = new TreeMap<>();
        if (references != null) {
            for (Reference reference : references) {
                if (reference.file() != null && !reference.file().isEmpty()) {
                    byFile.computeIfAbsent(reference.file(), f -> new LinkedHashSet<>()).add(reference.line());
                }
            }
        }
        for (Map.Entry<String, Set<Integer>> file : byFile.entrySet()) {
            file.getValue().stream().sorted().forEach(line -> {
                ObjectNode physical = locations.addObject().putObject("physicalLocation");
                physical.putObject("artifactLocation").put("uri", file.getKey());
                if (line > 0) {
                    physical.putObject("region").put("startLine", line);
                }
            });
        }
        if (locations.isEmpty() && fallbackUri != null) {
            locations.addObject().putObject("physicalLocation").putObject("artifactLocation").put("uri", fallbackUri);
        }
        return locations;
    }

    static String s3Uri(String bucket, String prefix) {
        if (prefix == null || prefix.isEmpty()) {
            return "s3://" + bucket;
        }
        return "s3://" + bucket + "/" + (prefix.startsWith("/") ? prefix.substring(1) : prefix);
    }

    private record RuleMeta(String name, String description, String level) {
    }

    private final class Results {
        private final ArrayNode entries = objectMapper.createArrayNode();
        private final Set<String> usedRules = new TreeSet<>();

        void add(String ruleId, String message, ArrayNode locations) {
            RuleMeta meta = RULES.get(ruleId);
            usedRules.add(ruleId);
            ObjectNode result = entries.addObject();
            result.put("ruleId", ruleId);
            result.put("level", meta.level());
            result.putObject("message").put("text",
                    message == null || message.isEmpty() ? meta.description() : message);
            if (!locations.isEmpty()) {
                result.set("locations", locations);
            }
        }
    }
}
