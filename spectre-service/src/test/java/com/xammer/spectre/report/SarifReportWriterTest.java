package com.xammer.spectre.report;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.xammer.spectre.dto.BucketDiscovery;
import com.xammer.spectre.dto.BucketMetadata;
import com.xammer.spectre.dto.BucketStatus;
import com.xammer.spectre.dto.DiscoveryReport;
import com.xammer.spectre.dto.ScanReport;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.StringWriter;

import static org.junit.jupiter.api.Assertions.*;

class SarifReportWriterTest {

    private final ObjectMapper objectMapper = ReportFixtures.objectMapper();
    private final SarifReportWriter writer = new SarifReportWriter(objectMapper);

    @Test
    void writeScan_emitsRulesAndCodeLocations() throws IOException {
        StringWriter out = new StringWriter();
        writer.writeScan(ReportFixtures.scanReport(), out);

        JsonNode log = objectMapper.readTree(out.toString());
        assertEquals("2.1.0", log.get("version").asText());
        assertEquals(SarifReportWriter.SCHEMA, log.get("$schema").asText());

        JsonNode run = log.get("runs").get(0);
        assertEquals("s3spectre", run.at("/tool/driver/name").asText());
        assertEquals("0.3.0", run.at("/tool/driver/version").asText());
        JsonNode rules = run.at("/tool/driver/rules");
        assertEquals(2, rules.size());
        assertEquals("s3spectre/MISSING_BUCKET", rules.get(0).get("id").asText());
        assertEquals("s3spectre/STALE_PREFIX", rules.get(1).get("id").asText());

        JsonNode results = run.get("results");
        assertEquals(2, results.size());

        JsonNode stale = results.get(0);
        assertEquals("s3spectre/STALE_PREFIX", stale.get("ruleId").asText());
        assertEquals("note", stale.get("level").asText());
        assertEquals("src/app.py", stale.at("/locations/0/physicalLocation/artifactLocation/uri").asText());
        assertEquals(20, stale.at("/locations/0/physicalLocation/region/startLine").asInt());

        JsonNode missing = results.get(1);
        assertEquals("s3spectre/MISSING_BUCKET", missing.get("ruleId").asText());
        assertEquals("warning", missing.get("level").asText());
        assertEquals("Bucket referenced in code but does not exist in AWS", missing.at("/message/text").asText());
        assertEquals(2, missing.get("locations").size());
        assertEquals("infra/main.tf", missing.at("/locations/0/physicalLocation/artifactLocation/uri").asText());
        assertEquals("src/app.py", missing.at("/locations/1/physicalLocation/artifactLocation/uri").asText());
    }

    @Test
    void writeScan_withoutReferences_fallsBackToS3Uri() throws IOException {
        ScanReport report = ReportFixtures.scanReport();
        report.getReferences().clear();
        StringWriter out = new StringWriter();

        writer.writeScan(report, out);

        JsonNode results = objectMapper.readTree(out.toString()).at("/runs/0/results");
        assertEquals("s3://data-bucket/old/",
                results.at("/0/locations/0/physicalLocation/artifactLocation/uri").asText());
        assertEquals("s3://ghost-bucket",
                results.at("/1/locations/0/physicalLocation/artifactLocation/uri").asText());
        assertTrue(results.at("/1/locations/0/physicalLocation/region").isMissingNode());
    }

    @Test
    void writeDiscovery_addsPublicAndEncryptionResultsWhenChecksEnabled() throws IOException {
        StringWriter out = new StringWriter();
        writer.writeDiscovery(ReportFixtures.discoveryReport(), out);

        JsonNode results = objectMapper.readTree(out.toString()).at("/runs/0/results");
        assertEquals(4, results.size());
        assertEquals("s3spectre/VERSION_SPRAWL", results.get(0).get("ruleId").asText());
        assertEquals("s3spectre/RISKY_BUCKET", results.get(1).get("ruleId").asText());
        assertEquals("Bucket risk score: 100. Factors: No encryption enabled; Public access enabled",
                results.get(1).at("/message/text").asText());
        assertEquals("s3spectre/PUBLIC_BUCKET", results.get(2).get("ruleId").asText());
        assertEquals("error", results.get(2).get("level").asText());
        assertEquals("s3spectre/NO_ENCRYPTION", results.get(3).get("ruleId").asText());
        assertEquals("s3://public-site", results.get(3).at("/locations/0/physicalLocation/artifactLocation/uri").asText());
    }

    @Test
    void writeDiscovery_checksDisabled_skipsPostureResults() throws IOException {
        DiscoveryReport report = ReportFixtures.discoveryReport();
        report.getConfig().setCheckEncryption(false);
        report.getConfig().setCheckPublicAccess(false);
        StringWriter out = new StringWriter();

        writer.writeDiscovery(report, out);

        JsonNode results = objectMapper.readTree(out.toString()).at("/runs/0/results");
        assertEquals(2, results.size());
    }

    @Test
    void writeDiscovery_noFindings_omitsResultsAndRules() throws IOException {
        DiscoveryReport report = ReportFixtures.discoveryReport();
        report.getBuckets().remove("public-site");
        report.getBuckets().remove("archive");
        StringWriter out = new StringWriter();

        writer.writeDiscovery(report, out);

        JsonNode run = objectMapper.readTree(out.toString()).at("/runs/0");
        assertTrue(run.path("results").isMissingNode());
        assertTrue(run.at("/tool/driver/rules").isMissingNode());
    }

    @Test
    void s3Uri_stripsLeadingSlashFromPrefix() {
        assertEquals("s3://bucket", SarifReportWriter.s3Uri("bucket", ""));
        assertEquals("s3://bucket/logs/", SarifReportWriter.s3Uri("bucket", "/logs/"));
    }

    @Test
    void statusMessage_inactiveBucketUsesDaysSinceActivity() {
        BucketDiscovery discovery = new BucketDiscovery();
        discovery.setName("cold");
        discovery.setStatus(BucketStatus.INACTIVE);
        discovery.setRiskScore(30);
        discovery.setBucketInfo(new BucketMetadata("cold"));
        discovery.getBucketInfo().setDaysSinceActivity(400);

        assertEquals("No activity for 400 days", SarifReportWriter.statusMessage(discovery, "Bucket has been inactive"));
    }
}
