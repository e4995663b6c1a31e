package com.xammer.spectre.service;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.xammer.spectre.dto.BaselineDiff;
import com.xammer.spectre.dto.BucketAnalysis;
import com.xammer.spectre.dto.BucketDiscovery;
import com.xammer.spectre.dto.BucketStatus;
import com.xammer.spectre.dto.DiscoveryReport;
import com.xammer.spectre.dto.Finding;
import com.xammer.spectre.dto.PrefixAnalysis;
import com.xammer.spectre.dto.ScanReport;
import com.xammer.spectre.exception.BaselineException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.TreeMap;

import static org.junit.jupiter.api.Assertions.*;

class BaselineServiceTest {

    @TempDir
    Path dir;

    private final ObjectMapper mapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);

    private final BaselineService service = new BaselineService(mapper);

    private static BucketAnalysis analysis(String name, BucketStatus status, PrefixAnalysis... prefixes) {
        BucketAnalysis analysis = new BucketAnalysis();
        analysis.setName(name);
        analysis.setStatus(status);
        analysis.setPrefixes(List.of(prefixes));
        return analysis;
    }

    private static ScanReport scanReport() {
        TreeMap<String, BucketAnalysis> buckets = new TreeMap<>();
        buckets.put("ghost", analysis("ghost", BucketStatus.MISSING_BUCKET));
        buckets.put("data", analysis("data", BucketStatus.OK,
                PrefixAnalysis.builder().prefix("old/").status(BucketStatus.STALE_PREFIX).build(),
                PrefixAnalysis.builder().prefix("live/").status(BucketStatus.OK).build()));
        return ScanReport.builder()
                .tool("s3spectre")
                .version("test")
                .timestamp(Instant.parse("2026-01-01T00:00:00Z"))
                .buckets(buckets)
                .build();
    }

    @Test
    void flattenScan_keepsOnlyNonOkFindings() {
        List<Finding> findings = service.flatten(scanReport());

        assertEquals(List.of(
                new Finding("STALE_PREFIX", "data", "old/"),
                new Finding("MISSING_BUCKET", "ghost", "")), findings);
    }

    @Test
    void flattenDiscovery_bucketLevelOnly() {
        BucketDiscovery risky = new BucketDiscovery();
        risky.setName("site");
        risky.setStatus(BucketStatus.RISKY);
        BucketDiscovery healthy = new BucketDiscovery();
        healthy.setName("fine");
        healthy.setStatus(BucketStatus.OK);
        TreeMap<String, BucketDiscovery> buckets = new TreeMap<>();
        buckets.put("site", risky);
        buckets.put("fine", healthy);

        List<Finding> findings = service.flatten(DiscoveryReport.builder().buckets(buckets).build());

        assertEquals(List.of(new Finding("RISKY", "site", "")), findings);
    }

    @Test
    void diff_againstItself_isAllUnchanged() {
        List<Finding> findings = service.flatten(scanReport());

        BaselineDiff diff = service.diff(findings, findings);

        assertTrue(diff.added().isEmpty());
        assertTrue(diff.resolved().isEmpty());
        assertEquals(findings, diff.unchanged());
    }

    @Test
    void diff_splitsAddedResolvedUnchanged() {
        Finding a = new Finding("MISSING_BUCKET", "a", null);
        Finding b = new Finding("STALE_PREFIX", "b", "x/");
        Finding c = new Finding("UNUSED_BUCKET", "c", "");

        BaselineDiff diff = service.diff(List.of(a, b), List.of(b, c));

        assertEquals(List.of(a), diff.added());
        assertEquals(List.of(c), diff.resolved());
        assertEquals(List.of(b), diff.unchanged());
    }

    @Test
    void loadScanBaseline_readsPreviousJsonReport() throws IOException {
        Path file = dir.resolve("baseline.json");
        mapper.writeValue(file.toFile(), scanReport());

        List<Finding> baseline = service.loadScanBaseline(file);

        assertEquals(service.flatten(scanReport()), baseline);
    }

    @Test
    void loadScanBaseline_ignoresUnknownFields() throws IOException {
        Path file = dir.resolve("baseline.json");
        Files.writeString(file, "{\"tool\":\"s3spectre\",\"extra\":1,\"buckets\":{\"x\":"
                + "{\"name\":\"x\",\"status\":\"UNUSED_BUCKET\",\"new_field\":true}}}");

        assertEquals(List.of(new Finding("UNUSED_BUCKET", "x", "")), service.loadScanBaseline(file));
    }

    @Test
    void loadBaseline_missingFile_isBaselineError() {
        BaselineException ex = assertThrows(BaselineException.class,
                () -> service.loadDiscoveryBaseline(dir.resolve("absent.json")));

        assertTrue(ex.getMessage().startsWith("read baseline"));
    }

    @Test
    void loadBaseline_malformedJson_isBaselineError() throws IOException {
        Path file = dir.resolve("broken.json");
        Files.writeString(file, "{ not json");

        BaselineException ex = assertThrows(BaselineException.class, () -> service.loadScanBaseline(file));

        assertTrue(ex.getMessage().startsWith("parse baseline"));
    }
}
