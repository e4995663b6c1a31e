package com.xammer.spectre.report;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.StringWriter;

import static org.junit.jupiter.api.Assertions.*;

class TextReportWriterTest {

    private final TextReportWriter writer = new TextReportWriter();

    @Test
    void writeScan_listsFindingsBySection() throws IOException {
        StringWriter out = new StringWriter();

        writer.writeScan(ReportFixtures.scanReport(), out);

        String text = out.toString();
        assertTrue(text.startsWith("S3Spectre Report\n"));
        assertTrue(text.contains("Scan Time: 2026-02-03 04:05:06 UTC\n"));
        assertTrue(text.contains("Total Buckets Scanned: 2\n"));
        assertTrue(text.contains("Missing Buckets: 1\n"));
        assertTrue(text.contains("  [MISSING_BUCKET]: ghost-bucket\n"));
        assertTrue(text.contains("  [STALE_PREFIX]: data-bucket/old/\n"));
        assertTrue(text.contains("  [OK]: data-bucket\n"));
        assertFalse(text.contains("Unused Buckets"));
        assertFalse(text.contains("\r"));
    }

    @Test
    void writeDiscovery_truncatesHealthyListAndShowsVersionOverhead() throws IOException {
        StringWriter out = new StringWriter();

        writer.writeDiscovery(ReportFixtures.discoveryReport(), out);

        String text = out.toString();
        assertTrue(text.contains("Scanning: All enabled AWS regions\n"));
        assertTrue(text.contains("  [RISKY]: public-site (eu-west-1)\n"));
        assertTrue(text.contains("    Risk Score: 100\n"));
        assertTrue(text.contains("      - Public access enabled\n"));
        assertTrue(text.contains("  [VERSION_SPRAWL]: archive (us-east-1)\n"));
        assertTrue(text.contains("(12 versions)"));
        assertTrue(text.contains("Version Overhead: 3.00 KB (75.0% of total)"));
        assertTrue(text.contains("Healthy Buckets: 12\n"));
        assertTrue(text.contains("  [OK]: healthy-09 (us-east-1)\n"));
        assertFalse(text.contains("healthy-10"));
        assertTrue(text.contains("  ... and 2 more\n"));
    }

    @Test
    void writer_leavesTargetOpen() throws IOException {
        StringWriter out = new StringWriter();

        writer.writeScan(ReportFixtures.scanReport(), out);
        out.write("tail");

        assertTrue(out.toString().endsWith("tail"));
    }
}
