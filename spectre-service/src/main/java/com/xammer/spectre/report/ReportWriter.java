package com.xammer.spectre.report;

import com.xammer.spectre.dto.DiscoveryReport;
import com.xammer.spectre.dto.ScanReport;

import java.io.IOException;
import java.io.Writer;

/**
 * Renders reports in one output format. Implementations never close the writer.
 */
public interface ReportWriter {

    /** Name used on the command line, e.g. {@code sarif}. */
    String format();

    void writeScan(ScanReport report, Writer out) throws IOException;

    void writeDiscovery(DiscoveryReport report, Writer out) throws IOException;
}
