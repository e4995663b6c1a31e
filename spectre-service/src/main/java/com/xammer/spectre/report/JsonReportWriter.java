package com.xammer.spectre.report;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.xammer.spectre.dto.DiscoveryReport;
import com.xammer.spectre.dto.ScanReport;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Writer;

@Component
public class JsonReportWriter implements ReportWriter {

    private final ObjectWriter writer;

    public JsonReportWriter(ObjectMapper objectMapper) {
        this.writer = objectMapper.writerWithDefaultPrettyPrinter()
                .without(JsonGenerator.Feature.AUTO_CLOSE_TARGET);
    }

    @Override
    public String format() {
        return "json";
    }

    @Override
    public void writeScan(ScanReport report, Writer out) throws IOException {
        writer.writeValue(out, report);
        out.write("\n");
    }

    @Override
    public void writeDiscovery(DiscoveryReport report, Writer out) throws IOException {
        writer.writeValue(out, report);
        out.write("\n");
    }
}
