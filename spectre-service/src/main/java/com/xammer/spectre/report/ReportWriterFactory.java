package com.xammer.spectre.report;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

@Component
public class ReportWriterFactory {

    private final Map<String, ReportWriter> writers = new TreeMap<>();

    public ReportWriterFactory(List<ReportWriter> writers) {
        for (ReportWriter writer : writers) {
            this.writers.put(writer.format(), writer);
        }
    }

    public ReportWriter get(String format) {
        String key = format == null ? "" : format.trim().toLowerCase(Locale.ROOT);
        ReportWriter writer = writers.get(key);
        if (writer == null) {
            throw new IllegalArgumentException("unsupported format: " + format
                    + " (supported: " + String.join(", ", writers.keySet()) + ")");
        }
        return writer;
    }

    public Set<String> supportedFormats() {
        return writers.keySet();
    }
}
