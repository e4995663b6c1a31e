package com.xammer.spectre.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Everything a scan run reports. Also the document format read back as a baseline.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ScanReport {
    private String tool;
    private String version;
    private Instant timestamp;
    private ScanReportConfig config;
    @Builder.Default
    private ScanSummary summary = new ScanSummary();
    @Builder.Default
    private SortedMap<String, BucketAnalysis> buckets = new TreeMap<>();
    @Builder.Default
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    private List<Reference> references = new ArrayList<>();

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class ScanReportConfig {
        private String repoPath;
        @JsonInclude(JsonInclude.Include.NON_EMPTY)
        private String awsProfile;
        @JsonInclude(JsonInclude.Include.NON_EMPTY)
        private String awsRegion;
        private int staleThresholdDays;
    }
}
