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

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class DiscoveryReport {
    private String tool;
    private String version;
    private Instant timestamp;
    private DiscoveryReportConfig config;
    @Builder.Default
    private DiscoverySummary summary = new DiscoverySummary();
    @Builder.Default
    private SortedMap<String, BucketDiscovery> buckets = new TreeMap<>();

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class DiscoveryReportConfig {
        @JsonInclude(JsonInclude.Include.NON_EMPTY)
        private String awsProfile;
        private boolean allRegions;
        @JsonInclude(JsonInclude.Include.NON_EMPTY)
        private List<String> regions = new ArrayList<>();
        private int ageThresholdDays;
        private int inactivityThresholdDays;
        private boolean checkEncryption;
        private boolean checkPublicAccess;
    }
}
