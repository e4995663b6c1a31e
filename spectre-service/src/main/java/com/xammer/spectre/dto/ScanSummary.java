package com.xammer.spectre.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ScanSummary {
    private int totalBuckets;
    private int okBuckets;
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    private List<String> missingBuckets = new ArrayList<>();
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    private List<String> unusedBuckets = new ArrayList<>();
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    private List<String> missingPrefixes = new ArrayList<>();
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    private List<String> stalePrefixes = new ArrayList<>();
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    private List<String> versionSprawl = new ArrayList<>();
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    private List<String> lifecycleMisconfig = new ArrayList<>();

    public int findingCount() {
        return missingBuckets.size() + unusedBuckets.size() + missingPrefixes.size()
                + stalePrefixes.size() + versionSprawl.size() + lifecycleMisconfig.size();
    }
}
