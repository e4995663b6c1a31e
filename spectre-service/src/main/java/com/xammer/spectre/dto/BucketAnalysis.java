package com.xammer.spectre.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Scan-mode verdict for a single bucket.
 */
@Data
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class BucketAnalysis {
    private String name;
    private BucketStatus status;
    private String message;
    private boolean referencedInCode;
    private boolean existsInAws;
    private boolean versioningEnabled;
    private int lifecycleRules;
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    private List<PrefixAnalysis> prefixes = new ArrayList<>();
    private UnusedScore unusedScore;
}
