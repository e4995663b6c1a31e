package com.xammer.spectre.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Discovery-mode verdict for a single bucket: additive risk score plus the factors behind it.
 */
@Data
@NoArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class BucketDiscovery {
    private String name;
    private String region;
    private BucketStatus status;
    private int riskScore;
    private List<String> riskFactors = new ArrayList<>();
    private List<String> recommendations = new ArrayList<>();
    @JsonInclude(JsonInclude.Include.NON_NULL)
    private BucketMetadata bucketInfo;
}
