package com.xammer.spectre.config;

import com.fasterxml.jackson.annotation.JsonSetter;
import com.fasterxml.jackson.annotation.Nulls;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Contents of {@code .s3spectre.yaml}. Unset fields keep their zero value and do not override anything.
 */
@Data
@NoArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class RepoConfig {
    private String region;
    @JsonSetter(nulls = Nulls.AS_EMPTY)
    private List<String> excludeBuckets = new ArrayList<>();
    @JsonSetter(nulls = Nulls.AS_EMPTY)
    private List<String> excludePrefixes = new ArrayList<>();
    private int staleDays;
    private String format;
    private String timeout;
}
