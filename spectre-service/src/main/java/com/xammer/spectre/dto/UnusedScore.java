package com.xammer.spectre.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class UnusedScore {
    private int total;
    private List<String> reasons = new ArrayList<>();
    @JsonProperty("is_unused")
    private boolean unused;
    private int notInCode;
    private int empty;
    private int deprecatedTag;
}
