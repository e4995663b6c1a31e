package com.xammer.spectre.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class PrefixMetadata {
    private String prefix;
    private boolean exists;
    private int objectCount;
    private Instant latestModified;
    private int daysSinceModified;

    public static PrefixMetadata absent(String prefix) {
        return new PrefixMetadata(prefix, false, 0, null, 0);
    }
}
