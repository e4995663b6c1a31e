package com.xammer.spectre.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Live state of one bucket as collected by the inspector.
 * <br>
 * Written only by the worker that inspects the bucket; treated as read-only once it is
 * handed to an analyzer. Soft collection failures accumulate in {@link #error}.
 */
@Data
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class BucketMetadata {
    private String name;
    private boolean exists;
    private String region;
    private Instant creationDate;
    private Instant lastActivity;
    private int daysSinceActivity;
    private int ageInDays;
    private boolean versioningEnabled;
    private int lifecycleRules;
    private List<PrefixMetadata> prefixes = new ArrayList<>();
    private Map<String, String> tags = new HashMap<>();
    @JsonProperty("is_empty")
    private boolean empty;
    private int objectCount;
    private long totalSize;
    private long totalVersionSize;
    private int versionCount;
    private EncryptionState encryption;
    private PublicAccessState publicAccess;
    private String error;

    public BucketMetadata(String name) {
        this.name = name;
    }

    public static BucketMetadata missing(String name, String error) {
        BucketMetadata metadata = new BucketMetadata(name);
        metadata.setExists(false);
        metadata.setError(error);
        return metadata;
    }

    /** Records a soft failure without discarding earlier ones. */
    public void appendError(String diagnostic) {
        if (diagnostic == null || diagnostic.isEmpty()) {
            return;
        }
        this.error = (error == null || error.isEmpty()) ? diagnostic : error + "; " + diagnostic;
    }
}
