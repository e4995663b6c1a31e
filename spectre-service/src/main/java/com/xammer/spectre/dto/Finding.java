package com.xammer.spectre.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Flattened, comparable issue used for baseline diffs. Two findings are equal when
 * type, bucket and prefix all match.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record Finding(
        @JsonProperty("type") String type,
        @JsonProperty("bucket") String bucket,
        @JsonProperty("prefix") String prefix
) {

    public Finding {
        prefix = prefix == null ? "" : prefix;
    }

    public static Finding bucket(BucketStatus status, String bucket) {
        return new Finding(status.name(), bucket, "");
    }

    public static Finding prefix(BucketStatus status, String bucket, String prefix) {
        return new Finding(status.name(), bucket, prefix);
    }
}
