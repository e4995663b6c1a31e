package com.xammer.spectre.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A bucket (and optionally prefix / version) mentioned somewhere in the scanned repository.
 *
 * @param context access hint detected on the line: read, write, list, unknown, or the file kind
 *                (terraform, yaml, json, env)
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record Reference(
        @JsonProperty("bucket") String bucket,
        @JsonProperty("prefix") String prefix,
        @JsonProperty("version_id") String versionId,
        @JsonProperty("file") String file,
        @JsonProperty("line") int line,
        @JsonProperty("context") String context
) {

    public static Reference of(String bucket, String prefix, String file, int line, String context) {
        return new Reference(bucket, prefix, null, file, line, context);
    }

    public boolean hasPrefix() {
        return prefix != null && !prefix.isEmpty();
    }
}
