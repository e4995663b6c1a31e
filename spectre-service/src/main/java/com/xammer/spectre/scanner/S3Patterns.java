package com.xammer.spectre.scanner;

import java.util.regex.Pattern;

/**
 * Regular expressions shared by the extractors.
 */
final class S3Patterns {

    private static final String BUCKET = "([a-z0-9][a-z0-9\\-.]{1,61}[a-z0-9])";

    /** {@code s3://bucket/key?versionId=v}: groups bucket, key, version. */
    static final Pattern S3_URL = Pattern.compile(
            "s3://" + BUCKET + "(?:/([^?\\s\"']+))?(?:\\?versionId=([^\\s\"']+))?");

    /** Virtual-hosted URL: groups bucket, region, key, version. */
    static final Pattern S3_HTTP_URL = Pattern.compile(
            "https?://" + BUCKET + "\\.s3(?:[.-]([a-z0-9-]+))?\\.amazonaws\\.com(?:/([^?\\s\"']+))?(?:\\?versionId=([^\\s\"']+))?");

    static final Pattern BUCKET_ASSIGNMENT = Pattern.compile(
            "(?:bucket|s3[-_]?bucket|s3[-_]?name)[\\s:=]+['\"]?" + BUCKET + "['\"]?", Pattern.CASE_INSENSITIVE);

    static final Pattern YAML_BUCKET_KEY = Pattern.compile(
            "(?:bucket|s3_bucket|s3Bucket):\\s*['\"]?" + BUCKET + "['\"]?", Pattern.CASE_INSENSITIVE);

    static final Pattern ENV_BUCKET = Pattern.compile(
            "(?:S3_BUCKET|BUCKET|AWS_BUCKET|BUCKET_NAME)=['\"]?" + BUCKET + "['\"]?", Pattern.CASE_INSENSITIVE);

    static final Pattern TF_BUCKET_RESOURCE = Pattern.compile("resource\\s+\"aws_s3_bucket\"\\s+\"[^\"]+\"\\s+\\{");
    static final Pattern TF_OBJECT_RESOURCE = Pattern.compile("resource\\s+\"aws_s3_(?:bucket_)?object\"\\s+\"[^\"]+\"\\s+\\{");
    static final Pattern TF_BUCKET_ATTRIBUTE = Pattern.compile("bucket\\s+=\\s+\"([^\"]+)\"");

    private static final Pattern WRITE_OP = Pattern.compile("(put|write|upload|store|save|create)", Pattern.CASE_INSENSITIVE);
    private static final Pattern READ_OP = Pattern.compile("(get|read|download|fetch|retrieve|load)", Pattern.CASE_INSENSITIVE);
    private static final Pattern LIST_OP = Pattern.compile("(list|ls|scan|iterate)", Pattern.CASE_INSENSITIVE);

    private S3Patterns() {
    }

    /** Guesses the access mode of a source line; write beats read beats list. */
    static String detectContext(String line) {
        if (WRITE_OP.matcher(line).find()) {
            return "write";
        }
        if (READ_OP.matcher(line).find()) {
            return "read";
        }
        if (LIST_OP.matcher(line).find()) {
            return "list";
        }
        return "unknown";
    }

    static String emptyToNull(String value) {
        return value == null || value.isEmpty() ? null : value;
    }
}
