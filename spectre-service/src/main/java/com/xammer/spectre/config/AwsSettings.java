package com.xammer.spectre.config;

/**
 * Connection settings for one audit run.
 *
 * @param profile          shared-config profile, blank for the default credential chain
 * @param region           default region, blank to use the SDK region chain
 * @param endpointOverride S3 endpoint for S3-compatible stores, blank for AWS
 * @param pathStyleAccess  path-style addressing, needed by most S3-compatible stores
 */
public record AwsSettings(String profile, String region, String endpointOverride, boolean pathStyleAccess) {

    public boolean hasProfile() {
        return profile != null && !profile.isBlank();
    }

    public boolean hasRegion() {
        return region != null && !region.isBlank();
    }

    public boolean hasEndpointOverride() {
        return endpointOverride != null && !endpointOverride.isBlank();
    }

    /** Copy with the given profile and region applied where they are non-blank. */
    public AwsSettings withOverrides(String profileOverride, String regionOverride) {
        return new AwsSettings(
                profileOverride == null || profileOverride.isBlank() ? profile : profileOverride,
                regionOverride == null || regionOverride.isBlank() ? region : regionOverride,
                endpointOverride,
                pathStyleAccess);
    }
}
