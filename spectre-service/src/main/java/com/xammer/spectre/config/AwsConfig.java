package com.xammer.spectre.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Connection defaults for the AWS clients. Clients themselves are created per run because the
 * profile and region can be overridden on the command line.
 */
@Configuration
public class AwsConfig {

    @Value("${spectre.aws.profile:}")
    private String profile;

    @Value("${spectre.aws.region:}")
    private String region;

    // Only set when pointing at an S3-compatible endpoint such as LocalStack or MinIO.
    @Value("${spectre.aws.endpoint:}")
    private String endpoint;

    @Value("${spectre.aws.path-style-access:false}")
    private boolean pathStyleAccess;

    @Bean
    public AwsSettings defaultAwsSettings() {
        return new AwsSettings(profile, region, endpoint, pathStyleAccess);
    }
}
