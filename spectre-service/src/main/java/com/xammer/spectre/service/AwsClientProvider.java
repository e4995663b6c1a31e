package com.xammer.spectre.service;

import com.xammer.spectre.config.AwsSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.ProfileCredentialsProvider;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.regions.providers.DefaultAwsRegionProviderChain;
import software.amazon.awssdk.services.ec2.Ec2Client;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3ClientBuilder;
import software.amazon.awssdk.services.s3.S3Configuration;

import java.net.URI;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Builds region-scoped AWS clients for one audit run and caches one {@link S3Client} per region.
 */
public class AwsClientProvider implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(AwsClientProvider.class);

    static final String FALLBACK_REGION = "us-east-1";

    private final AwsSettings settings;
    private final AwsCredentialsProvider credentialsProvider;
    private final String defaultRegion;
    private final Map<String, S3Client> s3Clients = new ConcurrentHashMap<>();
    private final Map<String, Ec2Client> ec2Clients = new ConcurrentHashMap<>();

    public AwsClientProvider(AwsSettings settings) {
        this.settings = settings;
        this.credentialsProvider = settings.hasProfile()
                ? ProfileCredentialsProvider.create(settings.profile())
                : DefaultCredentialsProvider.create();
        this.defaultRegion = settings.hasRegion() ? settings.region() : detectRegion();
        logger.info("AwsClientProvider initialized (profile={}, region={})",
                settings.hasProfile() ? settings.profile() : "default", defaultRegion);
    }

    /** Region used when nothing more specific is known. */
    public String getDefaultRegion() {
        return defaultRegion;
    }

    public String getProfile() {
        return settings.hasProfile() ? settings.profile() : "";
    }

    public S3Client getS3Client(String region) {
        String effective = region == null || region.isBlank() ? defaultRegion : region;
        return s3Clients.computeIfAbsent(effective, this::buildS3Client);
    }

    public S3Client getDefaultS3Client() {
        return getS3Client(defaultRegion);
    }

    public Ec2Client getEc2Client(String region) {
        String effective = region == null || region.isBlank() ? defaultRegion : region;
        return ec2Clients.computeIfAbsent(effective, r -> {
            logger.debug("Creating Ec2Client in region {}", r);
            return Ec2Client.builder()
                    .credentialsProvider(credentialsProvider)
                    .region(Region.of(r))
                    .build();
        });
    }

    private S3Client buildS3Client(String region) {
        logger.debug("Creating S3Client in region {}", region);
        S3ClientBuilder builder = S3Client.builder()
                .credentialsProvider(credentialsProvider)
                .region(Region.of(region))
                .serviceConfiguration(S3Configuration.builder()
                        .pathStyleAccessEnabled(settings.pathStyleAccess())
                        .build());
        if (settings.hasEndpointOverride()) {
            builder = builder.endpointOverride(URI.create(settings.endpointOverride()));
        }
        return builder.build();
    }

    private static String detectRegion() {
        try {
            return new DefaultAwsRegionProviderChain().getRegion().id();
        } catch (SdkClientException e) {
            logger.debug("No region configured, falling back to {}", FALLBACK_REGION);
            return FALLBACK_REGION;
        }
    }

    @Override
    public void close() {
        s3Clients.values().forEach(S3Client::close);
        ec2Clients.values().forEach(Ec2Client::close);
        s3Clients.clear();
        ec2Clients.clear();
    }
}
