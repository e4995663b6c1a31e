package com.xammer.spectre.service;

import com.xammer.spectre.dto.EncryptionState;
import com.xammer.spectre.dto.PrefixMetadata;
import com.xammer.spectre.dto.PublicAccessState;
import com.xammer.spectre.exception.ProviderException;
import com.xammer.spectre.util.CancellationToken;
import com.xammer.spectre.util.ErrorMessages;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.awscore.exception.AwsServiceException;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.BucketVersioningStatus;
import software.amazon.awssdk.services.s3.model.GetBucketEncryptionRequest;
import software.amazon.awssdk.services.s3.model.GetBucketEncryptionResponse;
import software.amazon.awssdk.services.s3.model.GetBucketLifecycleConfigurationRequest;
import software.amazon.awssdk.services.s3.model.GetBucketLifecycleConfigurationResponse;
import software.amazon.awssdk.services.s3.model.GetBucketLocationRequest;
import software.amazon.awssdk.services.s3.model.GetBucketLocationResponse;
import software.amazon.awssdk.services.s3.model.GetBucketTaggingRequest;
import software.amazon.awssdk.services.s3.model.GetBucketTaggingResponse;
import software.amazon.awssdk.services.s3.model.GetBucketVersioningRequest;
import software.amazon.awssdk.services.s3.model.GetBucketVersioningResponse;
import software.amazon.awssdk.services.s3.model.GetPublicAccessBlockRequest;
import software.amazon.awssdk.services.s3.model.GetPublicAccessBlockResponse;
import software.amazon.awssdk.services.s3.model.ListObjectVersionsRequest;
import software.amazon.awssdk.services.s3.model.ListObjectVersionsResponse;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Request;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Response;
import software.amazon.awssdk.services.s3.model.ObjectVersion;
import software.amazon.awssdk.services.s3.model.PublicAccessBlockConfiguration;
import software.amazon.awssdk.services.s3.model.S3Object;
import software.amazon.awssdk.services.s3.model.ServerSideEncryptionByDefault;
import software.amazon.awssdk.services.s3.model.ServerSideEncryptionRule;
import software.amazon.awssdk.services.s3.model.Tag;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * One method per bucket attribute. Every call goes through the {@link RetryExecutor}; provider
 * failures come back as diagnostics on the {@link CollectedField} instead of exceptions, so one
 * unreadable attribute never stops collection of the others. Cancellation still propagates.
 */
public class BucketMetadataCollector {

    private static final Logger logger = LoggerFactory.getLogger(BucketMetadataCollector.class);

    static final String DEFAULT_LOCATION = "us-east-1";
    static final int PREFIX_LISTING_MAX_KEYS = 1000;
    static final int VERSION_PAGE_SIZE = 1000;
    static final int MAX_VERSION_PAGES = 100;

    private final AwsClientProvider awsClientProvider;
    private final RetryExecutor retryExecutor;
    private final Clock clock;

    public BucketMetadataCollector(AwsClientProvider awsClientProvider, RetryExecutor retryExecutor, Clock clock) {
        this.awsClientProvider = awsClientProvider;
        this.retryExecutor = retryExecutor;
        this.clock = clock;
    }

    /**
     * Resolves the region a bucket lives in. A redirect carrying {@code x-amz-bucket-region}
     * still yields a region; any other failure leaves the value null.
     */
    public CollectedField<String> location(String bucket, CancellationToken token) {
        GetBucketLocationRequest request = GetBucketLocationRequest.builder().bucket(bucket).build();
        try {
            GetBucketLocationResponse response = retryExecutor.execute("get bucket location",
                    () -> awsClientProvider.getDefaultS3Client().getBucketLocation(request), token);
            return CollectedField.of(normalizeLocation(response.locationConstraintAsString()));
        } catch (ProviderException e) {
            Optional<String> redirected = regionHeader(e);
            if (redirected.isPresent()) {
                logger.debug("Bucket {} resolved to {} via region header", bucket, redirected.get());
                return CollectedField.of(redirected.get());
            }
            return CollectedField.failed(null, ErrorMessages.describe("get bucket location", bucket, e));
        }
    }

    public CollectedField<Boolean> versioning(S3Client s3, String bucket, CancellationToken token) {
        GetBucketVersioningRequest request = GetBucketVersioningRequest.builder().bucket(bucket).build();
        try {
            GetBucketVersioningResponse response = retryExecutor.execute("get versioning",
                    () -> s3.getBucketVersioning(request), token);
            return CollectedField.of(response.status() == BucketVersioningStatus.ENABLED);
        } catch (ProviderException e) {
            return CollectedField.failed(false, ErrorMessages.describe("get versioning", bucket, e));
        }
    }

    /** A bucket without lifecycle configuration has zero rules; that is not a failure. */
    public CollectedField<Integer> lifecycleRuleCount(S3Client s3, String bucket, CancellationToken token) {
        GetBucketLifecycleConfigurationRequest request =
                GetBucketLifecycleConfigurationRequest.builder().bucket(bucket).build();
        try {
            GetBucketLifecycleConfigurationResponse response = retryExecutor.execute("get lifecycle",
                    () -> s3.getBucketLifecycleConfiguration(request), token);
            return CollectedField.of(response.hasRules() ? response.rules().size() : 0);
        } catch (ProviderException e) {
            if (ErrorMessages.hasErrorCode(e, "NoSuchLifecycleConfiguration")) {
                return CollectedField.of(0);
            }
            return CollectedField.failed(0, ErrorMessages.describe("get lifecycle", bucket, e));
        }
    }

    public CollectedField<Map<String, String>> tags(S3Client s3, String bucket, CancellationToken token) {
        GetBucketTaggingRequest request = GetBucketTaggingRequest.builder().bucket(bucket).build();
        try {
            GetBucketTaggingResponse response = retryExecutor.execute("get tagging",
                    () -> s3.getBucketTagging(request), token);
            Map<String, String> tags = new HashMap<>();
            if (response.hasTagSet()) {
                for (Tag tag : response.tagSet()) {
                    if (tag.key() != null && tag.value() != null) {
                        tags.put(tag.key(), tag.value());
                    }
                }
            }
            return CollectedField.of(tags);
        } catch (ProviderException e) {
            if (ErrorMessages.hasErrorCode(e, "NoSuchTagSet")) {
                return CollectedField.of(new HashMap<>());
            }
            return CollectedField.failed(new HashMap<>(), ErrorMessages.describe("get tagging", bucket, e));
        }
    }

    /** Reads the first page of up to {@code maxKeys} objects for emptiness, size and activity. */
    public CollectedField<ObjectSample> objectSample(S3Client s3, String bucket, int maxKeys, CancellationToken token) {
        ListObjectsV2Request request = ListObjectsV2Request.builder().bucket(bucket).maxKeys(maxKeys).build();
        try {
            ListObjectsV2Response response = retryExecutor.execute("list objects",
                    () -> s3.listObjectsV2(request), token);
            List<S3Object> contents = response.hasContents() ? response.contents() : List.of();
            int keyCount = response.keyCount() != null ? response.keyCount() : contents.size();
            long totalSize = 0L;
            Instant latest = null;
            for (S3Object object : contents) {
                if (object.size() != null) {
                    totalSize += object.size();
                }
                latest = later(latest, object.lastModified());
            }
            return CollectedField.of(new ObjectSample(keyCount, totalSize, latest));
        } catch (ProviderException e) {
            return CollectedField.failed(ObjectSample.EMPTY, ErrorMessages.describe("list objects", bucket, e));
        }
    }

    public CollectedField<PrefixMetadata> prefix(S3Client s3, String bucket, String prefix, CancellationToken token) {
        ListObjectsV2Request request = ListObjectsV2Request.builder()
                .bucket(bucket)
                .prefix(prefix)
                .maxKeys(PREFIX_LISTING_MAX_KEYS)
                .build();
        try {
            ListObjectsV2Response response = retryExecutor.execute("list prefix",
                    () -> s3.listObjectsV2(request), token);
            List<S3Object> contents = response.hasContents() ? response.contents() : List.of();
            int keyCount = response.keyCount() != null ? response.keyCount() : contents.size();
            if (keyCount == 0) {
                return CollectedField.of(PrefixMetadata.absent(prefix));
            }
            Instant latest = null;
            for (S3Object object : contents) {
                latest = later(latest, object.lastModified());
            }
            int days = latest == null ? 0 : daysSince(latest);
            return CollectedField.of(new PrefixMetadata(prefix, true, keyCount, latest, days));
        } catch (ProviderException e) {
            return CollectedField.failed(PrefixMetadata.absent(prefix),
                    ErrorMessages.describe("list prefix " + prefix, bucket, e));
        }
    }

    /** Default encryption; a bucket without configuration counts as unencrypted. */
    public CollectedField<EncryptionState> encryption(S3Client s3, String bucket, CancellationToken token) {
        GetBucketEncryptionRequest request = GetBucketEncryptionRequest.builder().bucket(bucket).build();
        try {
            GetBucketEncryptionResponse response = retryExecutor.execute("get encryption",
                    () -> s3.getBucketEncryption(request), token);
            if (response.serverSideEncryptionConfiguration() == null
                    || !response.serverSideEncryptionConfiguration().hasRules()) {
                return CollectedField.of(EncryptionState.disabled());
            }
            for (ServerSideEncryptionRule rule : response.serverSideEncryptionConfiguration().rules()) {
                ServerSideEncryptionByDefault defaults = rule.applyServerSideEncryptionByDefault();
                if (defaults != null) {
                    return CollectedField.of(new EncryptionState(true, defaults.sseAlgorithmAsString(),
                            defaults.kmsMasterKeyID()));
                }
            }
            return CollectedField.of(EncryptionState.disabled());
        } catch (ProviderException e) {
            if (ErrorMessages.hasErrorCode(e, "ServerSideEncryptionConfigurationNotFoundError")) {
                return CollectedField.of(EncryptionState.disabled());
            }
            return CollectedField.failed(null, ErrorMessages.describe("get encryption", bucket, e));
        }
    }

    /** Public access block; a bucket without one is treated as public. */
    public CollectedField<PublicAccessState> publicAccess(S3Client s3, String bucket, CancellationToken token) {
        GetPublicAccessBlockRequest request = GetPublicAccessBlockRequest.builder().bucket(bucket).build();
        try {
            GetPublicAccessBlockResponse response = retryExecutor.execute("get public access block",
                    () -> s3.getPublicAccessBlock(request), token);
            PublicAccessBlockConfiguration config = response.publicAccessBlockConfiguration();
            if (config == null) {
                return CollectedField.of(PublicAccessState.fromFlags(false, false, false, false));
            }
            return CollectedField.of(PublicAccessState.fromFlags(
                    Boolean.TRUE.equals(config.blockPublicAcls()),
                    Boolean.TRUE.equals(config.ignorePublicAcls()),
                    Boolean.TRUE.equals(config.blockPublicPolicy()),
                    Boolean.TRUE.equals(config.restrictPublicBuckets())));
        } catch (ProviderException e) {
            if (ErrorMessages.hasErrorCode(e, "NoSuchPublicAccessBlockConfiguration")) {
                return CollectedField.of(PublicAccessState.fromFlags(false, false, false, false));
            }
            return CollectedField.failed(null, ErrorMessages.describe("get public access block", bucket, e));
        }
    }

    /**
     * Walks the version listing, at most {@value #MAX_VERSION_PAGES} pages, counting versions and
     * delete markers. Totals are local until the walk completes; a failed page zeroes them.
     */
    public CollectedField<VersionTotals> versionTotals(S3Client s3, String bucket, CancellationToken token) {
        int versionCount = 0;
        long totalSize = 0L;
        String keyMarker = null;
        String versionIdMarker = null;
        try {
            for (int page = 0; page < MAX_VERSION_PAGES; page++) {
                ListObjectVersionsRequest request = ListObjectVersionsRequest.builder()
                        .bucket(bucket)
                        .maxKeys(VERSION_PAGE_SIZE)
                        .keyMarker(keyMarker)
                        .versionIdMarker(versionIdMarker)
                        .build();
                ListObjectVersionsResponse response = retryExecutor.execute("list object versions",
                        () -> s3.listObjectVersions(request), token);
                if (response.hasVersions()) {
                    for (ObjectVersion version : response.versions()) {
                        if (version.size() != null) {
                            totalSize += version.size();
                        }
                        versionCount++;
                    }
                }
                if (response.hasDeleteMarkers()) {
                    versionCount += response.deleteMarkers().size();
                }
                if (!Boolean.TRUE.equals(response.isTruncated())) {
                    return CollectedField.of(new VersionTotals(versionCount, totalSize));
                }
                keyMarker = response.nextKeyMarker();
                versionIdMarker = response.nextVersionIdMarker();
            }
            logger.debug("Version listing of {} stopped after {} pages", bucket, MAX_VERSION_PAGES);
            return CollectedField.of(new VersionTotals(versionCount, totalSize));
        } catch (ProviderException e) {
            return CollectedField.failed(VersionTotals.NONE, ErrorMessages.describe("list object versions", bucket, e));
        }
    }

    int daysSince(Instant instant) {
        long days = Duration.between(instant, clock.instant()).toDays();
        return (int) Math.max(0L, days);
    }

    static String normalizeLocation(String constraint) {
        if (constraint == null || constraint.isEmpty()) {
            return DEFAULT_LOCATION;
        }
        if ("EU".equals(constraint)) {
            return "eu-west-1";
        }
        return constraint;
    }

    private static Optional<String> regionHeader(Throwable error) {
        Throwable current = error;
        while (current != null) {
            if (current instanceof AwsServiceException) {
                AwsServiceException serviceException = (AwsServiceException) current;
                if (serviceException.awsErrorDetails() != null
                        && serviceException.awsErrorDetails().sdkHttpResponse() != null) {
                    return serviceException.awsErrorDetails().sdkHttpResponse()
                            .firstMatchingHeader("x-amz-bucket-region");
                }
                return Optional.empty();
            }
            current = current.getCause();
        }
        return Optional.empty();
    }

    private static Instant later(Instant current, Instant candidate) {
        if (candidate == null) {
            return current;
        }
        return current == null || candidate.isAfter(current) ? candidate : current;
    }
}
