package com.xammer.spectre.service;

import com.xammer.spectre.dto.EncryptionState;
import com.xammer.spectre.dto.PrefixMetadata;
import com.xammer.spectre.dto.PublicAccessState;
import com.xammer.spectre.util.CancellationToken;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import software.amazon.awssdk.awscore.exception.AwsErrorDetails;
import software.amazon.awssdk.http.SdkHttpResponse;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.*;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class BucketMetadataCollectorTest {

    private static final Instant NOW = Instant.parse("2026-03-01T00:00:00Z");

    private S3Client s3;
    private BucketMetadataCollector collector;
    private final CancellationToken token = CancellationToken.none();

    private static S3Exception s3Error(int status, String code, String message) {
        return (S3Exception) S3Exception.builder()
                .statusCode(status)
                .message(message)
                .awsErrorDetails(AwsErrorDetails.builder().errorCode(code).errorMessage(message).build())
                .build();
    }

    @BeforeEach
    void setUp() {
        s3 = mock(S3Client.class);
        AwsClientProvider clients = mock(AwsClientProvider.class);
        when(clients.getDefaultS3Client()).thenReturn(s3);
        RetryExecutor retry = new RetryExecutor(
                new RetryPolicy(2, Duration.ZERO, new TransientErrorClassifier()::isTransient));
        collector = new BucketMetadataCollector(clients, retry, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void location_emptyConstraint_meansUsEast1() {
        when(s3.getBucketLocation(any(GetBucketLocationRequest.class)))
                .thenReturn(GetBucketLocationResponse.builder().build());

        assertEquals("us-east-1", collector.location("logs", token).value());
    }

    @Test
    void location_legacyEu_meansEuWest1() {
        when(s3.getBucketLocation(any(GetBucketLocationRequest.class)))
                .thenReturn(GetBucketLocationResponse.builder().locationConstraint("EU").build());

        assertEquals("eu-west-1", collector.location("logs", token).value());
    }

    @Test
    void location_redirectHeader_givesRegion() {
        S3Exception redirect = (S3Exception) S3Exception.builder()
                .statusCode(301)
                .message("PermanentRedirect")
                .awsErrorDetails(AwsErrorDetails.builder()
                        .errorCode("PermanentRedirect")
                        .sdkHttpResponse(SdkHttpResponse.builder()
                                .statusCode(301)
                                .putHeader("x-amz-bucket-region", "ap-southeast-2")
                                .build())
                        .build())
                .build();
        when(s3.getBucketLocation(any(GetBucketLocationRequest.class))).thenThrow(redirect);

        CollectedField<String> location = collector.location("logs", token);

        assertFalse(location.isFailed());
        assertEquals("ap-southeast-2", location.value());
    }

    @Test
    void location_accessDenied_isDiagnosed() {
        when(s3.getBucketLocation(any(GetBucketLocationRequest.class)))
                .thenThrow(s3Error(403, "AccessDenied", "Access Denied"));

        CollectedField<String> location = collector.location("logs", token);

        assertTrue(location.isFailed());
        assertNull(location.value());
        assertEquals("get bucket location failed for logs: Access Denied - check IAM permissions",
                location.diagnostic());
    }

    @Test
    void versioning_enabledAndSuspended() {
        when(s3.getBucketVersioning(any(GetBucketVersioningRequest.class)))
                .thenReturn(GetBucketVersioningResponse.builder().status(BucketVersioningStatus.ENABLED).build())
                .thenReturn(GetBucketVersioningResponse.builder().status(BucketVersioningStatus.SUSPENDED).build());

        assertTrue(collector.versioning(s3, "logs", token).value());
        assertFalse(collector.versioning(s3, "logs", token).value());
    }

    @Test
    void lifecycle_missingConfiguration_isZeroRulesWithoutError() {
        when(s3.getBucketLifecycleConfiguration(any(GetBucketLifecycleConfigurationRequest.class)))
                .thenThrow(s3Error(404, "NoSuchLifecycleConfiguration", "The lifecycle configuration does not exist"));

        CollectedField<Integer> rules = collector.lifecycleRuleCount(s3, "logs", token);

        assertFalse(rules.isFailed());
        assertEquals(0, rules.value());
    }

    @Test
    void lifecycle_countsRules() {
        when(s3.getBucketLifecycleConfiguration(any(GetBucketLifecycleConfigurationRequest.class)))
                .thenReturn(GetBucketLifecycleConfigurationResponse.builder()
                        .rules(LifecycleRule.builder().id("a").build(), LifecycleRule.builder().id("b").build())
                        .build());

        assertEquals(2, collector.lifecycleRuleCount(s3, "logs", token).value());
    }

    @Test
    void tags_missingTagSet_isEmptyWithoutError() {
        when(s3.getBucketTagging(any(GetBucketTaggingRequest.class)))
                .thenThrow(s3Error(404, "NoSuchTagSet", "The TagSet does not exist"));

        CollectedField<Map<String, String>> tags = collector.tags(s3, "logs", token);

        assertFalse(tags.isFailed());
        assertTrue(tags.value().isEmpty());
    }

    @Test
    void tags_otherFailure_keepsDiagnostic() {
        when(s3.getBucketTagging(any(GetBucketTaggingRequest.class)))
                .thenThrow(s3Error(403, "AccessDenied", "Access Denied"));

        CollectedField<Map<String, String>> tags = collector.tags(s3, "logs", token);

        assertTrue(tags.isFailed());
        assertTrue(tags.value().isEmpty());
        assertTrue(tags.diagnostic().startsWith("get tagging failed for logs"));
    }

    @Test
    void prefix_withObjects_reportsNewestModification() {
        when(s3.listObjectsV2(any(ListObjectsV2Request.class))).thenReturn(ListObjectsV2Response.builder()
                .keyCount(2)
                .contents(S3Object.builder().key("a/1").lastModified(NOW.minus(Duration.ofDays(40))).build(),
                        S3Object.builder().key("a/2").lastModified(NOW.minus(Duration.ofDays(10))).build())
                .build());

        PrefixMetadata prefix = collector.prefix(s3, "logs", "a/", token).value();

        assertTrue(prefix.isExists());
        assertEquals(2, prefix.getObjectCount());
        assertEquals(NOW.minus(Duration.ofDays(10)), prefix.getLatestModified());
        assertEquals(10, prefix.getDaysSinceModified());
    }

    @Test
    void prefix_noObjects_doesNotExist() {
        when(s3.listObjectsV2(any(ListObjectsV2Request.class)))
                .thenReturn(ListObjectsV2Response.builder().keyCount(0).build());

        CollectedField<PrefixMetadata> prefix = collector.prefix(s3, "logs", "gone/", token);

        assertFalse(prefix.isFailed());
        assertFalse(prefix.value().isExists());
        assertEquals("gone/", prefix.value().getPrefix());
    }

    @Test
    void objectSample_sumsSizes() {
        when(s3.listObjectsV2(any(ListObjectsV2Request.class))).thenReturn(ListObjectsV2Response.builder()
                .keyCount(2)
                .contents(S3Object.builder().key("x").size(100L).lastModified(NOW.minus(Duration.ofDays(3))).build(),
                        S3Object.builder().key("y").size(50L).lastModified(NOW.minus(Duration.ofDays(1))).build())
                .build());

        ObjectSample sample = collector.objectSample(s3, "logs", 100, token).value();

        assertEquals(2, sample.keyCount());
        assertEquals(150L, sample.totalSize());
        assertEquals(NOW.minus(Duration.ofDays(1)), sample.latestModified());
        assertFalse(sample.isEmpty());
    }

    @Test
    void encryption_missingConfiguration_isDisabled() {
        when(s3.getBucketEncryption(any(GetBucketEncryptionRequest.class)))
                .thenThrow(s3Error(404, "ServerSideEncryptionConfigurationNotFoundError", "not found"));

        CollectedField<EncryptionState> encryption = collector.encryption(s3, "logs", token);

        assertFalse(encryption.isFailed());
        assertFalse(encryption.value().isEnabled());
    }

    @Test
    void encryption_kms_isReported() {
        when(s3.getBucketEncryption(any(GetBucketEncryptionRequest.class))).thenReturn(
                GetBucketEncryptionResponse.builder()
                        .serverSideEncryptionConfiguration(ServerSideEncryptionConfiguration.builder()
                                .rules(ServerSideEncryptionRule.builder()
                                        .applyServerSideEncryptionByDefault(ServerSideEncryptionByDefault.builder()
                                                .sseAlgorithm(ServerSideEncryption.AWS_KMS)
                                                .kmsMasterKeyID("key-1")
                                                .build())
                                        .build())
                                .build())
                        .build());

        EncryptionState state = collector.encryption(s3, "logs", token).value();

        assertTrue(state.isEnabled());
        assertEquals("aws:kms", state.getAlgorithm());
        assertEquals("key-1", state.getKmsKeyId());
    }

    @Test
    void publicAccess_missingBlock_isPublic() {
        when(s3.getPublicAccessBlock(any(GetPublicAccessBlockRequest.class)))
                .thenThrow(s3Error(404, "NoSuchPublicAccessBlockConfiguration", "not found"));

        PublicAccessState state = collector.publicAccess(s3, "logs", token).value();

        assertTrue(state.isPubliclyAccessible());
    }

    @Test
    void publicAccess_allFlagsOn_isPrivate() {
        when(s3.getPublicAccessBlock(any(GetPublicAccessBlockRequest.class))).thenReturn(
                GetPublicAccessBlockResponse.builder()
                        .publicAccessBlockConfiguration(PublicAccessBlockConfiguration.builder()
                                .blockPublicAcls(true).ignorePublicAcls(true)
                                .blockPublicPolicy(true).restrictPublicBuckets(true)
                                .build())
                        .build());

        assertFalse(collector.publicAccess(s3, "logs", token).value().isPubliclyAccessible());
    }

    @Test
    void versionTotals_followsPagesAndCountsDeleteMarkers() {
        when(s3.listObjectVersions(any(ListObjectVersionsRequest.class)))
                .thenReturn(ListObjectVersionsResponse.builder()
                        .isTruncated(true)
                        .nextKeyMarker("k")
                        .nextVersionIdMarker("v")
                        .versions(ObjectVersion.builder().key("a").size(10L).build(),
                                ObjectVersion.builder().key("a").size(20L).build())
                        .build())
                .thenReturn(ListObjectVersionsResponse.builder()
                        .isTruncated(false)
                        .versions(ObjectVersion.builder().key("b").size(5L).build())
                        .deleteMarkers(DeleteMarkerEntry.builder().key("a").build())
                        .build());

        CollectedField<VersionTotals> totals = collector.versionTotals(s3, "logs", token);

        assertEquals(4, totals.value().versionCount());
        assertEquals(35L, totals.value().totalSize());
        verify(s3, times(2)).listObjectVersions(any(ListObjectVersionsRequest.class));
    }

    @Test
    void versionTotals_failedPage_discardsPartialTotals() {
        when(s3.listObjectVersions(any(ListObjectVersionsRequest.class)))
                .thenReturn(ListObjectVersionsResponse.builder()
                        .isTruncated(true)
                        .nextKeyMarker("k")
                        .versions(ObjectVersion.builder().key("a").size(10L).build())
                        .build())
                .thenThrow(s3Error(403, "AccessDenied", "Access Denied"));

        CollectedField<VersionTotals> totals = collector.versionTotals(s3, "logs", token);

        assertTrue(totals.isFailed());
        assertEquals(VersionTotals.NONE, totals.value());
    }

    @Test
    void versionTotals_transientPage_isRetried() {
        when(s3.listObjectVersions(any(ListObjectVersionsRequest.class)))
                .thenThrow(s3Error(503, "SlowDown", "Please reduce your request rate"))
                .thenReturn(ListObjectVersionsResponse.builder()
                        .isTruncated(false)
                        .versions(ObjectVersion.builder().key("a").size(7L).build())
                        .build());

        CollectedField<VersionTotals> totals = collector.versionTotals(s3, "logs", token);

        assertFalse(totals.isFailed());
        assertEquals(new VersionTotals(1, 7L), totals.value());
    }

    @Test
    void daysSince_neverNegative() {
        assertEquals(0, collector.daysSince(NOW.plus(Duration.ofDays(2))));
        assertEquals(30, collector.daysSince(NOW.minus(Duration.ofDays(30))));
    }
}
