package com.xammer.spectre.service;

import com.xammer.spectre.dto.BucketMetadata;
import com.xammer.spectre.dto.EncryptionState;
import com.xammer.spectre.dto.PrefixMetadata;
import com.xammer.spectre.dto.PublicAccessState;
import com.xammer.spectre.dto.Reference;
import com.xammer.spectre.exception.AuditCancelledException;
import com.xammer.spectre.exception.CollectionException;
import com.xammer.spectre.exception.ProviderException;
import com.xammer.spectre.util.CancellationToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.Bucket;
import software.amazon.awssdk.services.s3.model.ListBucketsRequest;
import software.amazon.awssdk.services.s3.model.ListBucketsResponse;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.function.Supplier;

/**
 * Collects live bucket metadata with bounded parallelism.
 * <br>
 * Two modes: {@link #inspect} looks only at buckets named by references, {@link #discoverAll}
 * looks at every bucket in the account. Only region resolution and the account-wide listing can
 * fail a call; everything per bucket degrades into the returned records.
 */
public class BucketInspector {

    private static final Logger logger = LoggerFactory.getLogger(BucketInspector.class);

    static final int SCAN_SAMPLE_KEYS = 1;
    static final int DISCOVERY_SAMPLE_KEYS = 100;

    private final AwsClientProvider awsClientProvider;
    private final RegionResolver regionResolver;
    private final BucketMetadataCollector collector;
    private final RetryExecutor retryExecutor;

    public BucketInspector(AwsClientProvider awsClientProvider, RegionResolver regionResolver,
                           BucketMetadataCollector collector, RetryExecutor retryExecutor) {
        this.awsClientProvider = awsClientProvider;
        this.regionResolver = regionResolver;
        this.collector = collector;
        this.retryExecutor = retryExecutor;
    }

    /**
     * Inspects every bucket named by {@code references}, together with the unique prefixes
     * referenced for it. The result holds exactly one entry per referenced, non-excluded bucket.
     */
    public Map<String, BucketMetadata> inspect(List<Reference> references, InspectionOptions options) {
        CancellationToken token = options.cancellationToken();
        ProgressListener progress = options.progressListener();

        List<String> regions = regionResolver.resolve(options.regionSelection(), token);
        logger.info("Scanning {} region(s): {}", regions.size(), regions);
        progress.onProgress(0, 1, String.format("Scanning %d region(s)", regions.size()));

        Map<String, Set<String>> prefixesByBucket = new LinkedHashMap<>();
        for (Reference reference : references) {
            if (options.excludedBuckets().contains(reference.bucket())) {
                continue;
            }
            Set<String> prefixes = prefixesByBucket.computeIfAbsent(reference.bucket(), b -> new LinkedHashSet<>());
            if (reference.hasPrefix()) {
                prefixes.add(reference.prefix());
            }
        }

        progress.onProgress(0, 2, "Listing buckets across regions");
        Map<String, Bucket> listed = listBuckets(token);

        Map<String, BucketMetadata> results = new HashMap<>();
        Progress counter = new Progress(prefixesByBucket.size(), progress);
        BoundedTaskRunner.runAll("spectre-scan", options.concurrency(), prefixesByBucket.keySet(), bucket -> {
            BucketMetadata metadata = guarded(bucket, () -> listed.containsKey(bucket)
                    ? inspectReferencedBucket(bucket, listed.get(bucket), prefixesByBucket.get(bucket), options)
                    : BucketMetadata.missing(bucket, null));
            record(results, counter, bucket, metadata, "Inspecting bucket " + bucket);
        }, token);

        return snapshot(results);
    }

    /**
     * Inspects every bucket the account owns, including encryption and public access when
     * the options ask for them.
     */
    public Map<String, BucketMetadata> discoverAll(InspectionOptions options) {
        CancellationToken token = options.cancellationToken();
        ProgressListener progress = options.progressListener();

        List<String> regions = regionResolver.resolve(options.regionSelection(), token);
        logger.info("Discovering buckets across {} region(s): {}", regions.size(), regions);
        progress.onProgress(0, 1, String.format("Discovering buckets across %d region(s)", regions.size()));

        progress.onProgress(0, 2, "Listing all S3 buckets");
        Map<String, Bucket> listed = listBuckets(token);
        List<String> names = new ArrayList<>();
        for (String name : listed.keySet()) {
            if (!options.excludedBuckets().contains(name)) {
                names.add(name);
            }
        }

        Map<String, BucketMetadata> results = new HashMap<>();
        Progress counter = new Progress(names.size(), progress);
        BoundedTaskRunner.runAll("spectre-discover", options.concurrency(), names, bucket -> {
            BucketMetadata metadata = guarded(bucket, () -> inspectFullBucket(bucket, listed.get(bucket), options));
            record(results, counter, bucket, metadata, "Inspecting " + bucket);
        }, token);

        return snapshot(results);
    }

    private Map<String, Bucket> listBuckets(CancellationToken token) {
        ListBucketsResponse response;
        try {
            response = retryExecutor.execute("list buckets",
                    () -> awsClientProvider.getDefaultS3Client().listBuckets(ListBucketsRequest.builder().build()),
                    token);
        } catch (ProviderException e) {
            logger.error("Failed to list S3 buckets: {}", e.getMessage());
            throw new CollectionException("failed to list AWS buckets: " + e.getMessage(), e);
        }
        Map<String, Bucket> buckets = new TreeMap<>();
        if (response.hasBuckets()) {
            for (Bucket bucket : response.buckets()) {
                if (bucket.name() != null) {
                    buckets.put(bucket.name(), bucket);
                }
            }
        }
        logger.debug("Account listing returned {} bucket(s)", buckets.size());
        return buckets;
    }

    private BucketMetadata inspectReferencedBucket(String name, Bucket listing, Set<String> prefixes,
                                                   InspectionOptions options) {
        CancellationToken token = options.cancellationToken();
        CollectedField<String> location = collector.location(name, token);
        if (location.isFailed()) {
            return BucketMetadata.missing(name, location.diagnostic());
        }

        BucketMetadata metadata = new BucketMetadata(name);
        metadata.setExists(true);
        metadata.setRegion(location.value());
        applyCreationDate(metadata, listing);

        S3Client s3 = awsClientProvider.getS3Client(location.value());
        collectCommon(metadata, s3, token);

        CollectedField<ObjectSample> sample = collector.objectSample(s3, name, SCAN_SAMPLE_KEYS, token);
        metadata.appendError(sample.diagnostic());
        if (!sample.isFailed()) {
            metadata.setEmpty(sample.value().isEmpty());
            metadata.setObjectCount(sample.value().keyCount());
        }

        if (!prefixes.isEmpty()) {
            metadata.setPrefixes(inspectPrefixes(metadata, s3, new ArrayList<>(prefixes), options));
        }
        return metadata;
    }

    private BucketMetadata inspectFullBucket(String name, Bucket listing, InspectionOptions options) {
        CancellationToken token = options.cancellationToken();
        CollectedField<String> location = collector.location(name, token);
        if (location.isFailed()) {
            return BucketMetadata.missing(name, location.diagnostic());
        }

        BucketMetadata metadata = new BucketMetadata(name);
        metadata.setExists(true);
        metadata.setRegion(location.value());
        applyCreationDate(metadata, listing);

        S3Client s3 = awsClientProvider.getS3Client(location.value());
        collectCommon(metadata, s3, token);

        CollectedField<ObjectSample> sample = collector.objectSample(s3, name, DISCOVERY_SAMPLE_KEYS, token);
        metadata.appendError(sample.diagnostic());
        if (!sample.isFailed()) {
            ObjectSample objects = sample.value();
            metadata.setEmpty(objects.isEmpty());
            metadata.setObjectCount(objects.keyCount());
            metadata.setTotalSize(objects.totalSize());
            if (objects.latestModified() != null) {
                metadata.setLastActivity(objects.latestModified());
                metadata.setDaysSinceActivity(collector.daysSince(objects.latestModified()));
            }
        }

        if (metadata.isVersioningEnabled()) {
            CollectedField<VersionTotals> versions = collector.versionTotals(s3, name, token);
            metadata.appendError(versions.diagnostic());
            metadata.setVersionCount(versions.value().versionCount());
            metadata.setTotalVersionSize(versions.value().totalSize());
        }
        if (options.collectEncryption()) {
            CollectedField<EncryptionState> encryption = collector.encryption(s3, name, token);
            metadata.setEncryption(encryption.value());
            metadata.appendError(encryption.diagnostic());
        }
        if (options.collectPublicAccess()) {
            CollectedField<PublicAccessState> publicAccess = collector.publicAccess(s3, name, token);
            metadata.setPublicAccess(publicAccess.value());
            metadata.appendError(publicAccess.diagnostic());
        }
        return metadata;
    }

    private void collectCommon(BucketMetadata metadata, S3Client s3, CancellationToken token) {
        String name = metadata.getName();
        CollectedField<Boolean> versioning = collector.versioning(s3, name, token);
        metadata.setVersioningEnabled(versioning.value());
        metadata.appendError(versioning.diagnostic());

        CollectedField<Integer> lifecycle = collector.lifecycleRuleCount(s3, name, token);
        metadata.setLifecycleRules(lifecycle.value());
        metadata.appendError(lifecycle.diagnostic());

        CollectedField<Map<String, String>> tags = collector.tags(s3, name, token);
        metadata.setTags(tags.value());
        metadata.appendError(tags.diagnostic());
    }

    private List<PrefixMetadata> inspectPrefixes(BucketMetadata metadata, S3Client s3, List<String> prefixes,
                                                 InspectionOptions options) {
        Map<String, CollectedField<PrefixMetadata>> collected = new HashMap<>();
        BoundedTaskRunner.runAll("spectre-prefix", options.concurrency(), prefixes, prefix -> {
            CollectedField<PrefixMetadata> field =
                    collector.prefix(s3, metadata.getName(), prefix, options.cancellationToken());
            synchronized (collected) {
                collected.put(prefix, field);
            }
        }, options.cancellationToken());

        List<PrefixMetadata> result = new ArrayList<>(prefixes.size());
        synchronized (collected) {
            for (String prefix : prefixes) {
                CollectedField<PrefixMetadata> field = collected.get(prefix);
                metadata.appendError(field.diagnostic());
                result.add(field.value());
            }
        }
        return result;
    }

    private void applyCreationDate(BucketMetadata metadata, Bucket listing) {
        Instant created = listing == null ? null : listing.creationDate();
        if (created != null) {
            metadata.setCreationDate(created);
            metadata.setAgeInDays(collector.daysSince(created));
        }
    }

    /** Any unexpected worker failure still yields a record so the key set stays complete. */
    private BucketMetadata guarded(String bucket, Supplier<BucketMetadata> work) {
        try {
            return work.get();
        } catch (AuditCancelledException e) {
            throw e;
        } catch (RuntimeException e) {
            logger.warn("Inspection of bucket {} failed: {}", bucket, e.getMessage(), e);
            return BucketMetadata.missing(bucket, "inspect bucket failed for " + bucket + ": " + e.getMessage());
        }
    }

    private static void record(Map<String, BucketMetadata> results, Progress counter, String bucket,
                               BucketMetadata metadata, String description) {
        synchronized (results) {
            results.put(bucket, metadata);
            counter.completed++;
            counter.listener.onProgress(counter.completed, counter.total, description);
        }
    }

    private static Map<String, BucketMetadata> snapshot(Map<String, BucketMetadata> results) {
        synchronized (results) {
            return new TreeMap<>(results);
        }
    }

    private static final class Progress {
        private final int total;
        private final ProgressListener listener;
        private int completed;

        private Progress(int total, ProgressListener listener) {
            this.total = total;
            this.listener = listener;
        }
    }
}
