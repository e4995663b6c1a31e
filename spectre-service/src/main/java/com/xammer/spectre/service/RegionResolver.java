package com.xammer.spectre.service;

import com.xammer.spectre.exception.AuditCancelledException;
import com.xammer.spectre.exception.ProviderException;
import com.xammer.spectre.exception.RegionResolutionException;
import com.xammer.spectre.util.CancellationToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.services.ec2.model.DescribeRegionsRequest;
import software.amazon.awssdk.services.ec2.model.DescribeRegionsResponse;
import software.amazon.awssdk.services.ec2.model.Region;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

public class RegionResolver {

    private static final Logger logger = LoggerFactory.getLogger(RegionResolver.class);

    private final AwsClientProvider awsClientProvider;
    private final RetryExecutor retryExecutor;

    public RegionResolver(AwsClientProvider awsClientProvider, RetryExecutor retryExecutor) {
        this.awsClientProvider = awsClientProvider;
        this.retryExecutor = retryExecutor;
    }

    public List<String> resolve(RegionSelection selection) {
        return resolve(selection, CancellationToken.none());
    }

    /**
     * Returns the ordered, de-duplicated regions to audit.
     *
     * @throws RegionResolutionException if all regions were requested and the listing call failed
     */
    public List<String> resolve(RegionSelection selection, CancellationToken token) {
        List<String> explicit = distinct(selection.regions());
        if (!explicit.isEmpty()) {
            logger.debug("Using explicit regions {}", explicit);
            return explicit;
        }
        if (selection.allRegions()) {
            return listEnabledRegions(token);
        }
        String region = selection.defaultRegion();
        if (region == null || region.isBlank()) {
            region = awsClientProvider.getDefaultRegion();
        }
        return List.of(region);
    }

    private List<String> listEnabledRegions(CancellationToken token) {
        DescribeRegionsRequest request = DescribeRegionsRequest.builder().allRegions(false).build();
        DescribeRegionsResponse response;
        try {
            response = retryExecutor.execute("describe regions",
                    () -> awsClientProvider.getEc2Client(awsClientProvider.getDefaultRegion()).describeRegions(request),
                    token);
        } catch (AuditCancelledException e) {
            throw e;
        } catch (ProviderException e) {
            logger.error("Failed to list enabled AWS regions: {}", e.getMessage());
            throw new RegionResolutionException("failed to list AWS regions: " + e.getMessage(), e);
        }
        List<String> names = new ArrayList<>();
        for (Region region : response.regions()) {
            if (region.regionName() != null) {
                names.add(region.regionName());
            }
        }
        if (names.isEmpty()) {
            throw new RegionResolutionException("failed to list AWS regions: no enabled regions returned", null);
        }
        logger.info("Resolved {} enabled region(s)", names.size());
        return distinct(names);
    }

    private static List<String> distinct(List<String> regions) {
        Set<String> seen = new LinkedHashSet<>();
        for (String region : regions) {
            if (region != null && !region.isBlank()) {
                seen.add(region.trim());
            }
        }
        return List.copyOf(seen);
    }
}
