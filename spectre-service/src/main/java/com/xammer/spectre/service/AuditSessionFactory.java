package com.xammer.spectre.service;

import com.xammer.spectre.config.AwsSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;

@Component
public class AuditSessionFactory {

    private static final Logger logger = LoggerFactory.getLogger(AuditSessionFactory.class);

    private final RetryExecutor retryExecutor;
    private final Clock clock;

    public AuditSessionFactory(RetryExecutor retryExecutor, Clock clock) {
        this.retryExecutor = retryExecutor;
        this.clock = clock;
    }

    public AuditSession open(AwsSettings settings) {
        AwsClientProvider provider = new AwsClientProvider(settings);
        logger.debug("Opened AWS session (profile={}, region={})", provider.getProfile(), provider.getDefaultRegion());
        RegionResolver regionResolver = new RegionResolver(provider, retryExecutor);
        BucketMetadataCollector collector = new BucketMetadataCollector(provider, retryExecutor, clock);
        BucketInspector inspector = new BucketInspector(provider, regionResolver, collector, retryExecutor);
        return new AuditSession(provider, inspector);
    }
}
