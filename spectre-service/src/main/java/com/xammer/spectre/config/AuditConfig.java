package com.xammer.spectre.config;

import com.xammer.spectre.service.RetryExecutor;
import com.xammer.spectre.service.RetryPolicy;
import com.xammer.spectre.service.TransientErrorClassifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
@EnableConfigurationProperties(SpectreProperties.class)
public class AuditConfig {

    @Bean
    public TransientErrorClassifier transientErrorClassifier() {
        return new TransientErrorClassifier();
    }

    @Bean
    public RetryPolicy retryPolicy(SpectreProperties properties, TransientErrorClassifier classifier) {
        SpectreProperties.Retry retry = properties.getRetry();
        return new RetryPolicy(retry.getMaxAttempts(), retry.getBaseDelay(), classifier::isTransient);
    }

    @Bean
    public RetryExecutor retryExecutor(RetryPolicy retryPolicy) {
        return new RetryExecutor(retryPolicy);
    }

    // Ages and activity windows are computed in UTC.
    @Bean
    public Clock auditClock() {
        return Clock.systemUTC();
    }
}
