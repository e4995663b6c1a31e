package com.xammer.spectre.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Defaults for every audit run, bound from {@code application.yml}. Command-line options and the
 * repository config file override these per run.
 */
@Data
@ConfigurationProperties(prefix = "spectre")
public class SpectreProperties {

    private String version = "dev";
    private int concurrency = 10;
    private boolean allRegions = true;
    private String format = "text";
    private Duration timeout = Duration.ZERO;
    private Retry retry = new Retry();
    private Scan scan = new Scan();
    private Discovery discovery = new Discovery();

    @Data
    public static class Retry {
        private int maxAttempts = 3;
        private Duration baseDelay = Duration.ofSeconds(1);
    }

    @Data
    public static class Scan {
        private int staleDays = 90;
        private int unusedThresholdDays = 180;
        private int unusedScoreThreshold = 150;
        private boolean checkUnused;
    }

    @Data
    public static class Discovery {
        private int ageThresholdDays = 365;
        private int inactiveDays = 180;
        private int riskScoreThreshold = 100;
        private boolean checkEncryption;
        private boolean checkPublic;
    }
}
