package com.xammer.spectre.command;

import com.xammer.spectre.config.AwsSettings;
import com.xammer.spectre.config.RepoConfig;
import com.xammer.spectre.config.RepoConfigLoader;
import com.xammer.spectre.config.SpectreProperties;
import com.xammer.spectre.dto.BaselineDiff;
import com.xammer.spectre.dto.Finding;
import com.xammer.spectre.exception.GateFailureException;
import com.xammer.spectre.exception.SpectreException;
import com.xammer.spectre.report.ReportWriter;
import com.xammer.spectre.report.ReportWriterFactory;
import com.xammer.spectre.service.AuditSession;
import com.xammer.spectre.service.AuditSessionFactory;
import com.xammer.spectre.service.BaselineService;
import com.xammer.spectre.service.ProgressListener;
import com.xammer.spectre.service.RegionSelection;
import com.xammer.spectre.util.CancellationToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Option resolution, output handling and baseline comparison shared by {@code scan} and {@code discover}.
 * Command-line options win over the repository config file, which wins over {@code application.yml}.
 */
public abstract class AuditCommand {

    private static final Logger logger = LoggerFactory.getLogger(AuditCommand.class);

    protected final RepoConfigLoader repoConfigLoader;
    protected final AuditSessionFactory sessionFactory;
    protected final ReportWriterFactory reportWriterFactory;
    protected final BaselineService baselineService;
    protected final SpectreProperties properties;
    protected final AwsSettings awsSettings;
    protected final Clock clock;

    protected AuditCommand(RepoConfigLoader repoConfigLoader, AuditSessionFactory sessionFactory,
                           ReportWriterFactory reportWriterFactory, BaselineService baselineService,
                           SpectreProperties properties, AwsSettings awsSettings, Clock clock) {
        this.repoConfigLoader = repoConfigLoader;
        this.sessionFactory = sessionFactory;
        this.reportWriterFactory = reportWriterFactory;
        this.baselineService = baselineService;
        this.properties = properties;
        this.awsSettings = awsSettings;
        this.clock = clock;
    }

    /** Command name as typed on the command line. */
    public abstract String name();

    /**
     * Runs the command.
     *
     * @throws GateFailureException when a {@code --fail-on-*} gate trips
     */
    public abstract void execute(CommandOptions options);

    protected AuditSession openSession(CommandOptions options, RepoConfig repoConfig) {
        String region = options.string("aws-region", repoConfig.getRegion());
        return sessionFactory.open(awsSettings.withOverrides(options.string("aws-profile", null), region));
    }

    protected String format(CommandOptions options, RepoConfig repoConfig) {
        String fromFile = repoConfig.getFormat();
        String fallback = fromFile == null || fromFile.isBlank() ? properties.getFormat() : fromFile;
        return options.string("format", fallback);
    }

    protected int concurrency(CommandOptions options) {
        return options.integer("concurrency", properties.getConcurrency());
    }

    protected CancellationToken cancellationToken(CommandOptions options, RepoConfig repoConfig) {
        Duration fromFile = RepoConfigLoader.timeoutOf(repoConfig);
        Duration fallback = fromFile.isZero() ? properties.getTimeout() : fromFile;
        Duration timeout = options.duration("timeout", fallback);
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            return CancellationToken.none();
        }
        logger.debug("Total timeout {}", timeout);
        return CancellationToken.withTimeout(timeout);
    }

    protected RegionSelection regionSelection(CommandOptions options, AuditSession session) {
        List<String> regions = options.list("regions");
        if (!regions.isEmpty()) {
            logger.info("Regions: {}", String.join(", ", regions));
            return RegionSelection.explicit(regions);
        }
        if (options.flag("all-regions", properties.isAllRegions())) {
            logger.info("Covering all enabled AWS regions");
            return RegionSelection.allEnabled();
        }
        logger.info("Region: {}", session.getDefaultRegion());
        return RegionSelection.defaultOnly(session.getDefaultRegion());
    }

    protected ProgressListener progressListener(CommandOptions options, String label) {
        boolean interactive = System.console() != null;
        if (!interactive || options.flag("no-progress", false)) {
            return ProgressListener.NONE;
        }
        return (current, total, message) -> {
            if (total > 0) {
                logger.debug("{} progress {}/{}: {}", label, current, total, message);
            } else {
                logger.debug("{} progress: {}", label, message);
            }
        };
    }

    /** Runs one step; failures other than gate trips come back with remediation hints attached. */
    protected <T> T stage(String operation, int concurrency, Supplier<T> step) {
        try {
            return step.get();
        } catch (GateFailureException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new SpectreException(ErrorAdvisor.advise(operation, e, concurrency), e);
        }
    }

    protected void writeReport(String output, int concurrency, ReportOutput action) {
        stage(output == null ? "report generation" : "output file creation", concurrency, () -> {
            try {
                if (output == null) {
                    Writer writer = new OutputStreamWriter(System.out, StandardCharsets.UTF_8);
                    action.write(writer);
                    writer.flush();
                } else {
                    try (Writer writer = Files.newBufferedWriter(Path.of(output), StandardCharsets.UTF_8)) {
                        action.write(writer);
                    }
                    logger.info("Report written to {}", output);
                }
                return null;
            } catch (IOException e) {
                throw new SpectreException(e.getMessage(), e);
            }
        });
    }

    /**
     * Compares the current findings with a previous JSON report, when {@code --baseline} is given.
     */
    protected void compareBaseline(CommandOptions options, int concurrency, List<Finding> current,
                                   Function<Path, List<Finding>> loader) {
        String baselinePath = options.string("baseline", null);
        if (baselinePath == null || baselinePath.isEmpty()) {
            return;
        }
        List<Finding> baseline = stage("baseline load", concurrency, () -> loader.apply(Path.of(baselinePath)));
        BaselineDiff diff = baselineService.diff(current, baseline);
        logger.info("Baseline comparison: new={}, resolved={}, unchanged={}",
                diff.added().size(), diff.resolved().size(), diff.unchanged().size());
        for (Finding finding : diff.added()) {
            logger.info("New finding: {} {}{}", finding.type(), finding.bucket(),
                    finding.prefix().isEmpty() ? "" : "/" + finding.prefix());
        }
    }

    /** Rewrites the output file as a JSON report so it can serve as the next baseline. */
    protected void updateBaseline(CommandOptions options, int concurrency, ReportOutput jsonAction) {
        if (!options.flag("update-baseline", false)) {
            return;
        }
        String output = options.string("output", null);
        if (output == null || output.isEmpty()) {
            logger.warn("--update-baseline needs --output; baseline not written");
            return;
        }
        stage("baseline write", concurrency, () -> {
            try (Writer writer = Files.newBufferedWriter(Path.of(output), StandardCharsets.UTF_8)) {
                jsonAction.write(writer);
                return null;
            } catch (IOException e) {
                throw new SpectreException(e.getMessage(), e);
            }
        });
        logger.info("Updated baseline {}", output);
    }

    protected ReportWriter reportWriter(String format) {
        return reportWriterFactory.get(format);
    }

    protected static void gate(boolean enabled, int count, String message) {
        if (enabled && count > 0) {
            throw new GateFailureException(String.format(message, count));
        }
    }

    @FunctionalInterface
    protected interface ReportOutput {
        void write(Writer writer) throws IOException;
    }
}
