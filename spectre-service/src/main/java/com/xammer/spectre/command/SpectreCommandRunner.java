package com.xammer.spectre.command;

import com.xammer.spectre.config.SpectreProperties;
import com.xammer.spectre.exception.GateFailureException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.logging.LogLevel;
import org.springframework.boot.logging.LoggingSystem;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.PrintStream;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Entry point of the command line: dispatches to a command and maps the outcome to a process exit code.
 */
@Component
public class SpectreCommandRunner implements CommandLineRunner, ExitCodeGenerator {

    private static final Logger logger = LoggerFactory.getLogger(SpectreCommandRunner.class);

    public static final int EXIT_OK = 0;
    public static final int EXIT_GATE_FAILED = 1;
    public static final int EXIT_ERROR = 2;

    static final String USAGE = "Usage: s3spectre <command> [--option=value ...]\n"
            + "\n"
            + "Commands:\n"
            + "  scan       Scan a repository and AWS S3 for bucket drift\n"
            + "  discover   Discover and analyze all S3 buckets in the AWS account\n"
            + "  version    Print version information\n"
            + "\n"
            + "Global options:\n"
            + "  --verbose  Enable debug logging\n";

    private final Map<String, AuditCommand> commands = new LinkedHashMap<>();
    private final SpectreProperties properties;
    private final LoggingSystem loggingSystem;
    private final PrintStream out;
    private int exitCode = EXIT_OK;

    @Autowired
    public SpectreCommandRunner(List<AuditCommand> commands, SpectreProperties properties,
                                LoggingSystem loggingSystem) {
        this(commands, properties, loggingSystem, System.out);
    }

    SpectreCommandRunner(List<AuditCommand> commands, SpectreProperties properties, LoggingSystem loggingSystem,
                         PrintStream out) {
        for (AuditCommand command : commands) {
            this.commands.put(command.name(), command);
        }
        this.properties = properties;
        this.loggingSystem = loggingSystem;
        this.out = out;
    }

    @Override
    public void run(String... args) {
        CommandOptions options = new CommandOptions(args);
        exitCode = dispatch(options);
    }

    int dispatch(CommandOptions options) {
        try {
            if (options.flag("verbose", false)) {
                loggingSystem.setLogLevel("com.xammer.spectre", LogLevel.DEBUG);
            }
            Optional<String> name = options.command();
            if (name.isEmpty() || name.get().equals("help")) {
                out.print(USAGE);
                return EXIT_OK;
            }
            if (name.get().equals("version")) {
                out.println("s3spectre version " + properties.getVersion());
                return EXIT_OK;
            }
            AuditCommand command = commands.get(name.get());
            if (command == null) {
                logger.error("Unknown command '{}'", name.get());
                out.print(USAGE);
                return EXIT_ERROR;
            }
            command.execute(options);
            return EXIT_OK;
        } catch (GateFailureException e) {
            logger.error("Error: {}", e.getMessage());
            return EXIT_GATE_FAILED;
        } catch (RuntimeException e) {
            logger.error("Error: {}", e.getMessage());
            logger.debug("Failure detail", e);
            return EXIT_ERROR;
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
