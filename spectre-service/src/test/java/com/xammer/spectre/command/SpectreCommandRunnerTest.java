package com.xammer.spectre.command;

import com.xammer.spectre.config.SpectreProperties;
import com.xammer.spectre.exception.GateFailureException;
import com.xammer.spectre.exception.SpectreException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.logging.LogLevel;
import org.springframework.boot.logging.LoggingSystem;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class SpectreCommandRunnerTest {

    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
    private AuditCommand scan;
    private LoggingSystem loggingSystem;
    private SpectreCommandRunner runner;

    @BeforeEach
    void setUp() {
        scan = mock(AuditCommand.class);
        when(scan.name()).thenReturn("scan");
        loggingSystem = mock(LoggingSystem.class);
        SpectreProperties properties = new SpectreProperties();
        properties.setVersion("0.3.0");
        runner = new SpectreCommandRunner(List.of(scan), properties, loggingSystem,
                new PrintStream(buffer, true, StandardCharsets.UTF_8));
    }

    private String printed() {
        return buffer.toString(StandardCharsets.UTF_8);
    }

    @Test
    void run_knownCommand_exitsZero() {
        runner.run("scan", "--repo=.");

        assertEquals(SpectreCommandRunner.EXIT_OK, runner.getExitCode());
        verify(scan).execute(any(CommandOptions.class));
    }

    @Test
    void dispatch_noCommand_printsUsage() {
        assertEquals(SpectreCommandRunner.EXIT_OK, runner.dispatch(new CommandOptions()));
        assertEquals(SpectreCommandRunner.USAGE, printed());
    }

    @Test
    void dispatch_version_printsVersion() {
        assertEquals(SpectreCommandRunner.EXIT_OK, runner.dispatch(new CommandOptions("version")));
        assertEquals("s3spectre version 0.3.0", printed().trim());
    }

    @Test
    void dispatch_unknownCommand_exitsTwo() {
        assertEquals(SpectreCommandRunner.EXIT_ERROR, runner.dispatch(new CommandOptions("prune")));
        assertTrue(printed().startsWith("Usage: s3spectre"));
    }

    @Test
    void dispatch_gateFailure_exitsOne() {
        doThrow(new GateFailureException("found 2 missing buckets")).when(scan).execute(any(CommandOptions.class));

        assertEquals(SpectreCommandRunner.EXIT_GATE_FAILED, runner.dispatch(new CommandOptions("scan")));
    }

    @Test
    void dispatch_operationalError_exitsTwo() {
        doThrow(new SpectreException("scan failed: boom")).when(scan).execute(any(CommandOptions.class));

        assertEquals(SpectreCommandRunner.EXIT_ERROR, runner.dispatch(new CommandOptions("scan")));
    }

    @Test
    void dispatch_invalidOptionValue_exitsTwo() {
        assertEquals(SpectreCommandRunner.EXIT_ERROR,
                runner.dispatch(new CommandOptions("scan", "--verbose=perhaps")));
        verify(scan, never()).execute(any(CommandOptions.class));
    }

    @Test
    void dispatch_verbose_raisesLogLevel() {
        runner.dispatch(new CommandOptions("scan", "--verbose"));

        verify(loggingSystem).setLogLevel("com.xammer.spectre", LogLevel.DEBUG);
    }
}
