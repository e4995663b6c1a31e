package com.xammer.spectre.command;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class CommandOptionsTest {

    @Test
    void command_isFirstPositionalArgument() {
        assertEquals(Optional.of("scan"), new CommandOptions("--repo=.", "scan", "extra").command());
        assertEquals(Optional.empty(), new CommandOptions("--verbose").command());
    }

    @Test
    void string_lastValueWinsAndIsTrimmed() {
        CommandOptions options = new CommandOptions("--format=json", "--format= sarif ");

        assertEquals("sarif", options.string("format", "text"));
        assertEquals("text", options.string("output", "text"));
    }

    @Test
    void flag_bareOrExplicitValue() {
        CommandOptions options = new CommandOptions("--fail-on-missing", "--check-unused=false", "--all-regions=TRUE");

        assertTrue(options.flag("fail-on-missing", false));
        assertFalse(options.flag("check-unused", true));
        assertTrue(options.flag("all-regions", false));
        assertTrue(options.flag("absent", true));
    }

    @Test
    void flag_invalidValue_throws() {
        CommandOptions options = new CommandOptions("--check-public=maybe");

        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                () -> options.flag("check-public", false));
        assertEquals("invalid value for --check-public: maybe", ex.getMessage());
    }

    @Test
    void integer_parsesOrRejects() {
        CommandOptions options = new CommandOptions("--concurrency=4", "--stale-days=ninety");

        assertEquals(4, options.integer("concurrency", 10));
        assertEquals(10, options.integer("absent", 10));
        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                () -> options.integer("stale-days", 90));
        assertEquals("invalid value for --stale-days: ninety", ex.getMessage());
    }

    @Test
    void duration_acceptsSimpleAndIsoStyles() {
        CommandOptions options = new CommandOptions("--timeout=30s", "--other=PT2M", "--bad=later");

        assertEquals(Duration.ofSeconds(30), options.duration("timeout", Duration.ZERO));
        assertEquals(Duration.ofMinutes(2), options.duration("other", Duration.ZERO));
        assertEquals(Duration.ZERO, options.duration("absent", Duration.ZERO));
        assertThrows(IllegalArgumentException.class, () -> options.duration("bad", Duration.ZERO));
    }

    @Test
    void list_splitsCommasAcrossRepeats() {
        CommandOptions options = new CommandOptions("--regions=us-east-1, eu-west-1", "--regions=ap-south-1", "--regions=");

        assertEquals(List.of("us-east-1", "eu-west-1", "ap-south-1"), options.list("regions"));
        assertTrue(options.list("exclude").isEmpty());
    }
}
