package com.xammer.spectre.command;

import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.DefaultApplicationArguments;
import org.springframework.boot.convert.DurationStyle;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Typed view over {@code --name=value} arguments. A bare {@code --flag} counts as {@code true}.
 */
public class CommandOptions {

    private final ApplicationArguments arguments;

    public CommandOptions(String... args) {
        this(new DefaultApplicationArguments(args));
    }

    public CommandOptions(ApplicationArguments arguments) {
        this.arguments = arguments;
    }

    /** First positional argument, or empty when none was given. */
    public Optional<String> command() {
        List<String> positional = arguments.getNonOptionArgs();
        return positional.isEmpty() ? Optional.empty() : Optional.of(positional.get(0));
    }

    public boolean isSet(String name) {
        return arguments.containsOption(name);
    }

    public String string(String name, String defaultValue) {
        List<String> values = arguments.getOptionValues(name);
        if (values == null || values.isEmpty()) {
            return defaultValue;
        }
        String last = values.get(values.size() - 1);
        return last == null ? defaultValue : last.trim();
    }

    public boolean flag(String name, boolean defaultValue) {
        if (!isSet(name)) {
            return defaultValue;
        }
        List<String> values = arguments.getOptionValues(name);
        if (values == null || values.isEmpty()) {
            return true;
        }
        String value = values.get(values.size() - 1).trim();
        if (value.equalsIgnoreCase("true")) {
            return true;
        }
        if (value.equalsIgnoreCase("false")) {
            return false;
        }
        throw new IllegalArgumentException("invalid value for --" + name + ": " + value);
    }

    public int integer(String name, int defaultValue) {
        String value = string(name, null);
        if (value == null || value.isEmpty()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("invalid value for --" + name + ": " + value, e);
        }
    }

    public Duration duration(String name, Duration defaultValue) {
        String value = string(name, null);
        if (value == null || value.isEmpty()) {
            return defaultValue;
        }
        try {
            return DurationStyle.detectAndParse(value);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("invalid value for --" + name + ": " + value, e);
        }
    }

    /** Comma-separated values; the option may also be repeated. */
    public List<String> list(String name) {
        List<String> values = arguments.getOptionValues(name);
        List<String> result = new ArrayList<>();
        if (values == null) {
            return result;
        }
        for (String value : values) {
            for (String part : value.split(",")) {
                if (!part.isBlank()) {
                    result.add(part.trim());
                }
            }
        }
        return result;
    }
}
