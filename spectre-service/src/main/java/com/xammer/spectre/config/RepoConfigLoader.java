package com.xammer.spectre.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.xammer.spectre.exception.ConfigFileException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.convert.DurationStyle;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Finds and parses the per-repository config file. The repository directory is searched
 * first, then the user's home directory; the first file found wins.
 */
@Component
public class RepoConfigLoader {

    private static final Logger logger = LoggerFactory.getLogger(RepoConfigLoader.class);

    static final String DEFAULT_FILE_NAME = ".s3spectre.yaml";
    static final String ALTERNATE_FILE_NAME = ".s3spectre.yml";

    private final ObjectMapper yamlMapper;
    private final Path homeDirectory;

    @Autowired
    public RepoConfigLoader() {
        this(homeDirectory());
    }

    public RepoConfigLoader(Path homeDirectory) {
        this.homeDirectory = homeDirectory;
        this.yamlMapper = new ObjectMapper(new YAMLFactory())
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    /** Returns an empty config when no file exists. */
    public RepoConfig load(Path directory) {
        for (Path candidate : searchPaths(directory)) {
            if (Files.isRegularFile(candidate)) {
                return parse(candidate);
            }
        }
        return new RepoConfig();
    }

    /** Parses a duration such as {@code 30s} or {@code 5m}; blank or invalid input means no timeout. */
    public static Duration timeoutOf(RepoConfig config) {
        String raw = config.getTimeout();
        if (raw == null || raw.isBlank()) {
            return Duration.ZERO;
        }
        try {
            return DurationStyle.detectAndParse(raw.trim());
        } catch (IllegalArgumentException e) {
            logger.warn("Ignoring invalid timeout '{}' in config file", raw);
            return Duration.ZERO;
        }
    }

    private RepoConfig parse(Path file) {
        try {
            byte[] raw = Files.readAllBytes(file);
            if (raw.length == 0) {
                return new RepoConfig();
            }
            RepoConfig config = yamlMapper.readValue(raw, RepoConfig.class);
            logger.info("Loaded config file {}", file);
            return config == null ? new RepoConfig() : config;
        } catch (IOException e) {
            throw new ConfigFileException("failed to load config file " + file + ": " + e.getMessage(), e);
        }
    }

    private List<Path> searchPaths(Path directory) {
        List<Path> paths = new ArrayList<>();
        if (directory != null) {
            paths.add(directory.resolve(DEFAULT_FILE_NAME));
            paths.add(directory.resolve(ALTERNATE_FILE_NAME));
        }
        if (homeDirectory != null) {
            paths.add(homeDirectory.resolve(DEFAULT_FILE_NAME));
            paths.add(homeDirectory.resolve(ALTERNATE_FILE_NAME));
        }
        return paths;
    }

    private static Path homeDirectory() {
        String home = System.getProperty("user.home");
        return home == null || home.isEmpty() ? null : Path.of(home);
    }
}
