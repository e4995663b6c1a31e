package com.xammer.spectre.config;

import com.xammer.spectre.exception.ConfigFileException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RepoConfigLoaderTest {

    @TempDir
    Path tempDir;

    private Path repo() throws IOException {
        return Files.createDirectories(tempDir.resolve("repo"));
    }

    private Path home() throws IOException {
        return Files.createDirectories(tempDir.resolve("home"));
    }

    @Test
    void load_repoFile_readsSnakeCaseKeys() throws IOException {
        Path repo = repo();
        Files.writeString(repo.resolve(".s3spectre.yaml"), String.join("\n",
                "region: eu-central-1",
                "exclude_buckets:",
                "  - legacy-bucket",
                "  - scratch",
                "exclude_prefixes: [tmp/]",
                "stale_days: 30",
                "format: sarif",
                "timeout: 2m",
                "unknown_key: ignored"));

        RepoConfig config = new RepoConfigLoader(home()).load(repo);

        assertEquals("eu-central-1", config.getRegion());
        assertEquals(List.of("legacy-bucket", "scratch"), config.getExcludeBuckets());
        assertEquals(List.of("tmp/"), config.getExcludePrefixes());
        assertEquals(30, config.getStaleDays());
        assertEquals("sarif", config.getFormat());
        assertEquals(Duration.ofMinutes(2), RepoConfigLoader.timeoutOf(config));
    }

    @Test
    void load_prefersYamlOverYmlAndRepoOverHome() throws IOException {
        Path repo = repo();
        Path home = home();
        Files.writeString(repo.resolve(".s3spectre.yml"), "format: json\n");
        Files.writeString(home.resolve(".s3spectre.yaml"), "format: text\n");
        RepoConfigLoader loader = new RepoConfigLoader(home);

        assertEquals("json", loader.load(repo).getFormat());

        Files.writeString(repo.resolve(".s3spectre.yaml"), "format: sarif\n");
        assertEquals("sarif", loader.load(repo).getFormat());
    }

    @Test
    void load_fallsBackToHomeDirectory() throws IOException {
        Path home = home();
        Files.writeString(home.resolve(".s3spectre.yml"), "stale_days: 45\n");

        RepoConfig config = new RepoConfigLoader(home).load(repo());

        assertEquals(45, config.getStaleDays());
    }

    @Test
    void load_noFile_returnsEmptyConfig() throws IOException {
        RepoConfig config = new RepoConfigLoader(home()).load(repo());

        assertNull(config.getRegion());
        assertTrue(config.getExcludeBuckets().isEmpty());
        assertEquals(0, config.getStaleDays());
        assertEquals(Duration.ZERO, RepoConfigLoader.timeoutOf(config));
    }

    @Test
    void load_emptyFile_returnsEmptyConfig() throws IOException {
        Path repo = repo();
        Files.writeString(repo.resolve(".s3spectre.yaml"), "");

        RepoConfig config = new RepoConfigLoader(home()).load(repo);

        assertNull(config.getFormat());
    }

    @Test
    void load_bareListKeys_yieldEmptyLists() throws IOException {
        Path repo = repo();
        Files.writeString(repo.resolve(".s3spectre.yaml"), "exclude_buckets:\nexclude_prefixes:\nformat: json\n");

        RepoConfig config = new RepoConfigLoader(home()).load(repo);

        assertNotNull(config.getExcludeBuckets());
        assertTrue(config.getExcludeBuckets().isEmpty());
        assertNotNull(config.getExcludePrefixes());
        assertTrue(config.getExcludePrefixes().isEmpty());
        assertEquals("json", config.getFormat());
    }

    @Test
    void load_malformedYaml_throwsConfigFileException() throws IOException {
        Path repo = repo();
        Path file = repo.resolve(".s3spectre.yaml");
        Files.writeString(file, "stale_days: [not, a, number\n");

        ConfigFileException ex = assertThrows(ConfigFileException.class,
                () -> new RepoConfigLoader(home()).load(repo));

        assertTrue(ex.getMessage().startsWith("failed to load config file " + file));
    }

    @Test
    void timeoutOf_invalidValue_meansNoTimeout() {
        RepoConfig config = new RepoConfig();
        config.setTimeout("soon");

        assertEquals(Duration.ZERO, RepoConfigLoader.timeoutOf(config));

        config.setTimeout("90s");
        assertEquals(Duration.ofSeconds(90), RepoConfigLoader.timeoutOf(config));
    }
}
