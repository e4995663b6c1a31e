package com.xammer.spectre.scanner;

import com.xammer.spectre.dto.Reference;
import com.xammer.spectre.exception.SpectreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Walks a repository and collects S3 references, one per distinct (bucket, prefix) pair.
 * Files are visited in sorted path order so the reference list is stable.
 */
@Service
public class RepoScanner {

    private static final Logger logger = LoggerFactory.getLogger(RepoScanner.class);

    static final long MAX_FILE_SIZE = 10L * 1024 * 1024;

    private final List<ReferenceExtractor> extractors;

    public RepoScanner(List<ReferenceExtractor> extractors) {
        this.extractors = List.copyOf(extractors);
    }

    public List<Reference> scan(Path repoPath) {
        if (!Files.isDirectory(repoPath)) {
            throw new SpectreException("repository path does not exist or is not a directory: " + repoPath);
        }
        Path root = repoPath.toAbsolutePath().normalize();
        List<Path> files = collectFiles(root);

        List<Reference> references = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (Path file : files) {
            for (Reference reference : scanFile(root, file)) {
                String key = reference.bucket() + "|" + (reference.prefix() == null ? "" : reference.prefix());
                if (seen.add(key)) {
                    references.add(reference);
                }
            }
        }
        logger.info("Found {} S3 reference(s) in {} file(s) under {}", references.size(), files.size(), root);
        return references;
    }

    private List<Path> collectFiles(Path root) {
        List<Path> files = new ArrayList<>();
        try {
            Files.walkFileTree(root, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                    if (!dir.equals(root) && isHidden(dir)) {
                        return FileVisitResult.SKIP_SUBTREE;
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                    if (attrs.isRegularFile() && !isHidden(file) && attrs.size() <= MAX_FILE_SIZE) {
                        files.add(file);
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFileFailed(Path file, IOException e) {
                    logger.warn("Skipping unreadable path {}: {}", file, e.getMessage());
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (IOException e) {
            throw new SpectreException("failed to walk repository " + root + ": " + e.getMessage(), e);
        }
        return files.stream()
                .sorted((a, b) -> relative(root, a).compareTo(relative(root, b)))
                .collect(Collectors.toList());
    }

    private List<Reference> scanFile(Path root, Path file) {
        String fileName = file.getFileName().toString().toLowerCase(Locale.ROOT);
        for (ReferenceExtractor extractor : extractors) {
            if (extractor.supports(fileName)) {
                try {
                    String content = new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
                    List<String> lines = content.lines().collect(Collectors.toList());
                    return extractor.extract(relative(root, file), lines);
                } catch (IOException e) {
                    logger.warn("Skipping unreadable file {}: {}", file, e.getMessage());
                    return List.of();
                }
            }
        }
        return List.of();
    }

    private static boolean isHidden(Path path) {
        Path name = path.getFileName();
        return name != null && name.toString().startsWith(".");
    }

    private static String relative(Path root, Path file) {
        return root.relativize(file).toString().replace('\\', '/');
    }
}
