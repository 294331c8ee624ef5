package com.agentflow.orchestrator.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.List;
import java.util.stream.Stream;

/**
 * Finds repositories directly under a root directory.
 *
 * A directory counts as a repository when it holds one of the
 * {@link #MARKERS}. Include / exclude globs match the directory name; an
 * empty include list means "everything", and excludes always win.
 */
@Component
public class RepositoryScanner {

    private static final Logger log = LoggerFactory.getLogger(RepositoryScanner.class);

    static final List<String> MARKERS = List.of(
            ".git", "pom.xml", "package.json", "pyproject.toml", "build.gradle");

    public List<Path> scan(Path root, List<String> includes, List<String> excludes) {
        if (!Files.isDirectory(root)) {
            throw new IllegalArgumentException("Not a directory: " + root);
        }
        List<PathMatcher> in  = matchers(includes);
        List<PathMatcher> out = matchers(excludes);

        try (Stream<Path> children = Files.list(root)) {
            List<Path> repos = children
                    .filter(Files::isDirectory)
                    .filter(RepositoryScanner::looksLikeRepository)
                    .filter(p -> in.isEmpty() || matchesAny(in, p))
                    .filter(p -> !matchesAny(out, p))
                    .sorted()
                    .toList();
            log.info("Found {} repositor{} under {}", repos.size(), repos.size() == 1 ? "y" : "ies", root);
            return repos;
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot list " + root, e);
        }
    }

    static boolean looksLikeRepository(Path dir) {
        return MARKERS.stream().anyMatch(m -> Files.exists(dir.resolve(m)));
    }

    private static List<PathMatcher> matchers(List<String> globs) {
        if (globs == null) {
            return List.of();
        }
        return globs.stream()
                .map(String::trim)
                .filter(g -> !g.isEmpty())
                .map(g -> FileSystems.getDefault().getPathMatcher("glob:" + g))
                .toList();
    }

    private static boolean matchesAny(List<PathMatcher> matchers, Path dir) {
        Path name = dir.getFileName();
        return matchers.stream().anyMatch(m -> m.matches(name));
    }
}
