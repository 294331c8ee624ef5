package com.agentflow.orchestrator.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RepositoryScannerTest {

    @TempDir Path root;

    final RepositoryScanner scanner = new RepositoryScanner();

    @BeforeEach
    void setUp() throws Exception {
        Files.createDirectories(root.resolve("api-service/.git"));
        Files.createDirectories(root.resolve("web-app"));
        Files.writeString(root.resolve("web-app/package.json"), "{}");
        Files.createDirectories(root.resolve("legacy-tool"));
        Files.writeString(root.resolve("legacy-tool/pom.xml"), "<project/>");
        Files.createDirectories(root.resolve("notes"));
        Files.writeString(root.resolve("notes/readme.txt"), "not a repo");
        Files.writeString(root.resolve("pom.xml"), "<project/>");
    }

    @Test
    void findsDirectoriesWithAMarker_sorted() {
        List<Path> repos = scanner.scan(root, List.of(), List.of());

        assertThat(repos).extracting(p -> p.getFileName().toString())
                .containsExactly("api-service", "legacy-tool", "web-app");
    }

    @Test
    void includeGlobs_narrowTheResult() {
        List<Path> repos = scanner.scan(root, List.of("*-service", " web-* "), null);

        assertThat(repos).extracting(p -> p.getFileName().toString())
                .containsExactly("api-service", "web-app");
    }

    @Test
    void excludesWinOverIncludes() {
        List<Path> repos = scanner.scan(root, List.of("*"), List.of("legacy-*", "web-app"));

        assertThat(repos).extracting(p -> p.getFileName().toString()).containsExactly("api-service");
    }

    @Test
    void rootMustBeADirectory() {
        assertThatThrownBy(() -> scanner.scan(root.resolve("pom.xml"), List.of(), List.of()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Not a directory");
    }
}
