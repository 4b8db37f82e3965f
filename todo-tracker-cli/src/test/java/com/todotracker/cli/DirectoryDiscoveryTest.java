package com.todotracker.cli;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DirectoryDiscoveryTest {

    @TempDir
    Path root;

    @Test
    void discover_skipsHiddenDirectoriesLargeFilesAndExcludes() throws IOException {
        Files.createDirectories(root.resolve(".git"));
        Files.writeString(root.resolve(".git").resolve("config.py"), "# TODO\n");
        Files.createDirectories(root.resolve("vendor").resolve("lib"));
        Files.writeString(root.resolve("vendor").resolve("lib").resolve("x.js"), "// TODO\n");
        Files.writeString(root.resolve("app.min.js"), "// TODO\n");
        Files.writeString(root.resolve("big.c"), "x".repeat(200));
        Files.writeString(root.resolve("b.rs"), "// TODO\n");
        Files.writeString(root.resolve("a.rs"), "// TODO\n");

        List<Path> files = new DirectoryDiscovery(root, 100, List.of("vendor/**", "*.min.js")).discover();

        assertThat(files).containsExactly(root.resolve("a.rs"), root.resolve("b.rs"));
    }

    @Test
    void discover_notADirectory_throws() {
        DirectoryDiscovery discovery = new DirectoryDiscovery(root.resolve("missing"), 100, List.of());

        assertThatThrownBy(discovery::discover).isInstanceOf(IOException.class);
    }
}
