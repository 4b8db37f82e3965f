package com.todotracker.cli;

import com.todotracker.TodoTrackerCLI;
import com.todotracker.core.model.Finding;
import com.todotracker.core.model.Tag;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("scan command")
class ScanCommandTest {

    @TempDir
    Path projectDir;

    private StringWriter out;
    private StringWriter err;

    @BeforeEach
    void setUp() throws IOException {
        Files.writeString(projectDir.resolve("main.rs"),
            "fn main() {\n    // TODO(bob,#7,p:critical): fix race\n    let s = \"// FIXME: in string\";\n}\n");
        Path src = Files.createDirectories(projectDir.resolve("src"));
        Files.writeString(src.resolve("util.py"), "# HACK: workaround\n# NOTE: custom\n");
        Files.writeString(projectDir.resolve("README.txt"), "TODO: prose is not scanned\n");
    }

    private int run(String... args) {
        out = new StringWriter();
        err = new StringWriter();
        CommandLine cli = TodoTrackerCLI.commandLine();
        cli.setOut(new PrintWriter(out));
        cli.setErr(new PrintWriter(err));
        return cli.execute(args);
    }

    @Test
    @DisplayName("Should print findings relative to the scanned directory")
    void scan_printsFindingsAndSummary() {
        int exitCode = run("scan", projectDir.toString());

        assertThat(exitCode).isZero();
        assertThat(out.toString())
            .contains("main.rs:2:8 TODO fix race")
            .contains("main.rs:3:17 FIXME in string\";")
            .contains("src/util.py:1:3 HACK workaround")
            .contains("✓ Found 3 markers in 2 files")
            .contains("  - HACK: 1")
            .doesNotContain("NOTE");
        assertThat(err.toString()).isEmpty();
    }

    @Test
    @DisplayName("Should serve the second run from the cache")
    void scan_secondRun_usesCache() {
        run("scan", projectDir.toString());
        int exitCode = run("scan", projectDir.toString());

        assertThat(exitCode).isZero();
        assertThat(out.toString()).contains("(2 from cache, 1 skipped)");
        assertThat(Files.exists(projectDir.resolve(".todo-tracker").resolve("cache.db"))).isTrue();
    }

    @Test
    @DisplayName("Should drop string literal matches in precise mode")
    void scan_precise_dropsStringLiterals() {
        int exitCode = run("scan", "--precise", "--summary-only", projectDir.toString());

        assertThat(exitCode).isZero();
        assertThat(out.toString())
            .contains("✓ Found 2 markers in 2 files")
            .doesNotContain("FIXME");
    }

    @Test
    @DisplayName("Should not reuse baseline cache entries in precise mode")
    void scan_preciseAfterBaseline_rescans() {
        run("scan", projectDir.toString());
        run("scan", "--precise", projectDir.toString());

        assertThat(out.toString())
            .contains("(0 from cache, 1 skipped)")
            .doesNotContain("FIXME");
    }

    @Test
    @DisplayName("Should report additional tags")
    void scan_extraTag_isReported() {
        int exitCode = run("scan", "-t", "NOTE", "--no-cache", projectDir.toString());

        assertThat(exitCode).isZero();
        assertThat(out.toString()).contains("src/util.py:2:3 NOTE custom");
        assertThat(Files.exists(projectDir.resolve(".todo-tracker"))).isFalse();
    }

    @Test
    @DisplayName("Should apply configuration file")
    void scan_configuration_isApplied() throws IOException {
        Files.writeString(projectDir.resolve(".todo-tracker.yaml"), String.join("\n",
            "scan:",
            "  tags: [HACK]",
            "cache:",
            "  enabled: false",
            "exclude:",
            "  - \"src/**\"",
            ""));

        int exitCode = run("scan", projectDir.toString());

        assertThat(exitCode).isZero();
        assertThat(out.toString())
            .contains("✓ Found 0 markers in 0 files")
            .doesNotContain("TODO");
    }

    @Test
    @DisplayName("Should fail on a missing directory")
    void scan_missingDirectory_fails() {
        int exitCode = run("scan", projectDir.resolve("nope").toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).contains("✗ Scan failed");
    }

    @Test
    @DisplayName("Should report unreadable files without failing")
    void scan_invalidFile_isReportedAsError() throws IOException {
        Files.write(projectDir.resolve("bad.c"), new byte[] {'/', '/', ' ', (byte) 0xFF, '\n'});

        int exitCode = run("scan", "--no-cache", projectDir.toString());

        assertThat(exitCode).isZero();
        assertThat(err.toString()).contains("bad.c: [ENCODING]");
    }

    @Test
    void formatFinding_usesOneBasedColumn() {
        Finding finding = Finding.bare(Tag.TODO, "msg", projectDir.resolve("a.rs").toString(), 4, 0);

        assertThat(ScanCommand.formatFinding(projectDir.toAbsolutePath().normalize(), finding))
            .isEqualTo("a.rs:4:1 TODO msg");
    }
}
