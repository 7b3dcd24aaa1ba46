package org.assertflat.cli;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import static org.assertj.core.api.Assertions.assertThat;

class MainTest {

    private static final String SOURCE = "package com.example;\n"
            + "\n"
            + "import static org.assertj.core.api.Assertions.assertThat;\n"
            + "\n"
            + "class SampleTest {\n"
            + "    void sample() {\n"
            + "        int count = 3;\n"
            + "        assertThat(count).isEqualTo(3);\n"
            + "    }\n"
            + "}\n";

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();
    private PrintStream originalOut;
    private PrintStream originalErr;

    @TempDir
    Path project;

    @BeforeEach
    void captureOutput() {
        originalOut = System.out;
        originalErr = System.err;
        System.setOut(new PrintStream(out, true, StandardCharsets.UTF_8));
        System.setErr(new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    @AfterEach
    void restoreOutput() {
        System.setOut(originalOut);
        System.setErr(originalErr);
        System.clearProperty("org.slf4j.simpleLogger.defaultLogLevel");
    }

    private static int run(String... args) {
        return new CommandLine(new Main()).execute(args);
    }

    private Path sample() throws IOException {
        Path file = project.resolve("src/test/java/com/example/SampleTest.java");
        Files.createDirectories(file.getParent());
        Files.writeString(file, SOURCE);
        return file;
    }

    @Test
    void migrate_rewritesTheProject() throws IOException {
        Path file = sample();

        int exitCode = run(project.toString());

        assertThat(exitCode).isZero();
        assertThat(Files.readString(file)).contains("assertEquals(3, count);");
        assertThat(out.toString(StandardCharsets.UTF_8))
                .contains("1 file(s) scanned, 1 changed, 0 failed")
                .contains("  changed " + file);
    }

    @Test
    void dryRun_reportsWithoutWriting() throws IOException {
        Path file = sample();

        int exitCode = run("--dry-run", "--no-type-resolution", project.toString());

        assertThat(exitCode).isZero();
        assertThat(Files.readString(file)).isEqualTo(SOURCE);
        assertThat(out.toString(StandardCharsets.UTF_8)).contains("  would change " + file);
    }

    @Test
    void parallelRun_isAccepted() throws IOException {
        sample();

        assertThat(run("-j", "2", project.toString())).isZero();
    }

    @Test
    void brokenSource_failsTheRun() throws IOException {
        Path broken = project.resolve("BrokenTest.java");
        Files.writeString(broken, "import static org.assertj.core.api.Assertions.assertThat;\nclass BrokenTest {");

        int exitCode = run(project.toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString(StandardCharsets.UTF_8)).contains("  failed " + broken);
    }

    @Test
    void missingPath_failsTheRun() {
        int exitCode = run(project.resolve("nowhere").toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString(StandardCharsets.UTF_8)).contains("path not found");
    }

    @Test
    void threadsBelowOne_failsTheRun() throws IOException {
        sample();

        assertThat(run("--threads", "0", project.toString())).isEqualTo(1);
        assertThat(err.toString(StandardCharsets.UTF_8)).contains("--threads must be at least 1");
    }

    @Test
    void help_printsUsage() {
        assertThat(run("--help")).isZero();
        assertThat(out.toString(StandardCharsets.UTF_8)).contains("Usage: assertflat");
    }

    @Test
    void verbose_isRecognizedAheadOfParsing() {
        assertThat(Main.verboseRequested(new String[] {"-v", "project"})).isTrue();
        assertThat(Main.verboseRequested(new String[] {"--dry-run", "--verbose", "project"})).isTrue();
        assertThat(Main.verboseRequested(new String[] {"--", "-v"})).isFalse();
        assertThat(Main.verboseRequested(new String[] {"--dry-run", "project"})).isFalse();
    }

    @Test
    void verboseRun_isAccepted() throws IOException {
        sample();

        assertThat(run("--verbose", "--dry-run", project.toString())).isZero();
    }
}
