package org.assertflat.migration;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.assertflat.MigrationException;
import org.assertflat.rewriter.RewriteListener;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.assertflat.test.SourceFixtures.testClass;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ProjectMigratorTest {

    private static final String MIGRATABLE = testClass("int count = 3;\nassertThat(count).isEqualTo(3);");

    @TempDir
    Path project;

    private Path write(String relative, String content) throws IOException {
        Path file = project.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
        return file;
    }

    private static MigrationOptions.Builder options() {
        return MigrationOptions.builder().classpath(List.of());
    }

    private static ProjectMigrator migrator(MigrationOptions options) {
        return new ProjectMigrator(options, RewriteListener.NONE);
    }

    @Test
    void changedFiles_areWrittenBack() throws IOException {
        Path changed = write("src/test/java/com/example/SampleTest.java", MIGRATABLE);
        Path plain = write("src/main/java/com/example/Sample.java", "package com.example;\nclass Sample { }\n");

        MigrationReport report = migrator(options().build()).migrate(project);

        assertThat(report.getFilesScanned()).isEqualTo(2);
        assertThat(report.getChangedFiles()).containsExactly(changed);
        assertThat(report.getRewritesApplied()).isEqualTo(1);
        assertThat(report.hasFailures()).isFalse();
        assertThat(Files.readString(changed)).contains("assertEquals(3, count);").doesNotContain("org.assertj");
        assertThat(Files.readString(plain)).isEqualTo("package com.example;\nclass Sample { }\n");
        assertThat(report).hasToString("2 file(s) scanned, 1 changed, 0 failed; 1 assertion(s) rewritten, 0 left unchanged, 0 failed");
    }

    @Test
    void buildOutputAndHiddenDirectories_areSkipped() throws IOException {
        write("src/test/java/com/example/SampleTest.java", MIGRATABLE);
        Path generated = write("target/generated-test-sources/SampleTest.java", MIGRATABLE);
        Path hidden = write(".git/SampleTest.java", MIGRATABLE);

        MigrationReport report = migrator(options().build()).migrate(project);

        assertThat(report.getFilesScanned()).isEqualTo(1);
        assertThat(Files.readString(generated)).isEqualTo(MIGRATABLE);
        assertThat(Files.readString(hidden)).isEqualTo(MIGRATABLE);
    }

    @Test
    void dryRun_writesNothing() throws IOException {
        Path file = write("src/test/java/com/example/SampleTest.java", MIGRATABLE);

        MigrationReport report = migrator(options().dryRun(true).build()).migrate(project);

        assertThat(report.isDryRun()).isTrue();
        assertThat(report.getChangedFiles()).containsExactly(file);
        assertThat(report.toString()).contains("1 would change");
        assertThat(Files.readString(file)).isEqualTo(MIGRATABLE);
    }

    @Test
    void brokenFile_isReportedAndTheRestMigrated() throws IOException {
        Path broken = write("src/test/java/com/example/BrokenTest.java",
                "import static org.assertj.core.api.Assertions.assertThat;\nclass BrokenTest {");
        Path good = write("src/test/java/com/example/SampleTest.java", MIGRATABLE);

        MigrationReport report = migrator(options().build()).migrate(project);

        assertThat(report.getFilesScanned()).isEqualTo(2);
        assertThat(report.getFilesFailed()).isEqualTo(1);
        assertThat(report.getFailures()).containsOnlyKeys(broken);
        assertThat(report.getFailures().get(broken)).startsWith("Parse error in ");
        assertThat(report.getChangedFiles()).containsExactly(good);
        assertThat(Files.readString(broken)).endsWith("class BrokenTest {");
    }

    @Test
    void parallelRun_migratesEveryFile() throws IOException {
        for (int i = 0; i < 6; i++) {
            write("src/test/java/com/example/Sample" + i + "Test.java",
                    MIGRATABLE.replace("class SampleTest", "class Sample" + i + "Test"));
        }

        MigrationReport report = migrator(options().threads(3).build()).migrate(project);

        assertThat(report.getFilesScanned()).isEqualTo(6);
        assertThat(report.getFilesChanged()).isEqualTo(6);
        assertThat(report.getChangedFiles()).isSorted();
        assertThat(report.getRewritesApplied()).isEqualTo(6);
    }

    @Test
    void singleFile_isMigrated() throws IOException {
        Path file = write("SampleTest.java", MIGRATABLE);

        MigrationReport report = migrator(options().build()).migrate(file);

        assertThat(report.getFilesChanged()).isEqualTo(1);
        assertThat(Files.readString(file)).contains("assertEquals(3, count);");
    }

    @Test
    void withoutTypeResolution_stillMigrates() throws IOException {
        Path file = write("src/test/java/com/example/SampleTest.java", testClass("List<String> names = new ArrayList<>();\n"
                + "assertThat(names).isEmpty();"));

        MigrationReport report = migrator(options().typeResolution(false).build()).migrate(project);

        assertThat(report.getRewritesApplied()).isEqualTo(1);
        assertThat(Files.readString(file)).contains("names != null && names.isEmpty()");
    }

    @Test
    void missingPath_raisesMigrationException() {
        Path missing = project.resolve("nowhere");

        assertThatThrownBy(() -> migrator(options().build()).migrate(missing))
                .isInstanceOf(MigrationException.class)
                .hasMessage("No such file or directory: " + missing);
    }

    @Test
    void options_rejectFewerThanOneThread() {
        assertThatThrownBy(() -> MigrationOptions.builder().threads(0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void options_parseClasspath() {
        String separator = File.pathSeparator;

        assertThat(MigrationOptions.parseClasspath("a.jar" + separator + " " + separator + "b.jar"))
                .containsExactly(Path.of("a.jar"), Path.of("b.jar"));
        assertThat(MigrationOptions.parseClasspath(null)).isEmpty();
    }
}
