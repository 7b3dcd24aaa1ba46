package org.assertflat;

import java.nio.file.Path;
import java.util.List;

import org.assertflat.migration.DocumentMigrator;
import org.assertflat.migration.MigrationOptions;
import org.assertflat.types.TypeSolvers;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ErrorHandlingTest {

    // 1. DocumentParseException: invalid syntax
    @Test
    void parseError_carriesDocumentAndLocation() {
        String broken = "import static org.assertj.core.api.Assertions.assertThat;\nclass Broken { void m( }";
        assertThatThrownBy(() -> AssertFlat.migrate(broken))
            .isInstanceOf(DocumentParseException.class)
            .satisfies(e -> {
                DocumentParseException pe = (DocumentParseException) e;
                assertThat(pe.getDocumentName()).isEqualTo("<source>");
                assertThat(pe.getLine()).isEqualTo(2);
                assertThat(pe.getMessage()).startsWith("Parse error in <source>");
            });
    }

    // 2. Non-AssertJ sources are never parsed
    @Test
    void parseError_notRaisedForSourcesWithoutAssertJ() {
        assertThat(AssertFlat.migrate("class Broken { void m( }")).isEqualTo("class Broken { void m( }");
    }

    // 3. MigrationException: structured path
    @Test
    void migration_reportsPath(@TempDir Path dir) {
        Path missing = dir.resolve("Missing.java");
        assertThatThrownBy(() -> new DocumentMigrator().migrate(missing))
            .isInstanceOf(MigrationException.class)
            .satisfies(e -> {
                MigrationException me = (MigrationException) e;
                assertThat(me.getPath()).isEqualTo(missing);
                assertThat(me.getMessage()).isEqualTo("Unable to read source file: " + missing);
                assertThat(me.getCause()).isNotNull();
            });
    }

    // 4. MigrationException: project root
    @Test
    void migration_missingProjectRoot(@TempDir Path dir) {
        Path missing = dir.resolve("absent");
        assertThatThrownBy(() -> AssertFlat.migrateProject(missing, MigrationOptions.builder().classpath(List.of()).build()))
            .isInstanceOf(MigrationException.class)
            .hasMessageContaining("No such file or directory");
    }

    // 5. TypeResolutionException: unreadable classpath entry
    @Test
    void typeResolution_unreadableJar(@TempDir Path dir) {
        Path jar = dir.resolve("absent.jar");
        assertThatThrownBy(() -> TypeSolvers.forProject(List.of(), List.of(jar)).get())
            .isInstanceOf(TypeResolutionException.class)
            .hasMessageContaining("absent.jar")
            .hasCauseInstanceOf(Exception.class);
    }

    // 6. Exception hierarchy: catching the root catches all
    @Test
    void hierarchy_allExtendAssertFlatException() {
        assertThat(new DocumentParseException("msg", "A.java", 1, 1)).isInstanceOf(AssertFlatException.class);
        assertThat(new MigrationException("msg", Path.of("A.java"), null)).isInstanceOf(AssertFlatException.class);
        assertThat(new TypeResolutionException("msg")).isInstanceOf(AssertFlatException.class);
        assertThat(new AssertFlatException("msg")).isInstanceOf(RuntimeException.class);
    }

    // 7. Catching the root exception from the facade
    @Test
    void hierarchy_catchRootException() {
        try {
            AssertFlat.migrate("import static org.assertj.core.api.Assertions.*;\nclass {");
        } catch (AssertFlatException e) {
            assertThat(e).isInstanceOf(DocumentParseException.class);
            return;
        }
        throw new AssertionError("Expected AssertFlatException");
    }
}
