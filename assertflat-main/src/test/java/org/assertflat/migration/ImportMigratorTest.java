package org.assertflat.migration;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import com.github.javaparser.StaticJavaParser;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.ImportDeclaration;
import com.github.javaparser.ast.stmt.ExpressionStmt;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ImportMigratorTest {

    private final ImportMigrator migrator = new ImportMigrator();

    private static List<String> imports(CompilationUnit compilationUnit) {
        return compilationUnit.getImports().stream()
                .map(ImportMigratorTest::describe)
                .collect(Collectors.toList());
    }

    private static String describe(ImportDeclaration declaration) {
        return (declaration.isStatic() ? "static " : "") + declaration.getNameAsString()
                + (declaration.isAsterisk() ? ".*" : "");
    }

    // ── removal ───────────────────────────────────────────────────────────

    @Test
    void staticWildcard_isRemovedWhenNoAssertJCallRemains() {
        CompilationUnit compilationUnit = StaticJavaParser.parse("import static org.assertj.core.api.Assertions.*;\n"
                + "class T { void m() { assertEquals(1, 1); } }");

        migrator.removeUnusedAssertJImports(compilationUnit);

        assertThat(imports(compilationUnit)).isEmpty();
    }

    @Test
    void staticWildcard_isKeptForRemainingEntries() {
        CompilationUnit compilationUnit = StaticJavaParser.parse("import static org.assertj.core.api.Assertions.*;\n"
                + "class T { void m() { assertThatThrownBy(() -> run()).hasMessage(\"x\"); } }");

        migrator.removeUnusedAssertJImports(compilationUnit);

        assertThat(imports(compilationUnit)).containsExactly("static org.assertj.core.api.Assertions.*");
    }

    @Test
    void staticWildcard_isKeptForHelperFactories() {
        CompilationUnit compilationUnit = StaticJavaParser.parse("import static org.assertj.core.api.Assertions.*;\n"
                + "class T { Object m() { return tuple(1, 2); } }");

        migrator.removeUnusedAssertJImports(compilationUnit);

        assertThat(imports(compilationUnit)).hasSize(1);
    }

    @Test
    void staticWildcard_ignoresLocallyDeclaredNamesakes() {
        CompilationUnit compilationUnit = StaticJavaParser.parse("import static org.assertj.core.api.Assertions.*;\n"
                + "class T {\n"
                + "    void m() { assertThatValid(1); }\n"
                + "    void assertThatValid(int value) { }\n"
                + "}");

        migrator.removeUnusedAssertJImports(compilationUnit);

        assertThat(imports(compilationUnit)).isEmpty();
    }

    @Test
    void singleStaticImports_areRemovedOneByOne() {
        CompilationUnit compilationUnit = StaticJavaParser.parse("import static org.assertj.core.api.Assertions.assertThat;\n"
                + "import static org.assertj.core.api.Assertions.within;\n"
                + "class T { void m() { assertThat(1).isCloseTo(1, within(0)); } }");
        compilationUnit.findFirst(ExpressionStmt.class).orElseThrow()
                .setExpression(StaticJavaParser.parseExpression("assertTrue(within(0) != null)"));

        migrator.removeUnusedAssertJImports(compilationUnit);

        assertThat(imports(compilationUnit)).containsExactly("static org.assertj.core.api.Assertions.within");
    }

    @Test
    void typeImports_areKeptWhileReferenced() {
        CompilationUnit compilationUnit = StaticJavaParser.parse("import org.assertj.core.api.SoftAssertions;\n"
                + "import org.assertj.core.data.Offset;\n"
                + "import org.assertj.core.api.*;\n"
                + "import java.util.List;\n"
                + "class T { SoftAssertions softly; }");

        migrator.removeUnusedAssertJImports(compilationUnit);

        assertThat(imports(compilationUnit))
                .containsExactly("org.assertj.core.api.SoftAssertions", "org.assertj.core.api.*", "java.util.List");
    }

    // ── additions ─────────────────────────────────────────────────────────

    @Test
    void assertionImports_areAddedOnce() {
        CompilationUnit compilationUnit = StaticJavaParser.parse("import static org.junit.jupiter.api.Assertions.assertTrue;\n"
                + "class T { }");

        migrator.addAssertionImports(compilationUnit, Set.of("assertTrue", "assertEquals"));

        assertThat(imports(compilationUnit)).containsExactlyInAnyOrder(
                "static org.junit.jupiter.api.Assertions.assertTrue",
                "static org.junit.jupiter.api.Assertions.assertEquals");
    }

    @Test
    void assertionImports_areCoveredByTheJupiterWildcard() {
        CompilationUnit compilationUnit = StaticJavaParser.parse("import static org.junit.jupiter.api.Assertions.*;\n"
                + "class T { }");

        migrator.addAssertionImports(compilationUnit, Set.of("assertEquals"));

        assertThat(imports(compilationUnit)).containsExactly("static org.junit.jupiter.api.Assertions.*");
    }

    @Test
    void typeImports_skipWildcardsAndTheOwnPackage() {
        CompilationUnit compilationUnit = StaticJavaParser.parse("package java.time;\n"
                + "import java.util.*;\n"
                + "import java.util.stream.Stream;\n"
                + "class T { }");

        migrator.addTypeImports(compilationUnit,
                Set.of("java.util.Arrays", "java.util.stream.Stream", "java.time.Duration", "java.util.concurrent.TimeUnit"));

        assertThat(imports(compilationUnit))
                .containsExactly("java.util.*", "java.util.stream.Stream", "java.util.concurrent.TimeUnit");
    }

    @Test
    void apply_swapsAssertJForJupiter() {
        CompilationUnit compilationUnit = StaticJavaParser.parse("import static org.assertj.core.api.Assertions.assertThat;\n"
                + "class T { void m() { assertEquals(1, 1); } }");

        migrator.apply(compilationUnit, Set.of("assertEquals"), Set.of());

        assertThat(imports(compilationUnit)).containsExactly("static org.junit.jupiter.api.Assertions.assertEquals");
    }
}
