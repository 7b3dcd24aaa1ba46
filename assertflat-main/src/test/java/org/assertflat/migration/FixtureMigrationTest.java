package org.assertflat.migration;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;

import com.github.javaparser.StaticJavaParser;
import org.assertflat.rewriter.RewriteListener;
import org.assertflat.test.CompiledSources;
import org.assertflat.types.TypeSolvers;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.assertflat.test.SourceFixtures.squash;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

class FixtureMigrationTest {

    private static final String FIXTURE_CLASS = "com.example.orders.OrderServiceTest";

    private static String fixture(String name) throws IOException {
        try (InputStream in = FixtureMigrationTest.class.getResourceAsStream("/fixtures/" + name)) {
            assertThat(in).as(name).isNotNull();
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    private static DocumentResult migrateFixture() throws IOException {
        return new DocumentMigrator(TypeSolvers.jdkOnly(), RewriteListener.NONE)
                .migrate("OrderServiceTest.java", fixture("OrderServiceTest.java"));
    }

    @Test
    void wholeTestClass_isMigratedToJupiter() throws IOException {
        DocumentResult result = migrateFixture();

        assertThat(result.getApplied()).isEqualTo(16);
        assertThat(result.getRejected()).isEqualTo(1);
        assertThat(result.getFailed()).isZero();
        assertThat(result.getMigrated())
                .contains("import static org.assertj.core.api.Assertions.assertThat;")
                .doesNotContain("assertThatCode")
                .doesNotContain("Assertions.within")
                .contains("import static org.junit.jupiter.api.Assertions.assertThrows;")
                .contains("import java.util.concurrent.TimeUnit;")
                .contains("class OrderServiceTest {");
        assertThat(squash(result.getMigrated()))
                .contains("assertTrue(quantity>0,\"quantity\");")
                .contains("assertEquals(\"ok\",assertDoesNotThrow(()->confirmed.get(1,TimeUnit.SECONDS)));")
                .contains("skus.forEach(sku->assertNotNull(sku));")
                .contains("assertEquals(\"A-1\",Optional.of(lines.get(0)).map(Line::getSku).orElse(null));")
                .contains("assertThat(lines).extracting(Line::getSku).contains(\"A-1\");")
                .contains("assertEquals(Optional.of(\"A-1\"),firstSku);")
                .contains("assertTrue(picked.containsAll(Arrays.asList(\"A-1\",\"B-2\")));");
        assertThatCode(() -> StaticJavaParser.parse(result.getMigrated())).doesNotThrowAnyException();
    }

    @Test
    void migratedFixture_compilesAndPasses(@TempDir Path directory) throws Throwable {
        String migrated = migrateFixture().getMigrated();

        assertThat(CompiledSources.compile(directory, FIXTURE_CLASS, migrated)).as(migrated).isEmpty();
        for (String test : List.of("totals", "lines", "failures", "confirmation", "picking")) {
            CompiledSources.invoke(directory, FIXTURE_CLASS, test);
        }
    }

    @Test
    void migratedFixture_isLeftAsIs() throws IOException {
        DocumentMigrator migrator = new DocumentMigrator(TypeSolvers.jdkOnly(), RewriteListener.NONE);
        String migrated = migrator.migrate("OrderServiceTest.java", fixture("OrderServiceTest.java")).getMigrated();

        DocumentResult again = migrator.migrate("OrderServiceTest.java", migrated);

        assertThat(again.isChanged()).isFalse();
        assertThat(again.getApplied()).isZero();
    }
}
