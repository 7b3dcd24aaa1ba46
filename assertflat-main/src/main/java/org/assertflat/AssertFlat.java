package org.assertflat;

import java.nio.file.Path;

import org.assertflat.migration.DocumentMigrator;
import org.assertflat.migration.MigrationOptions;
import org.assertflat.migration.MigrationReport;
import org.assertflat.migration.ProjectMigrator;

/**
 * Entry points for migrating AssertJ assertions to JUnit Jupiter assertions.
 */
public final class AssertFlat {

    private AssertFlat() {
    }

    /**
     * Migrates a single source text, resolving types against the JDK only.
     *
     * @return the migrated source, or the given one when nothing was rewritten
     * @throws DocumentParseException when the source is not valid Java
     */
    public static String migrate(String source) {
        return new DocumentMigrator().migrate("<source>", source).getMigrated();
    }

    public static MigrationReport migrateProject(Path root, MigrationOptions options) {
        return new ProjectMigrator(options).migrate(root);
    }
}
