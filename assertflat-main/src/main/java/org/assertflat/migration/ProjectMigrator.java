package org.assertflat.migration;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.function.Supplier;

import com.github.javaparser.resolution.TypeSolver;
import org.assertflat.AssertFlatException;
import org.assertflat.MigrationException;
import org.assertflat.rewriter.LoggingRewriteListener;
import org.assertflat.rewriter.RewriteListener;
import org.assertflat.types.TypeSolvers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Migrates every Java source file under a directory, or a single file. Documents are migrated
 * independently; one that cannot be parsed or written is reported and the run goes on.
 */
public class ProjectMigrator {

    private static final Logger log = LoggerFactory.getLogger(ProjectMigrator.class);

    private static final Set<String> SKIPPED_DIRECTORIES = Set.of("target", "build", "out");

    private final MigrationOptions options;
    private final RewriteListener listener;

    public ProjectMigrator(MigrationOptions options) {
        this(options, new LoggingRewriteListener());
    }

    public ProjectMigrator(MigrationOptions options, RewriteListener listener) {
        this.options = options;
        this.listener = listener;
    }

    /**
     * @throws MigrationException when the path does not exist or the directory tree cannot be walked
     */
    public MigrationReport migrate(Path path) {
        if (!Files.exists(path)) {
            throw new MigrationException("No such file or directory", path, null);
        }
        List<Path> files = new ArrayList<>();
        List<Path> sourceRoots = new ArrayList<>();
        if (Files.isDirectory(path)) {
            scan(path, files, sourceRoots);
            if (sourceRoots.isEmpty()) {
                sourceRoots.add(path);
            }
        } else {
            files.add(path);
            sourceRoots.add(path.toAbsolutePath().getParent());
        }
        log.info("Migrating {} source file(s) under {}{}", files.size(), path, options.isDryRun() ? " (dry run)" : "");

        DocumentMigrator migrator = new DocumentMigrator(typeSolvers(sourceRoots), listener);
        MigrationReport.Builder report = MigrationReport.builder(options.isDryRun());
        int threads = Math.max(1, options.getThreads());
        if (threads == 1 || files.size() < 2) {
            for (Path file : files) {
                migrateFile(migrator, file, report);
            }
        } else {
            migrateInParallel(migrator, files, threads, report, path);
        }
        MigrationReport result = report.build();
        log.info("{}: {}", path, result);
        return result;
    }

    private void migrateInParallel(DocumentMigrator migrator, List<Path> files, int threads,
                                   MigrationReport.Builder report, Path root) {
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        try {
            List<Future<?>> pending = new ArrayList<>();
            for (Path file : files) {
                pending.add(executor.submit(() -> migrateFile(migrator, file, report)));
            }
            for (Future<?> future : pending) {
                future.get();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new MigrationException("Interrupted while migrating", root, e);
        } catch (ExecutionException e) {
            throw new MigrationException("Migration worker failed", root, e.getCause());
        } finally {
            executor.shutdownNow();
        }
    }

    private void migrateFile(DocumentMigrator migrator, Path file, MigrationReport.Builder report) {
        DocumentResult result;
        try {
            result = migrator.migrate(file);
        } catch (AssertFlatException e) {
            log.warn("Skipping {}: {}", file, e.getMessage());
            report.failed(file, e.getMessage());
            return;
        }
        if (result.isChanged() && !options.isDryRun()) {
            try {
                Files.writeString(file, result.getMigrated(), StandardCharsets.UTF_8);
            } catch (IOException e) {
                log.warn("Unable to write {}", file, e);
                report.failed(file, "Unable to write: " + e.getMessage());
                return;
            }
        }
        report.add(file, result);
    }

    private Supplier<TypeSolver> typeSolvers(List<Path> sourceRoots) {
        if (!options.isTypeResolution()) {
            return null;
        }
        List<Path> roots = options.getSourceRoots().isEmpty() ? sourceRoots : options.getSourceRoots();
        return TypeSolvers.forProject(roots, options.getClasspath());
    }

    private static void scan(Path root, List<Path> files, List<Path> sourceRoots) {
        try {
            Files.walkFileTree(root, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                    String name = dir.getFileName() == null ? "" : dir.getFileName().toString();
                    if (!dir.equals(root) && (name.startsWith(".") || SKIPPED_DIRECTORIES.contains(name))) {
                        return FileVisitResult.SKIP_SUBTREE;
                    }
                    if (dir.endsWith("src/main/java") || dir.endsWith("src/test/java")) {
                        sourceRoots.add(dir);
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                    if (attrs.isRegularFile() && file.getFileName().toString().endsWith(".java")) {
                        files.add(file);
                    }
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (IOException e) {
            throw new MigrationException("Unable to scan source tree", root, e);
        }
        files.sort(null);
    }
}
