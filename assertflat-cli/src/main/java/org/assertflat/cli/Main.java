package org.assertflat.cli;

import picocli.CommandLine;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.Callable;

import org.assertflat.AssertFlatException;
import org.assertflat.migration.MigrationOptions;
import org.assertflat.migration.MigrationReport;
import org.assertflat.migration.ProjectMigrator;

@CommandLine.Command(name = "assertflat", description = "Rewrites AssertJ fluent assertions as JUnit Jupiter assertions",
        version = "1.0.0", mixinStandardHelpOptions = true)
public class Main implements Callable<Integer> {

    @CommandLine.Parameters(index = "0", description = "Project directory or Java source file to migrate")
    private Path path;

    @CommandLine.Option(names = {"-c", "--classpath"}, description = "Jars used to resolve types, separated by the platform path separator")
    private String classpath;

    @CommandLine.Option(names = {"-s", "--source-root"}, description = "Source root used to resolve types (repeatable; default: detected)")
    private Path[] sourceRoots;

    @CommandLine.Option(names = "--dry-run", description = "Report what would change without writing any file")
    private boolean dryRun;

    @CommandLine.Option(names = {"-j", "--threads"}, description = "Files migrated in parallel (default: ${DEFAULT-VALUE})", defaultValue = "1")
    private int threads;

    @CommandLine.Option(names = "--no-type-resolution", description = "Migrate without resolving types")
    private boolean noTypeResolution;

    @CommandLine.Option(names = {"-v", "--verbose"}, description = "Log every rewritten assertion")
    private boolean verbose;

    public static void main(String[] args) {
        if (verboseRequested(args)) {
            enableDebugLogging();
        }
        int exitCode = new CommandLine(new Main()).execute(args);
        System.exit(exitCode);
    }

    /**
     * Looks for {@code -v} or {@code --verbose} ahead of the end-of-options marker, so the log level
     * can be set before anything creates a logger.
     */
    static boolean verboseRequested(String[] args) {
        for (String arg : args) {
            if (arg.equals("--")) {
                return false;
            }
            if (arg.equals("-v") || arg.equals("--verbose")) {
                return true;
            }
        }
        return false;
    }

    // slf4j-simple reads the level once, when the first logger is created
    private static void enableDebugLogging() {
        System.setProperty("org.slf4j.simpleLogger.defaultLogLevel", "debug");
    }

    @Override
    public Integer call() {
        if (verbose) {
            enableDebugLogging();
        }
        if (!Files.exists(path)) {
            System.err.println("Error: path not found: " + path);
            return 1;
        }
        if (threads < 1) {
            System.err.println("Error: --threads must be at least 1");
            return 1;
        }
        MigrationOptions.Builder options = MigrationOptions.builder()
                .dryRun(dryRun)
                .threads(threads)
                .typeResolution(!noTypeResolution);
        if (classpath != null) {
            options.classpath(MigrationOptions.parseClasspath(classpath));
        }
        if (sourceRoots != null) {
            for (Path root : sourceRoots) {
                options.sourceRoot(root);
            }
        }

        MigrationReport report;
        try {
            report = new ProjectMigrator(options.build()).migrate(path);
        } catch (AssertFlatException e) {
            System.err.println("Error: " + e.getMessage());
            return 1;
        }
        System.out.println(report);
        for (Path changed : report.getChangedFiles()) {
            System.out.println((dryRun ? "  would change " : "  changed ") + changed);
        }
        for (Map.Entry<Path, String> failure : report.getFailures().entrySet()) {
            System.err.println("  failed " + failure.getKey() + ": " + failure.getValue());
        }
        return report.hasFailures() ? 1 : 0;
    }
}
