package org.assertflat.migration;

import java.io.File;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * Settings of a project run. Defaults come from system properties:
 * <ul>
 *     <li>{@code assertflat.classpath}: jars for type resolution, separated by the platform path separator</li>
 *     <li>{@code assertflat.dryRun}: report only, write nothing (default {@code false})</li>
 *     <li>{@code assertflat.threads}: documents migrated in parallel (default 1)</li>
 *     <li>{@code assertflat.typeResolution}: resolve types for the rules that need them (default {@code true})</li>
 * </ul>
 */
public final class MigrationOptions {

    public static final String CLASSPATH_PROPERTY = "assertflat.classpath";
    public static final String DRY_RUN_PROPERTY = "assertflat.dryRun";
    public static final String THREADS_PROPERTY = "assertflat.threads";
    public static final String TYPE_RESOLUTION_PROPERTY = "assertflat.typeResolution";

    private final List<Path> classpath;
    private final List<Path> sourceRoots;
    private final boolean dryRun;
    private final int threads;
    private final boolean typeResolution;

    private MigrationOptions(Builder builder) {
        this.classpath = List.copyOf(builder.classpath);
        this.sourceRoots = List.copyOf(builder.sourceRoots);
        this.dryRun = builder.dryRun;
        this.threads = builder.threads;
        this.typeResolution = builder.typeResolution;
    }

    public static MigrationOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<Path> getClasspath() {
        return classpath;
    }

    /**
     * Source roots for type resolution; empty means detect {@code src/main/java} and {@code src/test/java}
     * under the project root.
     */
    public List<Path> getSourceRoots() {
        return sourceRoots;
    }

    public boolean isDryRun() {
        return dryRun;
    }

    public int getThreads() {
        return threads;
    }

    public boolean isTypeResolution() {
        return typeResolution;
    }

    public static List<Path> parseClasspath(String classpath) {
        List<Path> entries = new ArrayList<>();
        if (classpath == null) {
            return entries;
        }
        for (String entry : classpath.split(File.pathSeparator)) {
            if (!entry.isBlank()) {
                entries.add(Paths.get(entry.trim()));
            }
        }
        return entries;
    }

    public static final class Builder {

        private final List<Path> classpath = new ArrayList<>(parseClasspath(System.getProperty(CLASSPATH_PROPERTY)));
        private final List<Path> sourceRoots = new ArrayList<>();
        private boolean dryRun = Boolean.getBoolean(DRY_RUN_PROPERTY);
        private int threads = Integer.getInteger(THREADS_PROPERTY, 1);
        private boolean typeResolution = Boolean.parseBoolean(System.getProperty(TYPE_RESOLUTION_PROPERTY, "true"));

        private Builder() {
        }

        public Builder classpath(List<Path> entries) {
            classpath.clear();
            classpath.addAll(entries);
            return this;
        }

        public Builder sourceRoot(Path root) {
            sourceRoots.add(root);
            return this;
        }

        public Builder dryRun(boolean dryRun) {
            this.dryRun = dryRun;
            return this;
        }

        public Builder threads(int threads) {
            if (threads < 1) {
                throw new IllegalArgumentException("threads must be at least 1, was " + threads);
            }
            this.threads = threads;
            return this;
        }

        public Builder typeResolution(boolean typeResolution) {
            this.typeResolution = typeResolution;
            return this;
        }

        public MigrationOptions build() {
            return new MigrationOptions(this);
        }
    }
}
